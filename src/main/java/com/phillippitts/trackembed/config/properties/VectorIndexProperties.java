package com.phillippitts.trackembed.config.properties;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

/**
 * Configuration properties for the vector index service.
 * Binds to properties prefixed with "vector-index".
 *
 * <p>Example application.properties:
 * <pre>
 * vector-index.url=http://qdrant:6333
 * vector-index.collection-name=track_embeddings
 * vector-index.dimension=1024
 * vector-index.recreate-collection=false
 * vector-index.max-attempts=3
 * vector-index.base-delay=1s
 * vector-index.request-timeout=10s
 * </pre>
 *
 * @param url base URL of the index REST API
 * @param apiKey optional API key sent with every request (blank disables the header)
 * @param collectionName collection holding the track embeddings
 * @param dimension vector dimensionality the collection is created with
 * @param recreateCollection drop and recreate an existing collection on startup (destructive)
 * @param maxAttempts attempt ceiling for every index operation
 * @param baseDelay delay before the second attempt; doubles for each further attempt
 * @param requestTimeout connect/read/write timeout of a single HTTP call
 */
@ConfigurationProperties(prefix = "vector-index")
@Validated
public record VectorIndexProperties(
        @DefaultValue("http://localhost:6333")
        @NotBlank(message = "Vector index URL must not be blank")
        String url,

        @DefaultValue("")
        String apiKey,

        @DefaultValue("track_embeddings")
        @NotBlank(message = "Collection name must not be blank")
        String collectionName,

        @DefaultValue("1024")
        @Positive(message = "Dimension must be positive")
        int dimension,

        @DefaultValue("false")
        boolean recreateCollection,

        @DefaultValue("3")
        @Positive(message = "Max attempts must be positive")
        int maxAttempts,

        @DefaultValue("1s")
        Duration baseDelay,

        @DefaultValue("10s")
        Duration requestTimeout
) {
    /**
     * Defaults used outside Spring (tests, tools).
     */
    public static VectorIndexProperties defaults(String url) {
        return new VectorIndexProperties(url, "", "track_embeddings", 1024, false, 3,
                Duration.ofSeconds(1), Duration.ofSeconds(10));
    }
}
