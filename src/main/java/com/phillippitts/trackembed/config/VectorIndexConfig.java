package com.phillippitts.trackembed.config;

import com.phillippitts.trackembed.config.properties.VectorIndexProperties;
import com.phillippitts.trackembed.service.index.QdrantHttpTransport;
import com.phillippitts.trackembed.service.index.RetryPolicy;
import com.phillippitts.trackembed.service.index.VectorIndexClient;
import com.phillippitts.trackembed.service.index.VectorIndexClientProvider;
import com.phillippitts.trackembed.service.index.VectorIndexTransportFactory;
import com.phillippitts.trackembed.service.metrics.PipelineMetrics;
import okhttp3.OkHttpClient;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Lazy;

/**
 * Vector index wiring.
 *
 * <p>The {@link VectorIndexClient} connects in its constructor, so the bean is {@link Lazy}:
 * an unreachable index fails the first job (or health probe) that needs it instead of
 * application startup, and creation is retried on the next request.
 */
@Configuration
public class VectorIndexConfig {

    @Bean
    public VectorIndexTransportFactory vectorIndexTransportFactory(OkHttpClient okHttpClient,
                                                                   VectorIndexProperties props) {
        return () -> new QdrantHttpTransport(okHttpClient, props.url(), props.apiKey(), props.requestTimeout());
    }

    @Bean
    public RetryPolicy vectorIndexRetryPolicy(VectorIndexProperties props) {
        return new RetryPolicy(props.maxAttempts(), props.baseDelay());
    }

    @Bean
    @Lazy
    public VectorIndexClient vectorIndexClient(VectorIndexTransportFactory transportFactory,
                                               RetryPolicy vectorIndexRetryPolicy,
                                               VectorIndexProperties props,
                                               PipelineMetrics metrics) {
        return new VectorIndexClient(transportFactory, vectorIndexRetryPolicy, props, metrics);
    }

    @Bean
    public VectorIndexClientProvider vectorIndexClientProvider(ObjectProvider<VectorIndexClient> clients) {
        return new VectorIndexClientProvider(clients);
    }
}
