package com.phillippitts.trackembed.config.properties;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Configuration properties for preview resolution and download.
 *
 * <p>The resolver command runs in a private working directory containing {@code tracks.json}
 * and must leave {@code preview_urls.json} behind. Reference the script by absolute path.
 */
@ConfigurationProperties(prefix = "pipeline.preview")
@Validated
public class PreviewProperties {

    @NotEmpty(message = "Preview resolver command must not be empty")
    private List<String> resolverCommand = new ArrayList<>(List.of("node", "scripts/get_previews.js"));

    @NotNull
    private Duration resolverTimeout = Duration.ofMinutes(5);

    @NotNull
    private Duration downloadTimeout = Duration.ofSeconds(10);

    @NotBlank
    private String fileExtension = ".mp3";

    public List<String> getResolverCommand() {
        return resolverCommand;
    }

    public void setResolverCommand(List<String> resolverCommand) {
        this.resolverCommand = resolverCommand;
    }

    public Duration getResolverTimeout() {
        return resolverTimeout;
    }

    public void setResolverTimeout(Duration resolverTimeout) {
        this.resolverTimeout = resolverTimeout;
    }

    public Duration getDownloadTimeout() {
        return downloadTimeout;
    }

    public void setDownloadTimeout(Duration downloadTimeout) {
        this.downloadTimeout = downloadTimeout;
    }

    public String getFileExtension() {
        return fileExtension;
    }

    public void setFileExtension(String fileExtension) {
        this.fileExtension = fileExtension;
    }
}
