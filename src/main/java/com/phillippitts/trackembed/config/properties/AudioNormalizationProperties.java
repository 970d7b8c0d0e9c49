package com.phillippitts.trackembed.config.properties;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

/**
 * Configuration properties for the transcoder. The target format itself is fixed in
 * {@link com.phillippitts.trackembed.service.audio.AudioFormat}.
 */
@ConfigurationProperties(prefix = "pipeline.audio")
@Validated
public class AudioNormalizationProperties {

    /** Transcoder binary, resolved through PATH when not absolute. */
    @NotBlank(message = "Transcoder path must not be blank")
    private String ffmpegPath = "ffmpeg";

    @NotNull
    private Duration timeout = Duration.ofSeconds(60);

    public String getFfmpegPath() {
        return ffmpegPath;
    }

    public void setFfmpegPath(String ffmpegPath) {
        this.ffmpegPath = ffmpegPath;
    }

    public Duration getTimeout() {
        return timeout;
    }

    public void setTimeout(Duration timeout) {
        this.timeout = timeout;
    }
}
