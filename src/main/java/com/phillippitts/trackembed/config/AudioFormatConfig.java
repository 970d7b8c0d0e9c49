package com.phillippitts.trackembed.config;

import com.phillippitts.trackembed.config.properties.AudioNormalizationProperties;
import com.phillippitts.trackembed.util.TimeUtils;
import jakarta.annotation.PostConstruct;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.context.annotation.Configuration;

import static com.phillippitts.trackembed.service.audio.AudioFormat.MAX_DURATION_SECONDS;
import static com.phillippitts.trackembed.service.audio.AudioFormat.MODEL_BITS_PER_SAMPLE;
import static com.phillippitts.trackembed.service.audio.AudioFormat.MODEL_BLOCK_ALIGN;
import static com.phillippitts.trackembed.service.audio.AudioFormat.MODEL_BYTE_RATE;
import static com.phillippitts.trackembed.service.audio.AudioFormat.MODEL_CHANNELS;
import static com.phillippitts.trackembed.service.audio.AudioFormat.MODEL_SAMPLE_RATE;
import static com.phillippitts.trackembed.service.audio.AudioFormat.NORMALIZED_EXTENSION;

/**
 * Checks at startup that the clip format the transcoder is told to produce is the one the
 * embedding model reads, and logs the transcoder setup once.
 */
@Configuration
class AudioFormatConfig {

    private static final Logger LOG = LogManager.getLogger(AudioFormatConfig.class);

    private final AudioNormalizationProperties props;

    AudioFormatConfig(AudioNormalizationProperties props) {
        this.props = props;
    }

    @PostConstruct
    void checkModelFormat() {
        if (MODEL_SAMPLE_RATE != 24_000 || MODEL_BITS_PER_SAMPLE != 16 || MODEL_CHANNELS != 1) {
            throw new IllegalStateException("Model expects 24 kHz 16-bit mono PCM, got "
                    + MODEL_SAMPLE_RATE + " Hz " + MODEL_BITS_PER_SAMPLE + "-bit " + MODEL_CHANNELS + "ch");
        }
        if (MODEL_BLOCK_ALIGN * MODEL_SAMPLE_RATE != MODEL_BYTE_RATE) {
            throw new IllegalStateException("Derived byte rate " + MODEL_BYTE_RATE
                    + " does not match block align " + MODEL_BLOCK_ALIGN);
        }
        if (MAX_DURATION_SECONDS <= 0 || !".wav".equals(NORMALIZED_EXTENSION)) {
            throw new IllegalStateException("Clips must be truncated WAV files");
        }
        long maxClipBytes = (long) MODEL_BYTE_RATE * MAX_DURATION_SECONDS;
        LOG.info("Clips normalized by '{}' to {} Hz mono {}-bit, at most {} s (~{} KB of PCM), timeout {}",
                props.getFfmpegPath(), MODEL_SAMPLE_RATE, MODEL_BITS_PER_SAMPLE,
                MAX_DURATION_SECONDS, maxClipBytes / 1024, TimeUtils.describe(props.getTimeout()));
    }
}
