package com.phillippitts.trackembed.service.audio;

/**
 * Single source of truth for the audio format the embedding model expects.
 * Required: 24 kHz, 16-bit signed PCM, mono, little-endian, at most 15 seconds.
 */
public final class AudioFormat {

    /** Sample rate the model was trained at, in Hz. */
    public static final int MODEL_SAMPLE_RATE = 24_000;
    /** Bits per sample written by the transcoder. */
    public static final int MODEL_BITS_PER_SAMPLE = 16;
    /** Number of channels (mono). */
    public static final int MODEL_CHANNELS = 1;
    /** Clips are truncated to this many seconds to bound inference cost. */
    public static final int MAX_DURATION_SECONDS = 15;

    /** Bytes per PCM frame (sample for all channels). */
    public static final int MODEL_BLOCK_ALIGN = (MODEL_BITS_PER_SAMPLE / 8) * MODEL_CHANNELS; // 2 bytes
    /** Bytes per second at the model format. */
    public static final int MODEL_BYTE_RATE = MODEL_SAMPLE_RATE * MODEL_BLOCK_ALIGN;          // 48,000

    /** Extension of normalized output files. */
    public static final String NORMALIZED_EXTENSION = ".wav";

    private AudioFormat() {}
}
