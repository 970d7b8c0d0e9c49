package com.phillippitts.trackembed.service.audio;

/**
 * Structural constants of the RIFF/WAVE container, used by {@link WavInspector}.
 *
 * <pre>
 * RIFF header (12 bytes)        RIFF_HEADER_SIZE
 * fmt chunk: header (8 bytes)   CHUNK_HEADER_SIZE
 *            data (&gt;= 16 bytes) FMT_CHUNK_MIN_SIZE
 * data chunk: header (8 bytes)  CHUNK_HEADER_SIZE
 *             PCM samples
 * </pre>
 */
public final class WavFormat {

    /** "RIFF" + file size - 8 + "WAVE". */
    public static final int RIFF_HEADER_SIZE = 12;

    /** 4-character chunk ID + little-endian uint32 size. */
    public static final int CHUNK_HEADER_SIZE = 8;

    /** Minimum fmt chunk for PCM: format, channels, rate, byte rate, block align, bits. */
    public static final int FMT_CHUNK_MIN_SIZE = 16;

    /** fmt audio format code for uncompressed PCM. */
    public static final int AUDIO_FORMAT_PCM = 1;

    /** fmt audio format code for WAVE_FORMAT_EXTENSIBLE (the transcoder may emit it). */
    public static final int AUDIO_FORMAT_EXTENSIBLE = 0xFFFE;

    private WavFormat() {
        // Utility class - prevent instantiation
    }
}
