package com.phillippitts.trackembed.service.audio;

/**
 * Format and length of a PCM WAV file as read from its header.
 *
 * @param sampleRate samples per second
 * @param channels channel count
 * @param bitsPerSample bits per sample
 * @param dataBytes size of the PCM payload in bytes
 */
public record WavInfo(int sampleRate, int channels, int bitsPerSample, long dataBytes) {

    /**
     * @return number of sample frames in the payload
     */
    public long frames() {
        int blockAlign = channels * (bitsPerSample / 8);
        return blockAlign == 0 ? 0 : dataBytes / blockAlign;
    }

    /**
     * @return playback length in milliseconds
     */
    public long durationMillis() {
        return sampleRate == 0 ? 0 : frames() * 1000L / sampleRate;
    }

    /**
     * @return true when the file matches the model format and length ceiling
     */
    public boolean matchesModelFormat() {
        return sampleRate == AudioFormat.MODEL_SAMPLE_RATE
                && channels == AudioFormat.MODEL_CHANNELS
                && bitsPerSample == AudioFormat.MODEL_BITS_PER_SAMPLE
                && durationMillis() <= AudioFormat.MAX_DURATION_SECONDS * 1000L;
    }
}
