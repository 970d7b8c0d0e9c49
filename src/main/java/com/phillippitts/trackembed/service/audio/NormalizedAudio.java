package com.phillippitts.trackembed.service.audio;

import java.nio.file.Path;

/**
 * One transcoded clip in the model format.
 *
 * @param source downloaded input clip
 * @param output normalized WAV file (same stem as the source)
 * @param info header of the normalized file
 */
public record NormalizedAudio(Path source, Path output, WavInfo info) {

    /**
     * @return file name without extension, shared by source and output
     */
    public String stem() {
        return AudioNormalizer.stem(output);
    }
}
