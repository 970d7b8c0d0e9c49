package com.phillippitts.trackembed.service.preview;

import java.io.IOException;
import java.nio.file.Path;

/**
 * Streams one preview clip to a local file.
 */
public interface PreviewDownloader {

    /**
     * Downloads {@code url} into {@code target}. On failure no file is left at {@code target}.
     *
     * @throws IOException on network error, timeout or non-success status
     */
    void download(String url, Path target) throws IOException;
}
