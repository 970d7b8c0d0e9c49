package com.phillippitts.trackembed.service.preview;

import java.nio.file.Path;
import java.util.Map;

/**
 * Outcome of one fetch run.
 *
 * @param status           {@link Status#SUCCESS} unless the batch failed structurally
 * @param message          human-readable summary
 * @param tracksTotal      tracks handed to the fetcher
 * @param tracksDownloaded clips downloaded by this run (already present files are not counted)
 * @param failures         tracks with no preview or a failed download
 * @param files            track id to local clip, including clips that were already present
 */
public record FetchSummary(
        Status status,
        String message,
        int tracksTotal,
        int tracksDownloaded,
        int failures,
        Map<String, Path> files
) {

    public enum Status { SUCCESS, FAILED }

    public FetchSummary {
        files = files == null ? Map.of() : Map.copyOf(files);
    }

    public static FetchSummary failed(String message, int tracksTotal) {
        return new FetchSummary(Status.FAILED, message, tracksTotal, 0, tracksTotal, Map.of());
    }

    public boolean isSuccess() {
        return status == Status.SUCCESS;
    }
}
