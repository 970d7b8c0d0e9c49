package com.phillippitts.trackembed.service.preview;

import com.phillippitts.trackembed.domain.TrackDescriptor;
import com.phillippitts.trackembed.exception.PreviewResolutionException;
import com.phillippitts.trackembed.exception.TrackEmbedException;
import com.phillippitts.trackembed.util.LogSanitizer;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;

/**
 * Resolves and downloads one preview clip per track.
 *
 * <p>Tracks that already carry a preview URL use it directly; the rest are resolved in one
 * batch through {@link PreviewResolver} by their {@code "name - artist"} key. Clips are saved as
 * {@code <sanitized key><extension>}. An existing file counts as already downloaded.
 *
 * <p>Per-track problems (no preview, network error, bad status, timeout) are logged and
 * counted, never thrown. A resolver that cannot be reached fails the whole batch with zero
 * downloads.
 *
 * <p>Downloads run on the supplied executor; their order is not observable.
 */
public class PreviewFetcher {

    private static final Logger LOG = LogManager.getLogger(PreviewFetcher.class);

    private final PreviewResolver resolver;
    private final PreviewDownloader downloader;
    private final Executor executor;
    private final String fileExtension;

    public PreviewFetcher(PreviewResolver resolver, PreviewDownloader downloader, Executor executor,
                          String fileExtension) {
        this.resolver = Objects.requireNonNull(resolver, "resolver");
        this.downloader = Objects.requireNonNull(downloader, "downloader");
        this.executor = Objects.requireNonNull(executor, "executor");
        this.fileExtension = Objects.requireNonNull(fileExtension, "fileExtension");
    }

    private enum Outcome { DOWNLOADED, PRESENT, FAILED }

    /**
     * Fetches previews for {@code tracks} into {@code targetDir}.
     *
     * @throws TrackEmbedException if {@code targetDir} cannot be created
     */
    public FetchSummary fetch(List<TrackDescriptor> tracks, Path targetDir) {
        Objects.requireNonNull(tracks, "tracks");
        try {
            Files.createDirectories(targetDir);
        } catch (IOException e) {
            throw new TrackEmbedException("Cannot create preview directory " + targetDir + ": " + e.getMessage(), e);
        }

        Map<String, String> resolved;
        try {
            resolved = resolveMissing(tracks);
        } catch (PreviewResolutionException e) {
            LOG.error("Preview resolution failed for {} tracks: {}", tracks.size(), e.getMessage());
            return FetchSummary.failed("Preview resolution failed: " + e.getMessage(), tracks.size());
        }

        // Tracks sharing a key share one file and one download
        Map<Path, String> urlByTarget = new LinkedHashMap<>();
        Map<String, Path> targetByTrack = new LinkedHashMap<>();
        int failures = 0;
        for (TrackDescriptor track : tracks) {
            String url = track.hasPreviewUrl() ? track.previewUrl() : resolved.get(track.displayKey());
            if (url == null) {
                LOG.warn("No preview for {}", LogSanitizer.forLog(track.displayKey()));
                failures++;
                continue;
            }
            Path target = targetFor(targetDir, track);
            String claimed = urlByTarget.putIfAbsent(target, url);
            if (claimed != null && !claimed.equals(url)) {
                LOG.warn("Track {} maps to clip {} already claimed by another preview URL; reusing that clip",
                        track.id(), LogSanitizer.forLog(target.getFileName().toString()));
            }
            targetByTrack.put(track.id(), target);
        }

        Map<Path, CompletableFuture<Outcome>> downloads = new LinkedHashMap<>();
        urlByTarget.forEach((target, url) ->
                downloads.put(target, CompletableFuture.supplyAsync(() -> downloadOne(url, target), executor)));
        Map<Path, Outcome> outcomes = new HashMap<>();
        downloads.forEach((target, future) -> outcomes.put(target, await(future)));

        int downloaded = 0;
        for (Outcome o : outcomes.values()) {
            if (o == Outcome.DOWNLOADED) {
                downloaded++;
            }
        }
        Map<String, Path> files = new LinkedHashMap<>();
        for (Map.Entry<String, Path> e : targetByTrack.entrySet()) {
            if (outcomes.get(e.getValue()) == Outcome.FAILED) {
                failures++;
            } else {
                files.put(e.getKey(), e.getValue());
            }
        }

        String message = "Downloaded " + downloaded + " previews out of " + tracks.size() + " tracks";
        LOG.info("{} ({} available, {} failed)", message, files.size(), failures);
        return new FetchSummary(FetchSummary.Status.SUCCESS, message, tracks.size(), downloaded, failures, files);
    }

    /**
     * @return local clip path for a track: sanitized {@code "name - artist"} plus the extension
     */
    public Path targetFor(Path targetDir, TrackDescriptor track) {
        return targetDir.resolve(FilenameSanitizer.sanitize(track.displayKey()) + fileExtension);
    }

    public String fileExtension() {
        return fileExtension;
    }

    private Map<String, String> resolveMissing(List<TrackDescriptor> tracks) {
        List<TrackDescriptor> missing = new ArrayList<>();
        for (TrackDescriptor t : tracks) {
            if (!t.hasPreviewUrl()) {
                missing.add(t);
            }
        }
        if (missing.isEmpty()) {
            return Map.of();
        }
        return resolver.resolve(missing);
    }

    private Outcome downloadOne(String url, Path target) {
        if (Files.exists(target)) {
            LOG.debug("Preview already present: {}", target.getFileName());
            return Outcome.PRESENT;
        }
        try {
            downloader.download(url, target);
            return Outcome.DOWNLOADED;
        } catch (IOException e) {
            LOG.warn("Download failed for {}: {}", target.getFileName(), e.getMessage());
            return Outcome.FAILED;
        }
    }

    private static Outcome await(CompletableFuture<Outcome> future) {
        try {
            return future.join();
        } catch (CompletionException | CancellationException e) {
            LOG.error("Download task failed unexpectedly", e);
            return Outcome.FAILED;
        }
    }
}
