package com.phillippitts.trackembed.service.pipeline;

import com.phillippitts.trackembed.config.properties.PipelineProperties;
import com.phillippitts.trackembed.domain.JobResult;
import com.phillippitts.trackembed.domain.JobStage;
import com.phillippitts.trackembed.domain.TrackDescriptor;
import com.phillippitts.trackembed.exception.EmbeddingModelException;
import com.phillippitts.trackembed.exception.InvalidEmbeddingException;
import com.phillippitts.trackembed.exception.TrackEmbedException;
import com.phillippitts.trackembed.exception.VectorIndexException;
import com.phillippitts.trackembed.service.audio.AudioNormalizer;
import com.phillippitts.trackembed.service.audio.NormalizedAudio;
import com.phillippitts.trackembed.service.embedding.EmbeddingArtifactEntry;
import com.phillippitts.trackembed.service.embedding.EmbeddingArtifactWriter;
import com.phillippitts.trackembed.service.embedding.EmbeddingModel;
import com.phillippitts.trackembed.service.embedding.EmbeddingReducer;
import com.phillippitts.trackembed.service.embedding.HiddenStates;
import com.phillippitts.trackembed.service.embedding.ReducedEmbedding;
import com.phillippitts.trackembed.service.index.VectorIndexClient;
import com.phillippitts.trackembed.service.metrics.PipelineMetrics;
import com.phillippitts.trackembed.service.preview.FetchSummary;
import com.phillippitts.trackembed.service.preview.FilenameSanitizer;
import com.phillippitts.trackembed.service.preview.PreviewFetcher;
import com.phillippitts.trackembed.util.LogSanitizer;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.function.Supplier;

/**
 * Drives one job through the pipeline stages:
 * <pre>
 * PROCESSING → DOWNLOADING → CONVERTING → EMBEDDING → COMPLETED
 * </pre>
 *
 * <p>Stages run strictly in sequence within a job. Per-track failures (no preview, failed
 * download, failed transcode, failed inference, failed store) are logged, counted and leave the
 * job running. Structural failures end the job in {@link JobStage#FAILED}: an empty track list,
 * no readable track, a failed fetch stage, or any exception escaping a stage. An escaping
 * exception is rethrown after the job was marked failed so the executor records it as well.
 *
 * <p>A job that becomes terminal from outside (watchdog cancellation) stops at the next check.
 */
public class LibraryPipelineOrchestrator {

    private static final Logger LOG = LogManager.getLogger(LibraryPipelineOrchestrator.class);

    static final String NO_TRACKS_MESSAGE = "No tracks provided for processing";
    static final String NO_VALID_TRACKS_MESSAGE = "No valid tracks found to process";
    static final String PREVIEWS_DIR = "previews";
    static final String WAV_DIR = "wav";

    private final TrackPayloadNormalizer payloadNormalizer;
    private final PreviewFetcher fetcher;
    private final AudioNormalizer audioNormalizer;
    private final EmbeddingModel model;
    private final EmbeddingReducer reducer;
    private final Supplier<VectorIndexClient> indexClient;
    private final EmbeddingArtifactWriter artifactWriter;
    private final PipelineProperties props;
    private final PipelineMetrics metrics;

    /**
     * @param indexClient resolved only when the embedding stage starts, so an unreachable index
     *                    fails the job instead of the application
     */
    public LibraryPipelineOrchestrator(TrackPayloadNormalizer payloadNormalizer,
                                       PreviewFetcher fetcher,
                                       AudioNormalizer audioNormalizer,
                                       EmbeddingModel model,
                                       EmbeddingReducer reducer,
                                       Supplier<VectorIndexClient> indexClient,
                                       EmbeddingArtifactWriter artifactWriter,
                                       PipelineProperties props,
                                       PipelineMetrics metrics) {
        this.payloadNormalizer = Objects.requireNonNull(payloadNormalizer, "payloadNormalizer");
        this.fetcher = Objects.requireNonNull(fetcher, "fetcher");
        this.audioNormalizer = Objects.requireNonNull(audioNormalizer, "audioNormalizer");
        this.model = Objects.requireNonNull(model, "model");
        this.reducer = Objects.requireNonNull(reducer, "reducer");
        this.indexClient = Objects.requireNonNull(indexClient, "indexClient");
        this.artifactWriter = Objects.requireNonNull(artifactWriter, "artifactWriter");
        this.props = Objects.requireNonNull(props, "props");
        this.metrics = Objects.requireNonNull(metrics, "metrics");
    }

    /**
     * Runs the job to a terminal stage.
     *
     * @return the result when the job completed, {@code null} when it failed or was cancelled
     * @throws RuntimeException any structural error, after the job was marked failed
     */
    public JobResult run(PipelineJob job) {
        if (!job.advance(JobStage.PROCESSING, "Processing tracks...")) {
            return null;
        }
        List<?> rawTracks = job.rawTracks();
        if (rawTracks.isEmpty()) {
            LOG.error(NO_TRACKS_MESSAGE);
            failJob(job, NO_TRACKS_MESSAGE);
            return null;
        }
        LOG.info("Starting library processing for user {} with {} tracks", job.userId(), rawTracks.size());

        JobStage current = JobStage.PROCESSING;
        try {
            long t0 = System.nanoTime();
            List<TrackDescriptor> tracks = payloadNormalizer.normalize(rawTracks);
            metrics.recordStageLatency(JobStage.PROCESSING, System.nanoTime() - t0);
            if (tracks.isEmpty()) {
                LOG.error(NO_VALID_TRACKS_MESSAGE);
                failJob(job, NO_VALID_TRACKS_MESSAGE);
                return null;
            }
            LOG.info("Normalized {} of {} track payloads", tracks.size(), rawTracks.size());

            Path userDir = props.getWorkDir().resolve(FilenameSanitizer.sanitize(job.userId()));
            Path previewsDir = userDir.resolve(PREVIEWS_DIR);
            Path wavDir = userDir.resolve(WAV_DIR);

            current = JobStage.DOWNLOADING;
            if (!job.advance(current, "Downloading audio previews...")) {
                return null;
            }
            t0 = System.nanoTime();
            FetchSummary summary = fetcher.fetch(tracks, previewsDir);
            metrics.recordStageLatency(current, System.nanoTime() - t0);
            if (!summary.isSuccess()) {
                String msg = "Failed to download previews: " + summary.message();
                LOG.error(msg);
                failJob(job, msg);
                return null;
            }
            countTrackFailures(current, summary.failures());

            current = JobStage.CONVERTING;
            if (!job.advance(current, "Converting audio files...")) {
                return null;
            }
            t0 = System.nanoTime();
            List<NormalizedAudio> converted = audioNormalizer.normalizeDirectory(previewsDir, wavDir,
                    fetcher.fileExtension());
            metrics.recordStageLatency(current, System.nanoTime() - t0);

            current = JobStage.EMBEDDING;
            if (!job.advance(current, "Extracting embeddings...")) {
                return null;
            }
            t0 = System.nanoTime();
            EmbeddingOutcome outcome = embedAll(job, tracks, summary, converted);
            metrics.recordStageLatency(current, System.nanoTime() - t0);
            if (outcome == null) {
                return null;
            }

            Path artifact = writeArtifact(job.userId(), outcome.entries());
            JobResult result = new JobResult(rawTracks.size(), outcome.stored(), artifact.toString());
            if (job.complete(result, "Library processing completed successfully")) {
                metrics.incrementJobOutcome("completed");
                LOG.info("Job {} completed: {} tracks, {} embeddings", job.token(), result.tracksProcessed(),
                        result.embeddingsGenerated());
            }
            return result;
        } catch (RuntimeException e) {
            LOG.error("Pipeline job {} for user {} failed in stage {}", job.token(), job.userId(), current, e);
            failJob(job, failureMessage(current, e));
            throw e;
        }
    }

    private record EmbeddingOutcome(int stored, List<EmbeddingArtifactEntry> entries) {}

    private EmbeddingOutcome embedAll(PipelineJob job, List<TrackDescriptor> tracks, FetchSummary summary,
                                      List<NormalizedAudio> converted) {
        Map<String, TrackDescriptor> byId = new HashMap<>();
        for (TrackDescriptor t : tracks) {
            byId.putIfAbsent(t.id(), t);
        }
        // Clip file name -> tracks; clips left over from earlier runs have no entry and are ignored
        Map<String, List<String>> tracksByClip = new HashMap<>();
        summary.files().forEach((trackId, file) ->
                tracksByClip.computeIfAbsent(file.getFileName().toString(), k -> new ArrayList<>()).add(trackId));

        int available = summary.files().size();
        int convertedForJob = 0;
        VectorIndexClient index = indexClient.get();

        int stored = 0;
        List<EmbeddingArtifactEntry> entries = new ArrayList<>();
        for (NormalizedAudio audio : converted) {
            List<String> trackIds = tracksByClip.get(audio.source().getFileName().toString());
            if (trackIds == null) {
                LOG.debug("Ignoring clip {} not requested by this job", audio.output().getFileName());
                continue;
            }
            convertedForJob += trackIds.size();
            if (job.isTerminal() || Thread.currentThread().isInterrupted()) {
                LOG.warn("Job {} stopped during embedding", job.token());
                return null;
            }

            ReducedEmbedding reduced;
            int[] shape;
            try {
                HiddenStates states = model.infer(audio.output());
                shape = states.shape();
                reduced = reducer.reduce(states, props.getLayer(), props.getReduction());
            } catch (EmbeddingModelException | IllegalArgumentException e) {
                LOG.error("Embedding failed for {}: {}", audio.output().getFileName(), e.getMessage());
                countTrackFailures(JobStage.EMBEDDING, trackIds.size());
                continue;
            }

            for (String trackId : trackIds) {
                if (storeOne(index, byId.get(trackId), job.userId(), reduced.vector())) {
                    stored++;
                    entries.add(new EmbeddingArtifactEntry(trackId, audio.output(), reduced, shape));
                } else {
                    countTrackFailures(JobStage.EMBEDDING, 1);
                }
            }
        }
        countTrackFailures(JobStage.CONVERTING, available - convertedForJob);
        LOG.info("Stored {} embeddings for {} converted tracks", stored, convertedForJob);
        return new EmbeddingOutcome(stored, entries);
    }

    private boolean storeOne(VectorIndexClient index, TrackDescriptor track, String userId, float[] vector) {
        Map<String, Object> metadata = new HashMap<>();
        metadata.put("name", track.name());
        metadata.put("artist", track.artist());
        metadata.put("duration_ms", track.durationMs());
        metadata.put("user_id", userId);
        try {
            boolean ok = index.storeEmbedding(track.id(), vector, metadata);
            if (!ok) {
                LOG.warn("Embedding for {} was not stored", LogSanitizer.forLog(track.displayKey()));
            }
            return ok;
        } catch (InvalidEmbeddingException e) {
            LOG.error("Rejected embedding for {}: {}", LogSanitizer.forLog(track.displayKey()), e.getMessage());
            return false;
        }
    }

    private Path writeArtifact(String userId, List<EmbeddingArtifactEntry> entries) {
        try {
            return artifactWriter.write(FilenameSanitizer.sanitize(userId), model.name(), entries);
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot write embeddings artifact: " + e.getMessage(), e);
        }
    }

    private void failJob(PipelineJob job, String message) {
        if (job.fail(message)) {
            metrics.incrementJobOutcome("failed");
        }
    }

    private void countTrackFailures(JobStage stage, int count) {
        for (int i = 0; i < count; i++) {
            metrics.incrementTrackFailure(stage);
        }
    }

    /**
     * Client-safe failure text: names the stage and the failure class, never paths or raw messages.
     */
    static String failureMessage(JobStage stage, RuntimeException e) {
        String what;
        if (e instanceof VectorIndexException) {
            what = "vector index unavailable";
        } else if (e instanceof EmbeddingModelException) {
            what = "embedding model failed";
        } else if (e instanceof TrackEmbedException || e instanceof UncheckedIOException) {
            what = "processing error";
        } else {
            what = "internal error";
        }
        return "Error in pipeline during " + stage.name().toLowerCase(Locale.ROOT) + ": " + what;
    }
}
