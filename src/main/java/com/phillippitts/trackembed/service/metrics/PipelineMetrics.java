package com.phillippitts.trackembed.service.metrics;

import com.phillippitts.trackembed.domain.JobStage;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Component;

import java.util.Locale;
import java.util.Objects;
import java.util.concurrent.TimeUnit;

/**
 * Centralized metrics for the embedding pipeline.
 *
 * <p>Provides instrumentation for:
 * <ul>
 *   <li>Stage latency per job stage</li>
 *   <li>Job outcomes (completed, failed, timed out)</li>
 *   <li>Per-track failures by stage</li>
 *   <li>Vector index retries by operation and failure kind</li>
 * </ul>
 *
 * <p>All metrics are exposed via Micrometer and available at /actuator/metrics.
 */
@Component
public class PipelineMetrics {

    private static final String METRIC_PREFIX = "trackembed.pipeline";
    private static final String INDEX_PREFIX = "trackembed.index";

    private final MeterRegistry registry;

    public PipelineMetrics(MeterRegistry registry) {
        this.registry = Objects.requireNonNull(registry, "registry");
    }

    /**
     * Records how long one stage of one job took.
     *
     * @param stage stage that finished
     * @param durationNanos duration in nanoseconds
     */
    public void recordStageLatency(JobStage stage, long durationNanos) {
        Timer.builder(METRIC_PREFIX + ".stage.latency")
                .description("Time spent in a pipeline stage")
                .tag("stage", tag(stage.name()))
                .register(registry)
                .record(durationNanos, TimeUnit.NANOSECONDS);
    }

    /**
     * Increments the job outcome counter.
     *
     * @param outcome completed, failed, rejected or timeout
     */
    public void incrementJobOutcome(String outcome) {
        Counter.builder(METRIC_PREFIX + ".jobs")
                .description("Number of finished pipeline jobs by outcome")
                .tag("outcome", outcome)
                .register(registry)
                .increment();
    }

    /**
     * Increments the per-track failure counter.
     *
     * @param stage stage the track dropped out in
     */
    public void incrementTrackFailure(JobStage stage) {
        Counter.builder(METRIC_PREFIX + ".track.failures")
                .description("Number of tracks excluded from a job")
                .tag("stage", tag(stage.name()))
                .register(registry)
                .increment();
    }

    /**
     * Records one index retry.
     *
     * @param operation index operation (store, search, ...)
     * @param kind failure kind that triggered the retry
     */
    public void incrementIndexRetry(String operation, String kind) {
        Counter.builder(INDEX_PREFIX + ".retries")
                .description("Number of retried vector index calls")
                .tag("operation", operation)
                .tag("kind", tag(kind))
                .register(registry)
                .increment();
    }

    private static String tag(String value) {
        return value.toLowerCase(Locale.ROOT);
    }
}
