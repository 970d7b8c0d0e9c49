package com.phillippitts.trackembed.service.pipeline;

import com.phillippitts.trackembed.config.properties.PipelineProperties;
import com.phillippitts.trackembed.service.metrics.PipelineMetrics;
import com.phillippitts.trackembed.util.TimeUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.scheduling.annotation.Scheduled;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;

/**
 * Enforces the per-job wall-clock limits.
 *
 * <p>Past the soft limit a job is reported once with a warning. Past the hard limit it is
 * marked failed and its worker is interrupted; any in-flight stage output is discarded.
 */
public class JobTimeoutWatchdog {

    private static final Logger LOG = LogManager.getLogger(JobTimeoutWatchdog.class);

    private final PipelineJobRegistry registry;
    private final PipelineProperties props;
    private final PipelineMetrics metrics;
    private final Clock clock;

    public JobTimeoutWatchdog(PipelineJobRegistry registry, PipelineProperties props, PipelineMetrics metrics,
                              Clock clock) {
        this.registry = Objects.requireNonNull(registry, "registry");
        this.props = Objects.requireNonNull(props, "props");
        this.metrics = Objects.requireNonNull(metrics, "metrics");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    @Scheduled(fixedDelayString = "${pipeline.watchdog-interval-ms:15000}")
    public void checkJobs() {
        Instant now = clock.instant();
        for (PipelineJob job : registry.activeJobs()) {
            Instant started = job.startedAt();
            if (started == null) {
                continue;
            }
            Duration elapsed = Duration.between(started, now);
            if (elapsed.compareTo(props.getHardTimeLimit()) > 0) {
                String msg = "Job exceeded time limit of " + props.getHardTimeLimit().toMinutes() + " minutes";
                if (job.fail(msg)) {
                    LOG.error("Job {} for user {} killed after {}", job.token(), job.userId(), TimeUtils.describe(elapsed));
                    metrics.incrementJobOutcome("timeout");
                    job.cancelExecution();
                }
            } else if (elapsed.compareTo(props.getSoftTimeLimit()) > 0 && job.markSoftLimitReported()) {
                LOG.warn("Job {} for user {} running for {}, past soft limit of {}",
                        job.token(), job.userId(), TimeUtils.describe(elapsed),
                        TimeUtils.describe(props.getSoftTimeLimit()));
            }
        }

        int purged = registry.purgeFinishedBefore(now.minus(props.getFinishedJobRetention()));
        if (purged > 0) {
            LOG.info("Dropped {} finished jobs not polled within {}", purged,
                    TimeUtils.describe(props.getFinishedJobRetention()));
        }
    }
}
