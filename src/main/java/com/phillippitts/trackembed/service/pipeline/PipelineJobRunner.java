package com.phillippitts.trackembed.service.pipeline;

import com.phillippitts.trackembed.domain.JobStage;
import com.phillippitts.trackembed.domain.JobStatus;
import com.phillippitts.trackembed.service.metrics.PipelineMetrics;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.apache.logging.log4j.ThreadContext;
import org.springframework.core.task.AsyncTaskExecutor;
import org.springframework.core.task.TaskRejectedException;

import java.util.List;
import java.util.Objects;
import java.util.concurrent.Future;

/**
 * Accepts job submissions and runs each job on the pipeline executor.
 *
 * <p>{@link #submit(String, List)} returns the job token immediately. The worker marks the job
 * {@link JobStage#STARTED}, puts {@code jobId} and {@code userId} into the Log4j2
 * {@link ThreadContext}, and hands the job to the {@link LibraryPipelineOrchestrator}. A
 * structural error escaping the orchestrator is logged here and rethrown, so the job's
 * {@link Future} completes exceptionally.
 */
public class PipelineJobRunner {

    private static final Logger LOG = LogManager.getLogger(PipelineJobRunner.class);

    private final PipelineJobRegistry registry;
    private final LibraryPipelineOrchestrator orchestrator;
    private final AsyncTaskExecutor executor;
    private final PipelineMetrics metrics;

    public PipelineJobRunner(PipelineJobRegistry registry, LibraryPipelineOrchestrator orchestrator,
                             AsyncTaskExecutor executor, PipelineMetrics metrics) {
        this.registry = Objects.requireNonNull(registry, "registry");
        this.orchestrator = Objects.requireNonNull(orchestrator, "orchestrator");
        this.executor = Objects.requireNonNull(executor, "executor");
        this.metrics = Objects.requireNonNull(metrics, "metrics");
    }

    /**
     * Registers a job and queues it.
     *
     * @param userId owner of the track list
     * @param rawTracks track payloads as received
     * @return opaque job token
     * @throws TaskRejectedException if the executor queue is full; the job is discarded
     */
    public String submit(String userId, List<?> rawTracks) {
        PipelineJob job = registry.create(userId, rawTracks);
        try {
            Future<?> future = executor.submit(() -> execute(job));
            job.attach(future);
        } catch (TaskRejectedException e) {
            LOG.warn("Pipeline executor saturated; rejecting job for user {}", userId);
            job.fail("Pipeline is at capacity");
            registry.release(job.token());
            metrics.incrementJobOutcome("rejected");
            throw e;
        }
        LOG.info("Submitted job {} for user {} ({} tracks)", job.token(), userId, rawTracks.size());
        return job.token();
    }

    /**
     * @see PipelineJobRegistry#status(String)
     */
    public JobStatus status(String token) {
        return registry.status(token);
    }

    void execute(PipelineJob job) {
        ThreadContext.put("jobId", job.token());
        ThreadContext.put("userId", job.userId());
        try {
            if (!job.advance(JobStage.STARTED, "Task started")) {
                LOG.info("Job {} was terminated before it started", job.token());
                return;
            }
            orchestrator.run(job);
        } catch (RuntimeException e) {
            LOG.error("Job {} errored: {}", job.token(), e.toString());
            throw e;
        } finally {
            ThreadContext.remove("jobId");
            ThreadContext.remove("userId");
        }
    }
}
