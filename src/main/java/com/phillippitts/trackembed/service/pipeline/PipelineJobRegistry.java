package com.phillippitts.trackembed.service.pipeline;

import com.phillippitts.trackembed.domain.JobStatus;
import com.phillippitts.trackembed.exception.PipelineJobNotFoundException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Issues job tokens and holds jobs until their terminal state has been observed.
 *
 * <p>A job is released the first time {@link #status(String)} returns a terminal status for it;
 * later queries for the same token fail with {@link PipelineJobNotFoundException}. Terminal jobs
 * nobody asks about are dropped by {@link #purgeFinishedBefore(Instant)}.
 */
public class PipelineJobRegistry {

    private static final Logger LOG = LogManager.getLogger(PipelineJobRegistry.class);

    private final Map<String, PipelineJob> jobs = new ConcurrentHashMap<>();
    private final Clock clock;

    public PipelineJobRegistry(Clock clock) {
        this.clock = clock;
    }

    public PipelineJobRegistry() {
        this(Clock.systemUTC());
    }

    /**
     * Creates a {@code PENDING} job with a fresh opaque token.
     */
    public PipelineJob create(String userId, List<?> rawTracks) {
        String token = UUID.randomUUID().toString();
        PipelineJob job = new PipelineJob(token, userId, rawTracks, clock);
        jobs.put(token, job);
        LOG.debug("Registered job {} for user {}", token, userId);
        return job;
    }

    /**
     * Returns the current status; a terminal status releases the job.
     *
     * @throws PipelineJobNotFoundException if the token is unknown or already released
     */
    public JobStatus status(String token) {
        PipelineJob job = jobs.get(token);
        if (job == null) {
            throw new PipelineJobNotFoundException(token);
        }
        JobStatus status = job.status();
        if (status.isTerminal() && jobs.remove(token, job)) {
            LOG.debug("Released job {} after terminal state {} was observed", token, status.stage());
        }
        return status;
    }

    /**
     * Drops a job without waiting for its terminal state to be observed.
     */
    public void release(String token) {
        jobs.remove(token);
    }

    /**
     * @return jobs that are not yet terminal
     */
    public List<PipelineJob> activeJobs() {
        List<PipelineJob> active = new ArrayList<>();
        for (PipelineJob job : jobs.values()) {
            if (!job.isTerminal()) {
                active.add(job);
            }
        }
        return active;
    }

    /**
     * Drops terminal jobs that finished before {@code cutoff} without their status being fetched.
     *
     * @return number of jobs dropped
     */
    public int purgeFinishedBefore(Instant cutoff) {
        int purged = 0;
        for (PipelineJob job : jobs.values()) {
            Instant finished = job.finishedAt();
            if (finished != null && finished.isBefore(cutoff) && jobs.remove(job.token(), job)) {
                LOG.debug("Dropped unclaimed job {} ({}), finished at {}", job.token(), job.stage(), finished);
                purged++;
            }
        }
        return purged;
    }

    public int size() {
        return jobs.size();
    }
}
