package com.phillippitts.trackembed.service.pipeline;

import com.phillippitts.trackembed.domain.JobStage;
import com.phillippitts.trackembed.domain.JobStatus;
import com.phillippitts.trackembed.exception.PipelineJobNotFoundException;
import com.phillippitts.trackembed.service.metrics.PipelineMetrics;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.apache.logging.log4j.ThreadContext;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.core.task.AsyncTaskExecutor;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.awaitility.Awaitility.await;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class PipelineJobRunnerTest {

    private PipelineJobRegistry registry;
    private LibraryPipelineOrchestrator orchestrator;
    private SimpleMeterRegistry meterRegistry;
    private PipelineMetrics metrics;
    private ThreadPoolTaskExecutor executor;

    @BeforeEach
    void setUp() {
        registry = new PipelineJobRegistry();
        orchestrator = mock(LibraryPipelineOrchestrator.class);
        meterRegistry = new SimpleMeterRegistry();
        metrics = new PipelineMetrics(meterRegistry);
        executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(1);
        executor.setMaxPoolSize(1);
        executor.setQueueCapacity(4);
        executor.setThreadNamePrefix("pipeline-test-");
        executor.initialize();
        ThreadContext.clearAll();
    }

    @AfterEach
    void tearDown() {
        executor.shutdown();
        ThreadContext.clearAll();
    }

    @Test
    void submitReturnsTokenAndRunsJobOnWorker() {
        AtomicReference<String> jobIdInContext = new AtomicReference<>();
        AtomicReference<String> userIdInContext = new AtomicReference<>();
        AtomicReference<JobStage> stageSeen = new AtomicReference<>();
        AtomicReference<String> threadName = new AtomicReference<>();
        when(orchestrator.run(any(PipelineJob.class))).thenAnswer(inv -> {
            PipelineJob job = inv.getArgument(0);
            jobIdInContext.set(ThreadContext.get("jobId"));
            userIdInContext.set(ThreadContext.get("userId"));
            stageSeen.set(job.stage());
            threadName.set(Thread.currentThread().getName());
            job.fail("No tracks provided for processing");
            return null;
        });
        PipelineJobRunner runner = new PipelineJobRunner(registry, orchestrator, executor, metrics);

        String token = runner.submit("alice", List.of(Map.of("id", "t1")));

        assertThat(token).isNotBlank();
        await().atMost(Duration.ofSeconds(5)).until(() -> registry.activeJobs().isEmpty());
        JobStatus status = runner.status(token);
        assertThat(status.stage()).isEqualTo(JobStage.FAILED);
        assertThat(jobIdInContext.get()).isEqualTo(token);
        assertThat(userIdInContext.get()).isEqualTo("alice");
        assertThat(stageSeen.get()).isEqualTo(JobStage.STARTED);
        assertThat(threadName.get()).startsWith("pipeline-test-");
        assertThatThrownBy(() -> runner.status(token)).isInstanceOf(PipelineJobNotFoundException.class);
    }

    @Test
    void rejectedSubmissionDiscardsJob() {
        AsyncTaskExecutor saturated = mock(AsyncTaskExecutor.class);
        when(saturated.submit(any(Runnable.class))).thenThrow(new TaskRejectedException("queue full"));
        PipelineJobRunner runner = new PipelineJobRunner(registry, orchestrator, saturated, metrics);

        assertThatThrownBy(() -> runner.submit("alice", List.of()))
                .isInstanceOf(TaskRejectedException.class);

        assertThat(registry.size()).isZero();
        assertThat(meterRegistry.counter("trackembed.pipeline.jobs", "outcome", "rejected").count()).isEqualTo(1.0);
    }

    @Test
    void executeSkipsJobTerminatedWhileQueued() {
        PipelineJobRunner runner = new PipelineJobRunner(registry, orchestrator, executor, metrics);
        PipelineJob job = registry.create("alice", List.of());
        job.fail("Job exceeded time limit of 30 minutes");

        runner.execute(job);

        verify(orchestrator, never()).run(any(PipelineJob.class));
    }

    @Test
    void executeRethrowsAndClearsContext() {
        IllegalStateException boom = new IllegalStateException("boom");
        when(orchestrator.run(any(PipelineJob.class))).thenThrow(boom);
        PipelineJobRunner runner = new PipelineJobRunner(registry, orchestrator, executor, metrics);
        PipelineJob job = registry.create("alice", List.of());

        assertThatThrownBy(() -> runner.execute(job)).isSameAs(boom);

        assertThat(ThreadContext.get("jobId")).isNull();
        assertThat(ThreadContext.get("userId")).isNull();
    }

    @Test
    void unknownTokenIsNotFound() {
        PipelineJobRunner runner = new PipelineJobRunner(registry, orchestrator, executor, metrics);

        assertThatThrownBy(() -> runner.status("missing")).isInstanceOf(PipelineJobNotFoundException.class);
    }
}
