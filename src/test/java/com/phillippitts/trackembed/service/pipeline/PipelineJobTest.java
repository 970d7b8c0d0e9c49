package com.phillippitts.trackembed.service.pipeline;

import com.phillippitts.trackembed.domain.JobResult;
import com.phillippitts.trackembed.domain.JobStage;
import com.phillippitts.trackembed.domain.JobStatus;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Arrays;
import java.util.List;
import java.util.concurrent.CompletableFuture;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class PipelineJobTest {

    private static final Clock CLOCK = Clock.fixed(Instant.parse("2024-05-01T10:00:00Z"), ZoneOffset.UTC);

    private static PipelineJob newJob() {
        return new PipelineJob("tok", "user", List.of(), CLOCK);
    }

    @Test
    void startsPendingWithZeroProgress() {
        JobStatus status = newJob().status();

        assertThat(status.stage()).isEqualTo(JobStage.PENDING);
        assertThat(status.progress()).isZero();
        assertThat(status.result()).isNull();
    }

    @Test
    void progressFollowsStages() {
        PipelineJob job = newJob();

        job.advance(JobStage.STARTED, "Task started");
        assertThat(job.status().progress()).isEqualTo(5);
        assertThat(job.startedAt()).isEqualTo(CLOCK.instant());
        job.advance(JobStage.PROCESSING, "p");
        assertThat(job.status().progress()).isEqualTo(20);
        job.advance(JobStage.DOWNLOADING, "d");
        assertThat(job.status().progress()).isEqualTo(40);
        job.advance(JobStage.CONVERTING, "c");
        assertThat(job.status().progress()).isEqualTo(60);
        job.advance(JobStage.EMBEDDING, "e");
        assertThat(job.status().progress()).isEqualTo(80);
        job.complete(new JobResult(3, 2, "/a.json"), "done");

        JobStatus status = job.status();
        assertThat(status.stage()).isEqualTo(JobStage.COMPLETED);
        assertThat(status.progress()).isEqualTo(100);
        assertThat(status.result().embeddingsGenerated()).isEqualTo(2);
        assertThat(status.message()).isEqualTo("done");
    }

    @Test
    void skippingStagesIsIllegal() {
        PipelineJob job = newJob();
        job.advance(JobStage.PROCESSING, "p");

        assertThatThrownBy(() -> job.advance(JobStage.EMBEDDING, "e"))
                .isInstanceOf(IllegalStateException.class);
        assertThatThrownBy(() -> job.complete(new JobResult(1, 1, "x"), "done"))
                .isInstanceOf(IllegalStateException.class);
    }

    @Test
    void failedIsAbsorbing() {
        PipelineJob job = newJob();
        job.advance(JobStage.PROCESSING, "p");

        assertThat(job.fail("boom")).isTrue();
        assertThat(job.fail("again")).isFalse();
        assertThat(job.advance(JobStage.DOWNLOADING, "d")).isFalse();

        JobStatus status = job.status();
        assertThat(status.stage()).isEqualTo(JobStage.FAILED);
        assertThat(status.message()).isEqualTo("boom");
        assertThat(status.progress()).isEqualTo(100);
    }

    @Test
    void advancingToFailedDelegatesToFail() {
        PipelineJob job = newJob();

        assertThat(job.advance(JobStage.FAILED, "x")).isTrue();
        assertThat(job.isTerminal()).isTrue();
    }

    @Test
    void softLimitIsReportedOnce() {
        PipelineJob job = newJob();

        assertThat(job.markSoftLimitReported()).isTrue();
        assertThat(job.markSoftLimitReported()).isFalse();
    }

    @Test
    void cancelExecutionCancelsAttachedFuture() {
        PipelineJob job = newJob();
        CompletableFuture<Void> future = new CompletableFuture<>();
        job.attach(future);

        job.cancelExecution();

        assertThat(future).isCancelled();
    }

    @Test
    void rawTracksMayContainNullsAndAreReadOnly() {
        PipelineJob job = new PipelineJob("t", "u", Arrays.asList("a", null), CLOCK);

        assertThat(job.rawTracks()).hasSize(2);
        assertThatThrownBy(() -> job.rawTracks().clear()).isInstanceOf(UnsupportedOperationException.class);
    }
}
