package com.phillippitts.trackembed.config.properties;

import com.phillippitts.trackembed.service.embedding.ReductionPolicy;
import jakarta.validation.constraints.AssertTrue;
import jakarta.validation.constraints.NotNull;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.nio.file.Path;
import java.time.Duration;

/**
 * Configuration properties for the library processing pipeline.
 *
 * <p>Example application.properties:
 * <pre>
 * pipeline.work-dir=data
 * pipeline.artifact-dir=data/embeddings
 * pipeline.soft-time-limit=25m
 * pipeline.hard-time-limit=30m
 * pipeline.finished-job-retention=1h
 * pipeline.layer=-1
 * pipeline.reduction=MEAN
 * </pre>
 */
@ConfigurationProperties(prefix = "pipeline")
@Validated
public class PipelineProperties {

    /** Root for per-user working directories ({@code <work-dir>/<user>/previews}, {@code .../wav}). */
    @NotNull
    private Path workDir = Path.of("data");

    /** Directory receiving one embeddings artifact per user. */
    @NotNull
    private Path artifactDir = Path.of("data", "embeddings");

    /** A job running longer than this is reported with a warning. */
    @NotNull
    private Duration softTimeLimit = Duration.ofMinutes(25);

    /** A job running longer than this is cancelled and marked failed. */
    @NotNull
    private Duration hardTimeLimit = Duration.ofMinutes(30);

    /** Terminal jobs whose status was never fetched are dropped after this long. */
    @NotNull
    private Duration finishedJobRetention = Duration.ofHours(1);

    /** Hidden-state layer to reduce; negative values count from the last layer. */
    private int layer = -1;

    /** Time-axis reduction applied before a vector is stored. */
    @NotNull
    private ReductionPolicy reduction = ReductionPolicy.MEAN;

    @AssertTrue(message = "pipeline.reduction must produce one vector per track (MEAN or MAX)")
    public boolean isReductionStorable() {
        return reduction != ReductionPolicy.NONE;
    }

    @AssertTrue(message = "pipeline.soft-time-limit must not exceed pipeline.hard-time-limit")
    public boolean isTimeLimitOrderValid() {
        return softTimeLimit == null || hardTimeLimit == null || softTimeLimit.compareTo(hardTimeLimit) <= 0;
    }

    public Path getWorkDir() {
        return workDir;
    }

    public void setWorkDir(Path workDir) {
        this.workDir = workDir;
    }

    public Path getArtifactDir() {
        return artifactDir;
    }

    public void setArtifactDir(Path artifactDir) {
        this.artifactDir = artifactDir;
    }

    public Duration getSoftTimeLimit() {
        return softTimeLimit;
    }

    public void setSoftTimeLimit(Duration softTimeLimit) {
        this.softTimeLimit = softTimeLimit;
    }

    public Duration getHardTimeLimit() {
        return hardTimeLimit;
    }

    public void setHardTimeLimit(Duration hardTimeLimit) {
        this.hardTimeLimit = hardTimeLimit;
    }

    public Duration getFinishedJobRetention() {
        return finishedJobRetention;
    }

    public void setFinishedJobRetention(Duration finishedJobRetention) {
        this.finishedJobRetention = finishedJobRetention;
    }

    public int getLayer() {
        return layer;
    }

    public void setLayer(int layer) {
        this.layer = layer;
    }

    public ReductionPolicy getReduction() {
        return reduction;
    }

    public void setReduction(ReductionPolicy reduction) {
        this.reduction = reduction;
    }
}
