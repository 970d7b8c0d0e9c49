package com.phillippitts.trackembed.exception;

import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.net.ConnectException;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ExceptionHierarchyTest {

    @Test
    void trackEmbedExceptionShouldIncludeMessageAndCause() {
        IOException cause = new IOException("IO failure");
        TrackEmbedException ex = new TrackEmbedException("wrapper error", cause);

        assertThat(ex.getMessage()).isEqualTo("wrapper error");
        assertThat(ex.getCause()).isEqualTo(cause);
        assertThat(ex).isInstanceOf(RuntimeException.class);
    }

    @Test
    void allDomainExceptionsExtendBase() {
        assertThat(new InvalidAudioException("bad")).isInstanceOf(TrackEmbedException.class);
        assertThat(new InvalidEmbeddingException(1024, 3)).isInstanceOf(TrackEmbedException.class);
        assertThat(new EmbeddingModelException("boom")).isInstanceOf(TrackEmbedException.class);
        assertThat(new PreviewResolutionException("down")).isInstanceOf(TrackEmbedException.class);
        assertThat(new PipelineJobNotFoundException("t")).isInstanceOf(TrackEmbedException.class);
        assertThat(new EmbeddingNotFoundException("t")).isInstanceOf(TrackEmbedException.class);
        assertThat(new ExternalProcessException("x", "ffmpeg", 1)).isInstanceOf(TrackEmbedException.class);
    }

    @Test
    void invalidAudioExceptionShouldNameFileAndReason() {
        InvalidAudioException ex = new InvalidAudioException(Path.of("/tmp/previews/Song.mp3"), "truncated");

        assertThat(ex.getMessage()).contains("Song.mp3").contains("truncated");
        assertThat(ex.getReason()).isEqualTo("truncated");
        assertThat(ex.getSource()).endsWith("Song.mp3");
    }

    @Test
    void invalidEmbeddingExceptionShouldReportBothDimensions() {
        InvalidEmbeddingException ex = new InvalidEmbeddingException(1024, 3);

        assertThat(ex.getMessage()).isEqualTo("Embedding size must be 1024, got 3");
        assertThat(ex.getExpectedDimension()).isEqualTo(1024);
        assertThat(ex.getActualDimension()).isEqualTo(3);
    }

    @Test
    void connectionExceptionIsAnIndexException() {
        ConnectException cause = new ConnectException("refused");
        VectorIndexConnectionException ex =
                new VectorIndexConnectionException("connect", "http://qdrant:6333", 3, cause);

        assertThat(ex).isInstanceOf(VectorIndexException.class);
        assertThat(ex.getAttempts()).isEqualTo(3);
        assertThat(ex.getUrl()).isEqualTo("http://qdrant:6333");
        assertThat(ex.getMessage()).contains("3 attempt(s)").contains("refused");
    }

    @Test
    void embeddingModelExceptionShouldNameAudioFile() {
        EmbeddingModelException ex = new EmbeddingModelException("runner crashed", "a.wav");

        assertThat(ex.getMessage()).contains("runner crashed").contains("audio: a.wav");
        assertThat(ex.getAudioFile()).isEqualTo("a.wav");
    }

    @Test
    void processExceptionBuilderShouldFormatContext() {
        ExternalProcessException ex = ExternalProcessExceptionBuilder.create("Non-zero exit: 1")
                .tool("ffmpeg")
                .exitCode(1)
                .durationMs(42)
                .metadata("stderr", "Invalid data found")
                .metadata("ignored", null)
                .build();

        assertThat(ex.getMessage())
                .isEqualTo("Non-zero exit: 1 (exitCode=1, durationMs=42, stderr=Invalid data found) (tool: ffmpeg)");
        assertThat(ex.getTool()).isEqualTo("ffmpeg");
        assertThat(ex.getExitCode()).isEqualTo(1);
    }

    @Test
    void processExceptionBuilderDefaultsToolAndExitCode() {
        ExternalProcessException ex = ExternalProcessExceptionBuilder.create("Failed to start").build();

        assertThat(ex.getTool()).isEqualTo("unknown");
        assertThat(ex.getExitCode()).isEqualTo(-1);
        assertThat(ex.getMessage()).isEqualTo("Failed to start (tool: unknown)");
    }

    @Test
    void processExceptionBuilderRejectsEmptyMessage() {
        assertThatThrownBy(() -> ExternalProcessExceptionBuilder.create(""))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
