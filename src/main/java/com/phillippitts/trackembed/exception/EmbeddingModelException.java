package com.phillippitts.trackembed.exception;

/**
 * Thrown when the external embedding model fails for one normalized clip
 * (crash, timeout, non-zero exit or unreadable output).
 */
public class EmbeddingModelException extends TrackEmbedException {

    private final String audioFile;

    public EmbeddingModelException(String message) {
        super(message);
        this.audioFile = "unknown";
    }

    public EmbeddingModelException(String message, String audioFile) {
        super(message + " (audio: " + audioFile + ")");
        this.audioFile = audioFile;
    }

    public EmbeddingModelException(String message, String audioFile, Throwable cause) {
        super(message + " (audio: " + audioFile + ")", cause);
        this.audioFile = audioFile;
    }

    public String getAudioFile() {
        return audioFile;
    }
}
