package com.phillippitts.trackembed.exception;

import java.nio.file.Path;

/**
 * Thrown when a downloaded clip cannot be decoded or transcoded, or when the transcoded
 * output does not match the model format (24 kHz, 16-bit signed PCM, mono).
 */
public class InvalidAudioException extends TrackEmbedException {

    private final String source;
    private final String reason;

    public InvalidAudioException(String reason) {
        super("Invalid audio: " + reason);
        this.source = "";
        this.reason = reason;
    }

    public InvalidAudioException(Path source, String reason) {
        super("Invalid audio (" + source.getFileName() + "): " + reason);
        this.source = source.toString();
        this.reason = reason;
    }

    public InvalidAudioException(Path source, String reason, Throwable cause) {
        super("Invalid audio (" + source.getFileName() + "): " + reason, cause);
        this.source = source.toString();
        this.reason = reason;
    }

    public String getSource() {
        return source;
    }

    public String getReason() {
        return reason;
    }
}
