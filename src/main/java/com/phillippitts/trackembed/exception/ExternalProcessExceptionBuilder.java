package com.phillippitts.trackembed.exception;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Fluent builder for {@link ExternalProcessException} with contextual details.
 *
 * <p><b>Usage:</b>
 * <pre>
 * throw ExternalProcessExceptionBuilder.create("Non-zero exit: 1")
 *         .tool("ffmpeg")
 *         .exitCode(1)
 *         .durationMs(420)
 *         .metadata("input", inputPath)
 *         .metadata("stderr", stderrSnippet)
 *         .build();
 * </pre>
 *
 * <p>The final message format is
 * {@code {message} (exitCode={code}, durationMs={ms}, {key}={value}, ...) (tool: {tool})}.
 */
public final class ExternalProcessExceptionBuilder {

    private final String message;
    private String tool;
    private Throwable cause;
    private Integer exitCode;
    private Long durationMs;
    private final Map<String, String> metadata = new LinkedHashMap<>();

    private ExternalProcessExceptionBuilder(String message) {
        this.message = message;
    }

    /**
     * Creates a new builder with the base error message.
     *
     * @param message base error message (must not be null or empty)
     * @return new builder instance
     */
    public static ExternalProcessExceptionBuilder create(String message) {
        if (message == null || message.isEmpty()) {
            throw new IllegalArgumentException("message must not be null or empty");
        }
        return new ExternalProcessExceptionBuilder(message);
    }

    public ExternalProcessExceptionBuilder tool(String tool) {
        this.tool = tool;
        return this;
    }

    public ExternalProcessExceptionBuilder cause(Throwable cause) {
        this.cause = cause;
        return this;
    }

    public ExternalProcessExceptionBuilder exitCode(int exitCode) {
        this.exitCode = exitCode;
        return this;
    }

    public ExternalProcessExceptionBuilder durationMs(long durationMs) {
        this.durationMs = durationMs;
        return this;
    }

    /**
     * Adds a metadata key-value pair to the exception message. Null keys or values are ignored.
     */
    public ExternalProcessExceptionBuilder metadata(String key, Object value) {
        if (key != null && value != null) {
            this.metadata.put(key, String.valueOf(value));
        }
        return this;
    }

    public ExternalProcessException build() {
        String detailedMessage = buildDetailedMessage();
        String toolName = tool != null ? tool : "unknown";
        int code = exitCode != null ? exitCode : -1;

        if (cause != null) {
            return new ExternalProcessException(detailedMessage, toolName, code, cause);
        }
        return new ExternalProcessException(detailedMessage, toolName, code);
    }

    private String buildDetailedMessage() {
        boolean hasDetails = exitCode != null || durationMs != null || !metadata.isEmpty();
        if (!hasDetails) {
            return message;
        }

        StringBuilder sb = new StringBuilder(message).append(" (");
        boolean first = true;

        if (exitCode != null) {
            sb.append("exitCode=").append(exitCode);
            first = false;
        }
        if (durationMs != null) {
            if (!first) {
                sb.append(", ");
            }
            sb.append("durationMs=").append(durationMs);
            first = false;
        }
        for (Map.Entry<String, String> entry : metadata.entrySet()) {
            if (!first) {
                sb.append(", ");
            }
            sb.append(entry.getKey()).append('=').append(entry.getValue());
            first = false;
        }
        return sb.append(')').toString();
    }
}
