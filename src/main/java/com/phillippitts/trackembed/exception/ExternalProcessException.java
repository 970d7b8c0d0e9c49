package com.phillippitts.trackembed.exception;

/**
 * Thrown when an external tool (transcoder, preview resolver, inference runner) cannot be
 * started, times out, or exits with a non-zero status.
 */
public class ExternalProcessException extends TrackEmbedException {

    private final String tool;
    private final int exitCode;

    public ExternalProcessException(String message, String tool, int exitCode) {
        super(message + " (tool: " + tool + ")");
        this.tool = tool;
        this.exitCode = exitCode;
    }

    public ExternalProcessException(String message, String tool, int exitCode, Throwable cause) {
        super(message + " (tool: " + tool + ")", cause);
        this.tool = tool;
        this.exitCode = exitCode;
    }

    public String getTool() {
        return tool;
    }

    /**
     * @return exit status of the process, or -1 when it never exited on its own
     */
    public int getExitCode() {
        return exitCode;
    }
}
