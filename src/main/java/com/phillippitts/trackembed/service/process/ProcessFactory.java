package com.phillippitts.trackembed.service.process;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;

/**
 * Seam between {@link ExternalProcessRunner} and the operating system. Tests substitute scripted
 * processes so the transcoder and model stages run without real binaries.
 */
@FunctionalInterface
public interface ProcessFactory {

    /**
     * @param command executable followed by its arguments
     * @param workingDir directory to run in, or {@code null} for the current one
     */
    Process start(List<String> command, Path workingDir) throws IOException;
}
