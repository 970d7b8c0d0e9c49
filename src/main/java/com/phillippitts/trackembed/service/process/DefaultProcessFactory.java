package com.phillippitts.trackembed.service.process;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;

/**
 * Starts real operating-system processes for the transcoder, the preview resolver and the
 * embedding model.
 *
 * <p>None of these tools is fed input, so the child's stdin is closed right after start;
 * ffmpeg otherwise polls it for interactive commands and can stall a worker.
 */
public final class DefaultProcessFactory implements ProcessFactory {

    private static final Logger LOG = LogManager.getLogger(DefaultProcessFactory.class);

    @Override
    public Process start(List<String> command, Path workingDir) throws IOException {
        ProcessBuilder builder = new ProcessBuilder(command).redirectErrorStream(false);
        if (workingDir != null) {
            builder.directory(workingDir.toFile());
        }
        Process process = builder.start();
        process.getOutputStream().close();
        LOG.debug("Started {} as pid {}", command.get(0), process.pid());
        return process;
    }
}
