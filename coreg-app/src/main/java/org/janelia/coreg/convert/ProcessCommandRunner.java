package org.janelia.coreg.convert;

import java.io.IOException;
import java.io.InterruptedIOException;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs commands as child processes that share this process's standard streams.
 */
public class ProcessCommandRunner
        implements CommandRunner {

    @Override
    public void run(final List<String> command)
            throws IOException {

        final ProcessBuilder processBuilder = new ProcessBuilder(command).inheritIO();

        LOG.info("run: running {}", processBuilder.command());

        final Process process = processBuilder.start();
        final int returnCode;
        try {
            returnCode = process.waitFor();
        } catch (final InterruptedException e) {
            process.destroy();
            Thread.currentThread().interrupt();
            final InterruptedIOException ioe = new InterruptedIOException("interrupted while running " + command);
            ioe.initCause(e);
            throw ioe;
        }

        if (returnCode != 0) {
            LOG.error("run: code {} returned", returnCode);
            throw new IOException("command " + command + " failed with code " + returnCode);
        }

        LOG.info("run: code {} returned", returnCode);
    }

    private static final Logger LOG = LoggerFactory.getLogger(ProcessCommandRunner.class);
}
