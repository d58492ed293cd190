package org.janelia.coreg.client;

import org.janelia.coreg.transform.SingularTransformException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Command line client wrapper that logs entry, exit and failures and then
 * terminates the JVM with a status that workflow engines can branch on:
 *
 * <ul>
 *     <li>{@link #SUCCESS} when the client completes,</li>
 *     <li>{@link #INVALID_INPUT} for bad arguments, transform files or candidate lists,</li>
 *     <li>{@link #DEGENERATE_REGISTRATION} when an upstream registration produced a singular matrix,</li>
 *     <li>{@link #FAILURE} for anything else (e.g. a conversion tool failed).</li>
 * </ul>
 *
 * Absence of the standard exit log message indicates that the client was terminated abnormally.
 */
public abstract class ClientRunner {

    public static final int SUCCESS = 0;
    public static final int FAILURE = 1;
    public static final int INVALID_INPUT = 2;
    public static final int DEGENERATE_REGISTRATION = 3;

    private final String[] args;

    /**
     * @param  args  command line arguments for client.
     */
    public ClientRunner(final String[] args) {
        this.args = args;
    }

    public void run() {
        System.exit(runAndGetExitStatus());
    }

    /**
     * Runs the client without exiting the JVM.
     *
     * @return exit status for the run.
     */
    public int runAndGetExitStatus() {

        LOG.info("run: entry");

        final long startTime = System.currentTimeMillis();

        int exitStatus;
        try {
            runClient(args);
            exitStatus = SUCCESS;
        } catch (final Throwable t) {
            LOG.error("run: caught exception", t);
            exitStatus = getExitStatus(t);
        }

        LOG.info("run: exit, status {} after {} ms", exitStatus, System.currentTimeMillis() - startTime);

        return exitStatus;
    }

    /**
     * This method should contain the specific client implementation to be wrapped.
     *
     * @param  args  command line arguments for client.
     *
     * @throws Exception
     *   if the client fails for any reason.
     */
    public abstract void runClient(final String[] args) throws Exception;

    static int getExitStatus(final Throwable t) {
        final int exitStatus;
        if (t instanceof SingularTransformException) {
            exitStatus = DEGENERATE_REGISTRATION;
        } else if (t instanceof IllegalArgumentException) {
            exitStatus = INVALID_INPUT;
        } else {
            exitStatus = FAILURE;
        }
        return exitStatus;
    }

    private static final Logger LOG = LoggerFactory.getLogger(ClientRunner.class);
}
