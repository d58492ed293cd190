package org.janelia.coreg.client;

import java.io.IOException;

import org.janelia.coreg.selection.CandidateSetMismatchException;
import org.janelia.coreg.transform.SingularTransformException;
import org.junit.Assert;
import org.junit.Test;

/**
 * Tests the {@link ClientRunner} class.
 */
public class ClientRunnerTest {

    @Test
    public void testSuccess() {
        final String[] received = new String[1];
        final ClientRunner runner = new ClientRunner(new String[] { "--strategy", "BBREGISTER" }) {
            @Override
            public void runClient(final String[] args) {
                received[0] = args[1];
            }
        };
        Assert.assertEquals("invalid status", ClientRunner.SUCCESS, runner.runAndGetExitStatus());
        Assert.assertEquals("args not passed to client", "BBREGISTER", received[0]);
    }

    @Test
    public void testFailureStatus() {
        validateStatus(new IOException("c3d_affine_tool exited with code 1"), ClientRunner.FAILURE);
        validateStatus(new IllegalStateException("unexpected"), ClientRunner.FAILURE);
        validateStatus(new IllegalArgumentException("missing --fsnativeTransform"), ClientRunner.INVALID_INPUT);
        validateStatus(new CandidateSetMismatchException("2 names but 3 transforms"), ClientRunner.INVALID_INPUT);
        validateStatus(new SingularTransformException("refined transform is singular", new double[] { 1.0, 1.0, 0.0 }),
                       ClientRunner.DEGENERATE_REGISTRATION);
    }

    private static void validateStatus(final Exception failure,
                                       final int expectedStatus) {
        final ClientRunner runner = new ClientRunner(new String[0]) {
            @Override
            public void runClient(final String[] args) throws Exception {
                throw failure;
            }
        };
        Assert.assertEquals("invalid status for " + failure.getClass().getSimpleName(),
                            expectedStatus, runner.runAndGetExitStatus());
    }

}
