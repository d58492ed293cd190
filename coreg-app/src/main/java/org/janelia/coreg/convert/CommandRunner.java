package org.janelia.coreg.convert;

import java.io.IOException;
import java.util.List;

/**
 * Runs an external command line tool.
 */
public interface CommandRunner {

    /**
     * Runs the specified command and waits for it to finish.
     *
     * @param  command  executable followed by its arguments.
     *
     * @throws IOException
     *   if the command cannot be started, is interrupted, or exits with a non-zero code.
     */
    void run(final List<String> command)
            throws IOException;
}
