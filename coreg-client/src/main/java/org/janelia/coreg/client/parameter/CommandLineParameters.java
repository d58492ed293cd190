package org.janelia.coreg.client.parameter;

import com.beust.jcommander.JCommander;
import com.beust.jcommander.Parameter;
import com.beust.jcommander.ParameterException;
import com.beust.jcommander.Parameters;
import com.beust.jcommander.internal.Console;
import com.fasterxml.jackson.core.JsonProcessingException;

import java.io.Serializable;

import org.janelia.coreg.json.JsonUtils;

/**
 * Base parameters for all command line tools.
 * Subclasses are nested in their client class as a static class named Parameters.
 */
@Parameters
public class CommandLineParameters implements Serializable {

    @Parameter(
            names = "--help",
            description = "Display this note",
            help = true)
    public transient boolean help;

    private transient JCommander jCommander;

    /**
     * Parses arguments for the client class that encloses this parameters class,
     * exiting the JVM after printing usage if help is requested or parsing fails.
     */
    public void parse(final String[] args) throws IllegalArgumentException {
        parse(args, this.getClass().getEnclosingClass(), true);
    }

    /**
     * @param  exitOnHelpOrFailure  if true, exit the JVM after printing usage for --help or a parse failure.
     *
     * @throws IllegalArgumentException
     *   if parsing fails and exitOnHelpOrFailure is false.
     */
    public void parse(final String[] args,
                      final Class<?> programClass,
                      final boolean exitOnHelpOrFailure) throws IllegalArgumentException {

        jCommander = JCommander.newBuilder()
                .addObject(this)
                .programName(getProgramName(programClass))
                .build();

        String parseFailure = null;
        try {
            jCommander.parse(args);
        } catch (final ParameterException pe) {
            parseFailure = pe.getMessage();
        }

        if (help || (parseFailure != null)) {

            printUsage(parseFailure);

            if (exitOnHelpOrFailure) {
                System.exit(parseFailure == null ? 0 : 2);
            } else if (parseFailure != null) {
                throw new IllegalArgumentException("failed to parse command line arguments, " + parseFailure);
            }
        }
    }

    /**
     * @return JSON representation of these parameters (for logging).
     */
    @Override
    public String toString() {
        try {
            return JsonUtils.MAPPER.writeValueAsString(this);
        } catch (final JsonProcessingException e) {
            throw new IllegalArgumentException(e);
        }
    }

    private void printUsage(final String parseFailure) {
        final Console console = jCommander.getConsole();
        if (parseFailure != null) {
            console.println("\nERROR: failed to parse command line arguments\n\n" + parseFailure);
        }
        console.println("");
        jCommander.usage();
    }

    private static String getProgramName(final Class<?> programClass) {
        return programClass == null ?
               "coreg-client" : "java -cp coreg-client-standalone.jar " + programClass.getName();
    }

    /**
     * Prints usage for the specified parameters without exiting (used by tests to verify
     * that parameter annotations are valid).
     */
    public static void parseHelp(final CommandLineParameters parameters) {
        parameters.parse(new String[] { "--help" },
                         parameters.getClass().getEnclosingClass(),
                         false);
    }

}
