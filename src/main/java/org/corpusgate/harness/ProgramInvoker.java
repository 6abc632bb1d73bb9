package org.corpusgate.harness;

import java.nio.file.Path;

/**
 * Runs one subcommand of the program under test against one corpus file.
 *
 * <p>Implementations never throw for a failing or hanging program; failures surface as a non-zero
 * exit code on the returned result.
 */
@FunctionalInterface
public interface ProgramInvoker {
    InvocationResult invoke(String subcommand, Path file);
}
