package org.corpusgate.gate;

import java.util.Objects;

/**
 * Precondition failure that aborts a gate run before any corpus file is processed.
 *
 * <p>Distinct from a gate that ran and missed its thresholds.
 */
public final class GateSetupException extends Exception {
    private static final long serialVersionUID = 1L;

    private final SetupFailure failure;

    public GateSetupException(SetupFailure failure, String message) {
        super(message);
        this.failure = Objects.requireNonNull(failure, "failure");
    }

    public SetupFailure failure() {
        return failure;
    }

    public enum SetupFailure {
        CORPUS_DIR_MISSING,
        NO_CORPUS_FILES,
        PROGRAM_MISSING,
        ARTIFACT_EXISTS
    }
}
