package org.corpusgate.harness;

import java.nio.charset.StandardCharsets;
import java.util.Objects;

/**
 * Outcome of one invocation of the program under test.
 *
 * <p>Captured streams may be truncated to a configured cap; {@link #stdoutSha256()} always covers
 * the complete standard output.
 */
public final class InvocationResult {
    public static final int SUCCESS_EXIT_CODE = 0;
    public static final int TIMEOUT_EXIT_CODE = 124;
    public static final int CAPTURE_FAILURE_EXIT_CODE = 125;
    public static final int SPAWN_FAILURE_EXIT_CODE = 127;

    private static final byte[] EMPTY = new byte[0];

    private final int exitCode;
    private final byte[] stdout;
    private final byte[] stderr;
    private final String stdoutSha256;
    private final long elapsedMillis;

    public InvocationResult(int exitCode, byte[] stdout, byte[] stderr, String stdoutSha256, long elapsedMillis) {
        if (elapsedMillis < 0L) {
            throw new IllegalArgumentException("elapsedMillis must be >= 0");
        }
        this.exitCode = exitCode;
        this.stdout = stdout == null ? EMPTY : stdout.clone();
        this.stderr = stderr == null ? EMPTY : stderr.clone();
        this.stdoutSha256 = Objects.requireNonNull(stdoutSha256, "stdoutSha256");
        this.elapsedMillis = elapsedMillis;
    }

    /**
     * Result whose hash is computed from the given, complete standard output.
     */
    public static InvocationResult of(int exitCode, byte[] stdout, byte[] stderr, long elapsedMillis) {
        byte[] safeStdout = stdout == null ? EMPTY : stdout;
        return new InvocationResult(exitCode, safeStdout, stderr, DeterminismChecker.sha256Hex(safeStdout), elapsedMillis);
    }

    public static InvocationResult of(int exitCode, String stdout, String stderr, long elapsedMillis) {
        return of(
            exitCode,
            stdout == null ? EMPTY : stdout.getBytes(StandardCharsets.UTF_8),
            stderr == null ? EMPTY : stderr.getBytes(StandardCharsets.UTF_8),
            elapsedMillis
        );
    }

    static InvocationResult spawnFailure(String message, long elapsedMillis) {
        return of(SPAWN_FAILURE_EXIT_CODE, EMPTY, String.valueOf(message).getBytes(StandardCharsets.UTF_8), elapsedMillis);
    }

    static InvocationResult captureFailure(String message, long elapsedMillis) {
        return of(CAPTURE_FAILURE_EXIT_CODE, EMPTY, String.valueOf(message).getBytes(StandardCharsets.UTF_8), elapsedMillis);
    }

    public int exitCode() {
        return exitCode;
    }

    public boolean succeeded() {
        return exitCode == SUCCESS_EXIT_CODE;
    }

    public boolean timedOut() {
        return exitCode == TIMEOUT_EXIT_CODE;
    }

    public byte[] stdout() {
        return stdout.clone();
    }

    public byte[] stderr() {
        return stderr.clone();
    }

    public String stdoutSha256() {
        return stdoutSha256;
    }

    public long elapsedMillis() {
        return elapsedMillis;
    }
}
