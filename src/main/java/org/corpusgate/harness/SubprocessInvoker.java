package org.corpusgate.harness;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.security.MessageDigest;
import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.TimeUnit;
import java.util.stream.Collectors;

/**
 * Invokes the program under test as a child process with a hard wall-clock timeout.
 *
 * <p>Standard output and standard error are redirected to scratch files, so output written before
 * a timeout is preserved and no pipe can fill up and stall the child. Output written after the
 * deadline is cut off. On every exit path the child and its descendants are terminated and
 * reaped and the scratch files are removed. A scratch file that cannot be read back is recorded
 * as a failed invocation rather than aborting the run.
 */
public final class SubprocessInvoker implements ProgramInvoker {
    public static final int DEFAULT_MAX_CAPTURED_BYTES = 64 * 1024 * 1024;

    private static final long REAP_GRACE_MILLIS = 5_000L;
    private static final int READ_BUFFER_BYTES = 64 * 1024;

    private final Path program;
    private final Duration timeout;
    private final int maxCapturedBytes;

    public SubprocessInvoker(Path program, Duration timeout) {
        this(program, timeout, DEFAULT_MAX_CAPTURED_BYTES);
    }

    public SubprocessInvoker(Path program, Duration timeout, int maxCapturedBytes) {
        this.program = Objects.requireNonNull(program, "program");
        this.timeout = Objects.requireNonNull(timeout, "timeout");
        if (timeout.isNegative() || timeout.isZero()) {
            throw new IllegalArgumentException("timeout must be > 0");
        }
        if (maxCapturedBytes <= 0) {
            throw new IllegalArgumentException("maxCapturedBytes must be > 0");
        }
        this.maxCapturedBytes = maxCapturedBytes;
    }

    @Override
    public InvocationResult invoke(String subcommand, Path file) {
        Objects.requireNonNull(subcommand, "subcommand");
        Objects.requireNonNull(file, "file");
        List<String> command = List.of(program.toString(), subcommand, file.toString());

        Path stdoutFile = null;
        Path stderrFile = null;
        try {
            stdoutFile = Files.createTempFile("corpus-gate-", ".stdout");
            stderrFile = Files.createTempFile("corpus-gate-", ".stderr");
        } catch (IOException e) {
            deleteQuietly(stdoutFile);
            throw new UncheckedIOException("Failed to create capture files for " + command, e);
        }
        try {
            return run(command, stdoutFile, stderrFile);
        } finally {
            deleteQuietly(stdoutFile);
            deleteQuietly(stderrFile);
        }
    }

    private InvocationResult run(List<String> command, Path stdoutFile, Path stderrFile) {
        ProcessBuilder builder = new ProcessBuilder(command);
        builder.redirectOutput(stdoutFile.toFile());
        builder.redirectError(stderrFile.toFile());

        long startedAtNanos = System.nanoTime();
        Process process;
        try {
            process = builder.start();
        } catch (IOException e) {
            return InvocationResult.spawnFailure(
                "failed to start " + command.get(0) + ": " + e.getMessage(),
                elapsedMillisSince(startedAtNanos)
            );
        }
        closeStandardInput(process);

        boolean finished;
        long stdoutLimit = Long.MAX_VALUE;
        long stderrLimit = Long.MAX_VALUE;
        try {
            finished = process.waitFor(timeout.toMillis(), TimeUnit.MILLISECONDS);
            if (!finished) {
                // output written after the deadline is not part of the result
                stdoutLimit = Files.size(stdoutFile);
                stderrLimit = Files.size(stderrFile);
                terminate(process);
            }
        } catch (InterruptedException e) {
            terminate(process);
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while waiting for " + command, e);
        } catch (IOException e) {
            return InvocationResult.captureFailure(
                "failed to read captured output of " + command.get(0) + ": " + e.getMessage(),
                elapsedMillisSince(startedAtNanos)
            );
        } finally {
            if (process.isAlive()) {
                terminate(process);
            }
        }
        long elapsedMillis = elapsedMillisSince(startedAtNanos);

        int exitCode = finished ? process.exitValue() : InvocationResult.TIMEOUT_EXIT_CODE;
        try {
            Capture stdout = capture(stdoutFile, maxCapturedBytes, stdoutLimit);
            Capture stderr = capture(stderrFile, maxCapturedBytes, stderrLimit);
            return new InvocationResult(exitCode, stdout.bytes(), stderr.bytes(), stdout.sha256(), elapsedMillis);
        } catch (IOException e) {
            return InvocationResult.captureFailure(
                "failed to read captured output of " + command.get(0) + ": " + e.getMessage(),
                elapsedMillis
            );
        }
    }

    /**
     * Kills the child first so it cannot run past the deadline, then whatever it spawned, and
     * waits for the child to be reaped.
     */
    private static void terminate(Process process) {
        List<ProcessHandle> descendants = process.descendants().collect(Collectors.toList());
        process.destroyForcibly();
        descendants.forEach(ProcessHandle::destroyForcibly);
        boolean interrupted = false;
        long deadline = System.nanoTime() + TimeUnit.MILLISECONDS.toNanos(REAP_GRACE_MILLIS);
        while (process.isAlive() && System.nanoTime() < deadline) {
            try {
                process.waitFor(REAP_GRACE_MILLIS, TimeUnit.MILLISECONDS);
            } catch (InterruptedException e) {
                interrupted = true;
            }
        }
        if (interrupted) {
            Thread.currentThread().interrupt();
        }
    }

    /**
     * Hashes the first {@code limit} bytes of the file and retains at most {@code maxBytes} of them.
     */
    private static Capture capture(Path file, int maxBytes, long limit) throws IOException {
        MessageDigest digest = DeterminismChecker.newSha256();
        ByteArrayOutputStream retained = new ByteArrayOutputStream();
        byte[] buffer = new byte[READ_BUFFER_BYTES];
        long remaining = limit;
        try (InputStream input = Files.newInputStream(file)) {
            int read;
            while (remaining > 0L && (read = input.read(buffer, 0, (int) Math.min(buffer.length, remaining))) != -1) {
                remaining -= read;
                digest.update(buffer, 0, read);
                int room = maxBytes - retained.size();
                if (room > 0) {
                    retained.write(buffer, 0, Math.min(room, read));
                }
            }
        }
        return new Capture(retained.toByteArray(), DeterminismChecker.toHex(digest.digest()));
    }

    private static void closeStandardInput(Process process) {
        try {
            process.getOutputStream().close();
        } catch (IOException ignored) {
            // the child may already have exited
        }
    }

    private static long elapsedMillisSince(long startedAtNanos) {
        return Math.max(0L, (System.nanoTime() - startedAtNanos) / 1_000_000L);
    }

    private static void deleteQuietly(Path file) {
        if (file == null) {
            return;
        }
        try {
            Files.deleteIfExists(file);
        } catch (IOException e) {
            file.toFile().deleteOnExit();
        }
    }

    private record Capture(byte[] bytes, String sha256) {
    }
}
