package org.corpusgate.gate;

import java.nio.file.Path;
import java.time.Duration;
import java.util.Objects;
import org.corpusgate.harness.SubprocessInvoker;

/**
 * Immutable configuration of one gate run.
 */
public final class GateConfig {
    static final Path DEFAULT_CORPUS_DIR = Path.of("corpus/local");
    static final Path DEFAULT_MANIFEST = Path.of("corpus/manifest.json");
    static final Path DEFAULT_PROGRAM = Path.of("target/release/hwp");
    static final Path DEFAULT_REPORTS_DIR = Path.of("reports/v1_gate");
    static final String DEFAULT_EXTENSION = "hwp";
    static final int DEFAULT_TIMEOUT_SECONDS = 30;

    private final Path corpusDir;
    private final Path manifest;
    private final Path program;
    private final Path reportsDir;
    private final String extension;
    private final Duration timeout;
    private final boolean checkMarkdown;
    private final GateThresholds thresholds;
    private final int maxFiles;
    private final int maxOutputBytes;
    private final boolean ciOutput;

    private GateConfig(Builder builder) {
        this.corpusDir = Objects.requireNonNull(builder.corpusDir, "corpusDir").normalize();
        this.manifest = Objects.requireNonNull(builder.manifest, "manifest").normalize();
        this.program = Objects.requireNonNull(builder.program, "program").normalize();
        this.reportsDir = Objects.requireNonNull(builder.reportsDir, "reportsDir").normalize();
        this.extension = requireText(builder.extension, "extension");
        this.timeout = Objects.requireNonNull(builder.timeout, "timeout");
        if (timeout.isZero() || timeout.isNegative()) {
            throw new IllegalArgumentException("timeout must be > 0");
        }
        this.checkMarkdown = builder.checkMarkdown;
        this.thresholds = Objects.requireNonNull(builder.thresholds, "thresholds");
        if (builder.maxFiles < 0) {
            throw new IllegalArgumentException("maxFiles must be >= 0");
        }
        this.maxFiles = builder.maxFiles;
        if (builder.maxOutputBytes <= 0) {
            throw new IllegalArgumentException("maxOutputBytes must be > 0");
        }
        this.maxOutputBytes = builder.maxOutputBytes;
        this.ciOutput = builder.ciOutput;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static GateConfig fromArgs(String[] args) {
        Objects.requireNonNull(args, "args");
        Builder builder = builder();
        int minCorpusSize = GateThresholds.defaults().minCorpusSize();
        double minSuccessA = GateThresholds.defaults().minSuccessA();
        double minSuccessB = GateThresholds.defaults().minSuccessB();
        double minSuccessC = GateThresholds.defaults().minSuccessC();
        double minDeterministicRate = GateThresholds.defaults().minDeterministicRate();

        for (String arg : args) {
            if (arg == null || arg.isBlank()) {
                continue;
            }
            if (arg.startsWith("--corpus-dir=")) {
                builder.corpusDir(Path.of(readValue(arg, "--corpus-dir=")));
                continue;
            }
            if (arg.startsWith("--manifest=")) {
                builder.manifest(Path.of(readValue(arg, "--manifest=")));
                continue;
            }
            if (arg.startsWith("--program=")) {
                builder.program(Path.of(readValue(arg, "--program=")));
                continue;
            }
            if (arg.startsWith("--reports-dir=")) {
                builder.reportsDir(Path.of(readValue(arg, "--reports-dir=")));
                continue;
            }
            if (arg.startsWith("--extension=")) {
                builder.extension(readValue(arg, "--extension="));
                continue;
            }
            if (arg.startsWith("--timeout-s=")) {
                int seconds = parseInt(readValue(arg, "--timeout-s="), "timeout-s");
                if (seconds <= 0) {
                    throw new IllegalArgumentException("timeout-s must be > 0");
                }
                builder.timeout(Duration.ofSeconds(seconds));
                continue;
            }
            if ("--check-markdown".equals(arg)) {
                builder.checkMarkdown(true);
                continue;
            }
            if (arg.startsWith("--min-corpus-size=")) {
                minCorpusSize = parseInt(readValue(arg, "--min-corpus-size="), "min-corpus-size");
                continue;
            }
            if (arg.startsWith("--min-success-a=")) {
                minSuccessA = parseDouble(readValue(arg, "--min-success-a="), "min-success-a");
                continue;
            }
            if (arg.startsWith("--min-success-b=")) {
                minSuccessB = parseDouble(readValue(arg, "--min-success-b="), "min-success-b");
                continue;
            }
            if (arg.startsWith("--min-success-c=")) {
                minSuccessC = parseDouble(readValue(arg, "--min-success-c="), "min-success-c");
                continue;
            }
            if (arg.startsWith("--min-deterministic-rate=")) {
                minDeterministicRate = parseDouble(readValue(arg, "--min-deterministic-rate="), "min-deterministic-rate");
                continue;
            }
            if (arg.startsWith("--max-files=")) {
                builder.maxFiles(parseInt(readValue(arg, "--max-files="), "max-files"));
                continue;
            }
            if (arg.startsWith("--max-output-bytes=")) {
                builder.maxOutputBytes(parseInt(readValue(arg, "--max-output-bytes="), "max-output-bytes"));
                continue;
            }
            if ("--ci".equals(arg)) {
                builder.ciOutput(true);
                continue;
            }
            throw new IllegalArgumentException("unknown option: " + arg);
        }

        builder.thresholds(new GateThresholds(minCorpusSize, minSuccessA, minSuccessB, minSuccessC, minDeterministicRate));
        return builder.build();
    }

    public Path corpusDir() {
        return corpusDir;
    }

    public Path manifest() {
        return manifest;
    }

    public Path program() {
        return program;
    }

    public Path reportsDir() {
        return reportsDir;
    }

    public String extension() {
        return extension;
    }

    public Duration timeout() {
        return timeout;
    }

    public boolean checkMarkdown() {
        return checkMarkdown;
    }

    public GateThresholds thresholds() {
        return thresholds;
    }

    public int maxFiles() {
        return maxFiles;
    }

    public int maxOutputBytes() {
        return maxOutputBytes;
    }

    public boolean ciOutput() {
        return ciOutput;
    }

    private static String readValue(String arg, String prefix) {
        String value = arg.substring(prefix.length()).trim();
        if (value.isEmpty()) {
            throw new IllegalArgumentException(prefix + " requires a value");
        }
        return value;
    }

    private static int parseInt(String value, String optionName) {
        try {
            return Integer.parseInt(value);
        } catch (NumberFormatException exception) {
            throw new IllegalArgumentException(optionName + " must be an integer: " + value);
        }
    }

    private static double parseDouble(String value, String optionName) {
        try {
            return Double.parseDouble(value);
        } catch (NumberFormatException exception) {
            throw new IllegalArgumentException(optionName + " must be a number: " + value);
        }
    }

    private static String requireText(String value, String fieldName) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException(fieldName + " must not be blank");
        }
        return value.trim();
    }

    public static final class Builder {
        private Path corpusDir = DEFAULT_CORPUS_DIR;
        private Path manifest = DEFAULT_MANIFEST;
        private Path program = DEFAULT_PROGRAM;
        private Path reportsDir = DEFAULT_REPORTS_DIR;
        private String extension = DEFAULT_EXTENSION;
        private Duration timeout = Duration.ofSeconds(DEFAULT_TIMEOUT_SECONDS);
        private boolean checkMarkdown;
        private GateThresholds thresholds = GateThresholds.defaults();
        private int maxFiles;
        private int maxOutputBytes = SubprocessInvoker.DEFAULT_MAX_CAPTURED_BYTES;
        private boolean ciOutput;

        private Builder() {
        }

        public Builder corpusDir(Path corpusDir) {
            this.corpusDir = corpusDir;
            return this;
        }

        public Builder manifest(Path manifest) {
            this.manifest = manifest;
            return this;
        }

        public Builder program(Path program) {
            this.program = program;
            return this;
        }

        public Builder reportsDir(Path reportsDir) {
            this.reportsDir = reportsDir;
            return this;
        }

        public Builder extension(String extension) {
            this.extension = extension;
            return this;
        }

        public Builder timeout(Duration timeout) {
            this.timeout = timeout;
            return this;
        }

        public Builder checkMarkdown(boolean checkMarkdown) {
            this.checkMarkdown = checkMarkdown;
            return this;
        }

        public Builder thresholds(GateThresholds thresholds) {
            this.thresholds = thresholds;
            return this;
        }

        public Builder maxFiles(int maxFiles) {
            this.maxFiles = maxFiles;
            return this;
        }

        public Builder maxOutputBytes(int maxOutputBytes) {
            this.maxOutputBytes = maxOutputBytes;
            return this;
        }

        public Builder ciOutput(boolean ciOutput) {
            this.ciOutput = ciOutput;
            return this;
        }

        public GateConfig build() {
            return new GateConfig(this);
        }
    }
}
