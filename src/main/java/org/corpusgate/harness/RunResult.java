package org.corpusgate.harness;

import java.util.Objects;
import java.util.Optional;
import org.corpusgate.manifest.Category;

/**
 * Outcome for one corpus file in one gate run.
 *
 * <p>A successful result has no error kind; a failed result always has one. Hashes, the
 * determinism verdict and structure stats are only meaningful for successful results.
 */
public final class RunResult {
    private final String relpath;
    private final Category category;
    private final long sizeBytes;
    private final boolean ok;
    private final ErrorKind errorKind;
    private final long timingMillis;
    private final String outSha256A;
    private final String outSha256B;
    private final Boolean deterministic;
    private final String mdSha256A;
    private final String mdSha256B;
    private final Boolean mdDeterministic;
    private final StructureStats stats;

    private RunResult(Builder builder) {
        this.relpath = Objects.requireNonNull(builder.relpath, "relpath");
        this.category = builder.category == null ? Category.UNLABELED : builder.category;
        if (builder.sizeBytes < 0L) {
            throw new IllegalArgumentException("sizeBytes must be >= 0");
        }
        if (builder.timingMillis < 0L) {
            throw new IllegalArgumentException("timingMillis must be >= 0");
        }
        if (builder.ok && builder.errorKind != null) {
            throw new IllegalArgumentException("successful result must not carry an error kind");
        }
        if (!builder.ok && builder.errorKind == null) {
            throw new IllegalArgumentException("failed result requires an error kind");
        }
        if (!builder.ok && (builder.deterministic != null || builder.stats != null)) {
            throw new IllegalArgumentException("failed result must not carry determinism or stats");
        }
        this.sizeBytes = builder.sizeBytes;
        this.ok = builder.ok;
        this.errorKind = builder.errorKind;
        this.timingMillis = builder.timingMillis;
        this.outSha256A = builder.outSha256A;
        this.outSha256B = builder.outSha256B;
        this.deterministic = builder.deterministic;
        this.mdSha256A = builder.mdSha256A;
        this.mdSha256B = builder.mdSha256B;
        this.mdDeterministic = builder.mdDeterministic;
        this.stats = builder.stats;
    }

    public static Builder builder(String relpath, Category category) {
        return new Builder(relpath, category);
    }

    public String relpath() {
        return relpath;
    }

    public Category category() {
        return category;
    }

    public long sizeBytes() {
        return sizeBytes;
    }

    public boolean ok() {
        return ok;
    }

    public Optional<ErrorKind> errorKind() {
        return Optional.ofNullable(errorKind);
    }

    public long timingMillis() {
        return timingMillis;
    }

    public Optional<String> outSha256A() {
        return Optional.ofNullable(outSha256A);
    }

    public Optional<String> outSha256B() {
        return Optional.ofNullable(outSha256B);
    }

    public Optional<Boolean> deterministic() {
        return Optional.ofNullable(deterministic);
    }

    /**
     * True only for a successful result whose two structured outputs hashed equal.
     */
    public boolean isDeterministicSuccess() {
        return ok && Boolean.TRUE.equals(deterministic);
    }

    public Optional<String> mdSha256A() {
        return Optional.ofNullable(mdSha256A);
    }

    public Optional<String> mdSha256B() {
        return Optional.ofNullable(mdSha256B);
    }

    public Optional<Boolean> mdDeterministic() {
        return Optional.ofNullable(mdDeterministic);
    }

    public Optional<StructureStats> stats() {
        return Optional.ofNullable(stats);
    }

    public static final class Builder {
        private final String relpath;
        private final Category category;
        private long sizeBytes;
        private boolean ok;
        private ErrorKind errorKind;
        private long timingMillis;
        private String outSha256A;
        private String outSha256B;
        private Boolean deterministic;
        private String mdSha256A;
        private String mdSha256B;
        private Boolean mdDeterministic;
        private StructureStats stats;

        private Builder(String relpath, Category category) {
            this.relpath = relpath;
            this.category = category;
        }

        public Builder sizeBytes(long sizeBytes) {
            this.sizeBytes = sizeBytes;
            return this;
        }

        public Builder succeeded(DeterminismChecker.Verdict verdict) {
            this.ok = true;
            this.errorKind = null;
            this.outSha256A = verdict.firstSha256();
            this.outSha256B = verdict.secondSha256();
            this.deterministic = verdict.deterministic();
            return this;
        }

        public Builder failed(ErrorKind errorKind) {
            this.ok = false;
            this.errorKind = Objects.requireNonNull(errorKind, "errorKind");
            return this;
        }

        public Builder timingMillis(long timingMillis) {
            this.timingMillis = timingMillis;
            return this;
        }

        public Builder secondaryFormat(DeterminismChecker.Verdict verdict) {
            this.mdSha256A = verdict.firstSha256();
            this.mdSha256B = verdict.secondSha256();
            this.mdDeterministic = verdict.deterministic();
            return this;
        }

        public Builder stats(StructureStats stats) {
            this.stats = stats;
            return this;
        }

        public RunResult build() {
            return new RunResult(this);
        }
    }
}
