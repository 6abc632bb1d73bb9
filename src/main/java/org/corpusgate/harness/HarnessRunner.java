package org.corpusgate.harness;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Runs every configured invocation for one corpus file and folds them into a {@link RunResult}.
 *
 * <p>Per file: {@code info} once, {@code json} twice and, when enabled, {@code markdown} twice.
 * Each structured-output invocation is a fresh process so the determinism check compares two
 * independent runs. The file succeeds only if every invocation exits with status 0.
 */
public final class HarnessRunner {
    public static final String INFO_COMMAND = "info";
    public static final String STRUCTURED_COMMAND = "json";
    public static final String SECONDARY_COMMAND = "markdown";

    private final ProgramInvoker invoker;
    private final boolean checkSecondaryFormat;
    private final OutputClassifier classifier;
    private final DeterminismChecker determinismChecker;
    private final StatsExtractor statsExtractor;

    public HarnessRunner(ProgramInvoker invoker, boolean checkSecondaryFormat) {
        this(invoker, checkSecondaryFormat, new OutputClassifier(), new DeterminismChecker(), new StatsExtractor());
    }

    HarnessRunner(
        ProgramInvoker invoker,
        boolean checkSecondaryFormat,
        OutputClassifier classifier,
        DeterminismChecker determinismChecker,
        StatsExtractor statsExtractor
    ) {
        this.invoker = Objects.requireNonNull(invoker, "invoker");
        this.checkSecondaryFormat = checkSecondaryFormat;
        this.classifier = Objects.requireNonNull(classifier, "classifier");
        this.determinismChecker = Objects.requireNonNull(determinismChecker, "determinismChecker");
        this.statsExtractor = Objects.requireNonNull(statsExtractor, "statsExtractor");
    }

    public RunResult run(CorpusFile file) {
        Objects.requireNonNull(file, "file");
        InvocationResult info = invoker.invoke(INFO_COMMAND, file.path());
        InvocationResult structuredA = invoker.invoke(STRUCTURED_COMMAND, file.path());
        InvocationResult structuredB = invoker.invoke(STRUCTURED_COMMAND, file.path());
        InvocationResult secondaryA = null;
        InvocationResult secondaryB = null;
        if (checkSecondaryFormat) {
            secondaryA = invoker.invoke(SECONDARY_COMMAND, file.path());
            secondaryB = invoker.invoke(SECONDARY_COMMAND, file.path());
        }

        List<InvocationResult> invocations = new ArrayList<>(5);
        invocations.add(info);
        invocations.add(structuredA);
        invocations.add(structuredB);
        if (checkSecondaryFormat) {
            invocations.add(secondaryA);
            invocations.add(secondaryB);
        }

        long timingMillis = 0L;
        boolean ok = true;
        for (InvocationResult invocation : invocations) {
            timingMillis += invocation.elapsedMillis();
            ok &= invocation.succeeded();
        }

        RunResult.Builder builder = RunResult.builder(file.relpath(), file.category())
            .sizeBytes(file.sizeBytes())
            .timingMillis(timingMillis);

        if (checkSecondaryFormat && secondaryA.succeeded() && secondaryB.succeeded()) {
            builder.secondaryFormat(determinismChecker.compare(secondaryA, secondaryB));
        }

        if (ok) {
            builder.succeeded(determinismChecker.compare(structuredA, structuredB));
            statsExtractor.extract(structuredA.stdout()).ifPresent(builder::stats);
        } else {
            int dominantExitCode = dominantExitCode(structuredA, info, secondaryA, secondaryB, structuredB);
            builder.failed(classifier.classify(invocations, dominantExitCode));
        }
        return builder.build();
    }

    /**
     * First non-zero exit status in the given priority order, or 0.
     */
    static int dominantExitCode(InvocationResult... byPriority) {
        for (InvocationResult invocation : byPriority) {
            if (invocation != null && !invocation.succeeded()) {
                return invocation.exitCode();
            }
        }
        return InvocationResult.SUCCESS_EXIT_CODE;
    }
}
