package org.corpusgate.gate;

import java.io.IOException;
import java.io.PrintStream;
import java.time.Clock;
import java.util.Objects;
import org.corpusgate.obs.JsonLinesLogger;
import org.corpusgate.obs.StructuredJsonLinesLogger;

/**
 * Command-line entry point of the corpus gate.
 *
 * <p>Exit codes: 0 thresholds met, 1 invalid arguments, 2 thresholds not met, 3 setup error.
 * This tool never uploads corpus files anywhere.
 */
public final class CorpusGateCli {
    public static final int EXIT_PASSED = 0;
    public static final int EXIT_INVALID_ARGUMENTS = 1;
    public static final int EXIT_GATE_FAILED = 2;
    public static final int EXIT_SETUP_ERROR = 3;

    private static final String PREFIX = "[corpus-gate] ";

    private final CorpusGate gate;
    private final GateArtifactRenderer renderer;

    CorpusGateCli(CorpusGate gate) {
        this.gate = Objects.requireNonNull(gate, "gate");
        this.renderer = new GateArtifactRenderer();
    }

    public static void main(String[] args) throws Exception {
        Clock clock = Clock.systemDefaultZone();
        int exitCode;
        try (JsonLinesLogger logger = StructuredJsonLinesLogger.toStandardError(clock)) {
            exitCode = new CorpusGateCli(new CorpusGate(clock, logger)).execute(args, System.out, System.err);
        }
        System.exit(exitCode);
    }

    int execute(String[] args, PrintStream out, PrintStream err) throws IOException {
        if (containsHelpFlag(args)) {
            printUsage(out);
            return EXIT_PASSED;
        }

        final GateConfig config;
        try {
            config = GateConfig.fromArgs(args);
        } catch (IllegalArgumentException exception) {
            err.println("Invalid argument: " + exception.getMessage());
            printUsage(err);
            return EXIT_INVALID_ARGUMENTS;
        }

        final CorpusGate.GateOutcome outcome;
        try {
            outcome = gate.run(config);
        } catch (GateSetupException exception) {
            out.println(PREFIX + exception.getMessage());
            if (exception.failure() == GateSetupException.SetupFailure.PROGRAM_MISSING) {
                out.println("Build the program under test or point --program at it.");
            }
            return EXIT_SETUP_ERROR;
        }

        GateSummary summary = outcome.summary();
        if (config.ciOutput()) {
            out.println(PREFIX + renderer.toCompactLine(summary));
            out.println(PREFIX + "summary: " + outcome.artifacts().summaryJson());
        } else {
            out.println("Corpus gate evaluated.");
            out.print(renderer.toConsoleText(summary, outcome.decision()));
            out.println("- detailsJsonl: " + outcome.artifacts().detailsJsonl());
            out.println("- summaryJson: " + outcome.artifacts().summaryJson());
        }

        if (outcome.passed()) {
            return EXIT_PASSED;
        }
        out.println(PREFIX + "FAILED thresholds");
        for (GateCheck check : outcome.decision().failedChecks()) {
            out.println(PREFIX + "- " + check.gateId() + ": " + check.measuredValue()
                + " " + check.operator().symbol() + " " + check.thresholdValue() + " not met");
        }
        out.println(renderer.toSummaryJson(summary, config.thresholds(), outcome.decision(), outcome.artifacts()));
        return EXIT_GATE_FAILED;
    }

    private static boolean containsHelpFlag(String[] args) {
        for (String arg : args) {
            if ("--help".equals(arg)) {
                return true;
            }
        }
        return false;
    }

    private static void printUsage(PrintStream stream) {
        stream.println("Usage: CorpusGateCli [options]");
        stream.println("  --corpus-dir=<path>              Local corpus root (default: corpus/local)");
        stream.println("  --manifest=<path>                Corpus manifest, JSON or YAML (default: corpus/manifest.json)");
        stream.println("  --program=<path>                 Program under test (default: target/release/hwp)");
        stream.println("  --reports-dir=<path>             Artifact directory (default: reports/v1_gate)");
        stream.println("  --extension=<ext>                File extension for directory scans (default: hwp)");
        stream.println("  --timeout-s=<int>                Per-invocation timeout in seconds (default: 30)");
        stream.println("  --check-markdown                 Also run the markdown output twice for determinism");
        stream.println("  --min-corpus-size=<int>          Minimum number of files, 0 disables (default: 100)");
        stream.println("  --min-success-a=<ratio>          Minimum success rate for category A (default: 0.95)");
        stream.println("  --min-success-b=<ratio>          Minimum success rate for category B (default: 0.85)");
        stream.println("  --min-success-c=<ratio>          Minimum success rate for category C (default: 0.80)");
        stream.println("  --min-deterministic-rate=<ratio> Minimum determinism rate (default: 0.99)");
        stream.println("  --max-files=<int>                Process at most this many files, 0 = no limit");
        stream.println("  --max-output-bytes=<int>         Bytes of each output stream kept in memory");
        stream.println("  --ci                             Compact one-line summary");
        stream.println("  --help                           Show this help message");
    }
}
