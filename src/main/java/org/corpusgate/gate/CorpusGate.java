package org.corpusgate.gate;

import java.io.IOException;
import java.nio.file.Files;
import java.time.Clock;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.Function;
import org.corpusgate.harness.CorpusFile;
import org.corpusgate.harness.ErrorKind;
import org.corpusgate.harness.HarnessRunner;
import org.corpusgate.harness.ProgramInvoker;
import org.corpusgate.harness.RunResult;
import org.corpusgate.harness.SubprocessInvoker;
import org.corpusgate.manifest.Category;
import org.corpusgate.manifest.CorpusManifestLoader;
import org.corpusgate.obs.CorrelationContext;
import org.corpusgate.obs.JsonLinesLogger;

/**
 * Runs the corpus gate end to end.
 *
 * <p>Setup checks run first and abort with {@link GateSetupException} before any artifact exists.
 * Files are then processed strictly one after another; each details record is written as soon as
 * its file completes, so the details artifact follows enumeration order.
 */
public final class CorpusGate {
    private final Clock clock;
    private final JsonLinesLogger logger;
    private final Function<GateConfig, ProgramInvoker> invokerFactory;
    private final GateAggregator aggregator;
    private final GateEvaluator evaluator;
    private final GateArtifactRenderer renderer;

    public CorpusGate(Clock clock, JsonLinesLogger logger) {
        this(
            clock,
            logger,
            config -> new SubprocessInvoker(config.program(), config.timeout(), config.maxOutputBytes())
        );
    }

    CorpusGate(Clock clock, JsonLinesLogger logger, Function<GateConfig, ProgramInvoker> invokerFactory) {
        this.clock = Objects.requireNonNull(clock, "clock");
        this.logger = Objects.requireNonNull(logger, "logger");
        this.invokerFactory = Objects.requireNonNull(invokerFactory, "invokerFactory");
        this.aggregator = new GateAggregator();
        this.evaluator = new GateEvaluator();
        this.renderer = new GateArtifactRenderer();
    }

    public GateOutcome run(GateConfig config) throws GateSetupException, IOException {
        Objects.requireNonNull(config, "config");
        String timestamp = ReportWriter.timestamp(clock);
        CorrelationContext setup = CorrelationContext.of(timestamp, "setup");

        try {
            Map<String, Category> categories = CorpusManifestLoader.loadCategoryMap(config.manifest());
            List<CorpusFile> files = new CorpusEnumerator(config.extension())
                .resolve(config.corpusDir(), categories, config.maxFiles());
            if (!Files.isRegularFile(config.program())) {
                throw new GateSetupException(
                    GateSetupException.SetupFailure.PROGRAM_MISSING,
                    "program under test not found: " + config.program().toAbsolutePath().normalize()
                );
            }

            Map<String, Object> startFields = new LinkedHashMap<>();
            startFields.put("corpusDir", config.corpusDir().toString());
            startFields.put("manifestEntries", categories.size());
            startFields.put("files", files.size());
            startFields.put("checkMarkdown", config.checkMarkdown());
            logger.info("gate run started", setup, startFields);

            ReportWriter.ArtifactPaths paths = ReportWriter.artifactPaths(config.reportsDir(), timestamp);
            try (ReportWriter writer = ReportWriter.open(paths, renderer)) {
                HarnessRunner harness = new HarnessRunner(invokerFactory.apply(config), config.checkMarkdown());
                List<RunResult> results = new ArrayList<>(files.size());
                for (CorpusFile file : files) {
                    RunResult result = harness.run(file);
                    results.add(result);
                    writer.append(result);
                    logFileResult(timestamp, result);
                }

                GateSummary summary = aggregator.aggregate(timestamp, results);
                GateDecision decision = evaluator.evaluate(summary, config.thresholds());
                writer.writeSummary(summary, config.thresholds(), decision);

                Map<String, Object> doneFields = new LinkedHashMap<>();
                doneFields.put("passed", decision.passed());
                doneFields.put("total", summary.totalFiles());
                doneFields.put("ok", summary.okCount());
                doneFields.put("summary", paths.summaryJson().toString());
                logger.info("gate run finished", CorrelationContext.of(timestamp, "evaluate"), doneFields);
                return new GateOutcome(summary, decision, paths, results);
            }
        } catch (GateSetupException e) {
            Map<String, Object> fields = new LinkedHashMap<>();
            fields.put("failure", e.failure().name());
            logger.error(e.getMessage(), setup, fields);
            throw e;
        }
    }

    private void logFileResult(String runId, RunResult result) {
        Map<String, Object> fields = new LinkedHashMap<>();
        fields.put("category", result.category().key());
        fields.put("ok", result.ok());
        fields.put("error", result.errorKind().map(ErrorKind::key).orElse(null));
        fields.put("timingMs", result.timingMillis());
        fields.put("deterministic", result.deterministic().orElse(null));
        CorrelationContext context = CorrelationContext.builder(runId, "file").relpath(result.relpath()).build();
        if (result.ok() && !result.isDeterministicSuccess()) {
            logger.warn("file output is not deterministic", context, fields);
            return;
        }
        logger.info(result.ok() ? "file passed" : "file failed", context, fields);
    }

    public static final class GateOutcome {
        private final GateSummary summary;
        private final GateDecision decision;
        private final ReportWriter.ArtifactPaths artifacts;
        private final List<RunResult> results;

        GateOutcome(
            GateSummary summary,
            GateDecision decision,
            ReportWriter.ArtifactPaths artifacts,
            List<RunResult> results
        ) {
            this.summary = Objects.requireNonNull(summary, "summary");
            this.decision = Objects.requireNonNull(decision, "decision");
            this.artifacts = Objects.requireNonNull(artifacts, "artifacts");
            this.results = List.copyOf(Objects.requireNonNull(results, "results"));
        }

        public GateSummary summary() {
            return summary;
        }

        public GateDecision decision() {
            return decision;
        }

        public ReportWriter.ArtifactPaths artifacts() {
            return artifacts;
        }

        public List<RunResult> results() {
            return results;
        }

        public boolean passed() {
            return decision.passed();
        }
    }
}
