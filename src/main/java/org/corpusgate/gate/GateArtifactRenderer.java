package org.corpusgate.gate;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import org.corpusgate.harness.ErrorKind;
import org.corpusgate.harness.RunResult;
import org.corpusgate.harness.StructureStats;
import org.corpusgate.manifest.Category;
import org.corpusgate.obs.JsonEncoder;

/**
 * Renders details records, the summary document and console text for a gate run.
 */
public final class GateArtifactRenderer {
    static final String UNLABELED_NOTE =
        "Files without category in the manifest are counted under '_' and are not gated unless labeled A/B/C.";

    public String toDetailsLine(RunResult result) {
        return JsonEncoder.encode(detailsRecord(result));
    }

    public String toSummaryJson(
        GateSummary summary,
        GateThresholds thresholds,
        GateDecision decision,
        ReportWriter.ArtifactPaths artifacts
    ) {
        return JsonEncoder.encodePretty(summaryDocument(summary, thresholds, decision, artifacts));
    }

    static Map<String, Object> detailsRecord(RunResult result) {
        Objects.requireNonNull(result, "result");
        StructureStats stats = result.stats().orElse(null);
        Map<String, Object> root = new LinkedHashMap<>();
        root.put("relpath", result.relpath());
        root.put("category", result.category() == Category.UNLABELED ? null : result.category().key());
        root.put("size_bytes", result.sizeBytes());
        root.put("ok", result.ok());
        root.put("error", result.errorKind().map(ErrorKind::key).orElse(null));
        root.put("timing_ms", result.timingMillis());
        root.put("out_sha256_a", result.outSha256A().orElse(null));
        root.put("out_sha256_b", result.outSha256B().orElse(null));
        root.put("deterministic", result.deterministic().orElse(null));
        root.put("md_sha256_a", result.mdSha256A().orElse(null));
        root.put("md_sha256_b", result.mdSha256B().orElse(null));
        root.put("md_deterministic", result.mdDeterministic().orElse(null));
        root.put("sections", stats == null ? null : stats.sections());
        root.put("paragraphs", stats == null ? null : stats.paragraphs());
        root.put("tables", stats == null ? null : stats.tables());
        return root;
    }

    static Map<String, Object> summaryDocument(
        GateSummary summary,
        GateThresholds thresholds,
        GateDecision decision,
        ReportWriter.ArtifactPaths artifacts
    ) {
        Objects.requireNonNull(summary, "summary");
        Objects.requireNonNull(thresholds, "thresholds");
        Objects.requireNonNull(decision, "decision");
        Objects.requireNonNull(artifacts, "artifacts");

        Map<String, Object> totals = new LinkedHashMap<>();
        Map<String, Object> ok = new LinkedHashMap<>();
        Map<String, Object> successRate = new LinkedHashMap<>();
        for (Category category : Category.values()) {
            PassRate rate = summary.category(category);
            totals.put(category.key(), rate.totalCount());
            ok.put(category.key(), rate.matchCount());
            successRate.put(category.key(), rate.rounded());
        }
        Map<String, Object> perCategory = new LinkedHashMap<>();
        perCategory.put("totals", totals);
        perCategory.put("ok", ok);
        perCategory.put("success_rate", successRate);

        Map<String, Object> timing = new LinkedHashMap<>();
        timing.put("p50", summary.timingMillis().p50());
        timing.put("p95", summary.timingMillis().p95());
        timing.put("p99", summary.timingMillis().p99());

        Map<String, Object> artifactPaths = new LinkedHashMap<>();
        artifactPaths.put("details_jsonl", artifacts.detailsJsonl().toString());
        artifactPaths.put("summary_json", artifacts.summaryJson().toString());

        List<Map<String, Object>> checks = new ArrayList<>();
        for (GateCheck check : decision.checks()) {
            Map<String, Object> item = new LinkedHashMap<>();
            item.put("gate_id", check.gateId());
            item.put("measured_value", check.measuredValue());
            item.put("operator", check.operator().symbol());
            item.put("threshold_value", check.thresholdValue());
            item.put("status", check.status().name());
            checks.add(item);
        }
        Map<String, Object> gate = new LinkedHashMap<>();
        gate.put("passed", decision.passed());
        gate.put("checks", checks);

        Map<String, Object> root = new LinkedHashMap<>();
        root.put("timestamp", summary.timestamp());
        root.put("total_files", summary.totalFiles());
        root.put("ok", summary.okCount());
        root.put("failed", summary.failedCount());
        root.put("per_category", perCategory);
        root.put("deterministic_rate", summary.determinism().rounded());
        root.put("timing_ms", timing);
        root.put("failures_by_type", new LinkedHashMap<>(summary.failuresByType()));
        root.put("thresholds", thresholds.toMap());
        root.put("artifacts", artifactPaths);
        root.put("gate", gate);
        root.put("notes", Map.of("category_underscore", UNLABELED_NOTE));
        return root;
    }

    /**
     * One-line machine-readable summary for CI logs.
     */
    public String toCompactLine(GateSummary summary) {
        Objects.requireNonNull(summary, "summary");
        return String.format(
            Locale.ROOT,
            "total=%d ok=%d det_rate=%s A=%s B=%s C=%s p95=%dms",
            summary.totalFiles(),
            summary.okCount(),
            summary.determinism().rounded(),
            summary.category(Category.A).rounded(),
            summary.category(Category.B).rounded(),
            summary.category(Category.C).rounded(),
            summary.timingMillis().p95()
        );
    }

    public String toConsoleText(GateSummary summary, GateDecision decision) {
        Objects.requireNonNull(summary, "summary");
        Objects.requireNonNull(decision, "decision");
        StringBuilder sb = new StringBuilder();
        sb.append("- overall: ").append(decision.passed() ? "PASS" : "FAIL").append('\n');
        sb.append("- total: ").append(summary.totalFiles()).append('\n');
        sb.append("- ok: ").append(summary.okCount()).append('\n');
        sb.append("- failed: ").append(summary.failedCount()).append('\n');
        for (Category category : Category.values()) {
            sb.append("- category ").append(category.key()).append(": ")
                .append(summary.category(category).formatted()).append('\n');
        }
        sb.append("- deterministicRate: ").append(summary.determinism().formatted()).append('\n');
        sb.append("- timingMs: p50=").append(summary.timingMillis().p50())
            .append(" p95=").append(summary.timingMillis().p95())
            .append(" p99=").append(summary.timingMillis().p99()).append('\n');
        if (!summary.failuresByType().isEmpty()) {
            sb.append("- failuresByType: ").append(JsonEncoder.encode(summary.failuresByType())).append('\n');
        }
        for (GateCheck check : decision.checks()) {
            sb.append("- ").append(check.gateId()).append(": ").append(check.status())
                .append(" (").append(formatValue(check.measuredValue()))
                .append(' ').append(check.operator().symbol()).append(' ')
                .append(formatValue(check.thresholdValue())).append(")\n");
        }
        return sb.toString();
    }

    private static String formatValue(double value) {
        if (value == Math.rint(value) && Math.abs(value) >= 1.0d) {
            return String.format(Locale.ROOT, "%.0f", value);
        }
        return String.format(Locale.ROOT, "%.4f", value);
    }
}
