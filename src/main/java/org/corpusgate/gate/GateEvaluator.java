package org.corpusgate.gate;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import org.corpusgate.manifest.Category;

/**
 * Applies {@link GateThresholds} to a {@link GateSummary}.
 *
 * <p>A pure function of its two arguments. Categories without files are exempt and the
 * unlabeled bucket is never checked.
 */
public final class GateEvaluator {
    public static final String CORPUS_SIZE_GATE = "min-corpus-size";
    public static final String SUCCESS_GATE_PREFIX = "min-success-";
    public static final String DETERMINISM_GATE = "min-deterministic-rate";

    public GateDecision evaluate(GateSummary summary, GateThresholds thresholds) {
        Objects.requireNonNull(summary, "summary");
        Objects.requireNonNull(thresholds, "thresholds");

        List<GateCheck> checks = new ArrayList<>();
        if (thresholds.minCorpusSize() > 0) {
            checks.add(check(CORPUS_SIZE_GATE, summary.totalFiles(), thresholds.minCorpusSize()));
        }
        for (Category category : Category.values()) {
            if (!category.gated()) {
                continue;
            }
            PassRate rate = summary.category(category);
            if (rate.totalCount() == 0) {
                continue;
            }
            checks.add(check(SUCCESS_GATE_PREFIX + category.key(), rate.ratio(), thresholds.minSuccessFor(category)));
        }
        checks.add(check(DETERMINISM_GATE, summary.deterministicRate(), thresholds.minDeterministicRate()));
        return new GateDecision(checks);
    }

    private static GateCheck check(String gateId, double measuredValue, double thresholdValue) {
        QualityGateOperator operator = QualityGateOperator.GREATER_OR_EQUAL;
        QualityGateStatus status = operator.test(measuredValue, thresholdValue)
            ? QualityGateStatus.PASS
            : QualityGateStatus.FAIL;
        return new GateCheck(gateId, operator, measuredValue, thresholdValue, status);
    }
}
