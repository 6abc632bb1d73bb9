package org.corpusgate.gate;

import java.util.LinkedHashMap;
import java.util.Map;
import org.corpusgate.manifest.Category;

/**
 * Threshold configuration for the corpus gate.
 */
public final class GateThresholds {
    private final int minCorpusSize;
    private final double minSuccessA;
    private final double minSuccessB;
    private final double minSuccessC;
    private final double minDeterministicRate;

    public GateThresholds(
        int minCorpusSize,
        double minSuccessA,
        double minSuccessB,
        double minSuccessC,
        double minDeterministicRate
    ) {
        if (minCorpusSize < 0) {
            throw new IllegalArgumentException("minCorpusSize must be >= 0");
        }
        this.minCorpusSize = minCorpusSize;
        this.minSuccessA = requireRatio(minSuccessA, "minSuccessA");
        this.minSuccessB = requireRatio(minSuccessB, "minSuccessB");
        this.minSuccessC = requireRatio(minSuccessC, "minSuccessC");
        this.minDeterministicRate = requireRatio(minDeterministicRate, "minDeterministicRate");
    }

    /**
     * V1 acceptance thresholds.
     */
    public static GateThresholds defaults() {
        return new GateThresholds(100, 0.95d, 0.85d, 0.80d, 0.99d);
    }

    public int minCorpusSize() {
        return minCorpusSize;
    }

    public double minSuccessA() {
        return minSuccessA;
    }

    public double minSuccessB() {
        return minSuccessB;
    }

    public double minSuccessC() {
        return minSuccessC;
    }

    public double minDeterministicRate() {
        return minDeterministicRate;
    }

    public double minSuccessFor(Category category) {
        return switch (category) {
            case A -> minSuccessA;
            case B -> minSuccessB;
            case C -> minSuccessC;
            case UNLABELED -> throw new IllegalArgumentException("unlabeled files are never gated");
        };
    }

    Map<String, Object> toMap() {
        Map<String, Object> minSuccess = new LinkedHashMap<>();
        minSuccess.put(Category.A.key(), minSuccessA);
        minSuccess.put(Category.B.key(), minSuccessB);
        minSuccess.put(Category.C.key(), minSuccessC);

        Map<String, Object> root = new LinkedHashMap<>();
        root.put("min_corpus_size", minCorpusSize);
        root.put("min_success", minSuccess);
        root.put("min_deterministic_rate", minDeterministicRate);
        return root;
    }

    private static double requireRatio(double value, String fieldName) {
        if (!Double.isFinite(value)) {
            throw new IllegalArgumentException(fieldName + " must be finite");
        }
        if (value < 0.0d || value > 1.0d) {
            throw new IllegalArgumentException(fieldName + " must be in range [0.0, 1.0]");
        }
        return value;
    }
}
