package org.corpusgate.gate;

import java.util.Objects;

/**
 * Evaluation output for a single threshold.
 */
public final class GateCheck {
    private final String gateId;
    private final QualityGateOperator operator;
    private final double measuredValue;
    private final double thresholdValue;
    private final QualityGateStatus status;

    GateCheck(
        String gateId,
        QualityGateOperator operator,
        double measuredValue,
        double thresholdValue,
        QualityGateStatus status
    ) {
        this.gateId = requireText(gateId, "gateId");
        this.operator = Objects.requireNonNull(operator, "operator");
        this.measuredValue = requireFinite(measuredValue, "measuredValue");
        this.thresholdValue = requireFinite(thresholdValue, "thresholdValue");
        this.status = Objects.requireNonNull(status, "status");
    }

    public String gateId() {
        return gateId;
    }

    public QualityGateOperator operator() {
        return operator;
    }

    public double measuredValue() {
        return measuredValue;
    }

    public double thresholdValue() {
        return thresholdValue;
    }

    public QualityGateStatus status() {
        return status;
    }

    public boolean passed() {
        return status == QualityGateStatus.PASS;
    }

    private static String requireText(String value, String fieldName) {
        if (value == null || value.trim().isEmpty()) {
            throw new IllegalArgumentException(fieldName + " must not be blank");
        }
        return value.trim();
    }

    private static double requireFinite(double value, String fieldName) {
        if (!Double.isFinite(value)) {
            throw new IllegalArgumentException(fieldName + " must be finite");
        }
        return value;
    }
}
