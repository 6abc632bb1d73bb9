package org.corpusgate.gate;

public enum QualityGateStatus {
    PASS,
    FAIL
}
