package org.corpusgate.obs;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Correlation metadata emitted with every structured log event of a gate run.
 */
public final class CorrelationContext {
    private final String runId;
    private final String stage;
    private final String relpath;

    private CorrelationContext(Builder builder) {
        this.runId = requireText(builder.runId, "runId");
        this.stage = requireText(builder.stage, "stage");
        this.relpath = normalize(builder.relpath);
    }

    public static CorrelationContext of(String runId, String stage) {
        return builder(runId, stage).build();
    }

    public static Builder builder(String runId, String stage) {
        return new Builder(runId, stage);
    }

    public Map<String, Object> asFields() {
        Map<String, Object> fields = new LinkedHashMap<>();
        fields.put("runId", runId);
        fields.put("stage", stage);
        if (relpath != null) {
            fields.put("relpath", relpath);
        }
        return fields;
    }

    private static String requireText(String value, String fieldName) {
        String normalized = normalize(value);
        if (normalized == null) {
            throw new IllegalArgumentException(fieldName + " must not be blank");
        }
        return normalized;
    }

    private static String normalize(String value) {
        if (value == null) {
            return null;
        }
        String trimmed = value.trim();
        return trimmed.isEmpty() ? null : trimmed;
    }

    public static final class Builder {
        private final String runId;
        private final String stage;
        private String relpath;

        private Builder(String runId, String stage) {
            this.runId = Objects.requireNonNull(runId, "runId");
            this.stage = Objects.requireNonNull(stage, "stage");
        }

        public Builder relpath(String relpath) {
            this.relpath = relpath;
            return this;
        }

        public CorrelationContext build() {
            return new CorrelationContext(this);
        }
    }
}
