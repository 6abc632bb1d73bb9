package org.corpusgate.manifest;

import java.util.Locale;

/**
 * Quality tier assigned to a corpus file. Every file lands in exactly one bucket.
 */
public enum Category {
    A("A", true),
    B("B", true),
    C("C", true),
    UNLABELED("_", false);

    private final String key;
    private final boolean gated;

    Category(String key, boolean gated) {
        this.key = key;
        this.gated = gated;
    }

    /**
     * Bucket key used in report artifacts.
     */
    public String key() {
        return key;
    }

    /**
     * Whether a success-rate threshold is ever applied to this bucket.
     */
    public boolean gated() {
        return gated;
    }

    /**
     * Lenient mapping from a manifest value; anything outside A/B/C is unlabeled.
     */
    public static Category fromManifestValue(Object rawValue) {
        if (!(rawValue instanceof String text)) {
            return UNLABELED;
        }
        String normalized = text.trim().toUpperCase(Locale.ROOT);
        return switch (normalized) {
            case "A" -> A;
            case "B" -> B;
            case "C" -> C;
            default -> UNLABELED;
        };
    }
}
