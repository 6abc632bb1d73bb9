package org.corpusgate.gate;

import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import org.corpusgate.manifest.Category;

/**
 * Aggregate metrics of one gate run.
 */
public final class GateSummary {
    private final String timestamp;
    private final int totalFiles;
    private final int okCount;
    private final Map<Category, PassRate> perCategory;
    private final PassRate determinism;
    private final Percentiles timingMillis;
    private final Map<String, Integer> failuresByType;

    GateSummary(
        String timestamp,
        int totalFiles,
        int okCount,
        Map<Category, PassRate> perCategory,
        PassRate determinism,
        Percentiles timingMillis,
        Map<String, Integer> failuresByType
    ) {
        this.timestamp = Objects.requireNonNull(timestamp, "timestamp");
        if (totalFiles < 0 || okCount < 0 || okCount > totalFiles) {
            throw new IllegalArgumentException("okCount must be in range [0, totalFiles]");
        }
        this.totalFiles = totalFiles;
        this.okCount = okCount;
        this.perCategory = copyCategories(perCategory);
        this.determinism = Objects.requireNonNull(determinism, "determinism");
        this.timingMillis = Objects.requireNonNull(timingMillis, "timingMillis");
        this.failuresByType = Collections.unmodifiableMap(
            new LinkedHashMap<>(Objects.requireNonNull(failuresByType, "failuresByType"))
        );
    }

    public String timestamp() {
        return timestamp;
    }

    public int totalFiles() {
        return totalFiles;
    }

    public int okCount() {
        return okCount;
    }

    public int failedCount() {
        return totalFiles - okCount;
    }

    /**
     * Totals and successes for every bucket, including {@link Category#UNLABELED}.
     */
    public Map<Category, PassRate> perCategory() {
        return perCategory;
    }

    public PassRate category(Category category) {
        return perCategory.get(Objects.requireNonNull(category, "category"));
    }

    /**
     * Deterministic successes over successes.
     */
    public PassRate determinism() {
        return determinism;
    }

    public double deterministicRate() {
        return determinism.ratio();
    }

    public Percentiles timingMillis() {
        return timingMillis;
    }

    public Map<String, Integer> failuresByType() {
        return failuresByType;
    }

    private static Map<Category, PassRate> copyCategories(Map<Category, PassRate> source) {
        Objects.requireNonNull(source, "perCategory");
        Map<Category, PassRate> copy = new EnumMap<>(Category.class);
        for (Category category : Category.values()) {
            copy.put(category, source.getOrDefault(category, PassRate.of(0, 0)));
        }
        return Collections.unmodifiableMap(copy);
    }
}
