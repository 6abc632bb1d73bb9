package org.corpusgate.gate;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import org.corpusgate.harness.ErrorKind;
import org.corpusgate.harness.RunResult;
import org.corpusgate.manifest.Category;

/**
 * Rolls per-file results into a {@link GateSummary}.
 *
 * <p>Order of the input does not matter except for the key order of the failure histogram,
 * which follows first occurrence.
 */
public final class GateAggregator {
    static final String UNKNOWN_FAILURE = "unknown";

    public GateSummary aggregate(String timestamp, List<RunResult> results) {
        Objects.requireNonNull(timestamp, "timestamp");
        Objects.requireNonNull(results, "results");

        int okCount = 0;
        int deterministicCount = 0;
        List<Long> successTimings = new ArrayList<>();
        Map<String, Integer> failuresByType = new LinkedHashMap<>();
        Map<Category, int[]> buckets = new EnumMap<>(Category.class);
        for (Category category : Category.values()) {
            buckets.put(category, new int[2]);
        }

        for (RunResult result : results) {
            Objects.requireNonNull(result, "result");
            int[] bucket = buckets.get(result.category());
            bucket[0]++;
            if (result.ok()) {
                okCount++;
                bucket[1]++;
                successTimings.add(result.timingMillis());
                if (result.isDeterministicSuccess()) {
                    deterministicCount++;
                }
                continue;
            }
            String kind = result.errorKind().map(ErrorKind::key).orElse(UNKNOWN_FAILURE);
            failuresByType.merge(kind, 1, Integer::sum);
        }

        Map<Category, PassRate> perCategory = new EnumMap<>(Category.class);
        for (Map.Entry<Category, int[]> entry : buckets.entrySet()) {
            perCategory.put(entry.getKey(), PassRate.of(entry.getValue()[1], entry.getValue()[0]));
        }

        return new GateSummary(
            timestamp,
            results.size(),
            okCount,
            perCategory,
            PassRate.of(deterministicCount, okCount),
            Percentiles.of(successTimings),
            failuresByType
        );
    }
}
