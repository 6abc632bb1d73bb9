package org.corpusgate.gate;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Nearest-rank p50/p95/p99 of a list of durations. An empty list yields all zeros.
 */
public record Percentiles(long p50, long p95, long p99) {
    public static final Percentiles ZERO = new Percentiles(0L, 0L, 0L);

    public static Percentiles of(List<Long> samples) {
        Objects.requireNonNull(samples, "samples");
        if (samples.isEmpty()) {
            return ZERO;
        }
        List<Long> sorted = new ArrayList<>(samples.size());
        for (Long value : samples) {
            sorted.add(Objects.requireNonNull(value, "sample"));
        }
        sorted.sort(Long::compareTo);
        return new Percentiles(pick(sorted, 0.50d), pick(sorted, 0.95d), pick(sorted, 0.99d));
    }

    static long pick(List<Long> sorted, double percentile) {
        if (percentile <= 0.0d || percentile > 1.0d || !Double.isFinite(percentile)) {
            throw new IllegalArgumentException("percentile must be in range (0.0, 1.0]");
        }
        if (sorted.isEmpty()) {
            return 0L;
        }
        int index = (int) Math.ceil(sorted.size() * percentile) - 1;
        int boundedIndex = Math.max(0, Math.min(sorted.size() - 1, index));
        return sorted.get(boundedIndex);
    }
}
