package org.corpusgate.gate;

import java.util.Locale;

/**
 * Utility value for rate calculations; an empty denominator yields 0, never NaN.
 */
public final class PassRate {
    private final int matchCount;
    private final int totalCount;

    private PassRate(int matchCount, int totalCount) {
        if (matchCount < 0) {
            throw new IllegalArgumentException("matchCount must be >= 0");
        }
        if (totalCount < 0) {
            throw new IllegalArgumentException("totalCount must be >= 0");
        }
        if (matchCount > totalCount) {
            throw new IllegalArgumentException("matchCount must be <= totalCount");
        }
        this.matchCount = matchCount;
        this.totalCount = totalCount;
    }

    public static PassRate of(int matchCount, int totalCount) {
        return new PassRate(matchCount, totalCount);
    }

    public int matchCount() {
        return matchCount;
    }

    public int totalCount() {
        return totalCount;
    }

    /**
     * Ratio in [0.0, 1.0].
     */
    public double ratio() {
        if (totalCount == 0) {
            return 0.0d;
        }
        return (double) matchCount / (double) totalCount;
    }

    /**
     * Ratio rounded to four decimals, as written to report artifacts.
     */
    public double rounded() {
        return round4(ratio());
    }

    public String formatted() {
        return String.format(Locale.ROOT, "%.2f%% (%d/%d)", ratio() * 100.0d, matchCount, totalCount);
    }

    static double round4(double value) {
        return Math.round(value * 10_000.0d) / 10_000.0d;
    }
}
