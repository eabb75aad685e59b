package com.starscope.common.ranking;

import java.util.Arrays;
import java.util.Collection;

/**
 * Sorted distribution of velocity values across every tracked repository,
 * built once per detection batch and queried per repository.
 *
 * <p>{@link #rank(double)} is the share of values strictly below the queried
 * one, as a percentage. Build is O(n log n); each lookup is O(log n).
 *
 * <p>Immutable after construction; safe to share across threads.
 */
public final class PercentileIndex {

    private static final PercentileIndex EMPTY = new PercentileIndex(new double[0]);

    private final double[] sorted;

    private PercentileIndex(double[] sorted) {
        this.sorted = sorted;
    }

    public static PercentileIndex empty() {
        return EMPTY;
    }

    public static PercentileIndex of(Collection<Double> values) {
        double[] copy = values.stream()
            .filter(v -> v != null && !v.isNaN())
            .mapToDouble(Double::doubleValue)
            .toArray();
        Arrays.sort(copy);
        return new PercentileIndex(copy);
    }

    /**
     * Percentile rank in [0, 100): count strictly less than {@code value}
     * divided by the total, times 100. An empty index ranks everything 0.
     */
    public double rank(double value) {
        if (sorted.length == 0) {
            return 0.0;
        }
        return lowerBound(value) * 100.0 / sorted.length;
    }

    public int size() {
        return sorted.length;
    }

    // First index whose element is >= value, i.e. the number of elements < value.
    private int lowerBound(double value) {
        int lo = 0;
        int hi = sorted.length;
        while (lo < hi) {
            int mid = (lo + hi) >>> 1;
            if (sorted[mid] < value) {
                lo = mid + 1;
            } else {
                hi = mid;
            }
        }
        return lo;
    }
}
