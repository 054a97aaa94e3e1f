package com.questrail.fits.image;

import com.questrail.fits.model.HistogramData;
import com.questrail.fits.model.HistogramStatistics;

/**
 * Mutable per-level counter for 16-bit presentation values.
 *
 * <p>All state is integer counts, so accumulators filled from disjoint parts
 * of an image can be {@link #merge merged} in any order and give identical
 * statistics. Statistics are derived from the counts in level order.</p>
 *
 * <p>Not thread-safe; use one accumulator per worker and merge.</p>
 */
final class HistogramAccumulator
{
    static final int BIT_DEPTH = 16;

    private final long[] counts = new long[HistogramData.LEVELS];
    private long total;

    void add(int level) {
        counts[level]++;
        total++;
    }

    /**
     * Adds another accumulator's counts into this one.
     */
    HistogramAccumulator merge(HistogramAccumulator other) {
        for (int i = 0; i < counts.length; i++) {
            counts[i] += other.counts[i];
        }
        total += other.total;
        return this;
    }

    HistogramData toHistogramData() {
        if (total == 0) {
            return new HistogramData(HistogramStatistics.empty(BIT_DEPTH), counts);
        }

        int min = -1;
        int max = -1;
        long sum = 0;
        for (int level = 0; level < counts.length; level++) {
            final long c = counts[level];
            if (c != 0) {
                if (min < 0) {
                    min = level;
                }
                max = level;
                sum += c * level;
            }
        }

        final double mean = (double) sum / total;

        double squares = 0;
        for (int level = min; level <= max; level++) {
            final long c = counts[level];
            if (c != 0) {
                final double d = level - mean;
                squares += c * d * d;
            }
        }
        final double stddev = Math.sqrt(squares / total);

        final HistogramStatistics stats = new HistogramStatistics(
                total, min, max, clamp(mean, min, max), stddev, BIT_DEPTH);
        return new HistogramData(stats, counts);
    }

    private static double clamp(double v, double lo, double hi) {
        return Math.max(lo, Math.min(hi, v));
    }
}
