package com.questrail.fits.model;

import java.util.Arrays;
import java.util.Objects;

/**
 * Statistics plus the full value distribution of an image at 16-bit
 * presentation depth.
 *
 * <p>The distribution holds one counter per 16-bit value, so it is exact and
 * independent of sample order.</p>
 */
public final class HistogramData
{
    public static final int LEVELS = 1 << 16;

    private final HistogramStatistics statistics;
    private final long[] distribution;

    public HistogramData(HistogramStatistics statistics, long[] distribution) {
        this.statistics = Objects.requireNonNull(statistics, "statistics");
        Objects.requireNonNull(distribution, "distribution");
        if (distribution.length != LEVELS) {
            throw new IllegalArgumentException(
                    "distribution must have " + LEVELS + " entries (was " + distribution.length + ")");
        }
        this.distribution = distribution.clone();
    }

    public HistogramStatistics statistics() {
        return statistics;
    }

    public long count() {
        return statistics.count();
    }

    public double minimum() {
        return statistics.minimum();
    }

    public double maximum() {
        return statistics.maximum();
    }

    public double mean() {
        return statistics.mean();
    }

    public double standardDeviation() {
        return statistics.standardDeviation();
    }

    public int bitDepth() {
        return statistics.bitDepth();
    }

    /**
     * Number of samples at a given 16-bit level.
     */
    public long countAt(int level) {
        return distribution[level];
    }

    /**
     * Linear interpolation between minimum and maximum:
     * {@code min + (max - min) * p / 100}.
     *
     * <p>This ignores the shape of the distribution; it is a display
     * stretch helper. See {@link #rankPercentile(double)} for the order
     * statistic.</p>
     *
     * @param percentage clamped to [0, 100]
     */
    public double percentile(double percentage) {
        final double p = clampPercentage(percentage);
        return minimum() + (maximum() - minimum()) * (p / 100.0);
    }

    /**
     * Nearest-rank percentile: the smallest level at or below which at least
     * {@code p} percent of samples fall. Returns 0 for an empty histogram.
     *
     * @param percentage clamped to [0, 100]
     */
    public double rankPercentile(double percentage) {
        final long n = count();
        if (n == 0) {
            return 0;
        }
        final double p = clampPercentage(percentage);
        final long rank = Math.max(1, (long) Math.ceil(p / 100.0 * n));

        long cumulative = 0;
        for (int level = 0; level < LEVELS; level++) {
            cumulative += distribution[level];
            if (cumulative >= rank) {
                return level;
            }
        }
        return maximum();
    }

    /**
     * Sample counts in {@code binCount} equal-width slices of [min, max].
     */
    public long[] bins(int binCount) {
        if (binCount <= 0) {
            return new long[0];
        }
        final long[] bins = new long[binCount];
        if (count() == 0) {
            return bins;
        }
        final int min = (int) minimum();
        final int max = (int) maximum();
        final long span = (long) max - min + 1;

        for (int level = min; level <= max; level++) {
            final long c = distribution[level];
            if (c != 0) {
                final int bin = (int) ((level - min) * (long) binCount / span);
                bins[bin] += c;
            }
        }
        return bins;
    }

    /**
     * {@link #bins(int)} scaled so that the fullest bin is 1.0.
     */
    public double[] normalizedBins(int binCount) {
        final long[] bins = bins(binCount);
        final double[] normalized = new double[bins.length];
        final long peak = Arrays.stream(bins).max().orElse(0);
        if (peak == 0) {
            return normalized;
        }
        for (int i = 0; i < bins.length; i++) {
            normalized[i] = (double) bins[i] / peak;
        }
        return normalized;
    }

    private static double clampPercentage(double p) {
        return Math.max(0.0, Math.min(100.0, p));
    }

    @Override
    public String toString() {
        return "HistogramData[" + statistics + ']';
    }
}
