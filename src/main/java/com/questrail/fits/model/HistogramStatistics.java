package com.questrail.fits.model;

/**
 * Summary statistics of an image's samples at a fixed presentation depth.
 *
 * <p>{@code standardDeviation} is the population value (divide by N). For an
 * empty sample set every value is zero.</p>
 */
public record HistogramStatistics(
        long count,
        double minimum,
        double maximum,
        double mean,
        double standardDeviation,
        int bitDepth
) {
    public static HistogramStatistics empty(int bitDepth) {
        return new HistogramStatistics(0, 0, 0, 0, 0, bitDepth);
    }
}
