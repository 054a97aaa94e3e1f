package com.questrail.fits.image;

import com.questrail.fits.error.CorruptedDataException;
import com.questrail.fits.internal.sample.PhysicalValueTransformer;
import com.questrail.fits.model.HistogramData;
import com.questrail.fits.model.SampleType;

import java.nio.ByteBuffer;

/**
 * HistogramEngine
 * -----------------------------------------------------------------------------
 * Maps every sample to a 16-bit presentation level and accumulates the
 * distribution.
 *
 * <p>Level mapping by sample type:</p>
 * <ul>
 *   <li>uint8: the value, widened</li>
 *   <li>int16: the unsigned reading of the same 16 bits</li>
 *   <li>int32: {@code v / 65536 + 32768}, integer division, clamped to [0, 65535]</li>
 *   <li>float32 / float64: {@code v * 65535}, clamped to [0, 65535] and
 *       truncated; input is expected normalized to [0, 1]. NaN is skipped.</li>
 * </ul>
 *
 * <p>The mapping is lossy for 32-bit and floating data.</p>
 */
final class HistogramEngine
{
    private static final int MAX_LEVEL = HistogramData.LEVELS - 1;

    private HistogramEngine() {}

    /**
     * Histogram of a native-order sample buffer.
     *
     * @throws CorruptedDataException if the length is not a whole number of samples
     */
    static HistogramData compute(byte[] nativeData, SampleType type) throws CorruptedDataException {
        final int bps = type.bytesPerSample();
        if (nativeData.length % bps != 0) {
            throw new CorruptedDataException(
                    "buffer length " + nativeData.length + " is not a multiple of " + bps + "-byte samples");
        }
        final HistogramAccumulator acc = new HistogramAccumulator();
        accumulate(PhysicalValueTransformer.wrap(nativeData), type, 0, nativeData.length / bps, acc);
        return acc.toHistogramData();
    }

    /**
     * Adds samples {@code [from, to)} of a native-order buffer to {@code acc}.
     */
    static void accumulate(ByteBuffer nativeBuffer, SampleType type, int from, int to, HistogramAccumulator acc) {
        for (int i = from; i < to; i++) {
            final int level = level(nativeBuffer, i, type);
            if (level >= 0) {
                acc.add(level);
            }
        }
    }

    /**
     * Presentation level of sample {@code index}, or -1 for a NaN sample.
     */
    static int level(ByteBuffer nativeBuffer, int index, SampleType type) {
        return switch (type) {
            case UINT8 -> nativeBuffer.get(index) & 0xFF;
            case INT16 -> nativeBuffer.getShort(index * 2) & 0xFFFF;
            case INT32 -> clamp(nativeBuffer.getInt(index * 4) / 65536 + 32768);
            case FLOAT32 -> fromFloating(nativeBuffer.getFloat(index * 4));
            case FLOAT64 -> fromFloating(nativeBuffer.getDouble(index * 8));
        };
    }

    private static int fromFloating(double v) {
        if (Double.isNaN(v)) {
            return -1;
        }
        final double scaled = Math.max(0.0, Math.min(MAX_LEVEL, v * MAX_LEVEL));
        return (int) scaled;
    }

    private static int clamp(int v) {
        return Math.max(0, Math.min(MAX_LEVEL, v));
    }
}
