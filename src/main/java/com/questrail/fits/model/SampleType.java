package com.questrail.fits.model;

import com.questrail.fits.error.UnsupportedBitDepthException;

/**
 * The five sample encodings a FITS primary array may declare through BITPIX.
 *
 * <p>FITS has no unsigned 16/32-bit type; unsigned data is stored signed with
 * a BZERO offset. 8-bit data is the only unsigned type.</p>
 */
public enum SampleType
{
    UINT8(8, 0, 255),
    INT16(16, Short.MIN_VALUE, Short.MAX_VALUE),
    INT32(32, Integer.MIN_VALUE, Integer.MAX_VALUE),
    FLOAT32(-32, Double.NEGATIVE_INFINITY, Double.POSITIVE_INFINITY),
    FLOAT64(-64, Double.NEGATIVE_INFINITY, Double.POSITIVE_INFINITY);

    private final int bitpix;
    private final double minValue;
    private final double maxValue;

    SampleType(int bitpix, double minValue, double maxValue) {
        this.bitpix = bitpix;
        this.minValue = minValue;
        this.maxValue = maxValue;
    }

    /**
     * Maps a BITPIX value to its sample type.
     *
     * @throws UnsupportedBitDepthException for any value other than 8, 16, 32, -32, -64
     */
    public static SampleType fromBitpix(int bitpix) throws UnsupportedBitDepthException {
        for (SampleType t : values()) {
            if (t.bitpix == bitpix) {
                return t;
            }
        }
        throw new UnsupportedBitDepthException(bitpix);
    }

    public int bitpix() {
        return bitpix;
    }

    public int bitDepth() {
        return Math.abs(bitpix);
    }

    public int bytesPerSample() {
        return Math.abs(bitpix) / 8;
    }

    public boolean isFloatingPoint() {
        return bitpix < 0;
    }

    public boolean isSigned() {
        return this != UINT8;
    }

    /**
     * Smallest physical value representable after scaling; negative infinity
     * for floating-point types.
     */
    public double minValue() {
        return minValue;
    }

    /**
     * Largest physical value representable after scaling; positive infinity
     * for floating-point types.
     */
    public double maxValue() {
        return maxValue;
    }

    /**
     * Clamps a physical value into this type's representable range.
     * Floating-point types are returned unchanged.
     */
    public double clamp(double value) {
        if (isFloatingPoint()) {
            return value;
        }
        return Math.max(minValue, Math.min(maxValue, value));
    }
}
