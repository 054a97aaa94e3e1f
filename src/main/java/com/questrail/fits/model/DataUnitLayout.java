package com.questrail.fits.model;

import com.questrail.fits.error.CorruptedDataException;
import com.questrail.fits.error.FitsException;
import com.questrail.fits.error.MalformedHeaderException;
import com.questrail.fits.error.MissingRequiredKeywordException;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.OptionalInt;

/**
 * Shape of a data unit as declared by its sizing keywords.
 *
 * <p>{@code payloadBytes = |BITPIX| / 8 * NAXIS1 * ... * NAXISn}, or 0 when
 * NAXIS is 0. A layout that exists always fits in a single Java array.</p>
 */
public record DataUnitLayout(SampleType sampleType, List<Integer> axisSizes, int payloadBytes)
{
    /** Largest NAXIS the standard allows. */
    public static final int MAX_NAXIS = 999;

    public DataUnitLayout {
        Objects.requireNonNull(sampleType, "sampleType");
        axisSizes = List.copyOf(axisSizes);
    }

    /**
     * Reads NAXIS, BITPIX and NAXIS1..NAXISn and computes the payload size.
     *
     * @throws MissingRequiredKeywordException if a sizing keyword is absent or not an integer
     * @throws MalformedHeaderException if NAXIS or an axis size is out of range
     * @throws com.questrail.fits.error.UnsupportedBitDepthException if BITPIX names no sample type
     * @throws CorruptedDataException if the payload cannot fit in a Java array
     */
    public static DataUnitLayout fromHeader(FitsHeader header)
            throws FitsException
    {
        Objects.requireNonNull(header, "header");

        final int naxis = requireInt(header, "NAXIS");
        final int bitpix = requireInt(header, "BITPIX");

        if (naxis < 0 || naxis > MAX_NAXIS) {
            throw new MalformedHeaderException("NAXIS out of range: " + naxis);
        }

        final List<Integer> axes = new ArrayList<>(naxis);
        for (int i = 1; i <= naxis; i++) {
            final int size = requireInt(header, "NAXIS" + i);
            if (size < 0) {
                throw new MalformedHeaderException("NAXIS" + i + " is negative: " + size);
            }
            axes.add(size);
        }

        final SampleType type = SampleType.fromBitpix(bitpix);

        long bytes = 0;
        if (naxis > 0) {
            try {
                long count = 1;
                for (int size : axes) {
                    count = Math.multiplyExact(count, (long) size);
                }
                bytes = Math.multiplyExact(count, (long) type.bytesPerSample());
            }
            catch (ArithmeticException e) {
                throw new CorruptedDataException("data unit size overflows for axes " + axes);
            }
        }

        if (bytes > Integer.MAX_VALUE) {
            throw new CorruptedDataException("data unit of " + bytes + " bytes exceeds the maximum array size");
        }

        return new DataUnitLayout(type, axes, (int) bytes);
    }

    private static int requireInt(FitsHeader header, String keyword)
            throws MissingRequiredKeywordException
    {
        final OptionalInt value = header.intValue(keyword);
        if (value.isEmpty()) {
            throw new MissingRequiredKeywordException(keyword);
        }
        return value.getAsInt();
    }
}
