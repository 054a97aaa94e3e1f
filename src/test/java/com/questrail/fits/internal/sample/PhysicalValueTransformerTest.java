package com.questrail.fits.internal.sample;

import com.questrail.fits.error.CorruptedDataException;
import com.questrail.fits.model.DataScaling;
import com.questrail.fits.model.SampleType;
import org.junit.jupiter.api.Test;

import java.nio.ByteBuffer;

import static com.questrail.fits.FitsTestFiles.*;
import static org.junit.jupiter.api.Assertions.*;

final class PhysicalValueTransformerTest
{
    private static byte[] nativeOf(byte[] bigEndian, SampleType type) throws Exception
    {
        return ByteOrderNormalizer.toNativeOrder(bigEndian, type);
    }

    @Test
    void identityScalingReturnsInputUnchanged() throws Exception
    {
        byte[] data = nativeOf(int16(1, 2, 3), SampleType.INT16);

        assertSame(data, PhysicalValueTransformer.transform(data, SampleType.INT16, DataScaling.IDENTITY));
    }

    @Test
    void affineScalingOnFloat64() throws Exception
    {
        byte[] data = nativeOf(float64(0.0, 1.5, -2.0), SampleType.FLOAT64);

        ByteBuffer out = nativeView(PhysicalValueTransformer.transform(
                data, SampleType.FLOAT64, new DataScaling(10.0, 2.0)));

        assertEquals(10.0, out.getDouble(0));
        assertEquals(13.0, out.getDouble(8));
        assertEquals(6.0, out.getDouble(16));
    }

    @Test
    void int16ResultsClampAtTypeLimits() throws Exception
    {
        byte[] data = nativeOf(int16(-32768, -1, 0, 32767), SampleType.INT16);

        ByteBuffer out = nativeView(PhysicalValueTransformer.transform(
                data, SampleType.INT16, new DataScaling(32768.0, 1.0)));

        assertEquals(0, out.getShort(0));
        assertEquals(32767, out.getShort(2));
        assertEquals(32767, out.getShort(4));
        assertEquals(32767, out.getShort(6));
    }

    @Test
    void uint8ClampsToByteRange() throws Exception
    {
        byte[] data = uint8(0, 100, 200);

        byte[] out = PhysicalValueTransformer.transform(data, SampleType.UINT8, new DataScaling(-50.0, 2.0));

        assertEquals(0, out[0] & 0xFF);
        assertEquals(150, out[1] & 0xFF);
        assertEquals(255, out[2] & 0xFF);
    }

    @Test
    void integerResultsTruncateTowardZero() throws Exception
    {
        byte[] data = nativeOf(int32(3, -3), SampleType.INT32);

        ByteBuffer out = nativeView(PhysicalValueTransformer.transform(
                data, SampleType.INT32, new DataScaling(0.0, 0.5)));

        assertEquals(1, out.getInt(0));
        assertEquals(-1, out.getInt(4));
    }

    @Test
    void float32IsNotClamped() throws Exception
    {
        byte[] data = nativeOf(float32(1.0f), SampleType.FLOAT32);

        ByteBuffer out = nativeView(PhysicalValueTransformer.transform(
                data, SampleType.FLOAT32, new DataScaling(0.0, 1.0e30)));

        assertEquals(1.0e30f, out.getFloat(0));
    }

    @Test
    void physicalSamplesAreUnclamped() throws Exception
    {
        byte[] data = nativeOf(int16(-32768, 0, 32767), SampleType.INT16);

        double[] values = PhysicalValueTransformer.physicalSamples(
                data, SampleType.INT16, new DataScaling(32768.0, 1.0));

        assertArrayEquals(new double[] { 0.0, 32768.0, 65535.0 }, values);
    }

    @Test
    void partialSampleIsCorrupted()
    {
        assertThrows(CorruptedDataException.class,
                () -> PhysicalValueTransformer.transform(new byte[5], SampleType.INT32, new DataScaling(1.0, 1.0)));
    }

    @Test
    void physicalDifferencesScaleWithBscale() throws Exception
    {
        int[] raw = { -70000, -3, 0, 1, 42, 65536, 1_000_000 };
        byte[] data = nativeOf(int32(raw), SampleType.INT32);

        for (double bscale : new double[] { 1.0, 0.5, 2.0, -3.25, 1e-3 }) {
            for (double bzero : new double[] { 0.0, 32768.0, -12.5 }) {
                double[] physical = PhysicalValueTransformer.physicalSamples(
                        data, SampleType.INT32, new DataScaling(bzero, bscale));

                for (int a = 0; a < raw.length; a++) {
                    for (int b = 0; b < raw.length; b++) {
                        double expected = bscale * ((double) raw[a] - raw[b]);
                        assertEquals(expected, physical[a] - physical[b], 1e-9 * Math.max(1.0, Math.abs(expected)),
                                "bscale=" + bscale + " bzero=" + bzero + " a=" + raw[a] + " b=" + raw[b]);
                    }
                }
            }
        }
    }
}

