package com.questrail.fits.internal.sample;

import com.questrail.fits.error.CorruptedDataException;
import com.questrail.fits.model.DataScaling;
import com.questrail.fits.model.SampleType;

import java.nio.ByteBuffer;
import java.nio.ByteOrder;

/**
 * PhysicalValueTransformer
 * -----------------------------------------------------------------------------
 * Applies {@code physical = bscale * raw + bzero} to every sample of a
 * native-order buffer, writing the result back in the same sample type.
 *
 * <p>Integer results are clamped to the type's range and then truncated
 * toward zero:</p>
 * <ul>
 *   <li>uint8: [0, 255]</li>
 *   <li>int16: [-32768, 32767]</li>
 *   <li>int32: [-2^31, 2^31 - 1]</li>
 *   <li>float32 / float64: unclamped (float32 is rounded to float)</li>
 * </ul>
 *
 * <p>Because the output keeps the storage type, the common unsigned-16
 * convention (BZERO = 32768) saturates at 32767. Use
 * {@link #physicalSamples(byte[], SampleType, DataScaling)} when the
 * unclamped physical values are needed.</p>
 */
public final class PhysicalValueTransformer
{
    private PhysicalValueTransformer() {}

    /**
     * Rescales every sample. With identity scaling the input array itself is
     * returned; otherwise a new array.
     *
     * @throws CorruptedDataException if the length is not a whole number of samples
     */
    public static byte[] transform(byte[] nativeData, SampleType type, DataScaling scaling)
            throws CorruptedDataException
    {
        checkLength(nativeData, type);
        if (scaling.isIdentity()) {
            return nativeData;
        }

        final int n = nativeData.length / type.bytesPerSample();
        final ByteBuffer in = wrap(nativeData);
        final ByteBuffer out = ByteBuffer.allocate(nativeData.length).order(ByteOrder.nativeOrder());

        for (int i = 0; i < n; i++) {
            final double physical = scaling.physicalValue(readRaw(in, i, type));
            final double clamped = type.clamp(physical);
            switch (type) {
                case UINT8 -> out.put(i, (byte) (int) clamped);
                case INT16 -> out.putShort(i * 2, (short) (int) clamped);
                case INT32 -> out.putInt(i * 4, (int) clamped);
                case FLOAT32 -> out.putFloat(i * 4, (float) clamped);
                case FLOAT64 -> out.putDouble(i * 8, clamped);
            }
        }
        return out.array();
    }

    /**
     * Unclamped physical value of every sample, as {@code double}.
     */
    public static double[] physicalSamples(byte[] nativeData, SampleType type, DataScaling scaling)
            throws CorruptedDataException
    {
        checkLength(nativeData, type);
        final int n = nativeData.length / type.bytesPerSample();
        final ByteBuffer in = wrap(nativeData);
        final double[] out = new double[n];
        for (int i = 0; i < n; i++) {
            out[i] = scaling.physicalValue(readRaw(in, i, type));
        }
        return out;
    }

    /**
     * Reads sample {@code index} of a native-order buffer as a raw (unscaled)
     * value. uint8 samples are read unsigned.
     */
    public static double readRaw(ByteBuffer nativeBuffer, int index, SampleType type) {
        return switch (type) {
            case UINT8 -> nativeBuffer.get(index) & 0xFF;
            case INT16 -> nativeBuffer.getShort(index * 2);
            case INT32 -> nativeBuffer.getInt(index * 4);
            case FLOAT32 -> nativeBuffer.getFloat(index * 4);
            case FLOAT64 -> nativeBuffer.getDouble(index * 8);
        };
    }

    /**
     * Read-only native-order view of a sample buffer.
     */
    public static ByteBuffer wrap(byte[] nativeData) {
        return ByteBuffer.wrap(nativeData).order(ByteOrder.nativeOrder()).asReadOnlyBuffer()
                .order(ByteOrder.nativeOrder());
    }

    private static void checkLength(byte[] data, SampleType type)
            throws CorruptedDataException
    {
        if (data.length % type.bytesPerSample() != 0) {
            throw new CorruptedDataException(
                    "buffer length " + data.length + " is not a multiple of "
                            + type.bytesPerSample() + "-byte " + type + " samples");
        }
    }
}
