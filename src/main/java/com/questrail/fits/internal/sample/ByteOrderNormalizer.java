package com.questrail.fits.internal.sample;

import com.questrail.fits.error.CorruptedDataException;
import com.questrail.fits.model.SampleType;

import java.nio.ByteOrder;

/**
 * ByteOrderNormalizer
 * -----------------------------------------------------------------------------
 * Converts FITS payloads between on-disk big-endian order and the platform's
 * native order.
 *
 * <p>FITS stores every multi-byte sample big-endian regardless of the machine
 * that wrote it. The rest of this library works on native-order buffers so
 * that samples can be read through a {@link java.nio.ByteBuffer} ordered with
 * {@link ByteOrder#nativeOrder()}.</p>
 *
 * <p>Conversion is a pure byte permutation within each sample. Floating-point
 * samples are never decoded, so NaN payloads and signalling bits survive
 * unchanged. {@link #swap(byte[], int)} is an involution.</p>
 */
public final class ByteOrderNormalizer
{
    private ByteOrderNormalizer() {}

    /**
     * Converts a big-endian payload to native order. Always returns a new array.
     *
     * @throws CorruptedDataException if the length is not a whole number of samples
     */
    public static byte[] toNativeOrder(byte[] bigEndian, SampleType type)
            throws CorruptedDataException
    {
        return reorder(bigEndian, type);
    }

    /**
     * Converts a native-order payload back to FITS big-endian order.
     */
    public static byte[] toBigEndian(byte[] nativeOrder, SampleType type)
            throws CorruptedDataException
    {
        return reorder(nativeOrder, type);
    }

    private static byte[] reorder(byte[] data, SampleType type)
            throws CorruptedDataException
    {
        if (ByteOrder.nativeOrder() == ByteOrder.BIG_ENDIAN) {
            checkLength(data, type.bytesPerSample());
            return data.clone();
        }
        return swap(data, type.bytesPerSample());
    }

    /**
     * Reverses the bytes of every {@code width}-byte sample. Width 1 is a copy.
     *
     * @param width sample width in bytes: 1, 2, 4 or 8
     * @return a new array; the input is not modified
     * @throws CorruptedDataException if {@code data.length} is not a multiple of {@code width}
     */
    public static byte[] swap(byte[] data, int width)
            throws CorruptedDataException
    {
        if (width != 1 && width != 2 && width != 4 && width != 8) {
            throw new IllegalArgumentException("Unsupported sample width: " + width);
        }
        checkLength(data, width);

        final byte[] out = new byte[data.length];
        if (width == 1) {
            System.arraycopy(data, 0, out, 0, data.length);
            return out;
        }

        for (int base = 0; base < data.length; base += width) {
            for (int i = 0; i < width; i++) {
                out[base + i] = data[base + width - 1 - i];
            }
        }
        return out;
    }

    private static void checkLength(byte[] data, int width)
            throws CorruptedDataException
    {
        if (data == null) {
            throw new CorruptedDataException("sample buffer is null");
        }
        if (data.length % width != 0) {
            throw new CorruptedDataException(
                    "buffer length " + data.length + " is not a multiple of sample width " + width);
        }
    }
}
