package com.questrail.fits.codec.impl;

import com.questrail.fits.error.InvalidDataSizeException;
import com.questrail.fits.model.DataUnitLayout;

import java.util.Arrays;

/**
 * FitsDataUnitReader
 * -----------------------------------------------------------------------------
 * Extracts the data unit that follows a decoded header, sized by its
 * {@link DataUnitLayout}.
 *
 * <p>The payload is copied out without its trailing padding; the returned
 * next offset skips the padding up to the following block boundary (or the
 * end of the buffer when the file omits the final padding).</p>
 */
final class FitsDataUnitReader
{
    /**
     * A data unit cut out of the file.
     */
    record DataUnit(DataUnitLayout layout, byte[] payload, int nextOffset) {}

    private FitsDataUnitReader() {}

    /**
     * Copies the payload starting at {@code dataOffset}.
     *
     * @throws InvalidDataSizeException if fewer than {@code payloadBytes} remain
     */
    static DataUnit read(byte[] file, int dataOffset, DataUnitLayout layout)
            throws InvalidDataSizeException
    {
        final long remaining = Math.max(0, file.length - dataOffset);
        if (remaining < layout.payloadBytes()) {
            throw new InvalidDataSizeException(layout.payloadBytes(), remaining);
        }

        final int end = dataOffset + layout.payloadBytes();
        final byte[] payload = Arrays.copyOfRange(file, dataOffset, end);
        final int next = (int) Math.min(FitsBlocks.padToBlock(end), file.length);

        return new DataUnit(layout, payload, next);
    }
}
