package com.questrail.fits.codec.impl;

import com.questrail.fits.codec.FitsHdu;
import com.questrail.fits.codec.FitsHduDecoder;
import com.questrail.fits.error.FitsException;
import com.questrail.fits.error.MalformedHeaderException;
import com.questrail.fits.model.DataUnitLayout;
import com.questrail.fits.model.DuplicateKeywordPolicy;
import com.questrail.fits.model.FitsHeader;

import java.util.Objects;

/**
 * DefaultFitsHduDecoder
 * -----------------------------------------------------------------------------
 * Concrete implementation of {@link FitsHduDecoder}.
 *
 * <p>This decoder performs the following steps, in order:</p>
 * <ol>
 *   <li>Header decoding up to {@code END} (FITS 4.0 section 4)</li>
 *   <li>Data unit sizing from NAXIS / NAXISn / BITPIX (section 4.4.1)</li>
 *   <li>Payload extraction and padding skip (section 3.3.2)</li>
 * </ol>
 *
 * <p>The payload is returned as stored: big-endian and unscaled.</p>
 */
public final class DefaultFitsHduDecoder implements FitsHduDecoder
{
    private final FitsHeaderParser headerParser;

    public DefaultFitsHduDecoder()
    {
        this(DuplicateKeywordPolicy.LAST_WINS);
    }

    public DefaultFitsHduDecoder(DuplicateKeywordPolicy duplicatePolicy)
    {
        this.headerParser = new FitsHeaderParser(duplicatePolicy);
    }

    @Override
    public FitsHdu decode(byte[] file, int offset) throws FitsException
    {
        checkOffset(file, offset);

        // 1) Header
        final FitsHeaderParser.Result parsed = headerParser.parse(file, offset);

        // 2) Sizing
        final DataUnitLayout layout = DataUnitLayout.fromHeader(parsed.header());

        // 3) Payload
        final FitsDataUnitReader.DataUnit unit = FitsDataUnitReader.read(file, parsed.dataOffset(), layout);

        return new FitsHdu(
                parsed.header(),
                layout.sampleType(),
                layout.axisSizes(),
                unit.payload(),
                offset,
                parsed.dataOffset(),
                unit.nextOffset());
    }

    @Override
    public FitsHeader decodeHeader(byte[] file, int offset) throws FitsException
    {
        checkOffset(file, offset);
        return headerParser.parse(file, offset).header();
    }

    private static void checkOffset(byte[] file, int offset) throws MalformedHeaderException
    {
        Objects.requireNonNull(file, "file");
        if (offset % FitsBlocks.BLOCK_SIZE != 0) {
            throw new MalformedHeaderException("HDU offset " + offset + " is not on a block boundary");
        }
    }
}
