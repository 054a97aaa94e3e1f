package com.questrail.fits.codec.impl;

import com.questrail.fits.error.InvalidDataSizeException;
import com.questrail.fits.model.DataUnitLayout;
import com.questrail.fits.model.DuplicateKeywordPolicy;
import com.questrail.fits.model.FitsHeader;
import org.junit.jupiter.api.Test;

import static com.questrail.fits.FitsTestFiles.*;
import static org.junit.jupiter.api.Assertions.*;

final class FitsDataUnitReaderTest
{
    private static FitsHeader headerOf(String... cards) throws Exception
    {
        return new FitsHeaderParser(DuplicateKeywordPolicy.LAST_WINS).parse(header(cards), 0).header();
    }

    @Test
    void shortPayloadReportsExpectedAndActual() throws Exception
    {
        DataUnitLayout layout = DataUnitLayout.fromHeader(headerOf(
                card("BITPIX", 16), card("NAXIS", 2), card("NAXIS1", 100), card("NAXIS2", 100)));
        byte[] file = new byte[BLOCK + 1000];

        InvalidDataSizeException e = assertThrows(InvalidDataSizeException.class,
                () -> FitsDataUnitReader.read(file, BLOCK, layout));
        assertEquals(20000, e.expected());
        assertEquals(1000, e.actual());
    }

    @Test
    void nextOffsetSkipsPaddingOrClampsToEnd() throws Exception
    {
        DataUnitLayout layout = DataUnitLayout.fromHeader(headerOf(
                card("BITPIX", 8), card("NAXIS", 1), card("NAXIS1", 10)));

        FitsDataUnitReader.DataUnit padded = FitsDataUnitReader.read(new byte[2 * BLOCK], BLOCK, layout);
        assertEquals(2 * BLOCK, padded.nextOffset());
        assertEquals(10, padded.payload().length);

        FitsDataUnitReader.DataUnit unpadded = FitsDataUnitReader.read(new byte[BLOCK + 10], BLOCK, layout);
        assertEquals(BLOCK + 10, unpadded.nextOffset());
    }
}
