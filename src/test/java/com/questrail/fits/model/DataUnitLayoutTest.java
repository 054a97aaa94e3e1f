package com.questrail.fits.model;

import com.questrail.fits.error.CorruptedDataException;
import com.questrail.fits.error.MalformedHeaderException;
import com.questrail.fits.error.MissingRequiredKeywordException;
import com.questrail.fits.error.UnsupportedBitDepthException;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

final class DataUnitLayoutTest
{
    private static FitsHeader header(String... keyValues)
    {
        List<HeaderRecord> records = new ArrayList<>();
        for (int i = 0; i < keyValues.length; i += 2) {
            records.add(new HeaderRecord(keyValues[i], keyValues[i + 1], null, i / 2));
        }
        return new FitsHeader(records, DuplicateKeywordPolicy.LAST_WINS);
    }

    @Test
    void computesPayloadSizeFromAxesAndBitpix() throws Exception
    {
        DataUnitLayout layout = DataUnitLayout.fromHeader(header(
                "BITPIX", "-32", "NAXIS", "3", "NAXIS1", "10", "NAXIS2", "20", "NAXIS3", "3"));

        assertEquals(SampleType.FLOAT32, layout.sampleType());
        assertEquals(List.of(10, 20, 3), layout.axisSizes());
        assertEquals(10 * 20 * 3 * 4, layout.payloadBytes());
    }

    @Test
    void naxisZeroHasEmptyPayload() throws Exception
    {
        DataUnitLayout layout = DataUnitLayout.fromHeader(header("BITPIX", "8", "NAXIS", "0"));

        assertEquals(0, layout.payloadBytes());
        assertTrue(layout.axisSizes().isEmpty());
    }

    @Test
    void missingNaxisnIsReported()
    {
        MissingRequiredKeywordException e = assertThrows(MissingRequiredKeywordException.class,
                () -> DataUnitLayout.fromHeader(header("BITPIX", "16", "NAXIS", "2", "NAXIS1", "4")));
        assertEquals("NAXIS2", e.keyword());
    }

    @Test
    void missingBitpixIsReported()
    {
        MissingRequiredKeywordException e = assertThrows(MissingRequiredKeywordException.class,
                () -> DataUnitLayout.fromHeader(header("NAXIS", "0")));
        assertEquals("BITPIX", e.keyword());
    }

    @Test
    void negativeAxisIsMalformed()
    {
        assertThrows(MalformedHeaderException.class,
                () -> DataUnitLayout.fromHeader(header("BITPIX", "16", "NAXIS", "1", "NAXIS1", "-5")));
    }

    @Test
    void naxisOutsideStandardRangeIsMalformed()
    {
        assertThrows(MalformedHeaderException.class,
                () -> DataUnitLayout.fromHeader(header("BITPIX", "16", "NAXIS", "1000")));
        assertThrows(MalformedHeaderException.class,
                () -> DataUnitLayout.fromHeader(header("BITPIX", "16", "NAXIS", "-1")));
        assertThrows(MalformedHeaderException.class,
                () -> DataUnitLayout.fromHeader(header("BITPIX", "8", "NAXIS", "2000000000", "NAXIS1", "1")));
    }

    @Test
    void unsupportedBitpixIsRejected()
    {
        UnsupportedBitDepthException e = assertThrows(UnsupportedBitDepthException.class,
                () -> DataUnitLayout.fromHeader(header("BITPIX", "24", "NAXIS", "0")));
        assertEquals(24, e.bitpix());
    }

    @Test
    void payloadBeyondArrayLimitIsCorrupted()
    {
        assertThrows(CorruptedDataException.class,
                () -> DataUnitLayout.fromHeader(header(
                        "BITPIX", "-64", "NAXIS", "2", "NAXIS1", "100000", "NAXIS2", "100000")));
    }

    @Test
    void axisProductOverflowIsCorrupted()
    {
        assertThrows(CorruptedDataException.class,
                () -> DataUnitLayout.fromHeader(header(
                        "BITPIX", "8", "NAXIS", "3",
                        "NAXIS1", "2147483647", "NAXIS2", "2147483647", "NAXIS3", "2147483647")));
    }
}
