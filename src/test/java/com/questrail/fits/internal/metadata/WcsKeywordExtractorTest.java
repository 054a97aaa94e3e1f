package com.questrail.fits.internal.metadata;

import com.questrail.fits.model.DuplicateKeywordPolicy;
import com.questrail.fits.model.FitsHeader;
import com.questrail.fits.model.HeaderRecord;
import com.questrail.fits.wcs.TransformMatrix;
import com.questrail.fits.wcs.WcsParameters;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

final class WcsKeywordExtractorTest
{
    private static FitsHeader header(String... keyValues)
    {
        List<HeaderRecord> records = new ArrayList<>();
        for (int i = 0; i < keyValues.length; i += 2) {
            records.add(new HeaderRecord(keyValues[i], keyValues[i + 1], null, i / 2));
        }
        return new FitsHeader(records, DuplicateKeywordPolicy.LAST_WINS);
    }

    private static String[] reference(String... extra)
    {
        List<String> kv = new ArrayList<>(List.of(
                "CRPIX1", "100", "CRPIX2", "200", "CRVAL1", "10.5", "CRVAL2", "-20.25"));
        kv.addAll(List.of(extra));
        return kv.toArray(new String[0]);
    }

    @Test
    void incompleteReferenceYieldsNoWcs()
    {
        assertTrue(WcsKeywordExtractor.extract(header("CRPIX1", "1", "CRPIX2", "1", "CRVAL1", "10")).isEmpty());
        assertTrue(WcsKeywordExtractor.extract(header(
                "CRPIX1", "1", "CRPIX2", "1", "CRVAL1", "10", "CRVAL2", "unknown")).isEmpty());
    }

    @Test
    void cdeltAndDefaults()
    {
        WcsParameters wcs = WcsKeywordExtractor.extract(header(reference("CDELT1", "-0.001", "CDELT2", "0.001")))
                .orElseThrow();

        assertEquals(100.0, wcs.referencePixel().x());
        assertEquals(-20.25, wcs.referenceValue().dec());
        assertEquals(-0.001, wcs.pixelScale().x());
        assertTrue(wcs.cdMatrix().isEmpty());
        assertEquals("RA", wcs.coordinateTypes().x());
        assertEquals("DEC", wcs.coordinateTypes().y());
        assertTrue(wcs.projection().isEmpty());
        assertTrue(wcs.rotationAngle().isEmpty());
    }

    @Test
    void partialCdMatrixDefaultsMissingToZero()
    {
        WcsParameters wcs = WcsKeywordExtractor.extract(header(reference("CD1_1", "-0.0003", "CD2_2", "0.0003")))
                .orElseThrow();

        assertEquals(new TransformMatrix(-0.0003, 0.0, 0.0, 0.0003), wcs.cdMatrix().orElseThrow());
        assertEquals(-0.0003, wcs.pixelScale().x());
        assertEquals(0.0003, wcs.pixelScale().y());
    }

    @Test
    void pcMatrixIsCombinedWithCdelt()
    {
        WcsParameters wcs = WcsKeywordExtractor.extract(header(reference(
                "CDELT1", "2", "CDELT2", "3", "PC1_2", "0.5"))).orElseThrow();

        assertEquals(new TransformMatrix(2.0, 1.0, 0.0, 3.0), wcs.cdMatrix().orElseThrow());
    }

    @Test
    void rotationFallsBackToCrota1()
    {
        WcsParameters a = WcsKeywordExtractor.extract(header(reference("CROTA1", "5", "CROTA2", "7"))).orElseThrow();
        WcsParameters b = WcsKeywordExtractor.extract(header(reference("CROTA1", "5"))).orElseThrow();

        assertEquals(7.0, a.rotationAngle().getAsDouble());
        assertEquals(5.0, b.rotationAngle().getAsDouble());
    }

    @Test
    void systemAndEquinoxAliases()
    {
        WcsParameters wcs = WcsKeywordExtractor.extract(header(reference("RADECSYS", "FK5", "EPOCH", "1950.0")))
                .orElseThrow();

        assertEquals(Optional.of("FK5"), wcs.coordinateSystem());
        assertEquals(1950.0, wcs.equinox().getAsDouble());
    }

    @Test
    void projectionCodes()
    {
        assertEquals("TAN", WcsKeywordExtractor.projectionCode("RA---TAN"));
        assertEquals("TAN", WcsKeywordExtractor.projectionCode("DEC--TAN"));
        assertEquals("TAN", WcsKeywordExtractor.projectionCode("RA---TAN-SIP"));
        assertEquals("SIN", WcsKeywordExtractor.projectionCode("GLON-SIN"));
        assertEquals("CAR", WcsKeywordExtractor.projectionCode("X-CAR"));
        assertNull(WcsKeywordExtractor.projectionCode("RA"));
        assertNull(WcsKeywordExtractor.projectionCode(null));
    }
}
