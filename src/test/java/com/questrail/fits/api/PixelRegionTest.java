package com.questrail.fits.api;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

final class PixelRegionTest
{
    @Test
    void fitsWithinIsInclusiveOfEdges()
    {
        assertTrue(new PixelRegion(1454, 1454, 100, 100).fitsWithin(3008, 3008));
        assertTrue(PixelRegion.full(3008, 3008).fitsWithin(3008, 3008));
        assertTrue(new PixelRegion(3008, 3008, 0, 0).fitsWithin(3008, 3008));
        assertFalse(new PixelRegion(3000, 3000, 100, 100).fitsWithin(3008, 3008));
        assertFalse(new PixelRegion(Integer.MAX_VALUE, 0, 1, 1).fitsWithin(Integer.MAX_VALUE, 1));
    }

    @Test
    void negativeComponentsAreRejected()
    {
        assertThrows(IllegalArgumentException.class, () -> new PixelRegion(-1, 0, 1, 1));
        assertThrows(IllegalArgumentException.class, () -> new PixelRegion(0, 0, 1, -1));
    }

    @Test
    void bayerPatternLayout()
    {
        assertEquals(BayerPattern.BayerColor.RED, BayerPattern.RGGB.colorAt(0, 0));
        assertEquals(BayerPattern.BayerColor.GREEN, BayerPattern.RGGB.colorAt(1, 0));
        assertEquals(BayerPattern.BayerColor.BLUE, BayerPattern.RGGB.colorAt(1, 1));
        assertEquals(BayerPattern.BayerColor.RED, BayerPattern.BGGR.colorAt(3, 3));
        assertEquals(BayerPattern.GBRG, BayerPattern.parse(" gbrg ").orElseThrow());
        assertTrue(BayerPattern.parse("XYZW").isEmpty());
    }

    @Test
    void dimensionsDerivedValues()
    {
        ImageDimensions d = new ImageDimensions(6000, 4000);

        assertEquals(24_000_000L, d.totalPixels());
        assertEquals(1.5, d.aspectRatio());
        assertEquals(24.0, d.megapixels());
        assertEquals(1.0, new ImageDimensions(10, 0).aspectRatio());
    }
}
