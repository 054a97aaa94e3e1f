package com.questrail.fits.error;

import com.questrail.fits.api.PixelRegion;

/**
 * A requested pixel region does not lie entirely within the image.
 */
public final class RegionOutOfBoundsException extends FitsException
{
    private final PixelRegion region;

    public RegionOutOfBoundsException(PixelRegion region, int imageWidth, int imageHeight) {
        super("Requested region " + region + " is outside image bounds "
                + imageWidth + "x" + imageHeight);
        this.region = region;
    }

    public PixelRegion region() {
        return region;
    }
}
