package com.questrail.fits.wcs;

/**
 * Degrees per pixel along each image axis (CDELT1, CDELT2). Signs carry axis
 * orientation; RA normally decreases to the right, so x is usually negative.
 */
public record PixelScale(double x, double y)
{
    public PixelScale toArcsec() {
        return new PixelScale(
                WcsMath.degreesToArcsecPerPixel(Math.abs(x)),
                WcsMath.degreesToArcsecPerPixel(Math.abs(y)));
    }
}
