package com.questrail.fits.wcs;

/**
 * A (possibly fractional) pixel position.
 *
 * <p>Whether the origin is 0-based or the FITS 1-based convention depends on
 * where the value is used; {@link WcsParameters#referencePixel()} is 1-based.</p>
 */
public record PixelCoordinate(double x, double y)
{
}
