package com.questrail.fits.wcs;

/**
 * Intermediate world coordinates: offsets on the tangent plane, in degrees.
 */
public record TangentPlaneOffset(double x, double y)
{
}
