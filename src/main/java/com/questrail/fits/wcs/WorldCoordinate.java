package com.questrail.fits.wcs;

/**
 * A position on the celestial sphere, in degrees.
 *
 * <p>No range is enforced here; use {@link WcsMath#validateCoordinates} to
 * normalize.</p>
 */
public record WorldCoordinate(double ra, double dec)
{
}
