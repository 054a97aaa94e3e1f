package com.questrail.fits.wcs;

import com.questrail.fits.error.ProjectionSingularityException;

/**
 * Spherical trigonometry and gnomonic projection for celestial coordinates.
 *
 * <p>Follows FITS WCS Paper II (Calabretta &amp; Greisen 2002) for the TAN
 * projection. All angles are in degrees unless a name says otherwise. Right
 * ascension lives in [0, 360), declination in [-90, +90].</p>
 *
 * <p>Stateless; every method is a pure function.</p>
 */
public final class WcsMath
{
    public static final double DEGREES_TO_RADIANS = Math.PI / 180.0;
    public static final double RADIANS_TO_DEGREES = 180.0 / Math.PI;

    /** Arcseconds in one radian. */
    public static final double ARCSEC_PER_RADIAN = 206_265.0;

    public static final double ARCSEC_PER_DEGREE = 3600.0;

    private WcsMath() {}

    // ------------------------------------------------------------------------
    // Normalization
    // ------------------------------------------------------------------------

    /**
     * Maps right ascension into [0, 360).
     */
    public static double normalizeRA(double ra) {
        double normalized = ra % 360.0;
        if (normalized < 0) {
            normalized += 360.0;
        }
        // -1e-20 + 360.0 rounds to 360.0
        return normalized >= 360.0 ? 0.0 : normalized;
    }

    /**
     * Clamps declination into [-90, +90].
     */
    public static double validateDeclination(double dec) {
        return Math.max(-90.0, Math.min(90.0, dec));
    }

    public static WorldCoordinate validateCoordinates(double ra, double dec) {
        return new WorldCoordinate(normalizeRA(ra), validateDeclination(dec));
    }

    // ------------------------------------------------------------------------
    // Angular distance
    // ------------------------------------------------------------------------

    /**
     * Great-circle separation between two sky positions, by the haversine
     * formula. Stable for small separations, near the poles and across the
     * 0/360 seam.
     *
     * @return separation in degrees, in [0, 180]
     */
    public static double angularSeparation(double ra1, double dec1, double ra2, double dec2) {
        final double dec1Rad = dec1 * DEGREES_TO_RADIANS;
        final double dec2Rad = dec2 * DEGREES_TO_RADIANS;
        final double deltaRA = (ra2 - ra1) * DEGREES_TO_RADIANS;
        final double deltaDec = dec2Rad - dec1Rad;

        final double sinHalfDec = Math.sin(deltaDec / 2);
        final double sinHalfRA = Math.sin(deltaRA / 2);

        double a = sinHalfDec * sinHalfDec
                + Math.cos(dec1Rad) * Math.cos(dec2Rad) * sinHalfRA * sinHalfRA;
        // rounding can push a marginally outside [0, 1]
        a = Math.max(0.0, Math.min(1.0, a));

        final double c = 2 * Math.atan2(Math.sqrt(a), Math.sqrt(1 - a));
        return c * RADIANS_TO_DEGREES;
    }

    public static double angularSeparation(WorldCoordinate a, WorldCoordinate b) {
        return angularSeparation(a.ra(), a.dec(), b.ra(), b.dec());
    }

    // ------------------------------------------------------------------------
    // TAN (gnomonic) projection
    // ------------------------------------------------------------------------

    /**
     * Projects a sky position onto the plane tangent at (ra0, dec0).
     *
     * @return tangent-plane offsets in degrees
     * @throws ProjectionSingularityException if the position is 90 degrees or
     *         more from the tangent point ({@code cos c <= 0})
     */
    public static TangentPlaneOffset tanProjectionForward(double ra, double dec, double ra0, double dec0)
            throws ProjectionSingularityException
    {
        final double decRad = dec * DEGREES_TO_RADIANS;
        final double dec0Rad = dec0 * DEGREES_TO_RADIANS;
        final double deltaRA = (ra - ra0) * DEGREES_TO_RADIANS;

        final double sinDec = Math.sin(decRad);
        final double cosDec = Math.cos(decRad);
        final double sinDec0 = Math.sin(dec0Rad);
        final double cosDec0 = Math.cos(dec0Rad);
        final double cosDeltaRA = Math.cos(deltaRA);

        final double cosC = sinDec0 * sinDec + cosDec0 * cosDec * cosDeltaRA;
        if (cosC <= 0) {
            throw new ProjectionSingularityException(String.format(
                    "(%.6f, %.6f) is too far from tangent point (%.6f, %.6f) for TAN projection",
                    ra, dec, ra0, dec0));
        }

        final double x = cosDec * Math.sin(deltaRA) / cosC;
        final double y = (sinDec * cosDec0 - cosDec * sinDec0 * cosDeltaRA) / cosC;

        return new TangentPlaneOffset(x * RADIANS_TO_DEGREES, y * RADIANS_TO_DEGREES);
    }

    /**
     * Maps tangent-plane offsets back to the sky. Always succeeds.
     *
     * <p>A zero offset returns the reference point exactly.</p>
     *
     * @param x tangent-plane x offset in degrees
     * @param y tangent-plane y offset in degrees
     */
    public static WorldCoordinate tanProjectionInverse(double x, double y, double ra0, double dec0) {
        final double xRad = x * DEGREES_TO_RADIANS;
        final double yRad = y * DEGREES_TO_RADIANS;
        final double rho = Math.sqrt(xRad * xRad + yRad * yRad);

        if (rho == 0) {
            return new WorldCoordinate(ra0, dec0);
        }

        final double ra0Rad = ra0 * DEGREES_TO_RADIANS;
        final double dec0Rad = dec0 * DEGREES_TO_RADIANS;
        final double c = Math.atan(rho);
        final double sinC = Math.sin(c);
        final double cosC = Math.cos(c);

        final double sinArg = cosC * Math.sin(dec0Rad) + (yRad * sinC * Math.cos(dec0Rad)) / rho;
        final double dec = Math.asin(Math.max(-1.0, Math.min(1.0, sinArg)));
        final double ra = ra0Rad + Math.atan2(
                xRad * sinC,
                rho * Math.cos(dec0Rad) * cosC - yRad * Math.sin(dec0Rad) * sinC);

        return validateCoordinates(ra * RADIANS_TO_DEGREES, dec * RADIANS_TO_DEGREES);
    }

    // ------------------------------------------------------------------------
    // Field of view and pixel scale
    // ------------------------------------------------------------------------

    /**
     * Angular extent of an image.
     *
     * @param pixelScaleX degrees per pixel along x (sign ignored)
     * @param pixelScaleY degrees per pixel along y (sign ignored)
     */
    public static FieldOfView calculateFieldOfView(double width, double height,
                                                   double pixelScaleX, double pixelScaleY) {
        final double fovWidth = width * Math.abs(pixelScaleX);
        final double fovHeight = height * Math.abs(pixelScaleY);
        return new FieldOfView(fovWidth, fovHeight, Math.sqrt(fovWidth * fovWidth + fovHeight * fovHeight));
    }

    public static double arcsecToDegreesPerPixel(double arcsecPerPixel) {
        return arcsecPerPixel / ARCSEC_PER_DEGREE;
    }

    public static double degreesToArcsecPerPixel(double degreesPerPixel) {
        return degreesPerPixel * ARCSEC_PER_DEGREE;
    }

    /**
     * Plate scale of a camera behind a telescope.
     *
     * @return arcseconds per pixel
     */
    public static double pixelScaleFromOptics(double focalLengthMm, double pixelSizeMicrons) {
        if (focalLengthMm <= 0) {
            throw new IllegalArgumentException("focalLengthMm must be positive (was " + focalLengthMm + ")");
        }
        return (pixelSizeMicrons / 1000.0) / focalLengthMm * ARCSEC_PER_RADIAN;
    }
}
