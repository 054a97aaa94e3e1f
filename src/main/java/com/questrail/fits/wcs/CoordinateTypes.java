package com.questrail.fits.wcs;

import java.util.Objects;

/**
 * CTYPE1/CTYPE2 axis type codes, e.g. {@code RA---TAN} / {@code DEC--TAN}.
 */
public record CoordinateTypes(String x, String y)
{
    public static final CoordinateTypes EQUATORIAL_DEFAULT = new CoordinateTypes("RA", "DEC");

    public CoordinateTypes {
        Objects.requireNonNull(x, "x");
        Objects.requireNonNull(y, "y");
    }
}
