package com.questrail.fits.wcs;

/**
 * Angular size of an image, in degrees.
 */
public record FieldOfView(double width, double height, double diagonal)
{
    public double widthArcmin() {
        return width * 60.0;
    }

    public double heightArcmin() {
        return height * 60.0;
    }
}
