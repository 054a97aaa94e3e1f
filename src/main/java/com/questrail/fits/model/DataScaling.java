package com.questrail.fits.model;

/**
 * BZERO/BSCALE affine mapping from stored sample values to physical values:
 * {@code physical = bscale * raw + bzero}.
 */
public record DataScaling(double bzero, double bscale)
{
    public static final double DEFAULT_BZERO = 0.0;
    public static final double DEFAULT_BSCALE = 1.0;

    public static final DataScaling IDENTITY = new DataScaling(DEFAULT_BZERO, DEFAULT_BSCALE);

    public double physicalValue(double raw) {
        return bscale * raw + bzero;
    }

    public boolean isIdentity() {
        return bscale == DEFAULT_BSCALE && bzero == DEFAULT_BZERO;
    }
}
