package com.questrail.fits.api;

/**
 * Width and height of the first image plane, from NAXIS1 and NAXIS2.
 */
public record ImageDimensions(int width, int height)
{
    public ImageDimensions {
        if (width < 0 || height < 0) {
            throw new IllegalArgumentException(
                    "Image dimensions must be non-negative (was " + width + "x" + height + ")");
        }
    }

    public long totalPixels() {
        return (long) width * height;
    }

    /**
     * Width divided by height, or 1.0 for an image with no rows.
     */
    public double aspectRatio() {
        return height > 0 ? (double) width / height : 1.0;
    }

    public double megapixels() {
        return totalPixels() / 1_000_000.0;
    }
}
