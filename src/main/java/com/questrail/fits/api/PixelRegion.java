package com.questrail.fits.api;

/**
 * Rectangular sub-region of an image, in 0-based pixel coordinates with the
 * origin at the first stored sample.
 *
 * <p>All components are non-negative. Whether a region is usable depends on the
 * image it is applied to; see {@link #fitsWithin(int, int)}.</p>
 *
 * @param x      column of the region's first pixel
 * @param y      row of the region's first pixel
 * @param width  number of columns
 * @param height number of rows
 */
public record PixelRegion(int x, int y, int width, int height)
{
    public PixelRegion {
        if (x < 0 || y < 0 || width < 0 || height < 0) {
            throw new IllegalArgumentException(
                    "PixelRegion components must be non-negative (was "
                            + x + "," + y + "," + width + "," + height + ")");
        }
    }

    /**
     * Region covering an entire image.
     */
    public static PixelRegion full(int imageWidth, int imageHeight) {
        return new PixelRegion(0, 0, imageWidth, imageHeight);
    }

    /**
     * Returns true if {@code x + width <= imageWidth} and
     * {@code y + height <= imageHeight}.
     *
     * <p>Sums are widened to {@code long} so that regions near
     * {@link Integer#MAX_VALUE} are rejected instead of overflowing.</p>
     */
    public boolean fitsWithin(int imageWidth, int imageHeight) {
        return (long) x + width <= imageWidth
                && (long) y + height <= imageHeight;
    }

    public long pixelCount() {
        return (long) width * height;
    }
}
