package com.questrail.fits.model;

/**
 * On-sensor pixel binning, from XBINNING/YBINNING.
 */
public record ImageBinning(int horizontal, int vertical)
{
    public static final ImageBinning NONE = new ImageBinning(1, 1);

    public ImageBinning {
        if (horizontal < 1 || vertical < 1) {
            throw new IllegalArgumentException(
                    "Binning factors must be >= 1 (was " + horizontal + "x" + vertical + ")");
        }
    }

    public static ImageBinning square(int factor) {
        return new ImageBinning(factor, factor);
    }
}
