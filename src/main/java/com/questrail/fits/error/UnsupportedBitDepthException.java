package com.questrail.fits.error;

/**
 * BITPIX declares a sample type other than 8, 16, 32, -32 or -64.
 */
public final class UnsupportedBitDepthException extends FitsException
{
    private final int bitpix;

    public UnsupportedBitDepthException(int bitpix) {
        super("Unsupported FITS BITPIX value: " + bitpix);
        this.bitpix = bitpix;
    }

    public int bitpix() {
        return bitpix;
    }
}
