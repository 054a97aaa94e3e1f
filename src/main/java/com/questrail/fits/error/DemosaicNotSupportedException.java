package com.questrail.fits.error;

/**
 * Bayer demosaicing was requested but is not available for the image.
 */
public final class DemosaicNotSupportedException extends FitsException
{
    public DemosaicNotSupportedException() {
        super("Bayer demosaicing is not supported for this image");
    }
}
