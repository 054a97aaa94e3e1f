package com.questrail.fits.image;

import com.questrail.fits.api.BayerPattern;
import com.questrail.fits.api.PixelRegion;
import com.questrail.fits.error.FitsException;
import com.questrail.fits.model.HistogramData;
import com.questrail.fits.model.ImageMetadata;

/**
 * AstroImage
 * -----------------------------------------------------------------------------
 * A decoded astronomical image.
 *
 * <p>The capability set is fixed. Pixel buffers returned by this interface
 * are always in native byte order with BZERO/BSCALE applied, and always
 * fresh copies that the caller may modify.</p>
 *
 * <p>This interface is sealed; {@link FitsImage} is the only implementation.</p>
 */
public sealed interface AstroImage permits FitsImage
{
    ImageMetadata metadata();

    /**
     * Every sample of the primary array, scaled, in storage order. For a cube
     * (NAXIS of 3 or more) this covers all planes, so it equals the full
     * region of {@link #pixelData(PixelRegion)} only when NAXIS is at most 2.
     *
     * @throws FitsException if the stored payload is inconsistent with the metadata
     */
    byte[] pixelData() throws FitsException;

    /**
     * Samples of a rectangular region of the first image plane, row by row.
     * Planes beyond the first are never included.
     *
     * @throws com.questrail.fits.error.RegionOutOfBoundsException if the region
     *         does not lie entirely inside the image
     */
    byte[] pixelData(PixelRegion region) throws FitsException;

    /**
     * Value distribution and statistics at 16-bit presentation depth.
     */
    HistogramData histogram() throws FitsException;

    /**
     * True when the header marks the image as raw one-shot-colour data.
     */
    boolean supportsBayerDemosaic();

    /**
     * Colour reconstruction from a Bayer mosaic.
     *
     * @throws com.questrail.fits.error.DemosaicNotSupportedException always;
     *         demosaicing is performed outside this library
     */
    AstroImage demosaic(BayerPattern pattern) throws FitsException;
}
