package com.questrail.fits.image;

import com.questrail.fits.api.BayerPattern;
import com.questrail.fits.api.ImageDimensions;
import com.questrail.fits.api.PixelRegion;
import com.questrail.fits.error.CorruptedDataException;
import com.questrail.fits.error.DemosaicNotSupportedException;
import com.questrail.fits.error.FitsException;
import com.questrail.fits.error.RegionOutOfBoundsException;
import com.questrail.fits.internal.sample.PhysicalValueTransformer;
import com.questrail.fits.model.HistogramData;
import com.questrail.fits.model.ImageMetadata;

import java.util.Objects;

/**
 * FITS primary image backed by its native-order, unscaled payload.
 *
 * <p>Scaling is applied on every call; nothing is cached. Instances are
 * immutable and may be shared between threads.</p>
 */
public final class FitsImage implements AstroImage
{
    private final ImageMetadata metadata;
    private final byte[] nativeData;

    /**
     * @param nativeData payload already converted to native byte order; copied
     */
    public FitsImage(ImageMetadata metadata, byte[] nativeData) {
        this.metadata = Objects.requireNonNull(metadata, "metadata");
        this.nativeData = Objects.requireNonNull(nativeData, "nativeData").clone();
        if (nativeData.length != metadata.payloadByteLength()) {
            throw new IllegalArgumentException("payload is " + nativeData.length
                    + " bytes but metadata describes " + metadata.payloadByteLength());
        }
    }

    @Override
    public ImageMetadata metadata() {
        return metadata;
    }

    @Override
    public byte[] pixelData() throws FitsException {
        final byte[] scaled = PhysicalValueTransformer.transform(
                nativeData, metadata.sampleType(), metadata.scaling());
        return scaled == nativeData ? nativeData.clone() : scaled;
    }

    @Override
    public byte[] pixelData(PixelRegion region) throws FitsException {
        final ImageDimensions d = metadata.dimensions();
        return RegionExtractor.extract(
                nativeData, d.width(), d.height(),
                metadata.sampleType(), metadata.scaling(), region);
    }

    @Override
    public HistogramData histogram() throws FitsException {
        return HistogramEngine.compute(pixelData(), metadata.sampleType());
    }

    @Override
    public boolean supportsBayerDemosaic() {
        return metadata.hasBayerIndicators();
    }

    @Override
    public AstroImage demosaic(BayerPattern pattern) throws DemosaicNotSupportedException {
        throw new DemosaicNotSupportedException();
    }

    /**
     * Unclamped physical value ({@code BSCALE * raw + BZERO}) of one pixel of
     * the first image plane.
     *
     * @throws RegionOutOfBoundsException if the pixel lies outside the image
     */
    public double physicalValueAt(int x, int y) throws RegionOutOfBoundsException {
        final ImageDimensions d = metadata.dimensions();
        if (x < 0 || y < 0 || x >= d.width() || y >= d.height()) {
            throw new RegionOutOfBoundsException(
                    new PixelRegion(Math.max(0, x), Math.max(0, y), 1, 1), d.width(), d.height());
        }
        final int index = y * d.width() + x;
        final double raw = PhysicalValueTransformer.readRaw(
                PhysicalValueTransformer.wrap(nativeData), index, metadata.sampleType());
        return metadata.physicalValue(raw);
    }

    /**
     * Unclamped physical value of every sample.
     */
    public double[] physicalSamples() throws CorruptedDataException {
        return PhysicalValueTransformer.physicalSamples(
                nativeData, metadata.sampleType(), metadata.scaling());
    }

    @Override
    public String toString() {
        return "FitsImage[" + metadata + ']';
    }
}
