package com.questrail.fits.image;

import com.questrail.fits.api.PixelRegion;
import com.questrail.fits.error.CorruptedDataException;
import com.questrail.fits.error.FitsException;
import com.questrail.fits.error.RegionOutOfBoundsException;
import com.questrail.fits.internal.sample.PhysicalValueTransformer;
import com.questrail.fits.model.DataScaling;
import com.questrail.fits.model.SampleType;

import java.util.Objects;

/**
 * RegionExtractor
 * -----------------------------------------------------------------------------
 * Copies a rectangular window out of a row-major, native-order sample buffer
 * and applies the physical value transform to the copy.
 *
 * <p>Each row of the window is one contiguous byte range of the source, so
 * the copy is a sequence of {@link System#arraycopy} calls. The scaled
 * result is identical to the same window cut from the fully scaled image.</p>
 */
final class RegionExtractor
{
    private RegionExtractor() {}

    static byte[] extract(byte[] nativeData,
                          int imageWidth,
                          int imageHeight,
                          SampleType type,
                          DataScaling scaling,
                          PixelRegion region)
            throws FitsException
    {
        Objects.requireNonNull(region, "region");
        if (!region.fitsWithin(imageWidth, imageHeight)) {
            throw new RegionOutOfBoundsException(region, imageWidth, imageHeight);
        }

        final int bps = type.bytesPerSample();
        final long rowBytes = (long) region.width() * bps;
        final long total = rowBytes * region.height();
        if (total > Integer.MAX_VALUE) {
            throw new CorruptedDataException("region of " + total + " bytes exceeds the maximum array size");
        }

        final byte[] out = new byte[(int) total];
        for (int row = 0; row < region.height(); row++) {
            final long srcStart = (((long) region.y() + row) * imageWidth + region.x()) * bps;
            if (srcStart + rowBytes > nativeData.length) {
                throw new CorruptedDataException("row " + (region.y() + row)
                        + " extends past the end of the " + nativeData.length + "-byte sample buffer");
            }
            System.arraycopy(nativeData, (int) srcStart, out, (int) (row * rowBytes), (int) rowBytes);
        }

        return PhysicalValueTransformer.transform(out, type, scaling);
    }
}
