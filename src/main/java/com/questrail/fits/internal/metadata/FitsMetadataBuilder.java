package com.questrail.fits.internal.metadata;

import com.questrail.fits.error.FitsException;
import com.questrail.fits.model.DataScaling;
import com.questrail.fits.model.DataUnitLayout;
import com.questrail.fits.model.FitsHeader;
import com.questrail.fits.model.ImageBinning;
import com.questrail.fits.model.ImageMetadata;
import com.questrail.fits.model.ObservationInfo;

import java.util.Objects;
import java.util.OptionalDouble;

/**
 * FitsMetadataBuilder
 * -----------------------------------------------------------------------------
 * Turns a decoded {@link FitsHeader} into {@link ImageMetadata}.
 *
 * <p>Required: NAXIS, BITPIX and NAXIS1..NAXISn. Everything else is optional
 * and simply left empty when absent or unparseable. Keyword aliases written
 * by common capture software are honoured:</p>
 * <ul>
 *   <li>EXPTIME, else EXPOSURE</li>
 *   <li>CCD-TEMP, else TEMP</li>
 * </ul>
 *
 * <p>The sizing keywords go through {@link DataUnitLayout#fromHeader}, the
 * same validation the decoder applies. An unsupported BITPIX, an out-of-range
 * NAXIS or a payload too large for one array therefore fails here, even when
 * only the header is loaded.</p>
 */
public final class FitsMetadataBuilder
{
    private FitsMetadataBuilder() {}

    public static ImageMetadata build(FitsHeader header, String fileName, long fileSize)
            throws FitsException
    {
        Objects.requireNonNull(header, "header");

        final DataUnitLayout layout = DataUnitLayout.fromHeader(header);

        final DataScaling scaling = new DataScaling(
                header.doubleValue("BZERO").orElse(DataScaling.DEFAULT_BZERO),
                header.doubleValue("BSCALE").orElse(DataScaling.DEFAULT_BSCALE));

        return ImageMetadata.builder()
                .withAxisSizes(layout.axisSizes())
                .withSampleType(layout.sampleType())
                .withScaling(scaling)
                .withFileName(fileName == null ? "" : fileName)
                .withFileSize(fileSize)
                .withHeader(header)
                .withObservation(observation(header))
                .withWcs(WcsKeywordExtractor.extract(header).orElse(null))
                .build();
    }

    static ObservationInfo observation(FitsHeader header) {
        return ObservationInfo.builder()
                .withTelescope(header.nonBlankValue("TELESCOP").orElse(null))
                .withInstrument(header.nonBlankValue("INSTRUME").orElse(null))
                .withObserver(header.nonBlankValue("OBSERVER").orElse(null))
                .withObject(header.nonBlankValue("OBJECT").orElse(null))
                .withFilter(header.nonBlankValue("FILTER").orElse(null))
                .withObservationDate(header.dateValue("DATE-OBS").orElse(null))
                .withExposureTime(boxed(firstDouble(header, "EXPTIME", "EXPOSURE")))
                .withTemperature(boxed(firstDouble(header, "CCD-TEMP", "TEMP")))
                .withGain(boxed(header.doubleValue("GAIN")))
                .withBinning(binning(header))
                .build();
    }

    private static ImageBinning binning(FitsHeader header) {
        final int x = header.intValue("XBINNING").orElse(1);
        final int y = header.intValue("YBINNING").orElse(1);
        return new ImageBinning(Math.max(1, x), Math.max(1, y));
    }

    private static OptionalDouble firstDouble(FitsHeader header, String primary, String fallback) {
        final OptionalDouble value = header.doubleValue(primary);
        return value.isPresent() ? value : header.doubleValue(fallback);
    }

    private static Double boxed(OptionalDouble value) {
        return value.isPresent() ? value.getAsDouble() : null;
    }
}
