package com.questrail.fits.image;

import com.questrail.fits.codec.FitsHdu;
import com.questrail.fits.codec.FitsHduDecoder;
import com.questrail.fits.codec.impl.DefaultFitsHduDecoder;
import com.questrail.fits.config.FitsLoaderConfig;
import com.questrail.fits.error.FitsException;
import com.questrail.fits.internal.metadata.FitsMetadataBuilder;
import com.questrail.fits.internal.sample.ByteOrderNormalizer;
import com.questrail.fits.model.FitsHeader;
import com.questrail.fits.model.ImageMetadata;
import com.questrail.fits.observability.FitsErrorEvent;
import com.questrail.fits.observability.FitsImageLoadedEvent;
import com.questrail.fits.observability.FitsObservabilitySink;
import com.questrail.fits.observability.FitsWcsWarningEvent;

import java.time.Instant;
import java.util.Objects;

/**
 * FitsImageLoader
 * -----------------------------------------------------------------------------
 * Entry point that turns the bytes of a FITS file into an {@link AstroImage}.
 *
 * <p>Pipeline, in order:</p>
 * <ol>
 *   <li>Header and data unit decoding ({@link FitsHduDecoder})</li>
 *   <li>Metadata and WCS interpretation ({@link FitsMetadataBuilder})</li>
 *   <li>Big-endian to native byte order ({@link ByteOrderNormalizer})</li>
 * </ol>
 *
 * <p>Scaling is deferred to the image accessors. The loader performs no I/O:
 * the caller supplies the complete file. It holds no mutable state and is
 * thread-safe when the configured sink is.</p>
 */
public final class FitsImageLoader
{
    private final FitsLoaderConfig config;
    private final FitsHduDecoder decoder;
    private final FitsObservabilitySink sink;

    public FitsImageLoader() {
        this(FitsLoaderConfig.defaults());
    }

    public FitsImageLoader(FitsLoaderConfig config) {
        this.config = Objects.requireNonNull(config, "config");
        this.decoder = new DefaultFitsHduDecoder(config.duplicatePolicy());
        this.sink = config.observabilitySink();
    }

    /**
     * Decodes the primary image of a FITS file.
     *
     * @param file     the complete file contents
     * @param fileName name reported in metadata and events; may be null
     * @throws FitsException on any decoding failure; no partial image is produced
     */
    public FitsImage load(byte[] file, String fileName) throws FitsException {
        Objects.requireNonNull(file, "file");
        final String name = fileName == null ? "" : fileName;

        try {
            final FitsHdu hdu = decoder.decodePrimary(file);
            final ImageMetadata metadata = FitsMetadataBuilder.build(hdu.header(), name, file.length);
            final byte[] nativeData = ByteOrderNormalizer.toNativeOrder(hdu.payload(), hdu.sampleType());
            final FitsImage image = new FitsImage(metadata, nativeData);

            publish(metadata, name, false);
            return image;
        }
        catch (FitsException e) {
            sink.onError(new FitsErrorEvent(Instant.now(), name, e.getMessage(), e));
            throw e;
        }
    }

    /**
     * Decodes only the header of a FITS file. The data unit is neither read
     * nor size-checked.
     *
     * @throws FitsException if the header is malformed or lacks a required keyword
     */
    public ImageMetadata parseMetadata(byte[] file, String fileName) throws FitsException {
        Objects.requireNonNull(file, "file");
        final String name = fileName == null ? "" : fileName;

        try {
            final FitsHeader header = decoder.decodeHeader(file, 0);
            final ImageMetadata metadata = FitsMetadataBuilder.build(header, name, file.length);

            publish(metadata, name, true);
            return metadata;
        }
        catch (FitsException e) {
            sink.onError(new FitsErrorEvent(Instant.now(), name, e.getMessage(), e));
            throw e;
        }
    }

    public FitsLoaderConfig config() {
        return config;
    }

    private void publish(ImageMetadata metadata, String name, boolean metadataOnly) {
        final Instant now = Instant.now();
        sink.onImageLoaded(new FitsImageLoadedEvent(
                now, name, metadata, metadata.header().records().size(), metadataOnly));

        if (config.reportWcsWarnings()) {
            metadata.wcs().ifPresent(wcs ->
                    wcs.validate().forEach(w -> sink.onWcsWarning(new FitsWcsWarningEvent(now, name, w))));
        }
    }
}
