package com.questrail.fits.observability;

import com.questrail.fits.model.ImageMetadata;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Production implementation of FitsObservabilitySink that emits logs via SLF4J.
 */
public final class Slf4jFitsObservabilitySink implements FitsObservabilitySink {
    private static final Logger log = LoggerFactory.getLogger(Slf4jFitsObservabilitySink.class);

    @Override
    public void onImageLoaded(FitsImageLoadedEvent event) {
        final ImageMetadata m = event.metadata();
        if (event.metadataOnly()) {
            log.info("FITS metadata {}: {}x{} {} (wcs={})",
                event.fileName(),
                m.dimensions().width(),
                m.dimensions().height(),
                m.sampleType(),
                m.hasWcs());
        } else {
            log.info("FITS image {}: {}x{} {}, {} bytes (wcs={})",
                event.fileName(),
                m.dimensions().width(),
                m.dimensions().height(),
                m.sampleType(),
                m.payloadByteLength(),
                m.hasWcs());
        }
        log.debug("FITS header {}: {} cards, {} keywords, scaling={}",
            event.fileName(),
            event.headerCards(),
            m.header().size(),
            m.scaling());
    }

    @Override
    public void onWcsWarning(FitsWcsWarningEvent event) {
        log.warn("FITS WCS {}: {}", event.fileName(), event.warning());
    }

    @Override
    public void onError(FitsErrorEvent event) {
        log.error("FITS Error {}: {}", event.fileName(), event.message(), event.cause());
    }
}
