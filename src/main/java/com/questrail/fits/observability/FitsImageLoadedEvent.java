package com.questrail.fits.observability;

import com.questrail.fits.model.ImageMetadata;

import java.time.Instant;

/**
 * Record representing a successful decode.
 *
 * @param metadataOnly true when only the header was decoded
 */
public record FitsImageLoadedEvent(
    Instant timestamp,
    String fileName,
    ImageMetadata metadata,
    int headerCards,
    boolean metadataOnly
) {
}
