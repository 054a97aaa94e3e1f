package com.questrail.fits.observability;

import java.time.Instant;

/**
 * Record representing a failed load.
 */
public record FitsErrorEvent(
    Instant timestamp,
    String fileName,
    String message,
    Throwable cause
) {
}
