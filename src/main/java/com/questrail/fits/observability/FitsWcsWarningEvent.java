package com.questrail.fits.observability;

import java.time.Instant;

/**
 * Record representing one advisory WCS validation warning.
 */
public record FitsWcsWarningEvent(
    Instant timestamp,
    String fileName,
    String warning
) {
}
