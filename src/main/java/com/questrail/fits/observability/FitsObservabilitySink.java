package com.questrail.fits.observability;

/**
 * Main interface for receiving image-loading observability events.
 * Implementations can provide logging, metrics, or tracing.
 */
public interface FitsObservabilitySink {
    /**
     * Called after an image, or its metadata alone, has been decoded.
     * @param event the load details
     */
    void onImageLoaded(FitsImageLoadedEvent event);

    /**
     * Called for each advisory warning produced by WCS validation.
     * @param event the warning
     */
    void onWcsWarning(FitsWcsWarningEvent event);

    /**
     * Called when a load fails.
     * @param event the error event
     */
    void onError(FitsErrorEvent event);
}
