package com.questrail.fits.observability;

/**
 * No-op implementation of FitsObservabilitySink.
 */
public final class NullObservabilitySink implements FitsObservabilitySink {
    public static final NullObservabilitySink INSTANCE = new NullObservabilitySink();

    private NullObservabilitySink() {}

    @Override
    public void onImageLoaded(FitsImageLoadedEvent event) {}

    @Override
    public void onWcsWarning(FitsWcsWarningEvent event) {}

    @Override
    public void onError(FitsErrorEvent event) {}
}
