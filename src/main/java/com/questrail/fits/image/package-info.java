/**
 * Image facade: loading, scaled pixel access, regions and histograms.
 *
 * <p>{@link com.questrail.fits.image.FitsImageLoader} is the entry point.
 * Everything it returns is immutable.</p>
 */
package com.questrail.fits.image;
