/**
 * Header interpretation: required sizing keywords, observatory keywords and
 * the celestial WCS keyword family.
 *
 * <p>Nothing here reads sample data.</p>
 */
package com.questrail.fits.internal.metadata;
