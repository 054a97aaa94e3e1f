/**
 * Default implementation of the FITS codec.
 *
 * <p>{@link com.questrail.fits.codec.impl.DefaultFitsHduDecoder} is the only
 * public type. Block geometry, card parsing and data unit sizing are
 * package-private so that the wire rules live in exactly one place.</p>
 */
package com.questrail.fits.codec.impl;
