package com.questrail.fits.error;

/**
 * Root of the FITS failure taxonomy.
 *
 * <p>Every decode, transform and projection operation in this library either
 * returns a complete result or throws exactly one subtype of this exception.
 * Partial results are never produced. None of these failures are transient:
 * a malformed byte buffer will not become valid by retrying.</p>
 *
 * <ul>
 *   <li>{@link MissingRequiredKeywordException} - NAXIS, BITPIX or NAXISn absent</li>
 *   <li>{@link MalformedHeaderException} - header structure cannot be decoded</li>
 *   <li>{@link InvalidDataSizeException} - payload shorter than declared</li>
 *   <li>{@link UnsupportedBitDepthException} - BITPIX outside 8/16/32/-32/-64</li>
 *   <li>{@link RegionOutOfBoundsException} - requested region leaves the image</li>
 *   <li>{@link ProjectionSingularityException} - point cannot be projected</li>
 *   <li>{@link CorruptedDataException} - sample data inconsistent with metadata</li>
 *   <li>{@link DemosaicNotSupportedException} - Bayer demosaic requested</li>
 * </ul>
 */
public abstract sealed class FitsException extends Exception
        permits MissingRequiredKeywordException,
                MalformedHeaderException,
                InvalidDataSizeException,
                UnsupportedBitDepthException,
                RegionOutOfBoundsException,
                ProjectionSingularityException,
                CorruptedDataException,
                DemosaicNotSupportedException
{
    protected FitsException(String message) {
        super(message);
    }

    protected FitsException(String message, Throwable cause) {
        super(message, cause);
    }
}
