package com.questrail.fits.codec;

import com.questrail.fits.error.FitsException;
import com.questrail.fits.model.FitsHeader;

/**
 * FitsHduDecoder
 * -----------------------------------------------------------------------------
 * Block-level decoder for FITS header-data units.
 *
 * <p>The decoder is responsible only for:</p>
 * <ul>
 *   <li>Decoding header cards up to and including {@code END}</li>
 *   <li>Sizing and extracting the data unit</li>
 *   <li>Skipping block padding</li>
 * </ul>
 *
 * <p>The decoder is <strong>not</strong> responsible for:</p>
 * <ul>
 *   <li>Interpreting observatory or WCS keywords</li>
 *   <li>Byte-order conversion or physical value scaling</li>
 *   <li>Reading files or streams</li>
 * </ul>
 *
 * <p>A failure aborts the decode with no partial result.</p>
 */
public interface FitsHduDecoder
{
    /**
     * Decodes the primary HDU at the start of a complete FITS file buffer.
     *
     * @param file the whole file
     * @return the decoded primary HDU
     * @throws FitsException if the header is malformed, a sizing keyword is
     *         missing, BITPIX is unsupported or the payload is truncated
     */
    default FitsHdu decodePrimary(byte[] file) throws FitsException {
        return decode(file, 0);
    }

    /**
     * Decodes the HDU whose header starts at {@code offset}, which must lie on
     * a 2880-byte block boundary.
     *
     * @throws FitsException on any structural failure
     */
    FitsHdu decode(byte[] file, int offset) throws FitsException;

    /**
     * Decodes only the header cards starting at {@code offset}, without
     * sizing or reading the data unit.
     *
     * @throws FitsException if the header is malformed
     */
    FitsHeader decodeHeader(byte[] file, int offset) throws FitsException;
}
