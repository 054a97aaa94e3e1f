package com.questrail.fits.codec.impl;

/**
 * FitsBlocks
 * -----------------------------------------------------------------------------
 * Fixed geometry of the FITS logical record structure (FITS 4.0 section 3.1).
 *
 * <p>Every header and every data unit occupies a whole number of 2880-byte
 * blocks. A header block holds 36 cards of 80 characters each.</p>
 */
final class FitsBlocks
{
    /** Logical block size in bytes. */
    static final int BLOCK_SIZE = 2880;

    /** Header card length in characters (bytes). */
    static final int CARD_SIZE = 80;

    /** Width of the keyword field, columns 1-8. */
    static final int KEYWORD_WIDTH = 8;

    private FitsBlocks() {}

    /**
     * Rounds {@code length} up to the next multiple of {@link #BLOCK_SIZE}.
     */
    static long padToBlock(long length)
    {
        final long remainder = length % BLOCK_SIZE;
        return remainder == 0 ? length : length + (BLOCK_SIZE - remainder);
    }
}
