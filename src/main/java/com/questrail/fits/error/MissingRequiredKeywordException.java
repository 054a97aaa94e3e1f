package com.questrail.fits.error;

/**
 * A keyword the FITS standard makes mandatory for an image HDU is absent or
 * does not hold an integer value.
 */
public final class MissingRequiredKeywordException extends FitsException
{
    private final String keyword;

    public MissingRequiredKeywordException(String keyword) {
        super("Missing required FITS keyword: " + keyword);
        this.keyword = keyword;
    }

    public String keyword() {
        return keyword;
    }
}
