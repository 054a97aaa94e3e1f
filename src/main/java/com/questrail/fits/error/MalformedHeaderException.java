package com.questrail.fits.error;

/**
 * The header block sequence could not be decoded into keyword records.
 */
public final class MalformedHeaderException extends FitsException
{
    private final String detail;

    public MalformedHeaderException(String detail) {
        super("Malformed FITS header: " + detail);
        this.detail = detail;
    }

    public String detail() {
        return detail;
    }
}
