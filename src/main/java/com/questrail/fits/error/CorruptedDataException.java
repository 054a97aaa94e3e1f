package com.questrail.fits.error;

/**
 * Sample data is inconsistent with the metadata describing it.
 */
public final class CorruptedDataException extends FitsException
{
    private final String detail;

    public CorruptedDataException(String detail) {
        super("Corrupted FITS data: " + detail);
        this.detail = detail;
    }

    public String detail() {
        return detail;
    }
}
