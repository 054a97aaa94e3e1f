package com.questrail.fits.error;

/**
 * Fewer payload bytes remain than the header declares.
 */
public final class InvalidDataSizeException extends FitsException
{
    private final long expected;
    private final long actual;

    public InvalidDataSizeException(long expected, long actual) {
        super("Invalid FITS data size: expected " + expected + " bytes, got " + actual);
        this.expected = expected;
        this.actual = actual;
    }

    public long expected() {
        return expected;
    }

    public long actual() {
        return actual;
    }
}
