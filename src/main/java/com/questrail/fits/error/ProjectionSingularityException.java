package com.questrail.fits.error;

/**
 * A celestial position cannot be projected onto the tangent plane, typically
 * because it lies on or beyond the horizon of the tangent point.
 */
public final class ProjectionSingularityException extends FitsException
{
    private final String detail;

    public ProjectionSingularityException(String detail) {
        super("Projection singularity: " + detail);
        this.detail = detail;
    }

    public String detail() {
        return detail;
    }
}
