package com.questrail.fits.wcs;

/**
 * 2x2 linear transform from pixel offsets to intermediate world coordinates
 * (the FITS CD matrix), in degrees per pixel.
 *
 * <pre>
 *   | x |   | cd11  cd12 |   | dx |
 *   | y | = | cd21  cd22 | * | dy |
 * </pre>
 */
public record TransformMatrix(double cd11, double cd12, double cd21, double cd22)
{
    /**
     * Determinants smaller than this are treated as singular.
     */
    public static final double SINGULARITY_THRESHOLD = 1e-15;

    /**
     * Builds the CD matrix equivalent to CDELT1/CDELT2 with a CROTA2 rotation.
     *
     * @param crota2 rotation of the y axis from north, in degrees
     */
    public static TransformMatrix fromCdelt(double cdelt1, double cdelt2, double crota2) {
        final double rot = crota2 * WcsMath.DEGREES_TO_RADIANS;
        final double cos = Math.cos(rot);
        final double sin = Math.sin(rot);
        return new TransformMatrix(
                cdelt1 * cos,
                -cdelt2 * sin,
                cdelt1 * sin,
                cdelt2 * cos);
    }

    /**
     * Builds the CD matrix from a PC matrix scaled by CDELT:
     * {@code CDi_j = CDELTi * PCi_j}.
     */
    public static TransformMatrix fromPc(double cdelt1, double cdelt2,
                                         double pc11, double pc12, double pc21, double pc22) {
        return new TransformMatrix(cdelt1 * pc11, cdelt1 * pc12, cdelt2 * pc21, cdelt2 * pc22);
    }

    public static TransformMatrix diagonal(double cdelt1, double cdelt2) {
        return new TransformMatrix(cdelt1, 0.0, 0.0, cdelt2);
    }

    public TangentPlaneOffset transform(double deltaX, double deltaY) {
        return new TangentPlaneOffset(
                cd11 * deltaX + cd12 * deltaY,
                cd21 * deltaX + cd22 * deltaY);
    }

    /**
     * Solves the 2x2 system for the pixel offset producing {@code (x, y)}.
     *
     * <p>When the determinant magnitude is below {@link #SINGULARITY_THRESHOLD}
     * the matrix cannot be inverted and each axis is divided by its entry in
     * {@code fallbackScale} instead.</p>
     */
    public PixelCoordinate inverseTransform(double x, double y, PixelScale fallbackScale) {
        final double det = determinant();
        if (Math.abs(det) < SINGULARITY_THRESHOLD) {
            return new PixelCoordinate(x / fallbackScale.x(), y / fallbackScale.y());
        }
        return new PixelCoordinate(
                (cd22 * x - cd12 * y) / det,
                (-cd21 * x + cd11 * y) / det);
    }

    public double determinant() {
        return cd11 * cd22 - cd12 * cd21;
    }

    /**
     * Geometric-mean pixel scale, {@code sqrt(|det|)}, in degrees per pixel.
     */
    public double effectivePixelScale() {
        return Math.sqrt(Math.abs(determinant()));
    }

    /**
     * Rotation of the matrix in degrees, from the CD2_1/CD1_1 column.
     */
    public double rotationDegrees() {
        return Math.atan2(cd21, cd11) * WcsMath.RADIANS_TO_DEGREES;
    }
}
