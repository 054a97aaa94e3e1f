package com.questrail.fits.wcs;

import com.questrail.fits.error.ProjectionSingularityException;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalDouble;

/**
 * Celestial World Coordinate System of an image: the mapping between pixel
 * positions and sky positions described by the CRPIX/CRVAL/CDELT/CD/CTYPE
 * keyword family.
 *
 * <h2>Conventions</h2>
 * <ul>
 *   <li>{@link #referencePixel()} is 1-based, as written in the header.</li>
 *   <li>{@link #worldCoordinates(double, double)} and
 *       {@link #pixelCoordinates(double, double)} work in 0-based pixel
 *       coordinates, matching array indices.</li>
 *   <li>A CD matrix, when present, is authoritative. CDELT and CROTA2 are
 *       only consulted when it is absent.</li>
 * </ul>
 *
 * <h2>Projections</h2>
 * <p>Only TAN is projected on the sphere. Any other projection code, or no
 * code at all, is handled as a linear offset from the reference value, which
 * is adequate only for small fields; {@link #validate()} reports it.</p>
 *
 * <p>Instances are immutable and safe to share between threads.</p>
 */
public final class WcsParameters
{
    public static final String TAN = "TAN";

    public static final double DEFAULT_EPOCH = 2000.0;

    /** Plausible range for imaging pixel scales, arcsec/pixel. */
    public static final double MIN_PLAUSIBLE_SCALE_ARCSEC = 0.1;
    public static final double MAX_PLAUSIBLE_SCALE_ARCSEC = 600.0;

    private final PixelCoordinate referencePixel;
    private final WorldCoordinate referenceValue;
    private final PixelScale pixelScale;
    private final TransformMatrix cdMatrix;
    private final Double rotationAngle;
    private final CoordinateTypes coordinateTypes;
    private final String projection;
    private final String coordinateSystem;
    private final Double equinox;

    private WcsParameters(Builder b) {
        this.referencePixel = Objects.requireNonNull(b.referencePixel, "referencePixel");
        this.referenceValue = Objects.requireNonNull(b.referenceValue, "referenceValue");
        this.pixelScale = Objects.requireNonNull(b.pixelScale, "pixelScale");
        this.coordinateTypes = Objects.requireNonNull(b.coordinateTypes, "coordinateTypes");
        this.cdMatrix = b.cdMatrix;
        this.rotationAngle = b.rotationAngle;
        this.projection = b.projection;
        this.coordinateSystem = b.coordinateSystem;
        this.equinox = b.equinox;
    }

    public PixelCoordinate referencePixel() {
        return referencePixel;
    }

    public WorldCoordinate referenceValue() {
        return referenceValue;
    }

    public PixelScale pixelScale() {
        return pixelScale;
    }

    public Optional<TransformMatrix> cdMatrix() {
        return Optional.ofNullable(cdMatrix);
    }

    public OptionalDouble rotationAngle() {
        return rotationAngle == null ? OptionalDouble.empty() : OptionalDouble.of(rotationAngle);
    }

    public CoordinateTypes coordinateTypes() {
        return coordinateTypes;
    }

    public Optional<String> projection() {
        return Optional.ofNullable(projection);
    }

    public Optional<String> coordinateSystem() {
        return Optional.ofNullable(coordinateSystem);
    }

    public OptionalDouble equinox() {
        return equinox == null ? OptionalDouble.empty() : OptionalDouble.of(equinox);
    }

    /**
     * Equinox of the reference coordinates, J2000 when the header is silent.
     */
    public double epoch() {
        return equinox == null ? DEFAULT_EPOCH : equinox;
    }

    public boolean isTanProjection() {
        return projection != null && TAN.equals(projection.toUpperCase(Locale.ROOT));
    }

    /**
     * The matrix actually applied to pixel offsets: the CD matrix if present,
     * otherwise one synthesized from CDELT and the optional rotation.
     */
    public TransformMatrix effectiveMatrix() {
        if (cdMatrix != null) {
            return cdMatrix;
        }
        if (rotationAngle != null) {
            return TransformMatrix.fromCdelt(pixelScale.x(), pixelScale.y(), rotationAngle);
        }
        return TransformMatrix.diagonal(pixelScale.x(), pixelScale.y());
    }

    // ------------------------------------------------------------------------
    // Transforms
    // ------------------------------------------------------------------------

    /**
     * Sky position of a 0-based pixel position.
     */
    public WorldCoordinate worldCoordinates(double x, double y) {
        final double deltaX = x + 1.0 - referencePixel.x();
        final double deltaY = y + 1.0 - referencePixel.y();

        final TangentPlaneOffset offset = effectiveMatrix().transform(deltaX, deltaY);

        if (isTanProjection()) {
            return WcsMath.tanProjectionInverse(
                    offset.x(), offset.y(), referenceValue.ra(), referenceValue.dec());
        }
        return WcsMath.validateCoordinates(
                referenceValue.ra() + offset.x(), referenceValue.dec() + offset.y());
    }

    /**
     * 0-based pixel position of a sky position.
     *
     * @throws ProjectionSingularityException if the projection is TAN and the
     *         position lies 90 degrees or more from the reference value
     */
    public PixelCoordinate pixelCoordinates(double ra, double dec) throws ProjectionSingularityException {
        final WorldCoordinate target = WcsMath.validateCoordinates(ra, dec);

        final TangentPlaneOffset offset;
        if (isTanProjection()) {
            offset = WcsMath.tanProjectionForward(
                    target.ra(), target.dec(), referenceValue.ra(), referenceValue.dec());
        } else {
            offset = new TangentPlaneOffset(
                    wrapDelta(target.ra() - referenceValue.ra()),
                    target.dec() - referenceValue.dec());
        }

        final PixelCoordinate delta = effectiveMatrix().inverseTransform(offset.x(), offset.y(), pixelScale);
        return new PixelCoordinate(
                referencePixel.x() + delta.x() - 1.0,
                referencePixel.y() + delta.y() - 1.0);
    }

    private static double wrapDelta(double deltaRa) {
        if (deltaRa > 180.0) {
            return deltaRa - 360.0;
        }
        if (deltaRa < -180.0) {
            return deltaRa + 360.0;
        }
        return deltaRa;
    }

    // ------------------------------------------------------------------------
    // Scale and field of view
    // ------------------------------------------------------------------------

    /**
     * Degrees per pixel. With a CD matrix both axes report {@code sqrt(|det|)}.
     */
    public PixelScale effectivePixelScale() {
        if (cdMatrix != null) {
            final double scale = cdMatrix.effectivePixelScale();
            return new PixelScale(scale, scale);
        }
        return pixelScale;
    }

    /**
     * Absolute arcseconds per pixel.
     */
    public PixelScale pixelScaleArcsec() {
        return effectivePixelScale().toArcsec();
    }

    public FieldOfView fieldOfView(double imageWidth, double imageHeight) {
        final PixelScale scale = effectivePixelScale();
        return WcsMath.calculateFieldOfView(imageWidth, imageHeight, scale.x(), scale.y());
    }

    // ------------------------------------------------------------------------
    // Validation
    // ------------------------------------------------------------------------

    /**
     * Advisory sanity checks. An empty list means nothing looked unusual; a
     * non-empty list never prevents the parameters from being used.
     */
    public List<String> validate() {
        final List<String> issues = new ArrayList<>();

        if (!coordinateTypes.x().contains("RA") && !coordinateTypes.x().contains("GLON")) {
            issues.add("Unexpected longitude coordinate type: " + coordinateTypes.x());
        }
        if (!coordinateTypes.y().contains("DEC") && !coordinateTypes.y().contains("GLAT")) {
            issues.add("Unexpected latitude coordinate type: " + coordinateTypes.y());
        }

        final PixelScale arcsec = pixelScaleArcsec();
        if (!isPlausibleScale(arcsec.x())) {
            issues.add(String.format(Locale.ROOT, "Unusual pixel scale X: %.3f arcsec/pixel", arcsec.x()));
        }
        if (!isPlausibleScale(arcsec.y())) {
            issues.add(String.format(Locale.ROOT, "Unusual pixel scale Y: %.3f arcsec/pixel", arcsec.y()));
        }

        if (referenceValue.ra() < 0 || referenceValue.ra() >= 360) {
            issues.add("RA reference value outside valid range [0,360): " + referenceValue.ra());
        }
        if (referenceValue.dec() < -90 || referenceValue.dec() > 90) {
            issues.add("Dec reference value outside valid range [-90,90]: " + referenceValue.dec());
        }

        if (projection != null && !isTanProjection()) {
            issues.add("Unsupported projection " + projection + ", using linear approximation");
        }

        return List.copyOf(issues);
    }

    private static boolean isPlausibleScale(double arcsecPerPixel) {
        return arcsecPerPixel >= MIN_PLAUSIBLE_SCALE_ARCSEC && arcsecPerPixel <= MAX_PLAUSIBLE_SCALE_ARCSEC;
    }

    public static Builder builder() {
        return new Builder();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof WcsParameters that)) return false;
        return referencePixel.equals(that.referencePixel)
                && referenceValue.equals(that.referenceValue)
                && pixelScale.equals(that.pixelScale)
                && Objects.equals(cdMatrix, that.cdMatrix)
                && Objects.equals(rotationAngle, that.rotationAngle)
                && coordinateTypes.equals(that.coordinateTypes)
                && Objects.equals(projection, that.projection)
                && Objects.equals(coordinateSystem, that.coordinateSystem)
                && Objects.equals(equinox, that.equinox);
    }

    @Override
    public int hashCode() {
        return Objects.hash(referencePixel, referenceValue, pixelScale, cdMatrix, rotationAngle,
                coordinateTypes, projection, coordinateSystem, equinox);
    }

    @Override
    public String toString() {
        return "WcsParameters[crpix=" + referencePixel
                + ", crval=" + referenceValue
                + ", cdelt=" + pixelScale
                + ", cd=" + cdMatrix
                + ", projection=" + projection
                + ']';
    }

    public static final class Builder {
        private PixelCoordinate referencePixel;
        private WorldCoordinate referenceValue;
        private PixelScale pixelScale = new PixelScale(0.0, 0.0);
        private TransformMatrix cdMatrix;
        private Double rotationAngle;
        private CoordinateTypes coordinateTypes = CoordinateTypes.EQUATORIAL_DEFAULT;
        private String projection;
        private String coordinateSystem;
        private Double equinox;

        public Builder withReferencePixel(double x, double y) {
            this.referencePixel = new PixelCoordinate(x, y);
            return this;
        }

        public Builder withReferenceValue(double ra, double dec) {
            this.referenceValue = new WorldCoordinate(ra, dec);
            return this;
        }

        public Builder withPixelScale(double x, double y) {
            this.pixelScale = new PixelScale(x, y);
            return this;
        }

        public Builder withCdMatrix(TransformMatrix cdMatrix) {
            this.cdMatrix = cdMatrix;
            return this;
        }

        public Builder withRotationAngle(Double rotationAngle) {
            this.rotationAngle = rotationAngle;
            return this;
        }

        public Builder withCoordinateTypes(String x, String y) {
            this.coordinateTypes = new CoordinateTypes(x, y);
            return this;
        }

        public Builder withProjection(String projection) {
            this.projection = projection;
            return this;
        }

        public Builder withCoordinateSystem(String coordinateSystem) {
            this.coordinateSystem = coordinateSystem;
            return this;
        }

        public Builder withEquinox(Double equinox) {
            this.equinox = equinox;
            return this;
        }

        public WcsParameters build() {
            return new WcsParameters(this);
        }
    }
}
