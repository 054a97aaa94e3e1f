package com.questrail.fits.model;

import com.questrail.fits.api.BayerPattern;
import com.questrail.fits.api.ImageDimensions;
import com.questrail.fits.wcs.WcsParameters;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Structured description of a FITS primary image, assembled once from its
 * header and never mutated.
 *
 * <p>The mandatory part (axes, sample type, scaling, header) is always
 * present. Observatory fields live in {@link ObservationInfo}; the WCS is
 * exposed as an {@link Optional} so that its absence is visible in the type.</p>
 *
 * <p>Invariant: {@code product(axisSizes) * sampleType.bytesPerSample()}
 * equals {@link #payloadByteLength()}.</p>
 */
public final class ImageMetadata
{
    private final List<Integer> axisSizes;
    private final SampleType sampleType;
    private final DataScaling scaling;
    private final String fileName;
    private final long fileSize;
    private final FitsHeader header;
    private final ObservationInfo observation;
    private final WcsParameters wcs;

    private ImageMetadata(Builder b) {
        this.axisSizes = List.copyOf(Objects.requireNonNull(b.axisSizes, "axisSizes"));
        this.sampleType = Objects.requireNonNull(b.sampleType, "sampleType");
        this.scaling = Objects.requireNonNull(b.scaling, "scaling");
        this.fileName = Objects.requireNonNull(b.fileName, "fileName");
        this.header = Objects.requireNonNull(b.header, "header");
        this.observation = Objects.requireNonNull(b.observation, "observation");
        this.fileSize = b.fileSize;
        this.wcs = b.wcs;

        for (Integer size : axisSizes) {
            if (size < 0) {
                throw new IllegalArgumentException("Axis sizes must be non-negative: " + axisSizes);
            }
        }
    }

    public int naxis() {
        return axisSizes.size();
    }

    /**
     * NAXIS1..NAXISn in header order.
     */
    public List<Integer> axisSizes() {
        return axisSizes;
    }

    /**
     * First image plane: NAXIS1 by NAXIS2. A one-axis image has height 1; an
     * image with no axes is 0 by 0.
     */
    public ImageDimensions dimensions() {
        final int width = axisSizes.isEmpty() ? 0 : axisSizes.get(0);
        final int height = axisSizes.size() > 1 ? axisSizes.get(1) : (axisSizes.isEmpty() ? 0 : 1);
        return new ImageDimensions(width, height);
    }

    public SampleType sampleType() {
        return sampleType;
    }

    public int bitpix() {
        return sampleType.bitpix();
    }

    public int bytesPerSample() {
        return sampleType.bytesPerSample();
    }

    public DataScaling scaling() {
        return scaling;
    }

    public double physicalValue(double raw) {
        return scaling.physicalValue(raw);
    }

    /**
     * Total number of samples across all axes.
     *
     * <p>Metadata produced by the loader has passed {@link DataUnitLayout}
     * sizing, so this never overflows for it.</p>
     *
     * @throws ArithmeticException if hand-built axis sizes overflow a {@code long}
     */
    public long sampleCount() {
        if (axisSizes.isEmpty()) {
            return 0;
        }
        long count = 1;
        for (Integer size : axisSizes) {
            count = Math.multiplyExact(count, size.longValue());
        }
        return count;
    }

    /**
     * @throws ArithmeticException if hand-built axis sizes overflow a {@code long}
     */
    public long payloadByteLength() {
        return Math.multiplyExact(sampleCount(), (long) sampleType.bytesPerSample());
    }

    public String fileName() {
        return fileName;
    }

    public long fileSize() {
        return fileSize;
    }

    public FitsHeader header() {
        return header;
    }

    /**
     * Raw value text of any header keyword.
     */
    public Optional<String> customValue(String keyword) {
        return header.stringValue(keyword);
    }

    public ObservationInfo observation() {
        return observation;
    }

    public Optional<WcsParameters> wcs() {
        return Optional.ofNullable(wcs);
    }

    public boolean hasWcs() {
        return wcs != null;
    }

    /**
     * Returns true if the header carries one of the colour-filter-array
     * markers written by one-shot-colour camera drivers (BAYERPAT or COLORTYP
     * with a non-blank value, or any XBAYROFF card).
     */
    public boolean hasBayerIndicators() {
        return header.nonBlankValue("BAYERPAT").isPresent()
                || header.nonBlankValue("COLORTYP").isPresent()
                || header.contains("XBAYROFF");
    }

    /**
     * The declared Bayer layout, when BAYERPAT names one.
     */
    public Optional<BayerPattern> bayerPattern() {
        return header.stringValue("BAYERPAT").flatMap(BayerPattern::parse);
    }

    public static Builder builder() {
        return new Builder();
    }

    @Override
    public String toString() {
        final ImageDimensions d = dimensions();
        return "ImageMetadata[" + fileName
                + ", " + d.width() + "x" + d.height()
                + ", naxis=" + axisSizes.size()
                + ", type=" + sampleType
                + ", scaling=" + scaling
                + ", wcs=" + (wcs != null)
                + ']';
    }

    public static final class Builder {
        private List<Integer> axisSizes;
        private SampleType sampleType;
        private DataScaling scaling = DataScaling.IDENTITY;
        private String fileName = "";
        private long fileSize;
        private FitsHeader header;
        private ObservationInfo observation = ObservationInfo.EMPTY;
        private WcsParameters wcs;

        public Builder withAxisSizes(List<Integer> axisSizes) {
            this.axisSizes = axisSizes;
            return this;
        }

        public Builder withSampleType(SampleType sampleType) {
            this.sampleType = sampleType;
            return this;
        }

        public Builder withScaling(DataScaling scaling) {
            this.scaling = scaling;
            return this;
        }

        public Builder withFileName(String fileName) {
            this.fileName = fileName;
            return this;
        }

        public Builder withFileSize(long fileSize) {
            this.fileSize = fileSize;
            return this;
        }

        public Builder withHeader(FitsHeader header) {
            this.header = header;
            return this;
        }

        public Builder withObservation(ObservationInfo observation) {
            this.observation = observation;
            return this;
        }

        public Builder withWcs(WcsParameters wcs) {
            this.wcs = wcs;
            return this;
        }

        public ImageMetadata build() {
            return new ImageMetadata(this);
        }
    }
}
