package com.questrail.fits.model;

import java.time.LocalDateTime;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalDouble;

/**
 * Observatory and acquisition fields read from a FITS header.
 *
 * <p>Every field is optional in FITS. Absent values are held as {@code null}
 * internally and surfaced through {@code Optional} accessors.</p>
 */
public final class ObservationInfo
{
    public static final ObservationInfo EMPTY = builder().build();

    private final String telescope;
    private final String instrument;
    private final String observer;
    private final String object;
    private final String filter;
    private final LocalDateTime observationDate;
    private final Double exposureTime;
    private final Double temperature;
    private final Double gain;
    private final ImageBinning binning;

    private ObservationInfo(Builder b) {
        this.telescope = b.telescope;
        this.instrument = b.instrument;
        this.observer = b.observer;
        this.object = b.object;
        this.filter = b.filter;
        this.observationDate = b.observationDate;
        this.exposureTime = b.exposureTime;
        this.temperature = b.temperature;
        this.gain = b.gain;
        this.binning = b.binning;
    }

    public Optional<String> telescope() { return Optional.ofNullable(telescope); }
    public Optional<String> instrument() { return Optional.ofNullable(instrument); }
    public Optional<String> observer() { return Optional.ofNullable(observer); }
    public Optional<String> object() { return Optional.ofNullable(object); }
    public Optional<String> filter() { return Optional.ofNullable(filter); }
    public Optional<LocalDateTime> observationDate() { return Optional.ofNullable(observationDate); }

    /** Exposure duration in seconds. */
    public OptionalDouble exposureTime() { return optional(exposureTime); }

    /** Sensor temperature in degrees Celsius. */
    public OptionalDouble temperature() { return optional(temperature); }

    public OptionalDouble gain() { return optional(gain); }

    /**
     * Binning factors; {@link ImageBinning#NONE} when the header does not say.
     */
    public ImageBinning binning() {
        return binning;
    }

    /**
     * Returns true if any acquisition field beyond binning is known.
     */
    public boolean hasAstronomicalInfo() {
        return telescope != null || instrument != null || object != null
                || exposureTime != null || observationDate != null;
    }

    private static OptionalDouble optional(Double v) {
        return v == null ? OptionalDouble.empty() : OptionalDouble.of(v);
    }

    public static Builder builder() {
        return new Builder();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ObservationInfo that)) return false;
        return Objects.equals(telescope, that.telescope)
                && Objects.equals(instrument, that.instrument)
                && Objects.equals(observer, that.observer)
                && Objects.equals(object, that.object)
                && Objects.equals(filter, that.filter)
                && Objects.equals(observationDate, that.observationDate)
                && Objects.equals(exposureTime, that.exposureTime)
                && Objects.equals(temperature, that.temperature)
                && Objects.equals(gain, that.gain)
                && binning.equals(that.binning);
    }

    @Override
    public int hashCode() {
        return Objects.hash(telescope, instrument, observer, object, filter,
                observationDate, exposureTime, temperature, gain, binning);
    }

    @Override
    public String toString() {
        return "ObservationInfo[telescope=" + telescope
                + ", instrument=" + instrument
                + ", object=" + object
                + ", filter=" + filter
                + ", exposureTime=" + exposureTime
                + ", binning=" + binning.horizontal() + "x" + binning.vertical()
                + ']';
    }

    public static final class Builder {
        private String telescope;
        private String instrument;
        private String observer;
        private String object;
        private String filter;
        private LocalDateTime observationDate;
        private Double exposureTime;
        private Double temperature;
        private Double gain;
        private ImageBinning binning = ImageBinning.NONE;

        public Builder withTelescope(String telescope) {
            this.telescope = telescope;
            return this;
        }

        public Builder withInstrument(String instrument) {
            this.instrument = instrument;
            return this;
        }

        public Builder withObserver(String observer) {
            this.observer = observer;
            return this;
        }

        public Builder withObject(String object) {
            this.object = object;
            return this;
        }

        public Builder withFilter(String filter) {
            this.filter = filter;
            return this;
        }

        public Builder withObservationDate(LocalDateTime observationDate) {
            this.observationDate = observationDate;
            return this;
        }

        public Builder withExposureTime(Double exposureTime) {
            this.exposureTime = exposureTime;
            return this;
        }

        public Builder withTemperature(Double temperature) {
            this.temperature = temperature;
            return this;
        }

        public Builder withGain(Double gain) {
            this.gain = gain;
            return this;
        }

        public Builder withBinning(ImageBinning binning) {
            this.binning = Objects.requireNonNull(binning, "binning");
            return this;
        }

        public ObservationInfo build() {
            return new ObservationInfo(this);
        }
    }
}
