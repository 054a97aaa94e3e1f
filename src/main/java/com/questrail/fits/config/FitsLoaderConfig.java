package com.questrail.fits.config;

import com.questrail.fits.model.DuplicateKeywordPolicy;
import com.questrail.fits.observability.FitsObservabilitySink;
import com.questrail.fits.observability.NullObservabilitySink;

import java.util.Objects;

/**
 * Aggregated configuration for {@link com.questrail.fits.image.FitsImageLoader}.
 */
public record FitsLoaderConfig(
    DuplicateKeywordPolicy duplicatePolicy,
    FitsObservabilitySink observabilitySink,
    boolean reportWcsWarnings
) {
    public FitsLoaderConfig {
        Objects.requireNonNull(duplicatePolicy, "duplicatePolicy");
        Objects.requireNonNull(observabilitySink, "observabilitySink");
    }

    /**
     * Last duplicate wins, no observability, WCS warnings reported.
     */
    public static FitsLoaderConfig defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private DuplicateKeywordPolicy duplicatePolicy = DuplicateKeywordPolicy.LAST_WINS;
        private FitsObservabilitySink observabilitySink = NullObservabilitySink.INSTANCE;
        private boolean reportWcsWarnings = true;

        public Builder withDuplicatePolicy(DuplicateKeywordPolicy duplicatePolicy) {
            this.duplicatePolicy = duplicatePolicy;
            return this;
        }

        public Builder withObservabilitySink(FitsObservabilitySink observabilitySink) {
            this.observabilitySink = observabilitySink;
            return this;
        }

        public Builder withReportWcsWarnings(boolean reportWcsWarnings) {
            this.reportWcsWarnings = reportWcsWarnings;
            return this;
        }

        public FitsLoaderConfig build() {
            return new FitsLoaderConfig(duplicatePolicy, observabilitySink, reportWcsWarnings);
        }
    }
}
