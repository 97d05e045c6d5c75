package org.cloudvision.chartpatterns.config;

import org.cloudvision.chartpatterns.exception.InvalidDetectionParamsException;
import org.cloudvision.chartpatterns.model.PatternKind;

import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.EnumSet;
import java.util.Set;

/**
 * Per-call detection settings.
 *
 * A null kind set means every kind; an empty set means none.
 */
public class DetectionParams {

    public static final int DEFAULT_LOOKBACK_PERIOD = 100;
    public static final double DEFAULT_MIN_CONFIDENCE = 0.6;

    private static final DetectionParams DEFAULTS = builder().build();

    private final int lookbackPeriod;           // Trailing candles to scan
    private final double minConfidence;         // Results below this are dropped
    private final Set<PatternKind> patternKinds;

    private DetectionParams(Builder builder) {
        this.lookbackPeriod = builder.lookbackPeriod;
        this.minConfidence = builder.minConfidence;
        this.patternKinds = builder.patternKinds == null
            ? null
            : Collections.unmodifiableSet(builder.patternKinds.isEmpty()
                ? EnumSet.noneOf(PatternKind.class)
                : EnumSet.copyOf(builder.patternKinds));
    }

    public static DetectionParams defaults() {
        return DEFAULTS;
    }

    public int getLookbackPeriod() { return lookbackPeriod; }
    public double getMinConfidence() { return minConfidence; }

    /**
     * Requested kinds, or null when every kind is requested.
     */
    public Set<PatternKind> getPatternKinds() { return patternKinds; }

    public boolean includes(PatternKind kind) {
        return patternKinds == null || patternKinds.contains(kind);
    }

    @Override
    public String toString() {
        return "DetectionParams{lookbackPeriod=" + lookbackPeriod
            + ", minConfidence=" + minConfidence
            + ", patternKinds=" + (patternKinds == null ? "all" : patternKinds) + "}";
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private int lookbackPeriod = DEFAULT_LOOKBACK_PERIOD;
        private double minConfidence = DEFAULT_MIN_CONFIDENCE;
        private Set<PatternKind> patternKinds;

        public Builder lookbackPeriod(int lookbackPeriod) {
            this.lookbackPeriod = lookbackPeriod;
            return this;
        }

        public Builder minConfidence(double minConfidence) {
            this.minConfidence = minConfidence;
            return this;
        }

        public Builder patternKinds(PatternKind... patternKinds) {
            return patternKinds(patternKinds == null ? null : Arrays.asList(patternKinds));
        }

        /**
         * @param patternKinds kinds to detect; null restores "all kinds"
         */
        public Builder patternKinds(Collection<PatternKind> patternKinds) {
            if (patternKinds == null) {
                this.patternKinds = null;
                return this;
            }
            Set<PatternKind> kinds = EnumSet.noneOf(PatternKind.class);
            for (PatternKind kind : patternKinds) {
                if (kind == null) {
                    throw new InvalidDetectionParamsException("patternKinds", "contains null");
                }
                kinds.add(kind);
            }
            this.patternKinds = kinds;
            return this;
        }

        public DetectionParams build() {
            if (lookbackPeriod <= 0) {
                throw new InvalidDetectionParamsException("lookbackPeriod",
                    "must be positive, got " + lookbackPeriod);
            }
            if (Double.isNaN(minConfidence) || minConfidence < 0.0 || minConfidence > 1.0) {
                throw new InvalidDetectionParamsException("minConfidence",
                    "must be within [0, 1], got " + minConfidence);
            }
            return new DetectionParams(this);
        }
    }
}
