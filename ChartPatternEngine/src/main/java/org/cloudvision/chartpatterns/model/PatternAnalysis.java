package org.cloudvision.chartpatterns.model;

import org.cloudvision.chartpatterns.visualization.PatternVisualization;

/**
 * A detected pattern instance. Freshly computed and immutable; callers that
 * persist results assign their own id and timestamp.
 */
public class PatternAnalysis {
    private final PatternKind patternKind;
    private final long startTime;
    private final long endTime;
    private final int startIndex;
    private final int endIndex;
    private final double confidence;
    private final PatternVisualization visualization;
    private final PatternMetrics metrics;
    private final DirectionalBias directionalBias;

    private PatternAnalysis(Builder builder) {
        this.patternKind = builder.patternKind;
        this.startTime = builder.startTime;
        this.endTime = builder.endTime;
        this.startIndex = builder.startIndex;
        this.endIndex = builder.endIndex;
        this.confidence = builder.confidence;
        this.visualization = builder.visualization;
        this.metrics = builder.metrics;
        this.directionalBias = builder.directionalBias != null ? builder.directionalBias : builder.patternKind.getBias();
    }

    // Getters
    public PatternKind getPatternKind() { return patternKind; }
    public long getStartTime() { return startTime; }
    public long getEndTime() { return endTime; }
    public int getStartIndex() { return startIndex; }
    public int getEndIndex() { return endIndex; }
    public double getConfidence() { return confidence; }
    public PatternVisualization getVisualization() { return visualization; }
    public PatternMetrics getMetrics() { return metrics; }
    public DirectionalBias getDirectionalBias() { return directionalBias; }

    /**
     * Copy of this analysis with candle indexes shifted by {@code offset}, used
     * to map indexes inside the lookback window back onto the caller's series.
     */
    public PatternAnalysis withIndexOffset(int offset) {
        if (offset == 0) {
            return this;
        }
        return toBuilder()
            .startIndex(startIndex + offset)
            .endIndex(endIndex + offset)
            .build();
    }

    public Builder toBuilder() {
        return builder(patternKind)
            .startTime(startTime)
            .endTime(endTime)
            .startIndex(startIndex)
            .endIndex(endIndex)
            .confidence(confidence)
            .visualization(visualization)
            .metrics(metrics)
            .directionalBias(directionalBias);
    }

    @Override
    public String toString() {
        return String.format("PatternAnalysis{kind=%s, bars=%d..%d, confidence=%.3f, bias=%s}",
                patternKind.getId(), startIndex, endIndex, confidence, directionalBias.getId());
    }

    public static Builder builder(PatternKind patternKind) {
        return new Builder(patternKind);
    }

    public static class Builder {
        private final PatternKind patternKind;
        private long startTime;
        private long endTime;
        private int startIndex;
        private int endIndex;
        private double confidence;
        private PatternVisualization visualization;
        private PatternMetrics metrics;
        private DirectionalBias directionalBias;

        private Builder(PatternKind patternKind) {
            this.patternKind = patternKind;
        }

        public Builder startTime(long startTime) {
            this.startTime = startTime;
            return this;
        }

        public Builder endTime(long endTime) {
            this.endTime = endTime;
            return this;
        }

        public Builder startIndex(int startIndex) {
            this.startIndex = startIndex;
            return this;
        }

        public Builder endIndex(int endIndex) {
            this.endIndex = endIndex;
            return this;
        }

        public Builder confidence(double confidence) {
            this.confidence = confidence;
            return this;
        }

        public Builder visualization(PatternVisualization visualization) {
            this.visualization = visualization;
            return this;
        }

        public Builder metrics(PatternMetrics metrics) {
            this.metrics = metrics;
            return this;
        }

        public Builder directionalBias(DirectionalBias directionalBias) {
            this.directionalBias = directionalBias;
            return this;
        }

        public PatternAnalysis build() {
            if (patternKind == null) {
                throw new IllegalStateException("Pattern kind is required");
            }
            if (startIndex >= endIndex) {
                throw new IllegalStateException("Pattern must span at least two bars: "
                    + startIndex + " >= " + endIndex);
            }
            if (Double.isNaN(confidence) || confidence < 0.0 || confidence > 1.0) {
                throw new IllegalStateException("Confidence out of range: " + confidence);
            }
            return new PatternAnalysis(this);
        }
    }
}
