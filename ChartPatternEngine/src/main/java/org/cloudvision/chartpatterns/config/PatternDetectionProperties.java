package org.cloudvision.chartpatterns.config;

import org.cloudvision.chartpatterns.exception.InvalidDetectionParamsException;
import org.cloudvision.chartpatterns.geometry.ExtremaFinder;
import org.cloudvision.chartpatterns.model.PatternKind;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.ArrayList;
import java.util.List;

/**
 * Engine defaults bound from {@code chart-patterns.detection.*}.
 *
 * <pre>
 * chart-patterns:
 *   detection:
 *     lookback-period: 100
 *     min-confidence: 0.6
 *     extrema-radius: 5
 *     pattern-kinds: [headAndShoulders, doubleTop]   # empty = all
 * </pre>
 */
@ConfigurationProperties(prefix = "chart-patterns.detection")
public class PatternDetectionProperties {

    public static final int MIN_EXTREMA_RADIUS = 1;
    public static final int MAX_EXTREMA_RADIUS = 20;

    private int lookbackPeriod = DetectionParams.DEFAULT_LOOKBACK_PERIOD;
    private double minConfidence = DetectionParams.DEFAULT_MIN_CONFIDENCE;
    private int extremaRadius = ExtremaFinder.DEFAULT_RADIUS;
    private List<PatternKind> patternKinds = new ArrayList<>();

    public int getLookbackPeriod() { return lookbackPeriod; }
    public void setLookbackPeriod(int lookbackPeriod) { this.lookbackPeriod = lookbackPeriod; }

    public double getMinConfidence() { return minConfidence; }
    public void setMinConfidence(double minConfidence) { this.minConfidence = minConfidence; }

    public int getExtremaRadius() { return extremaRadius; }
    public void setExtremaRadius(int extremaRadius) { this.extremaRadius = extremaRadius; }

    public List<PatternKind> getPatternKinds() { return patternKinds; }
    public void setPatternKinds(List<PatternKind> patternKinds) { this.patternKinds = patternKinds; }

    /**
     * Default per-call params. An empty kind list here means every kind.
     */
    public DetectionParams toDetectionParams() {
        return DetectionParams.builder()
            .lookbackPeriod(lookbackPeriod)
            .minConfidence(minConfidence)
            .patternKinds(patternKinds == null || patternKinds.isEmpty() ? null : patternKinds)
            .build();
    }

    public int validatedExtremaRadius() {
        if (extremaRadius < MIN_EXTREMA_RADIUS || extremaRadius > MAX_EXTREMA_RADIUS) {
            throw new InvalidDetectionParamsException("extremaRadius",
                "must be within [" + MIN_EXTREMA_RADIUS + ", " + MAX_EXTREMA_RADIUS + "], got " + extremaRadius);
        }
        return extremaRadius;
    }
}
