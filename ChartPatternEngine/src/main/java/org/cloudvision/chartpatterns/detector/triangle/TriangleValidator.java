package org.cloudvision.chartpatterns.detector.triangle;

import org.cloudvision.chartpatterns.geometry.TrendLine;
import org.cloudvision.chartpatterns.geometry.TrendLineFitter;
import org.cloudvision.chartpatterns.model.ExtremumPoint;
import org.cloudvision.chartpatterns.model.PatternKind;
import org.cloudvision.chartpatterns.scoring.ConfidencePolicy;
import org.cloudvision.chartpatterns.scoring.DefaultConfidencePolicy;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Classifies swing highs and lows into a triangle by the slopes of their
 * least-squares lines.
 *
 * Ascending:    flat upper line (|slope| < 0.001), rising lower line
 * Descending:   falling upper line, flat lower line
 * Symmetrical:  falling upper line, rising lower line
 *
 * Slopes are in price per bar and the threshold is absolute, so "flat" is
 * stricter for high-priced instruments.
 */
@Component
public class TriangleValidator {

    static final double SLOPE_THRESHOLD = 0.001;

    private final TrendLineFitter trendLineFitter;
    private final ConfidencePolicy confidencePolicy;

    /**
     * Uses the host's {@link ConfidencePolicy} bean when exactly one is defined,
     * otherwise the default scoring.
     */
    @Autowired
    public TriangleValidator(TrendLineFitter trendLineFitter, ObjectProvider<ConfidencePolicy> confidencePolicy) {
        this(trendLineFitter, confidencePolicy.getIfUnique(DefaultConfidencePolicy::new));
    }

    public TriangleValidator(TrendLineFitter trendLineFitter, ConfidencePolicy confidencePolicy) {
        this.trendLineFitter = trendLineFitter;
        this.confidencePolicy = confidencePolicy;
    }

    public TriangleValidation validate(List<ExtremumPoint> highs, List<ExtremumPoint> lows) {
        TrendLine upperLine = trendLineFitter.fit(highs);
        TrendLine lowerLine = trendLineFitter.fit(lows);

        if (highs.size() < 2 || lows.size() < 2) {
            return TriangleValidation.rejected("need at least two swing highs and two swing lows",
                upperLine, lowerLine);
        }

        // A bar that is both a swing high and a swing low has no place on either line
        Set<Integer> highIndexes = new HashSet<>();
        for (ExtremumPoint high : highs) {
            highIndexes.add(high.getIndex());
        }
        for (ExtremumPoint low : lows) {
            if (highIndexes.contains(low.getIndex())) {
                return TriangleValidation.rejected("swing high and swing low share bar " + low.getIndex(),
                    upperLine, lowerLine);
            }
        }

        double highSlope = upperLine.getSlope();
        double lowSlope = lowerLine.getSlope();
        PatternKind kind = classify(highSlope, lowSlope);
        if (kind == null) {
            return TriangleValidation.rejected(
                String.format("slopes %.6f / %.6f match no triangle", highSlope, lowSlope),
                upperLine, lowerLine);
        }

        double confidence = confidencePolicy.triangle(kind, highSlope, lowSlope);
        return TriangleValidation.accepted(kind, upperLine, lowerLine, confidence);
    }

    static PatternKind classify(double highSlope, double lowSlope) {
        boolean highFlat = Math.abs(highSlope) < SLOPE_THRESHOLD;
        boolean lowFlat = Math.abs(lowSlope) < SLOPE_THRESHOLD;
        boolean highFalling = highSlope < -SLOPE_THRESHOLD;
        boolean lowRising = lowSlope > SLOPE_THRESHOLD;

        if (highFlat && lowRising) {
            return PatternKind.ASCENDING_TRIANGLE;
        }
        if (highFalling && lowFlat) {
            return PatternKind.DESCENDING_TRIANGLE;
        }
        if (highFalling && lowRising) {
            return PatternKind.SYMMETRICAL_TRIANGLE;
        }
        return null;
    }
}
