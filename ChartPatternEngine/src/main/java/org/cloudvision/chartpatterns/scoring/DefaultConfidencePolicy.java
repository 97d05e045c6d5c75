package org.cloudvision.chartpatterns.scoring;

import org.cloudvision.chartpatterns.model.PatternKind;

/**
 * Linear-blend scoring: a 0.7 base plus bonuses for symmetry and flatness.
 * The weights are heuristic and not statistically calibrated.
 */
public class DefaultConfidencePolicy implements ConfidencePolicy {

    static final double BASE_CONFIDENCE = 0.7;
    static final double HEAD_AND_SHOULDERS_CAP = 0.95;

    @Override
    public double headAndShoulders(double shoulderDiff, double necklineDiff, double timeSymmetry) {
        double confidence = BASE_CONFIDENCE;
        confidence += Math.min(0.15, (1 - shoulderDiff * 10) * 0.15);
        confidence += Math.min(0.15, (1 - necklineDiff * 20) * 0.15);
        confidence += timeSymmetry * 0.10;
        return clamp(Math.min(confidence, HEAD_AND_SHOULDERS_CAP));
    }

    @Override
    public double triangle(PatternKind kind, double highSlope, double lowSlope) {
        double bonus;
        switch (kind) {
            case ASCENDING_TRIANGLE:
                // Flat resistance scores best
                bonus = 1 - Math.abs(highSlope) * 100;
                break;
            case DESCENDING_TRIANGLE:
                // Flat support scores best
                bonus = 1 - Math.abs(lowSlope) * 100;
                break;
            case SYMMETRICAL_TRIANGLE:
                // Both edges converging at the same rate scores best
                double convergenceRate = lowSlope == 0.0 ? 0.0 : Math.abs(highSlope) / Math.abs(lowSlope);
                bonus = 1 - Math.abs(1 - convergenceRate);
                break;
            default:
                throw new IllegalArgumentException("Not a triangle pattern: " + kind);
        }
        return clamp(BASE_CONFIDENCE + bonus * 0.15);
    }

    @Override
    public double doublePattern(double priceDiff) {
        return clamp(BASE_CONFIDENCE + 0.3 * (1 - priceDiff));
    }

    private static double clamp(double confidence) {
        if (Double.isNaN(confidence)) {
            return 0.0;
        }
        return Math.max(0.0, Math.min(1.0, confidence));
    }
}
