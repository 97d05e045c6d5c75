package org.cloudvision.chartpatterns.detector.triangle;

import org.cloudvision.chartpatterns.geometry.TrendLine;
import org.cloudvision.chartpatterns.model.PatternKind;

/**
 * Outcome of classifying one set of swing highs and lows.
 */
public class TriangleValidation {
    private final PatternKind kind;             // null when the swings form no triangle
    private final String rejectionReason;
    private final TrendLine upperLine;
    private final TrendLine lowerLine;
    private final double confidence;

    private TriangleValidation(PatternKind kind, String rejectionReason, TrendLine upperLine,
                               TrendLine lowerLine, double confidence) {
        this.kind = kind;
        this.rejectionReason = rejectionReason;
        this.upperLine = upperLine;
        this.lowerLine = lowerLine;
        this.confidence = confidence;
    }

    static TriangleValidation accepted(PatternKind kind, TrendLine upperLine, TrendLine lowerLine,
                                       double confidence) {
        return new TriangleValidation(kind, null, upperLine, lowerLine, confidence);
    }

    static TriangleValidation rejected(String reason, TrendLine upperLine, TrendLine lowerLine) {
        return new TriangleValidation(null, reason, upperLine, lowerLine, 0.0);
    }

    public boolean isValid() { return kind != null; }
    public PatternKind getKind() { return kind; }
    public String getRejectionReason() { return rejectionReason; }
    public TrendLine getUpperLine() { return upperLine; }
    public TrendLine getLowerLine() { return lowerLine; }
    public double getConfidence() { return confidence; }
}
