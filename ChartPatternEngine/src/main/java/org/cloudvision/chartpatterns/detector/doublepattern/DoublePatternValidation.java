package org.cloudvision.chartpatterns.detector.doublepattern;

/**
 * Outcome of checking a pair of tops (or bottoms).
 */
public class DoublePatternValidation {
    private final boolean valid;
    private final String rejectionReason;
    private final int necklineIndex;        // Bar of the opposing extreme between the pair
    private final double priceDiff;
    private final double confidence;

    private DoublePatternValidation(boolean valid, String rejectionReason, int necklineIndex,
                                    double priceDiff, double confidence) {
        this.valid = valid;
        this.rejectionReason = rejectionReason;
        this.necklineIndex = necklineIndex;
        this.priceDiff = priceDiff;
        this.confidence = confidence;
    }

    static DoublePatternValidation accepted(int necklineIndex, double priceDiff, double confidence) {
        return new DoublePatternValidation(true, null, necklineIndex, priceDiff, confidence);
    }

    static DoublePatternValidation rejected(String reason) {
        return new DoublePatternValidation(false, reason, -1, Double.NaN, 0.0);
    }

    public boolean isValid() { return valid; }
    public String getRejectionReason() { return rejectionReason; }
    public int getNecklineIndex() { return necklineIndex; }
    public double getPriceDiff() { return priceDiff; }
    public double getConfidence() { return confidence; }
}
