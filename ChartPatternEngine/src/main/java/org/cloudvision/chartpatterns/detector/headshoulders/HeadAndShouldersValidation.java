package org.cloudvision.chartpatterns.detector.headshoulders;

/**
 * Outcome of checking one (left shoulder, head, right shoulder) triple.
 */
public class HeadAndShouldersValidation {
    private final boolean valid;
    private final String rejectionReason;
    private final double confidence;
    private final int leftNecklineIndex;
    private final int rightNecklineIndex;
    private final double shoulderDiff;
    private final double necklineDiff;
    private final double timeSymmetry;

    private HeadAndShouldersValidation(boolean valid, String rejectionReason, double confidence,
                                       int leftNecklineIndex, int rightNecklineIndex,
                                       double shoulderDiff, double necklineDiff, double timeSymmetry) {
        this.valid = valid;
        this.rejectionReason = rejectionReason;
        this.confidence = confidence;
        this.leftNecklineIndex = leftNecklineIndex;
        this.rightNecklineIndex = rightNecklineIndex;
        this.shoulderDiff = shoulderDiff;
        this.necklineDiff = necklineDiff;
        this.timeSymmetry = timeSymmetry;
    }

    static HeadAndShouldersValidation accepted(double confidence, int leftNecklineIndex, int rightNecklineIndex,
                                               double shoulderDiff, double necklineDiff, double timeSymmetry) {
        return new HeadAndShouldersValidation(true, null, confidence, leftNecklineIndex, rightNecklineIndex,
            shoulderDiff, necklineDiff, timeSymmetry);
    }

    static HeadAndShouldersValidation rejected(String reason) {
        return new HeadAndShouldersValidation(false, reason, 0.0, -1, -1, Double.NaN, Double.NaN, Double.NaN);
    }

    public boolean isValid() { return valid; }
    public String getRejectionReason() { return rejectionReason; }
    public double getConfidence() { return confidence; }
    public int getLeftNecklineIndex() { return leftNecklineIndex; }
    public int getRightNecklineIndex() { return rightNecklineIndex; }
    public double getShoulderDiff() { return shoulderDiff; }
    public double getNecklineDiff() { return necklineDiff; }
    public double getTimeSymmetry() { return timeSymmetry; }
}
