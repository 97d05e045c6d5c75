package org.cloudvision.chartpatterns.scoring;

import org.cloudvision.chartpatterns.model.PatternKind;

/**
 * Turns the geometric quality of a validated candidate into a confidence in
 * [0, 1]. Validators decide whether a candidate is a pattern at all; the
 * policy only decides how sure we are.
 */
public interface ConfidencePolicy {

    /**
     * @param shoulderDiff  relative price difference between the shoulders
     * @param necklineDiff  relative price difference between the neckline points
     * @param timeSymmetry  1 when both halves take the same number of bars, towards 0 otherwise
     */
    double headAndShoulders(double shoulderDiff, double necklineDiff, double timeSymmetry);

    /**
     * @param kind       one of the three triangle kinds
     * @param highSlope  fitted slope of the swing highs
     * @param lowSlope   fitted slope of the swing lows
     */
    double triangle(PatternKind kind, double highSlope, double lowSlope);

    /**
     * @param priceDiff relative price difference between the two tops (or bottoms)
     */
    double doublePattern(double priceDiff);
}
