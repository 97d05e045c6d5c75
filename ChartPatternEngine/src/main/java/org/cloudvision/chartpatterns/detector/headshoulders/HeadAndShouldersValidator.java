package org.cloudvision.chartpatterns.detector.headshoulders;

import org.cloudvision.chartpatterns.detector.PriceScan;
import org.cloudvision.chartpatterns.model.Candle;
import org.cloudvision.chartpatterns.model.ExtremumPoint;
import org.cloudvision.chartpatterns.scoring.ConfidencePolicy;
import org.cloudvision.chartpatterns.scoring.DefaultConfidencePolicy;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.util.List;

/**
 * Geometry rules for head-and-shoulders candidates.
 *
 * RULES (all required):
 * 1. The head is strictly beyond both shoulders (higher, or lower for the inverse form)
 * 2. The shoulders are within 3% of each other, relative to the left shoulder
 * 3. A neckline candle exists strictly between each shoulder and the head:
 *    the lowest low (highest high for the inverse form) of that stretch
 *
 * The neckline slope is not a hard rule; a sloping neckline only lowers the confidence.
 */
@Component
public class HeadAndShouldersValidator {

    static final double MAX_SHOULDER_DIFF = 0.03;

    private final ConfidencePolicy confidencePolicy;

    @Autowired
    public HeadAndShouldersValidator(ObjectProvider<ConfidencePolicy> confidencePolicy) {
        this(confidencePolicy.getIfUnique(DefaultConfidencePolicy::new));
    }

    public HeadAndShouldersValidator(ConfidencePolicy confidencePolicy) {
        this.confidencePolicy = confidencePolicy;
    }

    public HeadAndShouldersValidation validate(List<Candle> candles, ExtremumPoint leftShoulder,
                                               ExtremumPoint head, ExtremumPoint rightShoulder,
                                               boolean inverse) {
        if (leftShoulder.getIndex() >= head.getIndex() || head.getIndex() >= rightShoulder.getIndex()) {
            return HeadAndShouldersValidation.rejected("points are not in time order");
        }

        // Rule 1: head beyond both shoulders
        int headVsLeft = head.getValue().compareTo(leftShoulder.getValue());
        int headVsRight = head.getValue().compareTo(rightShoulder.getValue());
        if (inverse ? (headVsLeft >= 0 || headVsRight >= 0) : (headVsLeft <= 0 || headVsRight <= 0)) {
            return HeadAndShouldersValidation.rejected("head does not exceed both shoulders");
        }

        // Rule 2: shoulders roughly equal
        double shoulderDiff = relativeDifference(leftShoulder.getValue(), rightShoulder.getValue());
        if (shoulderDiff > MAX_SHOULDER_DIFF) {
            return HeadAndShouldersValidation.rejected(
                String.format("shoulders differ by %.2f%%", shoulderDiff * 100));
        }

        // Rule 3: neckline points between shoulders and head
        int leftNeckline = PriceScan.extremeBetween(candles, leftShoulder.getIndex(), head.getIndex(), inverse);
        int rightNeckline = PriceScan.extremeBetween(candles, head.getIndex(), rightShoulder.getIndex(), inverse);
        if (leftNeckline == -1 || rightNeckline == -1) {
            return HeadAndShouldersValidation.rejected("no neckline point between shoulder and head");
        }

        BigDecimal leftNecklinePrice = necklinePrice(candles.get(leftNeckline), inverse);
        BigDecimal rightNecklinePrice = necklinePrice(candles.get(rightNeckline), inverse);
        double necklineDiff = relativeDifference(leftNecklinePrice, rightNecklinePrice);

        int leftSpan = head.getIndex() - leftShoulder.getIndex();
        int rightSpan = rightShoulder.getIndex() - head.getIndex();
        double timeSymmetry = 1.0 - (double) Math.abs(leftSpan - rightSpan) / Math.max(leftSpan, rightSpan);

        double confidence = confidencePolicy.headAndShoulders(shoulderDiff, necklineDiff, timeSymmetry);
        return HeadAndShouldersValidation.accepted(confidence, leftNeckline, rightNeckline,
            shoulderDiff, necklineDiff, timeSymmetry);
    }

    static BigDecimal necklinePrice(Candle candle, boolean inverse) {
        return inverse ? candle.getHigh() : candle.getLow();
    }

    /**
     * |a - b| / a, or +infinity when a is zero
     */
    static double relativeDifference(BigDecimal reference, BigDecimal other) {
        if (reference.signum() == 0) {
            return Double.POSITIVE_INFINITY;
        }
        return reference.subtract(other).abs().doubleValue() / reference.doubleValue();
    }
}
