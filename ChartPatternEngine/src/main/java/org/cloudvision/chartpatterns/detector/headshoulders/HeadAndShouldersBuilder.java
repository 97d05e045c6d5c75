package org.cloudvision.chartpatterns.detector.headshoulders;

import org.cloudvision.chartpatterns.model.Candle;
import org.cloudvision.chartpatterns.model.ExtremumPoint;
import org.cloudvision.chartpatterns.model.HeadAndShouldersMetrics;
import org.cloudvision.chartpatterns.model.PatternAnalysis;
import org.cloudvision.chartpatterns.model.PatternKind;
import org.cloudvision.chartpatterns.visualization.KeyPointKind;
import org.cloudvision.chartpatterns.visualization.LineRole;
import org.cloudvision.chartpatterns.visualization.LineStyle;
import org.cloudvision.chartpatterns.visualization.PatternColors;
import org.cloudvision.chartpatterns.visualization.PatternKeyPoint;
import org.cloudvision.chartpatterns.visualization.PatternVisualization;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.List;

/**
 * Turns a validated head-and-shoulders triple into a {@link PatternAnalysis}.
 *
 * Key points: LS, LV, H, RV, RS and the projected target T, placed at the last
 * candle of the window. The neckline is the average of LV and RV; the target
 * is the neckline minus the head height (plus, for the inverse form).
 */
@Component
public class HeadAndShouldersBuilder {

    private static final BigDecimal TWO = BigDecimal.valueOf(2);

    public PatternAnalysis build(List<Candle> candles, ExtremumPoint leftShoulder, ExtremumPoint head,
                                 ExtremumPoint rightShoulder, HeadAndShouldersValidation validation,
                                 boolean inverse) {
        if (!validation.isValid()) {
            throw new IllegalArgumentException("Cannot build a rejected candidate: " + validation.getRejectionReason());
        }

        PatternKind kind = inverse ? PatternKind.INVERSE_HEAD_AND_SHOULDERS : PatternKind.HEAD_AND_SHOULDERS;
        KeyPointKind shoulderKind = inverse ? KeyPointKind.TROUGH : KeyPointKind.PEAK;
        KeyPointKind necklineKind = inverse ? KeyPointKind.PEAK : KeyPointKind.TROUGH;

        Candle leftValley = candles.get(validation.getLeftNecklineIndex());
        Candle rightValley = candles.get(validation.getRightNecklineIndex());
        BigDecimal leftValleyPrice = HeadAndShouldersValidator.necklinePrice(leftValley, inverse);
        BigDecimal rightValleyPrice = HeadAndShouldersValidator.necklinePrice(rightValley, inverse);

        // Calculate neckline and target
        BigDecimal necklinePrice = leftValleyPrice.add(rightValleyPrice).divide(TWO, 8, RoundingMode.HALF_UP);
        BigDecimal patternHeight = head.getValue().subtract(necklinePrice).abs();
        BigDecimal targetPrice = inverse ? necklinePrice.add(patternHeight) : necklinePrice.subtract(patternHeight);

        String color = PatternColors.forBias(kind.getBias());
        PatternVisualization.Builder visualization = PatternVisualization.builder()
            .addKeyPoint(keyPoint(candles, leftShoulder, shoulderKind, "LS"))
            .addKeyPoint(new PatternKeyPoint(leftValley.getTime(), leftValleyPrice, necklineKind, "LV"))
            .addKeyPoint(keyPoint(candles, head, shoulderKind, "H"))
            .addKeyPoint(new PatternKeyPoint(rightValley.getTime(), rightValleyPrice, necklineKind, "RV"))
            .addKeyPoint(keyPoint(candles, rightShoulder, shoulderKind, "RS"));

        Candle last = candles.get(candles.size() - 1);
        if (last.getTime() > candles.get(rightShoulder.getIndex()).getTime()) {
            visualization.addKeyPoint(new PatternKeyPoint(last.getTime(), targetPrice, KeyPointKind.TARGET, "T"));
        }

        // Pattern outline and neckline
        visualization
            .addLine(0, 1, LineRole.OUTLINE, LineStyle.dashed())
            .addLine(1, 2, LineRole.OUTLINE, LineStyle.dashed())
            .addLine(2, 3, LineRole.OUTLINE, LineStyle.dashed())
            .addLine(3, 4, LineRole.OUTLINE, LineStyle.dashed())
            .addLine(1, 3, LineRole.NECKLINE, LineStyle.solid(color))
            .addArea(List.of(0, 1, 2, 3, 4), color, 0.1);

        double symmetry = 1.0 - HeadAndShouldersValidator.relativeDifference(
            leftShoulder.getValue(), rightShoulder.getValue());

        HeadAndShouldersMetrics metrics = new HeadAndShouldersMetrics(
            rightShoulder.getIndex() - leftShoulder.getIndex() + 1,
            necklinePrice,
            targetPrice,
            symmetry,
            leftShoulder.getValue(),
            head.getValue(),
            rightShoulder.getValue(),
            patternHeight
        );

        return PatternAnalysis.builder(kind)
            .startTime(candles.get(leftShoulder.getIndex()).getTime())
            .endTime(candles.get(rightShoulder.getIndex()).getTime())
            .startIndex(leftShoulder.getIndex())
            .endIndex(rightShoulder.getIndex())
            .confidence(validation.getConfidence())
            .visualization(visualization.build())
            .metrics(metrics)
            .build();
    }

    private PatternKeyPoint keyPoint(List<Candle> candles, ExtremumPoint point, KeyPointKind kind, String label) {
        return new PatternKeyPoint(candles.get(point.getIndex()).getTime(), point.getValue(), kind, label);
    }
}
