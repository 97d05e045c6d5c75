package org.cloudvision.chartpatterns.detector.doublepattern;

import org.cloudvision.chartpatterns.model.Candle;
import org.cloudvision.chartpatterns.model.DoublePatternMetrics;
import org.cloudvision.chartpatterns.model.ExtremumPoint;
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
import java.util.List;

@Component
public class DoublePatternBuilder {

    public PatternAnalysis build(List<Candle> candles, ExtremumPoint first, ExtremumPoint second,
                                 DoublePatternValidation validation, boolean bottom) {
        if (!validation.isValid()) {
            throw new IllegalArgumentException("Cannot build a rejected candidate: " + validation.getRejectionReason());
        }

        PatternKind kind = bottom ? PatternKind.DOUBLE_BOTTOM : PatternKind.DOUBLE_TOP;
        KeyPointKind extremeKind = bottom ? KeyPointKind.TROUGH : KeyPointKind.PEAK;
        String prefix = bottom ? "B" : "T";

        Candle neckline = candles.get(validation.getNecklineIndex());
        BigDecimal necklinePrice = bottom ? neckline.getHigh() : neckline.getLow();

        // Target = neckline -/+ (first extreme - neckline)
        BigDecimal patternHeight = first.getValue().subtract(necklinePrice).abs();
        BigDecimal targetPrice = bottom ? necklinePrice.add(patternHeight) : necklinePrice.subtract(patternHeight);
        BigDecimal stopLoss = bottom ? first.getValue().min(second.getValue()) : first.getValue().max(second.getValue());

        PatternVisualization.Builder visualization = PatternVisualization.builder()
            .addKeyPoint(new PatternKeyPoint(candles.get(first.getIndex()).getTime(), first.getValue(),
                extremeKind, prefix + "1"))
            .addKeyPoint(new PatternKeyPoint(neckline.getTime(), necklinePrice,
                bottom ? KeyPointKind.PEAK : KeyPointKind.TROUGH, "N"))
            .addKeyPoint(new PatternKeyPoint(candles.get(second.getIndex()).getTime(), second.getValue(),
                extremeKind, prefix + "2"));

        Candle last = candles.get(candles.size() - 1);
        if (last.getTime() > candles.get(second.getIndex()).getTime()) {
            visualization.addKeyPoint(new PatternKeyPoint(last.getTime(), targetPrice, KeyPointKind.TARGET, "T"));
        }

        // The neckline is a horizontal level through N
        visualization
            .addLine(0, 1, LineRole.OUTLINE, LineStyle.dashed())
            .addLine(1, 2, LineRole.OUTLINE, LineStyle.dashed())
            .addLine(1, 1, LineRole.NECKLINE, LineStyle.solid(PatternColors.forBias(kind.getBias())));

        DoublePatternMetrics metrics = new DoublePatternMetrics(
            second.getIndex() - first.getIndex() + 1,
            necklinePrice,
            targetPrice,
            stopLoss,
            first.getValue(),
            second.getValue(),
            validation.getPriceDiff()
        );

        return PatternAnalysis.builder(kind)
            .startTime(candles.get(first.getIndex()).getTime())
            .endTime(candles.get(second.getIndex()).getTime())
            .startIndex(first.getIndex())
            .endIndex(second.getIndex())
            .confidence(validation.getConfidence())
            .visualization(visualization.build())
            .metrics(metrics)
            .build();
    }
}
