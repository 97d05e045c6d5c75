package org.cloudvision.chartpatterns.detector.triangle;

import org.cloudvision.chartpatterns.model.Candle;
import org.cloudvision.chartpatterns.model.ExtremumPoint;
import org.cloudvision.chartpatterns.model.PatternAnalysis;
import org.cloudvision.chartpatterns.model.PatternKind;
import org.cloudvision.chartpatterns.model.TriangleMetrics;
import org.cloudvision.chartpatterns.visualization.KeyPointKind;
import org.cloudvision.chartpatterns.visualization.LineRole;
import org.cloudvision.chartpatterns.visualization.LineStyle;
import org.cloudvision.chartpatterns.visualization.PatternColors;
import org.cloudvision.chartpatterns.visualization.PatternKeyPoint;
import org.cloudvision.chartpatterns.visualization.PatternVisualization;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.List;

/**
 * Turns a classified set of swings into a {@link PatternAnalysis}.
 *
 * Key points are the swings in bar order, labelled H1.. and L1..; the
 * resistance line joins the first and last high, the support line the first
 * and last low.
 */
@Component
public class TriangleBuilder {

    private static final BigDecimal TWO = BigDecimal.valueOf(2);

    public PatternAnalysis build(List<Candle> candles, List<ExtremumPoint> highs, List<ExtremumPoint> lows,
                                 TriangleValidation validation) {
        if (!validation.isValid()) {
            throw new IllegalArgumentException("Cannot build a rejected triangle: " + validation.getRejectionReason());
        }
        PatternKind kind = validation.getKind();

        // Merge highs and lows by bar index
        PatternVisualization.Builder visualization = PatternVisualization.builder();
        int firstHighPoint = -1;
        int lastHighPoint = -1;
        int firstLowPoint = -1;
        int lastLowPoint = -1;
        int h = 0;
        int l = 0;
        while (h < highs.size() || l < lows.size()) {
            boolean takeHigh = l >= lows.size()
                || (h < highs.size() && highs.get(h).getIndex() < lows.get(l).getIndex());
            int pointIndex = visualization.keyPointCount();
            if (takeHigh) {
                ExtremumPoint high = highs.get(h++);
                visualization.addKeyPoint(new PatternKeyPoint(candles.get(high.getIndex()).getTime(),
                    high.getValue(), KeyPointKind.PEAK, "H" + h));
                if (firstHighPoint == -1) {
                    firstHighPoint = pointIndex;
                }
                lastHighPoint = pointIndex;
            } else {
                ExtremumPoint low = lows.get(l++);
                visualization.addKeyPoint(new PatternKeyPoint(candles.get(low.getIndex()).getTime(),
                    low.getValue(), KeyPointKind.TROUGH, "L" + l));
                if (firstLowPoint == -1) {
                    firstLowPoint = pointIndex;
                }
                lastLowPoint = pointIndex;
            }
        }

        List<Integer> allPoints = new ArrayList<>();
        for (int i = 0; i < visualization.keyPointCount(); i++) {
            allPoints.add(i);
        }
        visualization
            .addLine(firstHighPoint, lastHighPoint, LineRole.RESISTANCE, LineStyle.solid(PatternColors.BEARISH))
            .addLine(firstLowPoint, lastLowPoint, LineRole.SUPPORT, LineStyle.solid(PatternColors.BULLISH))
            .addArea(allPoints, PatternColors.forBias(kind.getBias()), 0.1);

        ExtremumPoint firstHigh = highs.get(0);
        ExtremumPoint lastHigh = highs.get(highs.size() - 1);
        ExtremumPoint firstLow = lows.get(0);
        ExtremumPoint lastLow = lows.get(lows.size() - 1);
        int startIndex = Math.min(firstHigh.getIndex(), firstLow.getIndex());
        int endIndex = Math.max(lastHigh.getIndex(), lastLow.getIndex());

        BigDecimal breakoutLevel;
        BigDecimal targetLevel;
        BigDecimal stopLoss;
        switch (kind) {
            case ASCENDING_TRIANGLE: {
                // Target = resistance + height
                BigDecimal resistance = average(highs);
                breakoutLevel = lastHigh.getValue();
                targetLevel = resistance.add(resistance.subtract(firstLow.getValue()));
                stopLoss = lastLow.getValue();
                break;
            }
            case DESCENDING_TRIANGLE: {
                // Target = support - height
                BigDecimal support = average(lows);
                breakoutLevel = lastLow.getValue();
                targetLevel = support.subtract(firstHigh.getValue().subtract(support));
                stopLoss = lastHigh.getValue();
                break;
            }
            default:
                // Direction is unknown until the breakout
                breakoutLevel = lastHigh.getValue().add(lastLow.getValue()).divide(TWO, 8, RoundingMode.HALF_UP);
                targetLevel = null;
                stopLoss = null;
                break;
        }

        TriangleMetrics metrics = new TriangleMetrics(
            endIndex - startIndex + 1,
            breakoutLevel,
            targetLevel,
            stopLoss,
            validation.getUpperLine().getSlope(),
            validation.getLowerLine().getSlope(),
            highs.size(),
            lows.size()
        );

        return PatternAnalysis.builder(kind)
            .startTime(candles.get(startIndex).getTime())
            .endTime(candles.get(endIndex).getTime())
            .startIndex(startIndex)
            .endIndex(endIndex)
            .confidence(validation.getConfidence())
            .visualization(visualization.build())
            .metrics(metrics)
            .build();
    }

    private static BigDecimal average(List<ExtremumPoint> points) {
        BigDecimal sum = BigDecimal.ZERO;
        for (ExtremumPoint point : points) {
            sum = sum.add(point.getValue());
        }
        return sum.divide(BigDecimal.valueOf(points.size()), 8, RoundingMode.HALF_UP);
    }
}
