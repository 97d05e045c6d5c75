package org.cloudvision.chartpatterns.detector.triangle;

import org.cloudvision.chartpatterns.detector.AbstractPatternFamilyDetector;
import org.cloudvision.chartpatterns.geometry.ExtremaFinder;
import org.cloudvision.chartpatterns.model.Candle;
import org.cloudvision.chartpatterns.model.ExtremumPoint;
import org.cloudvision.chartpatterns.model.PatternAnalysis;
import org.cloudvision.chartpatterns.model.PatternFamily;
import org.cloudvision.chartpatterns.model.PatternKind;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Ascending, descending and symmetrical triangle detection.
 *
 * Swings are located once over the whole window; triangles are then fitted on
 * the swings of the trailing 20, 25, ... 60 bars, so both tight and wide
 * formations ending near the latest bar are found.
 */
@Component
public class TriangleDetector extends AbstractPatternFamilyDetector {

    static final int MIN_BARS = 20;
    static final int MAX_LOOKBACK = 60;
    static final int LOOKBACK_STEP = 5;
    static final int MAX_RESULTS = 2;

    private final ExtremaFinder extremaFinder;
    private final TriangleValidator validator;
    private final TriangleBuilder builder;

    public TriangleDetector(ExtremaFinder extremaFinder, TriangleValidator validator, TriangleBuilder builder) {
        super(
            "triangle",
            "Triangle",
            "Converging support and resistance lines: ascending, descending and symmetrical triangles",
            PatternFamily.TRIANGLE
        );
        this.extremaFinder = extremaFinder;
        this.validator = validator;
        this.builder = builder;
    }

    @Override
    public int getMinRequiredCandles() {
        return MIN_BARS;
    }

    @Override
    public List<PatternAnalysis> detect(List<Candle> candles, PatternKind kind) {
        requireSupported(kind);
        List<PatternAnalysis> patterns = new ArrayList<>();
        int size = candles.size();
        if (size < MIN_BARS) {
            return patterns;
        }

        List<ExtremumPoint> highs = extremaFinder.findPeaks(candles);
        List<ExtremumPoint> lows = extremaFinder.findTroughs(candles);
        if (highs.size() < 2 || lows.size() < 2) {
            return patterns;
        }

        List<ExtremumPoint> previousHighs = null;
        List<ExtremumPoint> previousLows = null;
        for (int lookback = MIN_BARS; lookback <= Math.min(MAX_LOOKBACK, size); lookback += LOOKBACK_STEP) {
            int fromIndex = size - lookback;
            List<ExtremumPoint> recentHighs = since(highs, fromIndex);
            List<ExtremumPoint> recentLows = since(lows, fromIndex);
            if (recentHighs.size() < 2 || recentLows.size() < 2) {
                continue;
            }
            // A wider window that adds no swing would only repeat the same triangle
            if (recentHighs.equals(previousHighs) && recentLows.equals(previousLows)) {
                continue;
            }
            previousHighs = recentHighs;
            previousLows = recentLows;

            TriangleValidation validation = validator.validate(recentHighs, recentLows);
            if (validation.isValid() && validation.getKind() == kind
                    && validation.getConfidence() >= MIN_CANDIDATE_CONFIDENCE) {
                patterns.add(builder.build(candles, recentHighs, recentLows, validation));
            }
        }

        return rankByConfidence(patterns, MAX_RESULTS);
    }

    private static List<ExtremumPoint> since(List<ExtremumPoint> points, int fromIndex) {
        return points.stream()
            .filter(point -> point.getIndex() >= fromIndex)
            .collect(Collectors.toList());
    }
}
