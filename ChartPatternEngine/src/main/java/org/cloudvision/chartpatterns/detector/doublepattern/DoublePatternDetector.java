package org.cloudvision.chartpatterns.detector.doublepattern;

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

/**
 * Double Top / Double Bottom detection over every pair of swing highs (lows).
 */
@Component
public class DoublePatternDetector extends AbstractPatternFamilyDetector {

    static final int MAX_RESULTS = 2;

    private final ExtremaFinder extremaFinder;
    private final DoublePatternValidator validator;
    private final DoublePatternBuilder builder;

    public DoublePatternDetector(ExtremaFinder extremaFinder, DoublePatternValidator validator,
                                 DoublePatternBuilder builder) {
        super(
            "double-pattern",
            "Double Top/Bottom",
            "Two tops or two bottoms at nearly the same price separated by a neckline",
            PatternFamily.DOUBLE_PATTERN
        );
        this.extremaFinder = extremaFinder;
        this.validator = validator;
        this.builder = builder;
    }

    /**
     * Two strict extremes sit at least radius + 1 bars apart, and each needs
     * radius bars on its outer side.
     */
    @Override
    public int getMinRequiredCandles() {
        return extremaFinder.getRadius() * 3 + 2;
    }

    @Override
    public List<PatternAnalysis> detect(List<Candle> candles, PatternKind kind) {
        requireSupported(kind);
        List<PatternAnalysis> patterns = new ArrayList<>();

        boolean bottom = kind == PatternKind.DOUBLE_BOTTOM;
        List<ExtremumPoint> extremes = bottom
            ? extremaFinder.findTroughs(candles)
            : extremaFinder.findPeaks(candles);
        if (extremes.size() < 2) {
            return patterns;
        }

        for (int i = 0; i < extremes.size() - 1; i++) {
            for (int j = i + 1; j < extremes.size(); j++) {
                ExtremumPoint first = extremes.get(i);
                ExtremumPoint second = extremes.get(j);

                DoublePatternValidation validation = validator.validate(candles, first, second, bottom);
                if (validation.isValid() && validation.getConfidence() >= MIN_CANDIDATE_CONFIDENCE) {
                    patterns.add(builder.build(candles, first, second, validation, bottom));
                }
            }
        }

        return rankByConfidence(patterns, MAX_RESULTS);
    }
}
