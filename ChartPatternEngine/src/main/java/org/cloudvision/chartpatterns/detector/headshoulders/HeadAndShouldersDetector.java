package org.cloudvision.chartpatterns.detector.headshoulders;

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
 * Head and Shoulders / Inverse Head and Shoulders detection.
 *
 * Every ordered triple of swing highs (swing lows for the inverse form) is
 * tried as left shoulder, head and right shoulder. The scan is cubic in the
 * number of extrema, which the lookback window keeps small (a 100-bar window
 * with radius 5 yields at most ~10 extrema, i.e. ~120 triples).
 */
@Component
public class HeadAndShouldersDetector extends AbstractPatternFamilyDetector {

    static final int MIN_PATTERN_BARS = 15;
    static final int MAX_RESULTS = 3;

    private final ExtremaFinder extremaFinder;
    private final HeadAndShouldersValidator validator;
    private final HeadAndShouldersBuilder builder;

    public HeadAndShouldersDetector(ExtremaFinder extremaFinder, HeadAndShouldersValidator validator,
                                    HeadAndShouldersBuilder builder) {
        super(
            "head-and-shoulders",
            "Head and Shoulders",
            "Three-peak reversal: a head flanked by two shoulders of similar height over a common neckline",
            PatternFamily.HEAD_AND_SHOULDERS
        );
        this.extremaFinder = extremaFinder;
        this.validator = validator;
        this.builder = builder;
    }

    @Override
    public int getMinRequiredCandles() {
        return MIN_PATTERN_BARS;
    }

    @Override
    public List<PatternAnalysis> detect(List<Candle> candles, PatternKind kind) {
        requireSupported(kind);
        List<PatternAnalysis> patterns = new ArrayList<>();
        if (candles.size() < MIN_PATTERN_BARS) {
            return patterns;
        }

        boolean inverse = kind == PatternKind.INVERSE_HEAD_AND_SHOULDERS;
        List<ExtremumPoint> extremes = inverse
            ? extremaFinder.findTroughs(candles)
            : extremaFinder.findPeaks(candles);

        // Need at least 3 extremes for shoulders and head
        if (extremes.size() < 3) {
            return patterns;
        }

        for (int i = 0; i < extremes.size() - 2; i++) {
            for (int j = i + 1; j < extremes.size() - 1; j++) {
                for (int k = j + 1; k < extremes.size(); k++) {
                    ExtremumPoint leftShoulder = extremes.get(i);
                    ExtremumPoint head = extremes.get(j);
                    ExtremumPoint rightShoulder = extremes.get(k);

                    HeadAndShouldersValidation validation =
                        validator.validate(candles, leftShoulder, head, rightShoulder, inverse);
                    if (validation.isValid() && validation.getConfidence() >= MIN_CANDIDATE_CONFIDENCE) {
                        patterns.add(builder.build(candles, leftShoulder, head, rightShoulder, validation, inverse));
                    }
                }
            }
        }

        return rankByConfidence(patterns, MAX_RESULTS);
    }
}
