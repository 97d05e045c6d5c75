package org.cloudvision.chartpatterns.detector.doublepattern;

import org.cloudvision.chartpatterns.detector.PriceScan;
import org.cloudvision.chartpatterns.model.Candle;
import org.cloudvision.chartpatterns.model.ExtremumPoint;
import org.cloudvision.chartpatterns.scoring.ConfidencePolicy;
import org.cloudvision.chartpatterns.scoring.DefaultConfidencePolicy;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Double top / double bottom rules: two extremes within 1% of each other with
 * at least one bar between them. The neckline is the lowest low between two
 * tops, or the highest high between two bottoms.
 */
@Component
public class DoublePatternValidator {

    static final double MAX_PRICE_DIFF = 0.01;

    private final ConfidencePolicy confidencePolicy;

    @Autowired
    public DoublePatternValidator(ObjectProvider<ConfidencePolicy> confidencePolicy) {
        this(confidencePolicy.getIfUnique(DefaultConfidencePolicy::new));
    }

    public DoublePatternValidator(ConfidencePolicy confidencePolicy) {
        this.confidencePolicy = confidencePolicy;
    }

    public DoublePatternValidation validate(List<Candle> candles, ExtremumPoint first, ExtremumPoint second,
                                            boolean bottom) {
        if (first.getIndex() >= second.getIndex()) {
            return DoublePatternValidation.rejected("points are not in time order");
        }
        if (first.getValue().signum() == 0) {
            return DoublePatternValidation.rejected("first extreme is zero");
        }

        double priceDiff = first.getValue().subtract(second.getValue()).abs().doubleValue()
            / first.getValue().doubleValue();
        if (priceDiff > MAX_PRICE_DIFF) {
            return DoublePatternValidation.rejected(String.format("extremes differ by %.2f%%", priceDiff * 100));
        }

        int necklineIndex = PriceScan.extremeBetween(candles, first.getIndex(), second.getIndex(), bottom);
        if (necklineIndex == -1) {
            return DoublePatternValidation.rejected("no bar between the two extremes");
        }

        return DoublePatternValidation.accepted(necklineIndex, priceDiff, confidencePolicy.doublePattern(priceDiff));
    }
}
