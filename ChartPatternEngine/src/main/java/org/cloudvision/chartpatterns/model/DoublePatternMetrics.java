package org.cloudvision.chartpatterns.model;

import java.math.BigDecimal;

public class DoublePatternMetrics extends PatternMetrics {
    private final BigDecimal firstPeakPrice;
    private final BigDecimal secondPeakPrice;
    private final BigDecimal valleyPrice;
    private final double priceDifference;   // |first - second| / first

    public DoublePatternMetrics(int formationPeriod, BigDecimal valleyPrice, BigDecimal targetLevel,
                                BigDecimal stopLoss, BigDecimal firstPeakPrice, BigDecimal secondPeakPrice,
                                double priceDifference) {
        super(formationPeriod, valleyPrice, targetLevel, stopLoss, 1.0 - priceDifference);
        this.firstPeakPrice = firstPeakPrice;
        this.secondPeakPrice = secondPeakPrice;
        this.valleyPrice = valleyPrice;
        this.priceDifference = priceDifference;
    }

    public BigDecimal getFirstPeakPrice() { return firstPeakPrice; }
    public BigDecimal getSecondPeakPrice() { return secondPeakPrice; }
    public BigDecimal getValleyPrice() { return valleyPrice; }
    public double getPriceDifference() { return priceDifference; }
}
