package org.cloudvision.chartpatterns.model;

import java.math.BigDecimal;

public class TriangleMetrics extends PatternMetrics {
    private final double upperSlope;    // Fitted slope of swing highs, price per bar
    private final double lowerSlope;    // Fitted slope of swing lows, price per bar
    private final int swingHighCount;
    private final int swingLowCount;

    public TriangleMetrics(int formationPeriod, BigDecimal breakoutLevel, BigDecimal targetLevel,
                           BigDecimal stopLoss, double upperSlope, double lowerSlope,
                           int swingHighCount, int swingLowCount) {
        super(formationPeriod, breakoutLevel, targetLevel, stopLoss, null);
        this.upperSlope = upperSlope;
        this.lowerSlope = lowerSlope;
        this.swingHighCount = swingHighCount;
        this.swingLowCount = swingLowCount;
    }

    public double getUpperSlope() { return upperSlope; }
    public double getLowerSlope() { return lowerSlope; }
    public int getSwingHighCount() { return swingHighCount; }
    public int getSwingLowCount() { return swingLowCount; }
}
