package org.cloudvision.chartpatterns.model;

import java.math.BigDecimal;

public class HeadAndShouldersMetrics extends PatternMetrics {
    private final BigDecimal leftShoulderPrice;
    private final BigDecimal headPrice;
    private final BigDecimal rightShoulderPrice;
    private final BigDecimal necklineLevel;
    private final BigDecimal patternHeight;

    public HeadAndShouldersMetrics(int formationPeriod, BigDecimal necklineLevel, BigDecimal targetLevel,
                                   double symmetry, BigDecimal leftShoulderPrice, BigDecimal headPrice,
                                   BigDecimal rightShoulderPrice, BigDecimal patternHeight) {
        // The neckline is the breakout level and the head invalidates the pattern
        super(formationPeriod, necklineLevel, targetLevel, headPrice, symmetry);
        this.leftShoulderPrice = leftShoulderPrice;
        this.headPrice = headPrice;
        this.rightShoulderPrice = rightShoulderPrice;
        this.necklineLevel = necklineLevel;
        this.patternHeight = patternHeight;
    }

    public BigDecimal getLeftShoulderPrice() { return leftShoulderPrice; }
    public BigDecimal getHeadPrice() { return headPrice; }
    public BigDecimal getRightShoulderPrice() { return rightShoulderPrice; }
    public BigDecimal getNecklineLevel() { return necklineLevel; }
    public BigDecimal getPatternHeight() { return patternHeight; }
}
