package org.cloudvision.chartpatterns.geometry;

/**
 * Straight line {@code value = slope * index + intercept} over candle indexes.
 */
public class TrendLine {
    private final double slope;
    private final double intercept;

    public TrendLine(double slope, double intercept) {
        this.slope = slope;
        this.intercept = intercept;
    }

    public double getSlope() { return slope; }
    public double getIntercept() { return intercept; }

    public double valueAt(double index) {
        return slope * index + intercept;
    }

    @Override
    public String toString() {
        return String.format("TrendLine{slope=%.6f, intercept=%.4f}", slope, intercept);
    }
}
