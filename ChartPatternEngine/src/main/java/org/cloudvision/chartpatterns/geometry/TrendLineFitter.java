package org.cloudvision.chartpatterns.geometry;

import org.cloudvision.chartpatterns.model.ExtremumPoint;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Ordinary least-squares fit of swing-point price on candle index.
 */
@Component
public class TrendLineFitter {

    /**
     * Fit a line through the points. Fewer than two points, or points that
     * all share one index, give a flat line.
     */
    public TrendLine fit(List<ExtremumPoint> points) {
        if (points == null || points.isEmpty()) {
            return new TrendLine(0.0, 0.0);
        }
        if (points.size() < 2) {
            return new TrendLine(0.0, points.get(0).getValue().doubleValue());
        }

        int n = points.size();
        double sumX = 0.0;
        double sumY = 0.0;
        double sumXY = 0.0;
        double sumXX = 0.0;
        for (ExtremumPoint point : points) {
            double x = point.getIndex();
            double y = point.getValue().doubleValue();
            sumX += x;
            sumY += y;
            sumXY += x * y;
            sumXX += x * x;
        }

        double denominator = n * sumXX - sumX * sumX;
        if (denominator == 0.0) {
            return new TrendLine(0.0, sumY / n);
        }

        double slope = (n * sumXY - sumX * sumY) / denominator;
        double intercept = (sumY - slope * sumX) / n;
        return new TrendLine(slope, intercept);
    }
}
