package org.cloudvision.chartpatterns.geometry;

import org.cloudvision.chartpatterns.model.Candle;
import org.cloudvision.chartpatterns.model.ExtremumPoint;

import java.util.ArrayList;
import java.util.List;

/**
 * Locates swing highs and swing lows with a fixed-radius comparison window.
 *
 * A candle at index i is a peak when its high is strictly greater than the
 * high of every other candle in [i - radius, i + radius]; troughs are the
 * dual over the low. Candles closer than {@code radius} to either end of the
 * series are never reported. Cost is O(n * radius).
 */
public class ExtremaFinder {

    public static final int DEFAULT_RADIUS = 5;

    private final int radius;

    public ExtremaFinder() {
        this(DEFAULT_RADIUS);
    }

    public ExtremaFinder(int radius) {
        this.radius = requirePositive(radius);
    }

    public int getRadius() {
        return radius;
    }

    public List<ExtremumPoint> findPeaks(List<Candle> candles) {
        return findPeaks(candles, radius);
    }

    public List<ExtremumPoint> findTroughs(List<Candle> candles) {
        return findTroughs(candles, radius);
    }

    /**
     * Swing highs in ascending index order; empty when the series has at most
     * {@code 2 * radius} candles.
     *
     * @throws IllegalArgumentException if {@code radius < 1}
     */
    public static List<ExtremumPoint> findPeaks(List<Candle> candles, int radius) {
        requirePositive(radius);
        List<ExtremumPoint> peaks = new ArrayList<>();
        int size = candles.size();
        if (size <= radius * 2) {
            return peaks;
        }

        for (int i = radius; i < size - radius; i++) {
            Candle current = candles.get(i);
            boolean isPeak = true;
            for (int j = i - radius; j <= i + radius; j++) {
                if (j != i && candles.get(j).getHigh().compareTo(current.getHigh()) >= 0) {
                    isPeak = false;
                    break;
                }
            }
            if (isPeak) {
                peaks.add(new ExtremumPoint(i, current.getHigh()));
            }
        }
        return peaks;
    }

    /**
     * Swing lows in ascending index order; empty when the series has at most
     * {@code 2 * radius} candles.
     */
    public static List<ExtremumPoint> findTroughs(List<Candle> candles, int radius) {
        requirePositive(radius);
        List<ExtremumPoint> troughs = new ArrayList<>();
        int size = candles.size();
        if (size <= radius * 2) {
            return troughs;
        }

        for (int i = radius; i < size - radius; i++) {
            Candle current = candles.get(i);
            boolean isTrough = true;
            for (int j = i - radius; j <= i + radius; j++) {
                if (j != i && candles.get(j).getLow().compareTo(current.getLow()) <= 0) {
                    isTrough = false;
                    break;
                }
            }
            if (isTrough) {
                troughs.add(new ExtremumPoint(i, current.getLow()));
            }
        }
        return troughs;
    }

    private static int requirePositive(int radius) {
        if (radius < 1) {
            throw new IllegalArgumentException("Extrema radius must be positive: " + radius);
        }
        return radius;
    }
}
