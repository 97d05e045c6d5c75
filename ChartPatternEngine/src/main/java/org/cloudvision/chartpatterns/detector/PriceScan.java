package org.cloudvision.chartpatterns.detector;

import org.cloudvision.chartpatterns.model.Candle;

import java.util.List;

/**
 * Raw-candle scans shared by the pattern families.
 */
public final class PriceScan {

    private PriceScan() {
        // Utility class - prevent instantiation
    }

    /**
     * Index of the lowest low (or, with {@code highest}, the highest high)
     * strictly between two candle indexes. The first occurrence wins on ties.
     *
     * @return the index, or -1 when no candle lies strictly between the two
     */
    public static int extremeBetween(List<Candle> candles, int startIndex, int endIndex, boolean highest) {
        if (startIndex >= endIndex - 1) {
            return -1;
        }

        int bestIndex = startIndex + 1;
        for (int i = startIndex + 2; i < endIndex; i++) {
            int cmp = highest
                ? candles.get(i).getHigh().compareTo(candles.get(bestIndex).getHigh())
                : candles.get(bestIndex).getLow().compareTo(candles.get(i).getLow());
            if (cmp > 0) {
                bestIndex = i;
            }
        }
        return bestIndex;
    }
}
