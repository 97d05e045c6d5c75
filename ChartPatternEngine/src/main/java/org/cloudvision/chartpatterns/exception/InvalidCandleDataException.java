package org.cloudvision.chartpatterns.exception;

/**
 * Thrown when the candle series violates the input contract (ascending time,
 * present and non-negative prices).
 */
public class InvalidCandleDataException extends IllegalArgumentException {

    private final int candleIndex;

    public InvalidCandleDataException(int candleIndex, String message) {
        super(candleIndex >= 0 ? "Invalid candle at index " + candleIndex + ": " + message : message);
        this.candleIndex = candleIndex;
    }

    /**
     * Index of the offending candle, or -1 when the series itself is invalid.
     */
    public int getCandleIndex() {
        return candleIndex;
    }
}
