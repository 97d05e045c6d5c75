package org.cloudvision.chartpatterns.model;

import java.math.BigDecimal;

/**
 * One OHLCV bar. Candles are supplied by the caller in ascending time order
 * and are never modified by the engine.
 */
public class Candle {
    private final long time;            // Open time (Unix timestamp in seconds)
    private final BigDecimal open;
    private final BigDecimal high;
    private final BigDecimal low;
    private final BigDecimal close;
    private final BigDecimal volume;

    public Candle(long time, BigDecimal open, BigDecimal high, BigDecimal low,
                  BigDecimal close, BigDecimal volume) {
        this.time = time;
        this.open = open;
        this.high = high;
        this.low = low;
        this.close = close;
        this.volume = volume;
    }

    // Getters
    public long getTime() { return time; }
    public BigDecimal getOpen() { return open; }
    public BigDecimal getHigh() { return high; }
    public BigDecimal getLow() { return low; }
    public BigDecimal getClose() { return close; }
    public BigDecimal getVolume() { return volume; }

    @Override
    public String toString() {
        return String.format("Candle{time=%d, open=%s, high=%s, low=%s, close=%s, volume=%s}",
                time, open, high, low, close, volume);
    }
}
