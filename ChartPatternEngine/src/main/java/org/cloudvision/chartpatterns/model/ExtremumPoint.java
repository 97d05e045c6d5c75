package org.cloudvision.chartpatterns.model;

import java.math.BigDecimal;
import java.util.Objects;

/**
 * A swing point: a peak (taken from the candle high) or a trough (taken from
 * the candle low) at a candle index.
 */
public class ExtremumPoint {
    private final int index;
    private final BigDecimal value;

    public ExtremumPoint(int index, BigDecimal value) {
        this.index = index;
        this.value = value;
    }

    public int getIndex() { return index; }
    public BigDecimal getValue() { return value; }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ExtremumPoint)) return false;
        ExtremumPoint that = (ExtremumPoint) o;
        return index == that.index && value.compareTo(that.value) == 0;
    }

    @Override
    public int hashCode() {
        return Objects.hash(index, value.stripTrailingZeros());
    }

    @Override
    public String toString() {
        return "ExtremumPoint{index=" + index + ", value=" + value + "}";
    }
}
