package org.cloudvision.chartpatterns.visualization;

import java.math.BigDecimal;

/**
 * An annotated vertex of a pattern (shoulder, head, neckline point, target...).
 */
public class PatternKeyPoint {
    private final long time;            // Time (Unix timestamp in seconds)
    private final BigDecimal value;     // Price level
    private final KeyPointKind kind;
    private final String label;         // Short label, e.g. "LS", "H", "T"

    public PatternKeyPoint(long time, BigDecimal value, KeyPointKind kind, String label) {
        this.time = time;
        this.value = value;
        this.kind = kind;
        this.label = label;
    }

    // Getters
    public long getTime() { return time; }
    public BigDecimal getValue() { return value; }
    public KeyPointKind getKind() { return kind; }
    public String getLabel() { return label; }

    @Override
    public String toString() {
        return label + "@" + time + "=" + value;
    }
}
