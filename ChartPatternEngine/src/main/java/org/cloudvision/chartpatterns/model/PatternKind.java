package org.cloudvision.chartpatterns.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * The detectable chart patterns, in the order the detector evaluates them.
 */
public enum PatternKind {
    HEAD_AND_SHOULDERS("headAndShoulders", "Head and Shoulders",
        PatternFamily.HEAD_AND_SHOULDERS, DirectionalBias.BEARISH),
    INVERSE_HEAD_AND_SHOULDERS("inverseHeadAndShoulders", "Inverse Head and Shoulders",
        PatternFamily.HEAD_AND_SHOULDERS, DirectionalBias.BULLISH),
    ASCENDING_TRIANGLE("ascendingTriangle", "Ascending Triangle",
        PatternFamily.TRIANGLE, DirectionalBias.BULLISH),
    DESCENDING_TRIANGLE("descendingTriangle", "Descending Triangle",
        PatternFamily.TRIANGLE, DirectionalBias.BEARISH),
    SYMMETRICAL_TRIANGLE("symmetricalTriangle", "Symmetrical Triangle",
        PatternFamily.TRIANGLE, DirectionalBias.NEUTRAL),
    DOUBLE_TOP("doubleTop", "Double Top",
        PatternFamily.DOUBLE_PATTERN, DirectionalBias.BEARISH),
    DOUBLE_BOTTOM("doubleBottom", "Double Bottom",
        PatternFamily.DOUBLE_PATTERN, DirectionalBias.BULLISH);

    private final String id;
    private final String displayName;
    private final PatternFamily family;
    private final DirectionalBias bias;

    PatternKind(String id, String displayName, PatternFamily family, DirectionalBias bias) {
        this.id = id;
        this.displayName = displayName;
        this.family = family;
        this.bias = bias;
    }

    @JsonValue
    public String getId() { return id; }
    public String getDisplayName() { return displayName; }
    public PatternFamily getFamily() { return family; }
    public DirectionalBias getBias() { return bias; }

    /**
     * Resolve a kind from its wire id ("doubleTop") or enum name ("DOUBLE_TOP").
     */
    @JsonCreator
    public static PatternKind fromId(String value) {
        for (PatternKind kind : values()) {
            if (kind.id.equals(value) || kind.name().equalsIgnoreCase(value)) {
                return kind;
            }
        }
        throw new IllegalArgumentException("Unknown pattern kind: " + value);
    }
}
