package org.cloudvision.chartpatterns.model;

/**
 * Groups pattern kinds that share one detection algorithm.
 */
public enum PatternFamily {
    HEAD_AND_SHOULDERS("Head and Shoulders"),
    TRIANGLE("Triangle"),
    DOUBLE_PATTERN("Double Top/Bottom");

    private final String displayName;

    PatternFamily(String displayName) {
        this.displayName = displayName;
    }

    public String getDisplayName() {
        return displayName;
    }
}
