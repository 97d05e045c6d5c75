package org.cloudvision.chartpatterns.visualization;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * What a pattern line represents on the chart.
 */
public enum LineRole {
    OUTLINE("outline"),
    NECKLINE("neckline"),
    RESISTANCE("resistance"),
    SUPPORT("support");

    private final String id;

    LineRole(String id) {
        this.id = id;
    }

    @JsonValue
    public String getId() {
        return id;
    }
}
