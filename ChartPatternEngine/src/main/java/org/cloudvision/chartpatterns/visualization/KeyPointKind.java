package org.cloudvision.chartpatterns.visualization;

import com.fasterxml.jackson.annotation.JsonValue;

public enum KeyPointKind {
    PEAK("peak"),
    TROUGH("trough"),
    TARGET("target");

    private final String id;

    KeyPointKind(String id) {
        this.id = id;
    }

    @JsonValue
    public String getId() {
        return id;
    }
}
