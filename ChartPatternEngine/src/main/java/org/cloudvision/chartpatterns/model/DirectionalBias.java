package org.cloudvision.chartpatterns.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Trading interpretation implied by a detected pattern.
 */
public enum DirectionalBias {
    BULLISH("bullish"),
    BEARISH("bearish"),
    NEUTRAL("neutral");

    private final String id;

    DirectionalBias(String id) {
        this.id = id;
    }

    @JsonValue
    public String getId() {
        return id;
    }
}
