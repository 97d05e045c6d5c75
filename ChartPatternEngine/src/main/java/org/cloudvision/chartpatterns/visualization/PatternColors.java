package org.cloudvision.chartpatterns.visualization;

import org.cloudvision.chartpatterns.model.DirectionalBias;

/**
 * Chart colors keyed by directional bias.
 */
public final class PatternColors {

    public static final String BULLISH = "#4CAF50";
    public static final String BEARISH = "#F44336";
    public static final String NEUTRAL = "#2196F3";

    private PatternColors() {
    }

    public static String forBias(DirectionalBias bias) {
        switch (bias) {
            case BULLISH: return BULLISH;
            case BEARISH: return BEARISH;
            case NEUTRAL: return NEUTRAL;
            default: return "#9E9E9E";
        }
    }
}
