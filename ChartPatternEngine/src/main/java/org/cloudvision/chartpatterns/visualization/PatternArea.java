package org.cloudvision.chartpatterns.visualization;

import java.util.List;

/**
 * A shaded polygon over a subset of key points, e.g. the body of a
 * head-and-shoulders or the inside of a triangle.
 */
public class PatternArea {
    private final List<Integer> pointIndices;
    private final String fillColor;     // e.g. "#ff0000"
    private final double opacity;

    public PatternArea(List<Integer> pointIndices, String fillColor, double opacity) {
        this.pointIndices = List.copyOf(pointIndices);
        this.fillColor = fillColor;
        this.opacity = opacity;
    }

    // Getters
    public List<Integer> getPointIndices() { return pointIndices; }
    public String getFillColor() { return fillColor; }
    public double getOpacity() { return opacity; }
}
