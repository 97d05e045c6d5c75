package org.cloudvision.chartpatterns.visualization;

/**
 * Rendering hints for a pattern line.
 */
public class LineStyle {
    private final String color;         // Line color
    private final int lineWidth;        // Line width in pixels
    private final String lineStyle;     // "solid", "dashed", "dotted"

    private LineStyle(Builder builder) {
        this.color = builder.color;
        this.lineWidth = builder.lineWidth;
        this.lineStyle = builder.lineStyle;
    }

    // Getters
    public String getColor() { return color; }
    public int getLineWidth() { return lineWidth; }
    public String getLineStyle() { return lineStyle; }

    public static LineStyle dashed() {
        return builder().lineWidth(1).lineStyle("dashed").build();
    }

    public static LineStyle solid(String color) {
        return builder().color(color).build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private String color = "#9E9E9E";
        private int lineWidth = 2;
        private String lineStyle = "solid";

        public Builder color(String color) {
            this.color = color;
            return this;
        }

        public Builder lineWidth(int lineWidth) {
            this.lineWidth = lineWidth;
            return this;
        }

        public Builder lineStyle(String lineStyle) {
            this.lineStyle = lineStyle;
            return this;
        }

        public LineStyle build() {
            return new LineStyle(this);
        }
    }
}
