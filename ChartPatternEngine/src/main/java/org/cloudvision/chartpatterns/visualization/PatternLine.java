package org.cloudvision.chartpatterns.visualization;

/**
 * A line between two key points of the same pattern. Indexes refer to
 * positions in {@link PatternVisualization#getKeyPoints()}; a line whose
 * from and to index are equal marks a horizontal level through that point.
 */
public class PatternLine {
    private final int fromIndex;
    private final int toIndex;
    private final LineRole role;
    private final LineStyle style;

    public PatternLine(int fromIndex, int toIndex, LineRole role, LineStyle style) {
        this.fromIndex = fromIndex;
        this.toIndex = toIndex;
        this.role = role;
        this.style = style;
    }

    // Getters
    public int getFromIndex() { return fromIndex; }
    public int getToIndex() { return toIndex; }
    public LineRole getRole() { return role; }
    public LineStyle getStyle() { return style; }
}
