package org.cloudvision.chartpatterns.visualization;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.ArrayList;
import java.util.List;

/**
 * Drawing skeleton of a detected pattern: ordered key points, the lines that
 * connect them and optional shaded areas. Rendering is left to the caller.
 */
public class PatternVisualization {
    private final List<PatternKeyPoint> keyPoints;
    private final List<PatternLine> lines;
    @JsonInclude(JsonInclude.Include.NON_EMPTY)
    private final List<PatternArea> areas;

    private PatternVisualization(Builder builder) {
        this.keyPoints = List.copyOf(builder.keyPoints);
        this.lines = List.copyOf(builder.lines);
        this.areas = List.copyOf(builder.areas);
    }

    public List<PatternKeyPoint> getKeyPoints() { return keyPoints; }
    public List<PatternLine> getLines() { return lines; }
    public List<PatternArea> getAreas() { return areas; }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private final List<PatternKeyPoint> keyPoints = new ArrayList<>();
        private final List<PatternLine> lines = new ArrayList<>();
        private final List<PatternArea> areas = new ArrayList<>();

        /**
         * Append a key point. Points must be added in strictly ascending time.
         */
        public Builder addKeyPoint(PatternKeyPoint keyPoint) {
            if (!keyPoints.isEmpty()) {
                long last = keyPoints.get(keyPoints.size() - 1).getTime();
                if (keyPoint.getTime() <= last) {
                    throw new IllegalStateException("Key point " + keyPoint.getLabel()
                        + " is not after the previous key point (" + keyPoint.getTime() + " <= " + last + ")");
                }
            }
            keyPoints.add(keyPoint);
            return this;
        }

        public Builder addLine(int fromIndex, int toIndex, LineRole role, LineStyle style) {
            lines.add(new PatternLine(fromIndex, toIndex, role, style));
            return this;
        }

        public Builder addArea(List<Integer> pointIndices, String fillColor, double opacity) {
            areas.add(new PatternArea(pointIndices, fillColor, opacity));
            return this;
        }

        public int keyPointCount() {
            return keyPoints.size();
        }

        public PatternVisualization build() {
            for (PatternLine line : lines) {
                if (line.getFromIndex() < 0 || line.getToIndex() >= keyPoints.size()) {
                    throw new IllegalStateException("Line " + line.getRole().getId()
                        + " references a missing key point");
                }
            }
            return new PatternVisualization(this);
        }
    }
}
