package org.cloudvision.chartpatterns.detector;

import org.cloudvision.chartpatterns.model.PatternAnalysis;
import org.cloudvision.chartpatterns.model.PatternFamily;
import org.cloudvision.chartpatterns.model.PatternKind;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Abstract base class for family detectors providing common functionality
 */
public abstract class AbstractPatternFamilyDetector implements PatternFamilyDetector {

    /**
     * Candidates scoring below this are discarded before ranking.
     */
    public static final double MIN_CANDIDATE_CONFIDENCE = 0.6;

    private final String id;
    private final String name;
    private final String description;
    private final PatternFamily family;

    protected AbstractPatternFamilyDetector(String id, String name, String description, PatternFamily family) {
        this.id = id;
        this.name = name;
        this.description = description;
        this.family = family;
    }

    @Override
    public String getId() {
        return id;
    }

    @Override
    public String getName() {
        return name;
    }

    @Override
    public String getDescription() {
        return description;
    }

    @Override
    public PatternFamily getFamily() {
        return family;
    }

    /**
     * Reject kinds that belong to another family
     */
    protected void requireSupported(PatternKind kind) {
        if (kind == null || !getSupportedKinds().contains(kind)) {
            throw new IllegalArgumentException(getName() + " detector cannot detect " + kind);
        }
    }

    /**
     * Sort by descending confidence (stable for ties) and keep the best {@code limit}
     */
    protected List<PatternAnalysis> rankByConfidence(List<PatternAnalysis> patterns, int limit) {
        if (patterns.isEmpty()) {
            return new ArrayList<>();
        }
        return patterns.stream()
            .sorted(Comparator.comparingDouble(PatternAnalysis::getConfidence).reversed())
            .limit(limit)
            .collect(Collectors.toList());
    }
}
