package org.cloudvision.chartpatterns.detector;

import org.cloudvision.chartpatterns.model.Candle;
import org.cloudvision.chartpatterns.model.PatternAnalysis;
import org.cloudvision.chartpatterns.model.PatternFamily;
import org.cloudvision.chartpatterns.model.PatternKind;

import java.util.EnumSet;
import java.util.List;
import java.util.Set;

/**
 * Detector for one family of chart patterns.
 *
 * Implementations are stateless: every call to {@link #detect} is a pure
 * function of the candle window, so one instance may serve concurrent callers.
 * The facade registers every implementation it is given and routes each
 * requested {@link PatternKind} to the detector of its family.
 */
public interface PatternFamilyDetector {

    /**
     * Unique identifier, e.g. "head-and-shoulders"
     */
    String getId();

    /**
     * Display name, e.g. "Head and Shoulders"
     */
    String getName();

    String getDescription();

    PatternFamily getFamily();

    /**
     * Kinds this detector can find. Defaults to every kind of its family.
     */
    default Set<PatternKind> getSupportedKinds() {
        Set<PatternKind> kinds = EnumSet.noneOf(PatternKind.class);
        for (PatternKind kind : PatternKind.values()) {
            if (kind.getFamily() == getFamily()) {
                kinds.add(kind);
            }
        }
        return kinds;
    }

    /**
     * Smallest window on which detection can succeed. Shorter windows yield no
     * patterns rather than an error.
     */
    int getMinRequiredCandles();

    /**
     * Find instances of {@code kind} in the window.
     *
     * @param candles window to scan, ascending by time; indexes in the result refer to this list
     * @param kind    one of {@link #getSupportedKinds()}
     * @return detections sorted by descending confidence, capped per family; never null
     */
    List<PatternAnalysis> detect(List<Candle> candles, PatternKind kind);
}
