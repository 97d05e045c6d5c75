package org.cloudvision.chartpatterns;

import org.cloudvision.chartpatterns.config.DetectionParams;
import org.cloudvision.chartpatterns.config.PatternDetectionProperties;
import org.cloudvision.chartpatterns.detector.PatternFamilyDetector;
import org.cloudvision.chartpatterns.detector.doublepattern.DoublePatternBuilder;
import org.cloudvision.chartpatterns.detector.doublepattern.DoublePatternDetector;
import org.cloudvision.chartpatterns.detector.doublepattern.DoublePatternValidator;
import org.cloudvision.chartpatterns.detector.headshoulders.HeadAndShouldersBuilder;
import org.cloudvision.chartpatterns.detector.headshoulders.HeadAndShouldersDetector;
import org.cloudvision.chartpatterns.detector.headshoulders.HeadAndShouldersValidator;
import org.cloudvision.chartpatterns.detector.triangle.TriangleBuilder;
import org.cloudvision.chartpatterns.detector.triangle.TriangleDetector;
import org.cloudvision.chartpatterns.detector.triangle.TriangleValidator;
import org.cloudvision.chartpatterns.exception.InvalidCandleDataException;
import org.cloudvision.chartpatterns.exception.InvalidDetectionParamsException;
import org.cloudvision.chartpatterns.geometry.ExtremaFinder;
import org.cloudvision.chartpatterns.geometry.TrendLineFitter;
import org.cloudvision.chartpatterns.model.Candle;
import org.cloudvision.chartpatterns.model.PatternAnalysis;
import org.cloudvision.chartpatterns.model.PatternKind;
import org.cloudvision.chartpatterns.scoring.ConfidencePolicy;
import org.cloudvision.chartpatterns.scoring.DefaultConfidencePolicy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Entry point of the pattern engine.
 *
 * Provides:
 * - Registry of the family detectors, keyed by the pattern kinds they support
 * - Input validation of candles and detection params
 * - Lookback slicing, per-family isolation and confidence filtering
 *
 * Detection is synchronous and stateless, so one instance may be shared
 * between threads.
 */
@Service
public class PatternDetector {

    private static final Logger log = LoggerFactory.getLogger(PatternDetector.class);

    private final Map<PatternKind, PatternFamilyDetector> detectors = new EnumMap<>(PatternKind.class);
    private final DetectionParams defaultParams;

    @Autowired
    public PatternDetector(List<PatternFamilyDetector> detectorList, PatternDetectionProperties properties) {
        this(detectorList, properties.toDetectionParams());
    }

    public PatternDetector(List<PatternFamilyDetector> detectorList, DetectionParams defaultParams) {
        if (defaultParams == null) {
            throw new InvalidDetectionParamsException("params", "default params are required");
        }
        this.defaultParams = defaultParams;

        // Register all family detectors
        for (PatternFamilyDetector detector : detectorList) {
            for (PatternKind kind : detector.getSupportedKinds()) {
                PatternFamilyDetector previous = detectors.putIfAbsent(kind, detector);
                if (previous != null) {
                    throw new IllegalStateException("Pattern kind " + kind.getId() + " is claimed by both "
                        + previous.getId() + " and " + detector.getId());
                }
            }
        }

        log.info("PatternDetector initialized with {} family detectors covering {} pattern kinds",
            detectorList.size(), detectors.size());
    }

    /**
     * Engine with the default detectors and scoring, for callers without a
     * Spring context.
     */
    public static PatternDetector createDefault() {
        return create(new PatternDetectionProperties());
    }

    public static PatternDetector create(PatternDetectionProperties properties) {
        ExtremaFinder extremaFinder = new ExtremaFinder(properties.validatedExtremaRadius());
        ConfidencePolicy confidencePolicy = new DefaultConfidencePolicy();

        List<PatternFamilyDetector> detectorList = List.of(
            new HeadAndShouldersDetector(extremaFinder,
                new HeadAndShouldersValidator(confidencePolicy), new HeadAndShouldersBuilder()),
            new TriangleDetector(extremaFinder,
                new TriangleValidator(new TrendLineFitter(), confidencePolicy), new TriangleBuilder()),
            new DoublePatternDetector(extremaFinder,
                new DoublePatternValidator(confidencePolicy), new DoublePatternBuilder())
        );
        return new PatternDetector(detectorList, properties);
    }

    /**
     * Detect with the configured default params.
     */
    public List<PatternAnalysis> detect(List<Candle> candles) {
        return detect(candles, defaultParams);
    }

    /**
     * Detect patterns in the trailing {@code lookbackPeriod} candles.
     *
     * @param candles ascending-time series; indexes in the results refer to this list
     * @param params  lookback, confidence floor and kind filter
     * @return detections in kind order, each family sorted by descending
     *         confidence; unmodifiable and never null
     * @throws InvalidDetectionParamsException if params are missing
     * @throws InvalidCandleDataException      if the series breaks the input contract
     */
    public List<PatternAnalysis> detect(List<Candle> candles, DetectionParams params) {
        if (params == null) {
            throw new InvalidDetectionParamsException("params", "must not be null");
        }
        validateCandles(candles);

        int offset = Math.max(0, candles.size() - params.getLookbackPeriod());
        List<Candle> window = List.copyOf(candles.subList(offset, candles.size()));

        List<PatternAnalysis> results = new ArrayList<>();
        for (PatternKind kind : PatternKind.values()) {
            if (!params.includes(kind)) {
                continue;
            }
            PatternFamilyDetector detector = detectors.get(kind);
            if (detector == null) {
                log.debug("No detector registered for {}", kind.getId());
                continue;
            }
            if (window.size() < detector.getMinRequiredCandles()) {
                log.debug("Skipping {}: window of {} candles is below the {} required",
                    kind.getId(), window.size(), detector.getMinRequiredCandles());
                continue;
            }

            List<PatternAnalysis> found;
            try {
                found = detector.detect(window, kind);
            } catch (RuntimeException e) {
                log.warn("Detector {} failed for {}, continuing with remaining patterns",
                    detector.getId(), kind.getId(), e);
                continue;
            }

            for (PatternAnalysis analysis : found) {
                if (analysis.getConfidence() >= params.getMinConfidence()) {
                    results.add(analysis.withIndexOffset(offset));
                }
            }
        }

        log.debug("Detected {} patterns in {} of {} candles with {}",
            results.size(), window.size(), candles.size(), params);
        return Collections.unmodifiableList(results);
    }

    public Set<PatternKind> getSupportedKinds() {
        return Collections.unmodifiableSet(detectors.keySet());
    }

    public DetectionParams getDefaultParams() {
        return defaultParams;
    }

    private static void validateCandles(List<Candle> candles) {
        if (candles == null) {
            throw new InvalidCandleDataException(-1, "Candle list must not be null");
        }
        long previousTime = Long.MIN_VALUE;
        for (int i = 0; i < candles.size(); i++) {
            Candle candle = candles.get(i);
            if (candle == null) {
                throw new InvalidCandleDataException(i, "candle is null");
            }
            requireNonNegative(i, "open", candle.getOpen());
            requireNonNegative(i, "high", candle.getHigh());
            requireNonNegative(i, "low", candle.getLow());
            requireNonNegative(i, "close", candle.getClose());
            requireNonNegative(i, "volume", candle.getVolume());
            if (i > 0 && candle.getTime() <= previousTime) {
                throw new InvalidCandleDataException(i, "time " + candle.getTime()
                    + " is not after the previous candle's " + previousTime);
            }
            previousTime = candle.getTime();
        }
    }

    private static void requireNonNegative(int index, String field, BigDecimal value) {
        if (value == null) {
            throw new InvalidCandleDataException(index, field + " is missing");
        }
        if (value.signum() < 0) {
            throw new InvalidCandleDataException(index, field + " is negative: " + value);
        }
    }
}
