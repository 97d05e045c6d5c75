package org.cloudvision.chartpatterns;

import org.cloudvision.chartpatterns.config.DetectionParams;
import org.cloudvision.chartpatterns.config.PatternDetectionProperties;
import org.cloudvision.chartpatterns.detector.PatternFamilyDetector;
import org.cloudvision.chartpatterns.detector.doublepattern.DoublePatternBuilder;
import org.cloudvision.chartpatterns.detector.doublepattern.DoublePatternDetector;
import org.cloudvision.chartpatterns.detector.doublepattern.DoublePatternValidator;
import org.cloudvision.chartpatterns.exception.InvalidCandleDataException;
import org.cloudvision.chartpatterns.exception.InvalidDetectionParamsException;
import org.cloudvision.chartpatterns.geometry.ExtremaFinder;
import org.cloudvision.chartpatterns.model.Candle;
import org.cloudvision.chartpatterns.model.DirectionalBias;
import org.cloudvision.chartpatterns.model.PatternAnalysis;
import org.cloudvision.chartpatterns.model.PatternFamily;
import org.cloudvision.chartpatterns.model.PatternKind;
import org.cloudvision.chartpatterns.scoring.DefaultConfidencePolicy;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

/**
 * End-to-end tests of the detection facade
 *
 * Tests cover:
 * - Head and shoulders on a clean synthetic series
 * - Series without extrema
 * - Confidence floor, kind filter and lookback slicing
 * - Input validation and per-family isolation
 */
class PatternDetectorTest {

    private PatternDetector detector;

    @BeforeEach
    void setUp() {
        detector = PatternDetector.createDefault();
    }

    @Test
    @DisplayName("Should register every pattern kind")
    void testSupportedKinds() {
        assertEquals(PatternKind.values().length, detector.getSupportedKinds().size());
        assertEquals(100, detector.getDefaultParams().getLookbackPeriod());
    }

    @Test
    @DisplayName("Shoulders at 100, head at 110 and neckline at 95 give one bearish head and shoulders")
    void testHeadAndShouldersScenario() {
        List<PatternAnalysis> results = detector.detect(headAndShouldersCandles(), DetectionParams.defaults());

        List<PatternAnalysis> headAndShoulders = ofKind(results, PatternKind.HEAD_AND_SHOULDERS);
        assertEquals(1, headAndShoulders.size());
        PatternAnalysis pattern = headAndShoulders.get(0);
        assertEquals(DirectionalBias.BEARISH, pattern.getDirectionalBias());
        assertEquals(80.0, pattern.getMetrics().getTargetLevel().doubleValue(), 1e-6);
        assertTrue(ofKind(results, PatternKind.INVERSE_HEAD_AND_SHOULDERS).isEmpty());
    }

    @Test
    @DisplayName("Results come in pattern kind order")
    void testKindOrder() {
        List<PatternAnalysis> results = detector.detect(headAndShouldersCandles());

        // Equal shoulders and equal neckline lows also form a double top and a double bottom
        assertEquals(List.of(PatternKind.HEAD_AND_SHOULDERS, PatternKind.DOUBLE_TOP, PatternKind.DOUBLE_BOTTOM),
            results.stream().map(PatternAnalysis::getPatternKind).collect(Collectors.toList()));
    }

    @Test
    @DisplayName("Strictly rising candles contain no pattern")
    void testMonotonicSeries() {
        List<Candle> candles = pathCandles(new double[]{0, 100}, new double[]{99, 199});

        assertTrue(detector.detect(candles).isEmpty());
    }

    @Test
    @DisplayName("Nothing clears a 0.99 confidence bar")
    void testHighConfidenceFloor() {
        // Uneven shoulders and neckline: only the head and shoulders qualifies, at 0.95
        List<Candle> candles = pathCandles(
            new double[]{0, 80}, new double[]{20, 100}, new double[]{30, 96}, new double[]{45, 110},
            new double[]{60, 97.5}, new double[]{70, 102}, new double[]{99, 85});

        List<PatternAnalysis> relaxed = detector.detect(candles);
        assertEquals(1, relaxed.size());
        assertEquals(PatternKind.HEAD_AND_SHOULDERS, relaxed.get(0).getPatternKind());

        DetectionParams strict = DetectionParams.builder().minConfidence(0.99).build();
        assertTrue(detector.detect(candles, strict).isEmpty());
    }

    @Test
    @DisplayName("Identical inputs give identical outputs")
    void testIdempotent() {
        List<Candle> candles = headAndShouldersCandles();

        List<PatternAnalysis> first = detector.detect(candles);
        List<PatternAnalysis> second = detector.detect(candles);

        assertEquals(first.size(), second.size());
        for (int i = 0; i < first.size(); i++) {
            assertEquals(first.get(i).toString(), second.get(i).toString());
            assertEquals(0, first.get(i).getMetrics().getTargetLevel()
                .compareTo(second.get(i).getMetrics().getTargetLevel()));
        }
    }

    @Test
    @DisplayName("Indexes refer to the caller's series when the lookback trims it")
    void testIndexOffset() {
        // 50 rising candles, then the head and shoulders series shifted by 50 bars
        List<Candle> candles = pathCandles(
            new double[]{0, 60}, new double[]{50, 80}, new double[]{70, 100}, new double[]{80, 96},
            new double[]{95, 110}, new double[]{110, 96}, new double[]{120, 100}, new double[]{149, 85});

        List<PatternAnalysis> headAndShoulders = ofKind(detector.detect(candles), PatternKind.HEAD_AND_SHOULDERS);

        assertEquals(1, headAndShoulders.size());
        PatternAnalysis pattern = headAndShoulders.get(0);
        assertEquals(70, pattern.getStartIndex());
        assertEquals(120, pattern.getEndIndex());
        assertEquals(candles.get(70).getTime(), pattern.getStartTime());
        assertEquals(candles.get(120).getTime(), pattern.getEndTime());
    }

    @Test
    @DisplayName("A lookback longer than the series scans all of it")
    void testLookbackLongerThanSeries() {
        DetectionParams params = DetectionParams.builder().lookbackPeriod(500).build();

        assertEquals(detector.detect(headAndShouldersCandles()).size(),
            detector.detect(headAndShouldersCandles(), params).size());
    }

    @Test
    @DisplayName("Only requested kinds are detected")
    void testKindFilter() {
        DetectionParams onlyHeadAndShoulders = DetectionParams.builder()
            .patternKinds(PatternKind.HEAD_AND_SHOULDERS)
            .build();
        List<PatternAnalysis> results = detector.detect(headAndShouldersCandles(), onlyHeadAndShoulders);
        assertEquals(1, results.size());
        assertEquals(PatternKind.HEAD_AND_SHOULDERS, results.get(0).getPatternKind());

        DetectionParams none = DetectionParams.builder().patternKinds(Collections.emptyList()).build();
        assertTrue(detector.detect(headAndShouldersCandles(), none).isEmpty());
    }

    @Test
    @DisplayName("Short series yield no patterns rather than errors")
    void testShortSeries() {
        assertTrue(detector.detect(headAndShouldersCandles().subList(0, 10)).isEmpty());
        assertTrue(detector.detect(new ArrayList<>()).isEmpty());
    }

    @Test
    @DisplayName("Returned list is unmodifiable")
    void testUnmodifiableResult() {
        List<PatternAnalysis> results = detector.detect(headAndShouldersCandles());

        assertThrows(UnsupportedOperationException.class, () -> results.add(results.get(0)));
    }

    @Test
    @DisplayName("Should reject missing params")
    void testNullParams() {
        InvalidDetectionParamsException exception = assertThrows(InvalidDetectionParamsException.class,
            () -> detector.detect(headAndShouldersCandles(), null));
        assertEquals("params", exception.getParameter());
    }

    @Test
    @DisplayName("Should reject candles out of time order")
    void testUnorderedCandles() {
        List<Candle> candles = new ArrayList<>(headAndShouldersCandles());
        Collections.swap(candles, 40, 41);

        InvalidCandleDataException exception = assertThrows(InvalidCandleDataException.class,
            () -> detector.detect(candles));
        assertEquals(41, exception.getCandleIndex());
    }

    @Test
    @DisplayName("Should reject duplicate timestamps, negative and missing prices")
    void testMalformedCandles() {
        List<Candle> duplicate = new ArrayList<>(headAndShouldersCandles());
        duplicate.set(1, createCandle(81, 0));
        assertThrows(InvalidCandleDataException.class, () -> detector.detect(duplicate));

        List<Candle> negative = new ArrayList<>(headAndShouldersCandles());
        negative.set(5, new Candle(negative.get(5).getTime(), BigDecimal.ONE, BigDecimal.ONE,
            BigDecimal.valueOf(-1), BigDecimal.ONE, BigDecimal.ONE));
        InvalidCandleDataException exception = assertThrows(InvalidCandleDataException.class,
            () -> detector.detect(negative));
        assertEquals(5, exception.getCandleIndex());

        List<Candle> missing = new ArrayList<>(headAndShouldersCandles());
        missing.set(7, new Candle(missing.get(7).getTime(), null, BigDecimal.ONE,
            BigDecimal.ONE, BigDecimal.ONE, BigDecimal.ONE));
        assertThrows(InvalidCandleDataException.class, () -> detector.detect(missing));

        assertThrows(InvalidCandleDataException.class, () -> detector.detect(null));
    }

    @Test
    @DisplayName("A failing family does not stop the others")
    void testFamilyIsolation() {
        PatternDetector isolated = new PatternDetector(
            List.of(failingHeadAndShouldersDetector(), doublePatternDetector()),
            DetectionParams.defaults());

        List<PatternAnalysis> results = isolated.detect(headAndShouldersCandles());

        assertEquals(List.of(PatternKind.DOUBLE_TOP, PatternKind.DOUBLE_BOTTOM),
            results.stream().map(PatternAnalysis::getPatternKind).collect(Collectors.toList()));
    }

    @Test
    @DisplayName("Two detectors may not claim the same kind")
    void testDuplicateRegistration() {
        assertThrows(IllegalStateException.class,
            () -> new PatternDetector(List.of(doublePatternDetector(), doublePatternDetector()),
                DetectionParams.defaults()));
    }

    @Test
    @DisplayName("Should reject an extrema radius outside 1-20")
    void testInvalidRadius() {
        PatternDetectionProperties properties = new PatternDetectionProperties();
        properties.setExtremaRadius(21);

        assertThrows(InvalidDetectionParamsException.class, () -> PatternDetector.create(properties));
    }

    private PatternFamilyDetector doublePatternDetector() {
        return new DoublePatternDetector(new ExtremaFinder(),
            new DoublePatternValidator(new DefaultConfidencePolicy()), new DoublePatternBuilder());
    }

    private PatternFamilyDetector failingHeadAndShouldersDetector() {
        return new PatternFamilyDetector() {
            @Override
            public String getId() {
                return "failing";
            }

            @Override
            public String getName() {
                return "Failing";
            }

            @Override
            public String getDescription() {
                return "Always throws";
            }

            @Override
            public PatternFamily getFamily() {
                return PatternFamily.HEAD_AND_SHOULDERS;
            }

            @Override
            public int getMinRequiredCandles() {
                return 1;
            }

            @Override
            public List<PatternAnalysis> detect(List<Candle> candles, PatternKind kind) {
                throw new IllegalStateException("detector failure");
            }
        };
    }

    private List<PatternAnalysis> ofKind(List<PatternAnalysis> results, PatternKind kind) {
        return results.stream()
            .filter(result -> result.getPatternKind() == kind)
            .collect(Collectors.toList());
    }

    /**
     * 100 candles: shoulders at 100 (bars 20, 70), head at 110 (bar 45),
     * neckline lows at 95 (bars 30, 60)
     */
    private List<Candle> headAndShouldersCandles() {
        return pathCandles(
            new double[]{0, 80}, new double[]{20, 100}, new double[]{30, 96}, new double[]{45, 110},
            new double[]{60, 96}, new double[]{70, 100}, new double[]{99, 85});
    }

    private List<Candle> pathCandles(double[]... waypoints) {
        List<Candle> result = new ArrayList<>();
        for (int w = 0; w < waypoints.length - 1; w++) {
            int from = (int) waypoints[w][0];
            int to = (int) waypoints[w + 1][0];
            for (int i = from; i < to; i++) {
                double price = waypoints[w][1] + (waypoints[w + 1][1] - waypoints[w][1]) * (i - from) / (to - from);
                result.add(createCandle(price, i));
            }
        }
        double[] last = waypoints[waypoints.length - 1];
        result.add(createCandle(last[1], (int) last[0]));
        return result;
    }

    private Candle createCandle(double price, int index) {
        return new Candle(
            1_700_000_000L + index * 60L,
            BigDecimal.valueOf(price - 0.5),
            BigDecimal.valueOf(price),
            BigDecimal.valueOf(price - 1),
            BigDecimal.valueOf(price - 0.25),
            BigDecimal.valueOf(1000)
        );
    }
}
