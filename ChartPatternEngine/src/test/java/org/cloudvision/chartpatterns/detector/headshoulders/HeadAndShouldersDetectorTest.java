package org.cloudvision.chartpatterns.detector.headshoulders;

import org.cloudvision.chartpatterns.geometry.ExtremaFinder;
import org.cloudvision.chartpatterns.model.Candle;
import org.cloudvision.chartpatterns.model.DirectionalBias;
import org.cloudvision.chartpatterns.model.HeadAndShouldersMetrics;
import org.cloudvision.chartpatterns.model.PatternAnalysis;
import org.cloudvision.chartpatterns.model.PatternFamily;
import org.cloudvision.chartpatterns.model.PatternKind;
import org.cloudvision.chartpatterns.scoring.DefaultConfidencePolicy;
import org.cloudvision.chartpatterns.visualization.KeyPointKind;
import org.cloudvision.chartpatterns.visualization.LineRole;
import org.cloudvision.chartpatterns.visualization.PatternKeyPoint;
import org.cloudvision.chartpatterns.visualization.PatternLine;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for head-and-shoulders detection on synthetic price paths
 */
class HeadAndShouldersDetectorTest {

    private HeadAndShouldersDetector detector;

    @BeforeEach
    void setUp() {
        detector = new HeadAndShouldersDetector(
            new ExtremaFinder(),
            new HeadAndShouldersValidator(new DefaultConfidencePolicy()),
            new HeadAndShouldersBuilder()
        );
    }

    @Test
    @DisplayName("Should have correct detector metadata")
    void testDetectorMetadata() {
        assertEquals("head-and-shoulders", detector.getId());
        assertEquals("Head and Shoulders", detector.getName());
        assertNotNull(detector.getDescription());
        assertEquals(PatternFamily.HEAD_AND_SHOULDERS, detector.getFamily());
        assertEquals(15, detector.getMinRequiredCandles());
        assertTrue(detector.getSupportedKinds().contains(PatternKind.INVERSE_HEAD_AND_SHOULDERS));
        assertEquals(2, detector.getSupportedKinds().size());
    }

    @Test
    @DisplayName("Should detect a textbook head and shoulders")
    void testDetectsHeadAndShoulders() {
        List<PatternAnalysis> patterns = detector.detect(headAndShouldersCandles(), PatternKind.HEAD_AND_SHOULDERS);

        assertEquals(1, patterns.size());
        PatternAnalysis pattern = patterns.get(0);
        assertEquals(PatternKind.HEAD_AND_SHOULDERS, pattern.getPatternKind());
        assertEquals(DirectionalBias.BEARISH, pattern.getDirectionalBias());
        assertEquals(20, pattern.getStartIndex());
        assertEquals(70, pattern.getEndIndex());
        assertEquals(0.95, pattern.getConfidence(), 1e-9);

        HeadAndShouldersMetrics metrics = (HeadAndShouldersMetrics) pattern.getMetrics();
        assertEquals(51, metrics.getFormationPeriod());
        assertEquals(0, new BigDecimal("95").compareTo(metrics.getNecklineLevel()));
        assertEquals(0, new BigDecimal("95").compareTo(metrics.getBreakoutLevel()));
        assertEquals(0, new BigDecimal("80").compareTo(metrics.getTargetLevel()));
        assertEquals(0, new BigDecimal("110").compareTo(metrics.getStopLoss()));
        assertEquals(0, new BigDecimal("15").compareTo(metrics.getPatternHeight()));
        assertEquals(1.0, metrics.getSymmetry().doubleValue(), 1e-12);
    }

    @Test
    @DisplayName("Should lay out key points, outline and neckline")
    void testVisualization() {
        List<Candle> candles = headAndShouldersCandles();
        PatternAnalysis pattern = detector.detect(candles, PatternKind.HEAD_AND_SHOULDERS).get(0);

        List<PatternKeyPoint> keyPoints = pattern.getVisualization().getKeyPoints();
        assertEquals(List.of("LS", "LV", "H", "RV", "RS", "T"),
            keyPoints.stream().map(PatternKeyPoint::getLabel).collect(Collectors.toList()));
        assertEquals(KeyPointKind.PEAK, keyPoints.get(2).getKind());
        assertEquals(KeyPointKind.TROUGH, keyPoints.get(1).getKind());
        assertEquals(KeyPointKind.TARGET, keyPoints.get(5).getKind());
        assertEquals(candles.get(99).getTime(), keyPoints.get(5).getTime());
        for (int i = 1; i < keyPoints.size(); i++) {
            assertTrue(keyPoints.get(i).getTime() > keyPoints.get(i - 1).getTime());
        }

        List<PatternLine> lines = pattern.getVisualization().getLines();
        assertEquals(5, lines.size());
        PatternLine neckline = lines.get(4);
        assertEquals(LineRole.NECKLINE, neckline.getRole());
        assertEquals(1, neckline.getFromIndex());
        assertEquals(3, neckline.getToIndex());
        assertEquals(1, pattern.getVisualization().getAreas().size());
    }

    @Test
    @DisplayName("Should detect the inverse form with a bullish target")
    void testDetectsInverse() {
        List<Candle> candles = pathCandles(
            new double[]{0, 120}, new double[]{20, 100}, new double[]{30, 104}, new double[]{45, 90},
            new double[]{60, 104}, new double[]{70, 100}, new double[]{99, 115});

        List<PatternAnalysis> patterns = detector.detect(candles, PatternKind.INVERSE_HEAD_AND_SHOULDERS);

        assertEquals(1, patterns.size());
        PatternAnalysis pattern = patterns.get(0);
        assertEquals(DirectionalBias.BULLISH, pattern.getDirectionalBias());
        HeadAndShouldersMetrics metrics = (HeadAndShouldersMetrics) pattern.getMetrics();
        assertEquals(0, new BigDecimal("104").compareTo(metrics.getNecklineLevel()));
        assertEquals(0, new BigDecimal("119").compareTo(metrics.getTargetLevel()));
        assertEquals(0, new BigDecimal("89").compareTo(metrics.getStopLoss()));
        assertEquals(KeyPointKind.TROUGH, pattern.getVisualization().getKeyPoints().get(0).getKind());

        // Only two swing highs, so no regular pattern
        assertTrue(detector.detect(candles, PatternKind.HEAD_AND_SHOULDERS).isEmpty());
    }

    @Test
    @DisplayName("Should return nothing for fewer than 15 candles")
    void testTooFewCandles() {
        List<Candle> candles = headAndShouldersCandles().subList(0, 14);

        assertTrue(detector.detect(candles, PatternKind.HEAD_AND_SHOULDERS).isEmpty());
    }

    @Test
    @DisplayName("Should reject kinds of other families")
    void testUnsupportedKind() {
        assertThrows(IllegalArgumentException.class,
            () -> detector.detect(headAndShouldersCandles(), PatternKind.DOUBLE_TOP));
    }

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
