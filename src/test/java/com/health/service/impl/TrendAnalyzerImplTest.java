package com.health.service.impl;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

import java.time.Clock;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import com.health.analysis.AnomalyDetector;
import com.health.analysis.StatisticsCalculator;
import com.health.analysis.TrendClassifier;
import com.health.common.utils.NumberFormatUtils;
import com.health.config.HealthTrendProperties;
import com.health.domain.enums.MetricType;
import com.health.domain.enums.PredictionMethod;
import com.health.domain.enums.TimeRange;
import com.health.domain.enums.TrendDirection;
import com.health.domain.vo.DateRange;
import com.health.domain.vo.Measurement;
import com.health.domain.vo.TimeWindow;
import com.health.domain.vo.TrendAnalysis;
import com.health.domain.vo.TrendPoint;
import com.health.domain.vo.TrendPrediction;
import com.health.domain.vo.TrendSummary;
import com.health.exception.TrendAnalysisErrorType;
import com.health.exception.TrendAnalysisException;

@DisplayName("趋势分析服务测试")
class TrendAnalyzerImplTest {

    private static final LocalDateTime NOW = LocalDateTime.of(2024, 1, 11, 8, 0);

    private TrendAnalyzerImpl trendAnalyzer;

    @BeforeEach
    void setUp() {
        trendAnalyzer = createAnalyzer(Clock.fixed(NOW.toInstant(ZoneOffset.UTC), ZoneOffset.UTC));
    }

    @Nested
    @DisplayName("趋势分析")
    class AnalyzeTrendsTests {

        @Test
        @DisplayName("严格递增的5天数据判定为上升趋势")
        void testIncreasingSeries() {
            List<Measurement> measurements = dailyWeights(NOW.minusDays(5), 68, 69, 70, 71, 72);

            TrendAnalysis analysis = trendAnalyzer.analyzeTrends(measurements, TimeRange.WEEK);

            assertThat(analysis.getDataType()).isEqualTo(MetricType.WEIGHT);
            assertThat(analysis.getDirection()).isEqualTo(TrendDirection.INCREASING);
            assertThat(analysis.getSlope()).isGreaterThan(0).isCloseTo(1.0, within(1e-9));
            assertThat(analysis.getCorrelation()).isCloseTo(1.0, within(1e-9));
            assertThat(analysis.getTrendPoints()).hasSize(5);
            assertThat(analysis.getAnomalies()).isEmpty();
            assertThat(analysis.getTimeRange()).isEqualTo(DateRange.of(NOW.minusDays(7), NOW));
        }

        @Test
        @DisplayName("汇总统计和置信度")
        void testSummaryAndConfidence() {
            List<Measurement> measurements = dailyWeights(NOW.minusDays(5), 68, 69, 70, 71, 72);

            TrendAnalysis analysis = trendAnalyzer.analyzeTrends(measurements, TimeRange.WEEK);

            TrendSummary summary = analysis.getSummary();
            assertThat(summary.getTotalDataPoints()).isEqualTo(5);
            assertThat(summary.getAverageValue()).isCloseTo(70.0, within(1e-9));
            assertThat(summary.getMinimumValue()).isEqualTo(68.0);
            assertThat(summary.getMaximumValue()).isEqualTo(72.0);
            assertThat(summary.getFirstValue()).isEqualTo(68.0);
            assertThat(summary.getLastValue()).isEqualTo(72.0);
            assertThat(summary.getStandardDeviation()).isCloseTo(Math.sqrt(2.5), within(1e-9));
            assertThat(summary.getChangePercentage()).isCloseTo(4.0 / 68 * 100, within(1e-9));

            // R² = 1，质量得分 = (3 + 29/30) / 4
            double quality = (3.0 + 29.0 / 30) / 4;
            assertThat(analysis.getConfidence()).isCloseTo((1.0 + quality) / 2, within(1e-9));
        }

        @Test
        @DisplayName("一周窗口的移动平均窗口为7，记录不足时没有均值")
        void testRelativeWindowMovingAverage() {
            List<Measurement> measurements = dailyWeights(NOW.minusDays(5), 68, 69, 70, 71, 72);

            TrendAnalysis analysis = trendAnalyzer.analyzeTrends(measurements, TimeRange.WEEK);

            assertThat(analysis.getTrendPoints()).allMatch(point -> point.getMovingAverage() == null);
        }

        @Test
        @DisplayName("显式范围按记录数推导窗口大小")
        void testExplicitRangeMovingAverage() {
            List<Measurement> measurements = dailyWeights(LocalDateTime.of(2023, 6, 1, 8, 0), 70, 71, 69, 72, 68);
            DateRange range = DateRange.of(LocalDateTime.of(2023, 6, 1, 0, 0), LocalDateTime.of(2023, 6, 30, 0, 0));

            TrendAnalysis analysis = trendAnalyzer.analyzeTrends(measurements, range);

            List<TrendPoint> points = analysis.getTrendPoints();
            assertThat(points.get(0).getMovingAverage()).isNull();
            assertThat(points.get(1).getMovingAverage()).isNull();
            assertThat(NumberFormatUtils.scale(points.get(2).getMovingAverage()).doubleValue()).isEqualTo(70.0);
            assertThat(NumberFormatUtils.scale(points.get(3).getMovingAverage()).doubleValue()).isEqualTo(70.67);
            assertThat(NumberFormatUtils.scale(points.get(4).getMovingAverage()).doubleValue()).isEqualTo(69.67);
            assertThat(analysis.getTimeRange()).isEqualTo(range);
        }

        @Test
        @DisplayName("异常点在趋势点上被标记")
        void testAnomalyFlagging() {
            List<Measurement> measurements = dailyWeights(NOW.minusDays(8), 70, 70, 70, 75, 70, 70, 70);

            TrendAnalysis analysis = trendAnalyzer.analyzeTrends(measurements, TimeRange.MONTH);

            assertThat(analysis.getAnomalies()).hasSize(1);
            assertThat(analysis.getAnomalies().get(0).getValue()).isEqualTo(75.0);
            List<TrendPoint> points = analysis.getTrendPoints();
            for (int i = 0; i < points.size(); i++) {
                assertThat(points.get(i).isAnomaly()).isEqualTo(i == 3);
            }
        }

        @Test
        @DisplayName("乱序输入按时间升序输出，窗口外的记录被过滤")
        void testSortingAndFiltering() {
            List<Measurement> measurements = new ArrayList<>(dailyWeights(NOW.minusDays(3), 70, 71, 72));
            Collections.reverse(measurements);
            measurements.add(Measurement.of(NOW.minusDays(20), 90, MetricType.WEIGHT));

            TrendAnalysis analysis = trendAnalyzer.analyzeTrends(measurements, TimeRange.WEEK);

            assertThat(analysis.getTrendPoints()).extracting(TrendPoint::getValue).containsExactly(70.0, 71.0, 72.0);
            assertThat(analysis.getSummary().getTotalDataPoints()).isEqualTo(3);
        }

        @Test
        @DisplayName("空记录抛出数据不足异常")
        void testEmptyRecords() {
            assertThatThrownBy(() -> trendAnalyzer.analyzeTrends(Collections.emptyList(), TimeRange.WEEK))
                    .isInstanceOf(TrendAnalysisException.class)
                    .hasFieldOrPropertyWithValue("errorType", TrendAnalysisErrorType.INSUFFICIENT_DATA);
        }

        @Test
        @DisplayName("窗口内少于2条记录抛出数据不足异常")
        void testTooFewInWindow() {
            List<Measurement> measurements = List.of(
                    Measurement.of(NOW.minusDays(1), 70, MetricType.WEIGHT),
                    Measurement.of(NOW.minusDays(60), 71, MetricType.WEIGHT));

            assertThatThrownBy(() -> trendAnalyzer.analyzeTrends(measurements, TimeRange.WEEK))
                    .isInstanceOf(TrendAnalysisException.class)
                    .hasFieldOrPropertyWithValue("errorType", TrendAnalysisErrorType.INSUFFICIENT_DATA);
        }

        @Test
        @DisplayName("窗口边界计算溢出时抛出计算失败异常")
        void testWindowOverflow() {
            LocalDateTime nearMin = LocalDateTime.MIN.plusDays(1);
            TrendAnalyzerImpl analyzer = createAnalyzer(Clock.fixed(nearMin.toInstant(ZoneOffset.UTC), ZoneOffset.UTC));
            List<Measurement> measurements = dailyWeights(NOW, 70, 71);

            assertThatThrownBy(() -> analyzer.analyzeTrends(measurements, TimeWindow.relative(30, 7)))
                    .isInstanceOf(TrendAnalysisException.class)
                    .hasFieldOrPropertyWithValue("errorType", TrendAnalysisErrorType.CALCULATION_FAILED);
        }

        @Test
        @DisplayName("按记录数推导移动平均窗口")
        void testDetermineOptimalWindowSize() {
            assertThat(trendAnalyzer.determineOptimalWindowSize(2)).isEqualTo(3);
            assertThat(trendAnalyzer.determineOptimalWindowSize(7)).isEqualTo(3);
            assertThat(trendAnalyzer.determineOptimalWindowSize(8)).isEqualTo(7);
            assertThat(trendAnalyzer.determineOptimalWindowSize(30)).isEqualTo(7);
            assertThat(trendAnalyzer.determineOptimalWindowSize(90)).isEqualTo(14);
            assertThat(trendAnalyzer.determineOptimalWindowSize(91)).isEqualTo(30);
        }
    }

    @Nested
    @DisplayName("趋势预测")
    class PredictionTests {

        @Test
        @DisplayName("从最后一个趋势点线性外推")
        void testPredictTrend() {
            TrendAnalysis analysis = trendAnalyzer.analyzeTrends(
                    dailyWeights(NOW.minusDays(5), 68, 69, 70, 71, 72), TimeRange.WEEK);

            TrendPrediction prediction = trendAnalyzer.predictTrend(analysis, 3);

            assertThat(prediction.getPredictedPoints()).hasSize(3);
            assertThat(prediction.getPredictedPoints()).extracting(TrendPoint::getValue)
                    .containsExactly(73.0, 74.0, 75.0);
            assertThat(prediction.getPredictedPoints()).extracting(TrendPoint::getTimestamp)
                    .containsExactly(NOW, NOW.plusDays(1), NOW.plusDays(2));
            assertThat(prediction.getPredictedPoints()).allMatch(p -> p.getMovingAverage() == null && !p.isAnomaly());
            assertThat(prediction.getConfidence()).isCloseTo(analysis.getConfidence() * 0.8, within(1e-9));
            assertThat(prediction.getMethodology()).isEqualTo("Linear Regression");
            assertThat(prediction.getValidUntil()).isEqualTo(NOW.plusDays(3));
            assertThat(prediction.getDataType()).isEqualTo(MetricType.WEIGHT);
        }

        @Test
        @DisplayName("预测值不小于0，置信度限制在 [0.1, 0.9]")
        void testPredictionClamping() {
            TrendAnalysis falling = manualAnalysis(5.0, -10.0, 0.05);
            TrendAnalysis overConfident = manualAnalysis(5.0, 1.0, 1.25);

            TrendPrediction fallingPrediction = trendAnalyzer.predictTrend(falling, 2);

            assertThat(fallingPrediction.getPredictedPoints()).extracting(TrendPoint::getValue).containsExactly(0.0, 0.0);
            assertThat(fallingPrediction.getConfidence()).isEqualTo(0.1);
            assertThat(trendAnalyzer.predictTrend(overConfident, 1).getConfidence()).isEqualTo(0.9);
        }

        @Test
        @DisplayName("预测天数为0时抛出无效周期异常")
        void testZeroDaysAhead() {
            TrendAnalysis analysis = manualAnalysis(70.0, 1.0, 0.5);

            assertThatThrownBy(() -> trendAnalyzer.predictTrend(analysis, 0))
                    .isInstanceOf(TrendAnalysisException.class)
                    .hasFieldOrPropertyWithValue("errorType", TrendAnalysisErrorType.INVALID_PERIOD);
            assertThatThrownBy(() -> trendAnalyzer.predictTrend(analysis, -3))
                    .isInstanceOf(TrendAnalysisException.class);
        }

        @Test
        @DisplayName("没有趋势点时抛出数据不足异常")
        void testEmptyTrendPoints() {
            TrendAnalysis analysis = TrendAnalysis.builder().dataType(MetricType.STEPS).confidence(0.5).build();

            assertThatThrownBy(() -> trendAnalyzer.predictTrend(analysis, 3))
                    .isInstanceOf(TrendAnalysisException.class)
                    .hasFieldOrPropertyWithValue("errorType", TrendAnalysisErrorType.INSUFFICIENT_DATA);
        }

        @Test
        @DisplayName("预测日期溢出时抛出计算失败异常")
        void testPredictionDateOverflow() {
            TrendAnalysis analysis = TrendAnalysis.builder()
                    .dataType(MetricType.WEIGHT)
                    .trendPoint(TrendPoint.builder().timestamp(LocalDateTime.MAX.minusDays(1)).value(70).build())
                    .confidence(0.5)
                    .build();

            assertThatThrownBy(() -> trendAnalyzer.predictTrend(analysis, 5))
                    .isInstanceOf(TrendAnalysisException.class)
                    .hasFieldOrPropertyWithValue("errorType", TrendAnalysisErrorType.CALCULATION_FAILED);
        }

        @Test
        @DisplayName("按不同方法预测单个值")
        void testPredictValue() {
            List<Measurement> measurements = dailyWeights(NOW.minusDays(5), 68, 69, 70, 71, 72);

            assertThat(trendAnalyzer.predictValue(measurements, 1, PredictionMethod.LINEAR_REGRESSION))
                    .isCloseTo(73.0, within(1e-9));
            assertThat(trendAnalyzer.predictValue(measurements, 3, PredictionMethod.LINEAR_REGRESSION))
                    .isCloseTo(75.0, within(1e-9));
            assertThat(trendAnalyzer.predictValue(measurements, 1, PredictionMethod.MOVING_AVERAGE))
                    .isCloseTo(70.0, within(1e-9));
            assertThat(trendAnalyzer.predictValue(measurements, 1, PredictionMethod.SEASONAL_DECOMPOSITION))
                    .isEqualTo(72.0);

            double expectedEma = 68;
            for (double v : new double[]{69, 70, 71, 72}) {
                expectedEma = 0.3 * v + 0.7 * expectedEma;
            }
            assertThat(trendAnalyzer.predictValue(measurements, 1, PredictionMethod.EXPONENTIAL_SMOOTHING))
                    .isCloseTo(expectedEma, within(1e-9));
        }

        @Test
        @DisplayName("单值预测的参数校验")
        void testPredictValueValidation() {
            assertThatThrownBy(() -> trendAnalyzer.predictValue(Collections.emptyList(), 1, PredictionMethod.MOVING_AVERAGE))
                    .isInstanceOf(TrendAnalysisException.class)
                    .hasFieldOrPropertyWithValue("errorType", TrendAnalysisErrorType.INSUFFICIENT_DATA);
            assertThatThrownBy(() -> trendAnalyzer.predictValue(dailyWeights(NOW, 70), 0, PredictionMethod.MOVING_AVERAGE))
                    .isInstanceOf(TrendAnalysisException.class)
                    .hasFieldOrPropertyWithValue("errorType", TrendAnalysisErrorType.INVALID_PERIOD);
        }
    }

    private static TrendAnalyzerImpl createAnalyzer(Clock clock) {
        StatisticsCalculator statisticsCalculator = new StatisticsCalculator();
        AnomalyDetector anomalyDetector = new AnomalyDetector(statisticsCalculator);
        HealthTrendProperties properties = new HealthTrendProperties();
        return new TrendAnalyzerImpl(
                statisticsCalculator,
                anomalyDetector,
                new TrendClassifier(statisticsCalculator, properties),
                new DataQualityServiceImpl(anomalyDetector, properties, clock),
                properties,
                clock);
    }

    private static TrendAnalysis manualAnalysis(double lastValue, double slope, double confidence) {
        return TrendAnalysis.builder()
                .dataType(MetricType.WEIGHT)
                .trendPoint(TrendPoint.builder().timestamp(NOW.minusDays(1)).value(lastValue).build())
                .slope(slope)
                .confidence(confidence)
                .build();
    }

    private static List<Measurement> dailyWeights(LocalDateTime start, double... values) {
        List<Measurement> measurements = new ArrayList<>();
        for (int i = 0; i < values.length; i++) {
            measurements.add(Measurement.of(start.plusDays(i), values[i], MetricType.WEIGHT));
        }
        return measurements;
    }
}
