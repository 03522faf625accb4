package com.health.service.impl;

import java.time.Clock;
import java.time.DateTimeException;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.stream.Collectors;

import org.springframework.stereotype.Service;

import com.health.analysis.AnomalyDetector;
import com.health.analysis.StatisticsCalculator;
import com.health.analysis.TrendClassifier;
import com.health.config.HealthTrendProperties;
import com.health.domain.enums.DataFrequency;
import com.health.domain.enums.OutlierDetectionMethod;
import com.health.domain.enums.PredictionMethod;
import com.health.domain.enums.TrendDirection;
import com.health.domain.vo.AnomalyPoint;
import com.health.domain.vo.DataQualityAssessment;
import com.health.domain.vo.DateRange;
import com.health.domain.vo.LinearRegressionResult;
import com.health.domain.vo.Measurement;
import com.health.domain.vo.RegressionPoint;
import com.health.domain.vo.TimeWindow;
import com.health.domain.vo.TrendAnalysis;
import com.health.domain.vo.TrendPoint;
import com.health.domain.vo.TrendPrediction;
import com.health.domain.vo.TrendSummary;
import com.health.domain.vo.VariabilityMetrics;
import com.health.exception.TrendAnalysisException;
import com.health.service.DataQualityService;
import com.health.service.TrendAnalyzer;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * 趋势分析服务实现
 * <p>
 * 流程：按窗口过滤并排序 → 计算移动平均 → 线性回归 → 趋势分类 →
 * 异常检测 → 汇总统计 → 置信度（R² 与数据质量得分的平均）。
 * </p>
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class TrendAnalyzerImpl implements TrendAnalyzer {

    private static final String LINEAR_REGRESSION_METHODOLOGY = "Linear Regression";
    private static final double EXPONENTIAL_SMOOTHING_ALPHA = 0.3;
    private static final int PREDICTION_MOVING_AVERAGE_WINDOW = 7;

    private final StatisticsCalculator statisticsCalculator;
    private final AnomalyDetector anomalyDetector;
    private final TrendClassifier trendClassifier;
    private final DataQualityService dataQualityService;
    private final HealthTrendProperties properties;
    private final Clock clock;

    @Override
    public TrendAnalysis analyzeTrends(List<Measurement> measurements, TimeWindow window) {
        long startTime = System.currentTimeMillis();

        if (measurements == null || measurements.isEmpty()) {
            throw TrendAnalysisException.insufficientData("测量记录不能为空");
        }
        if (window == null) {
            throw TrendAnalysisException.invalidPeriod("时间窗口不能为空");
        }

        try {
            DateRange dateRange = resolveDateRange(window);

            List<Measurement> sorted = measurements.stream()
                    .filter(m -> dateRange.contains(m.getTimestamp()))
                    .sorted(Comparator.comparing(Measurement::getTimestamp))
                    .collect(Collectors.toList());

            if (sorted.size() < 2) {
                throw TrendAnalysisException.insufficientData(
                        String.format("时间范围 %s ~ %s 内仅有 %d 条记录，至少需要2条",
                                dateRange.start(), dateRange.end(), sorted.size()));
            }

            int windowSize = window.isExplicit()
                    ? determineOptimalWindowSize(sorted.size())
                    : window.getMovingAverageWindow();

            List<Double> values = sorted.stream().map(Measurement::getValue).collect(Collectors.toList());
            LinearRegressionResult regression = statisticsCalculator.linearRegressionOverIndex(values);
            TrendDirection direction = trendClassifier.classifyTrend(values, properties.getClassificationThreshold());
            List<AnomalyPoint> anomalies = anomalyDetector.detectAnomalies(sorted, properties.getAnomalySensitivity());
            List<TrendPoint> trendPoints = calculateTrendPoints(sorted, values, windowSize, anomalies);
            TrendSummary summary = calculateTrendSummary(values);
            DataQualityAssessment quality = dataQualityService.assessDataQuality(sorted);
            double confidence = (regression.rSquared() + quality.getOverallScore()) / 2.0;

            log.debug("回归结果: slope={}, correlation={}, rSquared={}, windowSize={}",
                    regression.slope(), regression.correlation(), regression.rSquared(), windowSize);

            TrendAnalysis analysis = TrendAnalysis.builder()
                    .dataType(sorted.get(0).getMetricType())
                    .timeRange(dateRange)
                    .trendPoints(trendPoints)
                    .direction(direction)
                    .slope(regression.slope())
                    .correlation(regression.correlation())
                    .anomalies(anomalies)
                    .summary(summary)
                    .confidence(confidence)
                    .build();

            log.info("趋势分析完成: dataType={}, records={}, direction={}, confidence={}, 耗时={}ms",
                    analysis.getDataType(), sorted.size(), direction,
                    String.format("%.3f", confidence), System.currentTimeMillis() - startTime);
            return analysis;

        } catch (TrendAnalysisException e) {
            log.warn("趋势分析失败: {}, 耗时={}ms", e.getMessage(), System.currentTimeMillis() - startTime);
            throw e;
        }
    }

    @Override
    public List<Double> calculateMovingAverage(List<Double> values, int windowSize) {
        return statisticsCalculator.movingAverage(values, windowSize);
    }

    @Override
    public List<Double> calculateWeightedMovingAverage(List<Double> values, List<Double> weights) {
        return statisticsCalculator.weightedMovingAverage(values, weights);
    }

    @Override
    public List<Double> calculateExponentialMovingAverage(List<Double> values, double alpha) {
        return statisticsCalculator.exponentialMovingAverage(values, alpha);
    }

    @Override
    public List<AnomalyPoint> detectAnomalies(List<Measurement> measurements, double sensitivity) {
        return anomalyDetector.detectAnomalies(measurements, sensitivity);
    }

    @Override
    public List<Integer> detectOutliers(List<Double> values, OutlierDetectionMethod method) {
        return anomalyDetector.detectOutliers(values, method);
    }

    @Override
    public TrendPrediction predictTrend(TrendAnalysis analysis, int daysAhead) {
        if (daysAhead <= 0) {
            throw TrendAnalysisException.invalidPeriod("预测天数必须为正数: " + daysAhead);
        }
        if (analysis == null || analysis.getTrendPoints().isEmpty()) {
            throw TrendAnalysisException.insufficientData("趋势点为空，无法预测");
        }

        TrendPoint lastPoint = analysis.getTrendPoints().get(analysis.getTrendPoints().size() - 1);
        List<TrendPoint> predictedPoints = new ArrayList<>(daysAhead);
        LocalDateTime validUntil;
        try {
            for (int day = 1; day <= daysAhead; day++) {
                double predictedValue = lastPoint.getValue() + analysis.getSlope() * day;
                predictedPoints.add(TrendPoint.builder()
                        .timestamp(lastPoint.getTimestamp().plusDays(day))
                        .value(Math.max(0, predictedValue))
                        .movingAverage(null)
                        .anomaly(false)
                        .build());
            }
            validUntil = LocalDateTime.now(clock).plusDays(daysAhead);
        } catch (DateTimeException | ArithmeticException e) {
            throw TrendAnalysisException.calculationFailed("无法计算预测日期", e);
        }

        double confidence = Math.max(properties.getMinimumPredictionConfidence(),
                Math.min(properties.getMaximumPredictionConfidence(),
                        analysis.getConfidence() * properties.getPredictionConfidenceFactor()));

        log.info("趋势预测完成: dataType={}, daysAhead={}, confidence={}",
                analysis.getDataType(), daysAhead, String.format("%.3f", confidence));

        return TrendPrediction.builder()
                .dataType(analysis.getDataType())
                .predictedPoints(predictedPoints)
                .confidence(confidence)
                .methodology(LINEAR_REGRESSION_METHODOLOGY)
                .validUntil(validUntil)
                .build();
    }

    @Override
    public double predictValue(List<Measurement> measurements, int daysAhead, PredictionMethod method) {
        if (measurements == null || measurements.isEmpty()) {
            throw TrendAnalysisException.insufficientData("测量记录不能为空");
        }
        if (daysAhead <= 0) {
            throw TrendAnalysisException.invalidPeriod("预测天数必须为正数: " + daysAhead);
        }

        List<Double> values = measurements.stream()
                .sorted(Comparator.comparing(Measurement::getTimestamp))
                .map(Measurement::getValue)
                .collect(Collectors.toList());
        double lastValue = values.get(values.size() - 1);

        switch (method) {
            case LINEAR_REGRESSION:
                return statisticsCalculator.linearRegressionOverIndex(values)
                        .predictValue(values.size() + daysAhead - 1);
            case EXPONENTIAL_SMOOTHING:
                return lastOrDefault(statisticsCalculator.exponentialMovingAverage(values, EXPONENTIAL_SMOOTHING_ALPHA), lastValue);
            case MOVING_AVERAGE:
                int windowSize = Math.min(PREDICTION_MOVING_AVERAGE_WINDOW, values.size());
                return lastOrDefault(statisticsCalculator.movingAverage(values, windowSize), lastValue);
            case SEASONAL_DECOMPOSITION:
                // 简化实现：未做季节分解，返回最新值
                return lastValue;
            default:
                throw TrendAnalysisException.invalidPeriod("不支持的预测方法: " + method);
        }
    }

    @Override
    public double calculateCorrelation(List<Double> firstSeries, List<Double> secondSeries) {
        return statisticsCalculator.correlation(firstSeries, secondSeries);
    }

    @Override
    public LinearRegressionResult calculateLinearRegression(List<RegressionPoint> points) {
        return statisticsCalculator.linearRegression(points);
    }

    @Override
    public VariabilityMetrics calculateVariability(List<Double> values) {
        return statisticsCalculator.variability(values);
    }

    @Override
    public double calculateMedian(List<Double> values) {
        return statisticsCalculator.median(values);
    }

    @Override
    public TrendDirection classifyTrend(List<Double> values, double threshold) {
        return trendClassifier.classifyTrend(values, threshold);
    }

    @Override
    public double calculateTrendStrength(TrendAnalysis analysis) {
        return trendClassifier.calculateTrendStrength(analysis);
    }

    @Override
    public DataQualityAssessment assessDataQuality(List<Measurement> measurements) {
        return dataQualityService.assessDataQuality(measurements);
    }

    @Override
    public List<DateRange> identifyDataGaps(List<Measurement> measurements, DataFrequency expectedFrequency) {
        return dataQualityService.identifyDataGaps(measurements, expectedFrequency);
    }

    // ==================== 私有辅助方法 ====================

    private DateRange resolveDateRange(TimeWindow window) {
        if (window.isExplicit()) {
            return window.getDateRange();
        }
        try {
            LocalDateTime end = LocalDateTime.now(clock);
            return DateRange.of(end.minusDays(window.getDays()), end);
        } catch (DateTimeException | ArithmeticException e) {
            throw TrendAnalysisException.calculationFailed("无法根据时间窗口计算开始日期", e);
        }
    }

    /**
     * 根据记录数推导移动平均窗口
     */
    int determineOptimalWindowSize(int recordCount) {
        if (recordCount <= 7) {
            return Math.max(3, recordCount / 3);
        } else if (recordCount <= 30) {
            return 7;
        } else if (recordCount <= 90) {
            return 14;
        }
        return 30;
    }

    private List<TrendPoint> calculateTrendPoints(List<Measurement> sorted, List<Double> values, int windowSize,
                                                  List<AnomalyPoint> anomalies) {
        List<Double> movingAverages = statisticsCalculator.movingAverage(values, windowSize);

        List<TrendPoint> points = new ArrayList<>(sorted.size());
        for (int i = 0; i < sorted.size(); i++) {
            Measurement measurement = sorted.get(i);
            Double movingAverage = !movingAverages.isEmpty() && i >= windowSize - 1
                    ? movingAverages.get(i - windowSize + 1)
                    : null;
            points.add(TrendPoint.builder()
                    .timestamp(measurement.getTimestamp())
                    .value(measurement.getValue())
                    .movingAverage(movingAverage)
                    .anomaly(isAnomaly(measurement, anomalies))
                    .build());
        }
        return points;
    }

    private boolean isAnomaly(Measurement measurement, List<AnomalyPoint> anomalies) {
        return anomalies.stream().anyMatch(a -> a.getTimestamp().equals(measurement.getTimestamp())
                && Double.compare(a.getValue(), measurement.getValue()) == 0);
    }

    private TrendSummary calculateTrendSummary(List<Double> values) {
        if (values.isEmpty()) {
            return TrendSummary.empty();
        }

        double firstValue = values.get(0);
        double lastValue = values.get(values.size() - 1);
        double changePercentage = firstValue == 0 ? 0 : (lastValue - firstValue) / firstValue * 100;

        return TrendSummary.builder()
                .totalDataPoints(values.size())
                .averageValue(statisticsCalculator.mean(values))
                .minimumValue(values.stream().mapToDouble(Double::doubleValue).min().orElse(0))
                .maximumValue(values.stream().mapToDouble(Double::doubleValue).max().orElse(0))
                .standardDeviation(statisticsCalculator.sampleStandardDeviation(values))
                .changePercentage(changePercentage)
                .firstValue(firstValue)
                .lastValue(lastValue)
                .build();
    }

    private static double lastOrDefault(List<Double> values, double defaultValue) {
        return values.isEmpty() ? defaultValue : values.get(values.size() - 1);
    }
}
