package com.health.service;

import java.util.List;

import com.health.domain.enums.DataFrequency;
import com.health.domain.enums.OutlierDetectionMethod;
import com.health.domain.enums.PredictionMethod;
import com.health.domain.enums.TimeRange;
import com.health.domain.enums.TrendDirection;
import com.health.domain.vo.AnomalyPoint;
import com.health.domain.vo.DataQualityAssessment;
import com.health.domain.vo.DateRange;
import com.health.domain.vo.LinearRegressionResult;
import com.health.domain.vo.Measurement;
import com.health.domain.vo.RegressionPoint;
import com.health.domain.vo.TimeWindow;
import com.health.domain.vo.TrendAnalysis;
import com.health.domain.vo.TrendPrediction;
import com.health.domain.vo.VariabilityMetrics;
import com.health.exception.TrendAnalysisException;

/**
 * 健康指标趋势分析接口
 * <p>
 * 汇总统计计算、异常检测、趋势分类、数据质量评估和趋势预测。
 * 实现必须是无状态的：每次调用相互独立，结果为新的不可变对象。
 * </p>
 */
public interface TrendAnalyzer {

    // ==================== 趋势分析 ====================

    /**
     * 分析指定时间窗口内的趋势
     *
     * @param measurements 测量序列，无需预先排序
     * @param window       时间窗口
     * @return 趋势分析结果
     * @throws TrendAnalysisException 输入为空或窗口内少于2个点时抛出 INSUFFICIENT_DATA，
     *                                窗口边界计算溢出时抛出 CALCULATION_FAILED
     */
    TrendAnalysis analyzeTrends(List<Measurement> measurements, TimeWindow window);

    /**
     * 分析最近一段预设时间范围内的趋势
     */
    default TrendAnalysis analyzeTrends(List<Measurement> measurements, TimeRange timeRange) {
        return analyzeTrends(measurements, TimeWindow.of(timeRange));
    }

    /**
     * 分析显式日期范围内的趋势，移动平均窗口按记录数自动推导
     */
    default TrendAnalysis analyzeTrends(List<Measurement> measurements, DateRange dateRange) {
        return analyzeTrends(measurements, TimeWindow.between(dateRange));
    }

    // ==================== 移动平均 ====================

    List<Double> calculateMovingAverage(List<Double> values, int windowSize);

    List<Double> calculateWeightedMovingAverage(List<Double> values, List<Double> weights);

    List<Double> calculateExponentialMovingAverage(List<Double> values, double alpha);

    // ==================== 异常检测 ====================

    /**
     * Z分数异常检测，少于3个点时返回空列表
     */
    List<AnomalyPoint> detectAnomalies(List<Measurement> measurements, double sensitivity);

    /**
     * 离群值检测，返回离群值下标；少于3个点时返回空列表
     */
    List<Integer> detectOutliers(List<Double> values, OutlierDetectionMethod method);

    // ==================== 趋势预测 ====================

    /**
     * 从最后一个趋势点出发做线性外推
     *
     * @param analysis  已完成的趋势分析
     * @param daysAhead 预测天数，必须为正
     * @throws TrendAnalysisException daysAhead 非正时抛出 INVALID_PERIOD，无趋势点时抛出 INSUFFICIENT_DATA
     */
    TrendPrediction predictTrend(TrendAnalysis analysis, int daysAhead);

    /**
     * 按指定方法预测 daysAhead 天后的单个值
     */
    double predictValue(List<Measurement> measurements, int daysAhead, PredictionMethod method);

    // ==================== 统计分析 ====================

    double calculateCorrelation(List<Double> firstSeries, List<Double> secondSeries);

    LinearRegressionResult calculateLinearRegression(List<RegressionPoint> points);

    VariabilityMetrics calculateVariability(List<Double> values);

    double calculateMedian(List<Double> values);

    // ==================== 趋势分类 ====================

    TrendDirection classifyTrend(List<Double> values, double threshold);

    double calculateTrendStrength(TrendAnalysis analysis);

    // ==================== 数据质量 ====================

    DataQualityAssessment assessDataQuality(List<Measurement> measurements);

    List<DateRange> identifyDataGaps(List<Measurement> measurements, DataFrequency expectedFrequency);
}
