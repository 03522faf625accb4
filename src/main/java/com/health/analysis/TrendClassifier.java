package com.health.analysis;

import java.util.List;

import org.springframework.stereotype.Component;

import com.health.config.HealthTrendProperties;
import com.health.domain.enums.TrendDirection;
import com.health.domain.vo.LinearRegressionResult;
import com.health.domain.vo.TrendAnalysis;
import com.health.domain.vo.TrendSummary;

import lombok.RequiredArgsConstructor;

/**
 * 趋势分类
 * <p>
 * 以下标为自变量做线性回归，斜率按序列均值归一化；
 * 变异系数超过波动阈值时，无论斜率如何均判定为剧烈波动；
 * 严格单调的序列按单调方向判定。
 * </p>
 */
@Component
@RequiredArgsConstructor
public class TrendClassifier {

    private static final double ANOMALY_PENALTY_WEIGHT = 0.1;
    private static final double STRONG_LEVEL = 0.8;
    private static final double MODERATE_LEVEL = 0.5;

    private final StatisticsCalculator statisticsCalculator;
    private final HealthTrendProperties properties;

    /**
     * 判定趋势方向
     *
     * @param values    按时间排序的数值序列
     * @param threshold |归一化斜率| 低于该值视为平稳
     * @return 趋势方向，少于2个点时为 {@link TrendDirection#STABLE}
     */
    public TrendDirection classifyTrend(List<Double> values, double threshold) {
        if (values == null || values.size() < 2) {
            return TrendDirection.STABLE;
        }

        LinearRegressionResult regression = statisticsCalculator.linearRegressionOverIndex(values);
        double mean = statisticsCalculator.mean(values);
        // 均值为0时无法归一化，直接使用原始斜率
        double normalizedSlope = mean == 0 ? regression.slope() : regression.slope() / mean;

        double volatility = statisticsCalculator.variability(values).coefficientOfVariation();
        if (volatility > properties.getVolatilityThreshold()) {
            return TrendDirection.VOLATILE;
        }

        // 严格单调的低波动序列直接按方向判定，不受斜率幅度影响
        int monotonicity = monotonicity(values);
        if (monotonicity > 0) {
            return TrendDirection.INCREASING;
        }
        if (monotonicity < 0) {
            return TrendDirection.DECREASING;
        }

        if (Math.abs(normalizedSlope) < threshold) {
            return TrendDirection.STABLE;
        }
        return normalizedSlope > 0 ? TrendDirection.INCREASING : TrendDirection.DECREASING;
    }

    /**
     * 趋势强度 [0, 1]
     * <p>
     * (|相关系数| + max(0, 1 - 标准差/均值)) / 2，再减去 异常点占比 × 0.1。
     * </p>
     */
    public double calculateTrendStrength(TrendAnalysis analysis) {
        TrendSummary summary = analysis.getSummary();
        if (summary == null || summary.getTotalDataPoints() == 0) {
            return 0.0;
        }

        double correlationStrength = Math.abs(analysis.getCorrelation());
        double consistencyScore = summary.getAverageValue() == 0
                ? 0.0
                : 1.0 - summary.getStandardDeviation() / summary.getAverageValue();
        double anomalyRatio = (double) analysis.getAnomalies().size() / summary.getTotalDataPoints();

        double strength = (correlationStrength + Math.max(0, consistencyScore)) / 2.0
                - anomalyRatio * ANOMALY_PENALTY_WEIGHT;
        return Math.max(0.0, Math.min(1.0, strength));
    }

    /**
     * @return 1 表示严格递增，-1 表示严格递减，0 表示非严格单调
     */
    private int monotonicity(List<Double> values) {
        boolean increasing = true;
        boolean decreasing = true;
        for (int i = 1; i < values.size(); i++) {
            double step = values.get(i) - values.get(i - 1);
            increasing &= step > 0;
            decreasing &= step < 0;
        }
        return increasing ? 1 : decreasing ? -1 : 0;
    }

    /**
     * 生成一句话的趋势描述
     *
     * @param label 时间段描述，例如 "一个月"
     */
    public String describeTrend(TrendDirection direction, double strength, double confidence, String label) {
        String strengthText = strength > STRONG_LEVEL ? "强" : strength > MODERATE_LEVEL ? "中等" : "弱";
        String confidenceText = confidence > STRONG_LEVEL ? "高" : confidence > MODERATE_LEVEL ? "中等" : "低";
        return String.format("%s内检测到%s的%s趋势，置信度%s", label, strengthText, direction.getDisplayName(), confidenceText);
    }
}
