package com.health.analysis;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import org.apache.commons.math3.stat.correlation.PearsonsCorrelation;
import org.apache.commons.math3.stat.regression.SimpleRegression;
import org.springframework.stereotype.Component;

import com.health.domain.vo.LinearRegressionResult;
import com.health.domain.vo.RegressionPoint;
import com.health.domain.vo.VariabilityMetrics;

/**
 * 统计基础计算
 * <p>
 * 所有方法均为纯函数：不修改入参，不依赖外部状态。
 * 数据量不足时返回约定的退化值（空列表或全零结果），不抛出异常。
 * </p>
 */
@Component
public class StatisticsCalculator {

    /**
     * 简单移动平均
     *
     * @param values     原始序列
     * @param windowSize 窗口大小
     * @return 长度为 {@code values.size() - windowSize + 1} 的均值序列；窗口非法时为空
     */
    public List<Double> movingAverage(List<Double> values, int windowSize) {
        if (values == null || values.isEmpty() || windowSize <= 0 || windowSize > values.size()) {
            return Collections.emptyList();
        }

        List<Double> averages = new ArrayList<>(values.size() - windowSize + 1);
        for (int i = windowSize - 1; i < values.size(); i++) {
            double windowSum = 0;
            for (int j = i - windowSize + 1; j <= i; j++) {
                windowSum += values.get(j);
            }
            averages.add(windowSum / windowSize);
        }
        return averages;
    }

    /**
     * 加权平均
     *
     * @return 仅含一个元素 Σ(v·w)/Σw 的列表；长度不一致、为空或权重和不为正时返回空列表
     */
    public List<Double> weightedMovingAverage(List<Double> values, List<Double> weights) {
        if (values == null || weights == null || values.isEmpty() || values.size() != weights.size()) {
            return Collections.emptyList();
        }

        double weightSum = 0;
        double weightedSum = 0;
        for (int i = 0; i < values.size(); i++) {
            weightSum += weights.get(i);
            weightedSum += values.get(i) * weights.get(i);
        }
        if (weightSum <= 0) {
            return Collections.emptyList();
        }
        return List.of(weightedSum / weightSum);
    }

    /**
     * 指数移动平均，首个输出等于首个输入
     *
     * @param alpha 平滑系数，要求 0 < alpha <= 1
     */
    public List<Double> exponentialMovingAverage(List<Double> values, double alpha) {
        if (values == null || values.isEmpty() || alpha <= 0 || alpha > 1) {
            return Collections.emptyList();
        }

        List<Double> ema = new ArrayList<>(values.size());
        ema.add(values.get(0));
        for (int i = 1; i < values.size(); i++) {
            ema.add(alpha * values.get(i) + (1 - alpha) * ema.get(i - 1));
        }
        return ema;
    }

    /**
     * 最小二乘线性回归
     * <p>
     * 少于2个点或自变量无变化时返回全零结果。
     * 因变量恒定时相关系数与 R² 取0；恰好2个点时残差自由度为0，标准误取0。
     * </p>
     */
    public LinearRegressionResult linearRegression(List<RegressionPoint> points) {
        if (points == null || points.size() < 2) {
            return LinearRegressionResult.empty();
        }

        SimpleRegression regression = new SimpleRegression();
        for (RegressionPoint p : points) {
            regression.addData(p.x(), p.y());
        }

        double slope = regression.getSlope();
        if (Double.isNaN(slope)) {
            return LinearRegressionResult.empty();
        }

        double correlation = zeroIfNaN(regression.getR());
        double rSquared = zeroIfNaN(regression.getRSquare());
        double standardError = points.size() > 2 ? Math.sqrt(zeroIfNaN(regression.getMeanSquareError())) : 0;

        return new LinearRegressionResult(slope, regression.getIntercept(), correlation, rSquared, standardError);
    }

    /**
     * 以下标为自变量的回归，x = 0, 1, 2, ...
     */
    public LinearRegressionResult linearRegressionOverIndex(List<Double> values) {
        List<RegressionPoint> points = new ArrayList<>(values.size());
        for (int i = 0; i < values.size(); i++) {
            points.add(new RegressionPoint(i, values.get(i)));
        }
        return linearRegression(points);
    }

    /**
     * 皮尔逊相关系数
     * 长度不一致、少于2个元素或任一序列方差为0时返回0
     */
    public double correlation(List<Double> first, List<Double> second) {
        if (first == null || second == null || first.size() < 2 || first.size() != second.size()) {
            return 0.0;
        }
        double coefficient = new PearsonsCorrelation().correlation(toArray(first), toArray(second));
        return zeroIfNaN(coefficient);
    }

    /**
     * 离散程度指标
     * 四分位使用排序后 floor(0.25n) 与 floor(0.75n) 位置的元素
     */
    public VariabilityMetrics variability(List<Double> values) {
        if (values == null || values.isEmpty()) {
            return VariabilityMetrics.empty();
        }

        double mean = mean(values);
        double variance = sampleVariance(values, mean);
        double standardDeviation = Math.sqrt(variance);
        double coefficientOfVariation = mean == 0 ? 0 : standardDeviation / Math.abs(mean);

        List<Double> sorted = sorted(values);
        double range = sorted.get(sorted.size() - 1) - sorted.get(0);
        double interquartileRange = sorted.get(upperQuartileIndex(sorted.size()))
                - sorted.get(lowerQuartileIndex(sorted.size()));

        return new VariabilityMetrics(variance, standardDeviation, coefficientOfVariation, range, interquartileRange);
    }

    /**
     * 中位数，偶数个元素时取中间两个的平均；空序列返回0
     */
    public double median(List<Double> values) {
        if (values == null || values.isEmpty()) {
            return 0.0;
        }
        List<Double> sorted = sorted(values);
        int count = sorted.size();
        if (count % 2 == 0) {
            return (sorted.get(count / 2 - 1) + sorted.get(count / 2)) / 2;
        }
        return sorted.get(count / 2);
    }

    public double mean(List<Double> values) {
        if (values == null || values.isEmpty()) {
            return 0.0;
        }
        double sum = 0;
        for (double v : values) {
            sum += v;
        }
        return sum / values.size();
    }

    /**
     * 样本标准差（n-1），少于2个元素时为0
     */
    public double sampleStandardDeviation(List<Double> values) {
        if (values == null || values.size() < 2) {
            return 0.0;
        }
        return Math.sqrt(sampleVariance(values, mean(values)));
    }

    int lowerQuartileIndex(int size) {
        return (int) Math.floor(size * 0.25);
    }

    int upperQuartileIndex(int size) {
        return (int) Math.floor(size * 0.75);
    }

    List<Double> sorted(List<Double> values) {
        List<Double> sorted = new ArrayList<>(values);
        Collections.sort(sorted);
        return sorted;
    }

    private double sampleVariance(List<Double> values, double mean) {
        if (values.size() < 2) {
            return 0.0;
        }
        double sumSquares = 0;
        for (double v : values) {
            sumSquares += (v - mean) * (v - mean);
        }
        return sumSquares / (values.size() - 1);
    }

    private static double[] toArray(List<Double> values) {
        return values.stream().mapToDouble(Double::doubleValue).toArray();
    }

    private static double zeroIfNaN(double value) {
        return Double.isNaN(value) ? 0.0 : value;
    }
}
