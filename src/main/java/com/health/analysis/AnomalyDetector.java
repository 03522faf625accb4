package com.health.analysis;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;

import org.springframework.stereotype.Component;

import com.health.domain.enums.AnomalySeverity;
import com.health.domain.enums.OutlierDetectionMethod;
import com.health.domain.vo.AnomalyPoint;
import com.health.domain.vo.Measurement;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * 异常点与离群值检测
 * <p>
 * 所有检测至少需要3个数据点，不足时返回空结果。
 * </p>
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class AnomalyDetector {

    private static final int MINIMUM_POINTS = 3;
    private static final double Z_SCORE_OUTLIER_THRESHOLD = 2.0;
    private static final double IQR_MULTIPLIER = 1.5;
    private static final double MODIFIED_Z_SCORE_CONSTANT = 0.6745;
    private static final double MODIFIED_Z_SCORE_THRESHOLD = 3.5;

    private final StatisticsCalculator statisticsCalculator;

    /**
     * 基于Z分数的异常点检测
     *
     * @param measurements 测量序列
     * @param sensitivity  Z分数阈值，{@code zScore >= sensitivity} 即判定为异常
     * @return 异常点列表，按输入顺序排列
     */
    public List<AnomalyPoint> detectAnomalies(List<Measurement> measurements, double sensitivity) {
        if (measurements == null || measurements.size() < MINIMUM_POINTS) {
            return Collections.emptyList();
        }

        List<Double> values = measurements.stream().map(Measurement::getValue).collect(Collectors.toList());
        double mean = statisticsCalculator.mean(values);
        double standardDeviation = statisticsCalculator.sampleStandardDeviation(values);
        if (standardDeviation == 0) {
            log.debug("序列无波动，跳过异常检测: count={}", measurements.size());
            return Collections.emptyList();
        }

        List<AnomalyPoint> anomalies = new ArrayList<>();
        for (Measurement measurement : measurements) {
            double zScore = Math.abs(measurement.getValue() - mean) / standardDeviation;
            if (zScore >= sensitivity) {
                anomalies.add(AnomalyPoint.builder()
                        .timestamp(measurement.getTimestamp())
                        .value(measurement.getValue())
                        .expectedValue(mean)
                        .deviationScore(zScore)
                        .severity(AnomalySeverity.fromZScore(zScore))
                        .build());
            }
        }

        log.debug("异常检测完成: count={}, anomalies={}, sensitivity={}",
                measurements.size(), anomalies.size(), sensitivity);
        return anomalies;
    }

    /**
     * 按指定方法检测离群值
     *
     * @return 离群值在输入序列中的下标
     */
    public List<Integer> detectOutliers(List<Double> values, OutlierDetectionMethod method) {
        if (values == null || values.size() < MINIMUM_POINTS) {
            return Collections.emptyList();
        }

        switch (method) {
            case Z_SCORE:
                return detectOutliersZScore(values);
            case IQR:
                return detectOutliersIqr(values);
            case MODIFIED_Z_SCORE:
                return detectOutliersModifiedZScore(values);
            case ISOLATION:
                // 简化实现：以Z分数法作为基线
                return detectOutliersZScore(values);
            default:
                throw new IllegalArgumentException("不支持的离群值检测方法: " + method);
        }
    }

    private List<Integer> detectOutliersZScore(List<Double> values) {
        double mean = statisticsCalculator.mean(values);
        double standardDeviation = statisticsCalculator.sampleStandardDeviation(values);
        if (standardDeviation == 0) {
            return Collections.emptyList();
        }

        List<Integer> outliers = new ArrayList<>();
        for (int i = 0; i < values.size(); i++) {
            double zScore = Math.abs(values.get(i) - mean) / standardDeviation;
            if (zScore >= Z_SCORE_OUTLIER_THRESHOLD) {
                outliers.add(i);
            }
        }
        return outliers;
    }

    private List<Integer> detectOutliersIqr(List<Double> values) {
        List<Double> sorted = statisticsCalculator.sorted(values);
        double q1 = sorted.get(statisticsCalculator.lowerQuartileIndex(sorted.size()));
        double q3 = sorted.get(statisticsCalculator.upperQuartileIndex(sorted.size()));
        double iqr = q3 - q1;

        double lowerBound = q1 - IQR_MULTIPLIER * iqr;
        double upperBound = q3 + IQR_MULTIPLIER * iqr;

        List<Integer> outliers = new ArrayList<>();
        for (int i = 0; i < values.size(); i++) {
            double value = values.get(i);
            if (value < lowerBound || value > upperBound) {
                outliers.add(i);
            }
        }
        return outliers;
    }

    private List<Integer> detectOutliersModifiedZScore(List<Double> values) {
        double median = statisticsCalculator.median(values);
        List<Double> deviations = values.stream()
                .map(v -> Math.abs(v - median))
                .collect(Collectors.toList());
        double medianAbsoluteDeviation = statisticsCalculator.median(deviations);

        List<Integer> outliers = new ArrayList<>();
        for (int i = 0; i < values.size(); i++) {
            double deviation = values.get(i) - median;
            if (medianAbsoluteDeviation == 0) {
                // MAD为0时，偏离中位数的值得分无穷大
                if (deviation != 0) {
                    outliers.add(i);
                }
                continue;
            }
            double modifiedZScore = MODIFIED_Z_SCORE_CONSTANT * deviation / medianAbsoluteDeviation;
            if (Math.abs(modifiedZScore) >= MODIFIED_Z_SCORE_THRESHOLD) {
                outliers.add(i);
            }
        }
        return outliers;
    }
}
