package com.health.domain.vo;

import lombok.Builder;
import lombok.Value;

/**
 * 趋势汇总统计
 * changePercentage = (lastValue - firstValue) / firstValue * 100，首值为0时取0
 */
@Value
@Builder
public class TrendSummary {
    int totalDataPoints;
    double averageValue;
    double minimumValue;
    double maximumValue;
    double standardDeviation;
    double changePercentage;
    double firstValue;
    double lastValue;

    public static TrendSummary empty() {
        return TrendSummary.builder().build();
    }
}
