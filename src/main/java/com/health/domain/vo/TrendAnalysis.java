package com.health.domain.vo;

import java.util.List;

import com.health.domain.enums.MetricType;
import com.health.domain.enums.TrendDirection;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

/**
 * 趋势分析结果
 * 每次调用生成新的不可变快照
 */
@Value
@Builder
public class TrendAnalysis {
    MetricType dataType;
    DateRange timeRange;
    @Singular
    List<TrendPoint> trendPoints;
    TrendDirection direction;
    double slope;
    double correlation;
    @Singular
    List<AnomalyPoint> anomalies;
    TrendSummary summary;
    /**
     * 置信度 [0, 1]
     */
    double confidence;
}
