package com.health.domain.vo;

import java.time.LocalDateTime;
import java.util.List;

import com.health.domain.enums.MetricType;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

/**
 * 趋势预测结果
 * 预测点均为未来日期，movingAverage为空，值不小于0
 */
@Value
@Builder
public class TrendPrediction {
    MetricType dataType;
    @Singular
    List<TrendPoint> predictedPoints;
    double confidence;
    String methodology;
    LocalDateTime validUntil;
}
