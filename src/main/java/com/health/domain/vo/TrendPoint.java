package com.health.domain.vo;

import java.time.LocalDateTime;

import lombok.Builder;
import lombok.Value;

/**
 * 趋势序列中的单个点
 * movingAverage 仅从第 (windowSize-1) 个点开始存在
 */
@Value
@Builder(toBuilder = true)
public class TrendPoint {
    LocalDateTime timestamp;
    double value;
    Double movingAverage;
    boolean anomaly;
}
