package com.health.domain.vo;

import java.time.LocalDateTime;

import com.health.domain.enums.AnomalySeverity;

import lombok.Builder;
import lombok.Value;

/**
 * 异常点
 */
@Value
@Builder
public class AnomalyPoint {
    LocalDateTime timestamp;
    double value;
    /**
     * 序列均值
     */
    double expectedValue;
    /**
     * Z分数（非负）
     */
    double deviationScore;
    AnomalySeverity severity;
}
