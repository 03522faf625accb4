package com.health.domain.vo;

import java.time.LocalDateTime;

import com.health.domain.enums.MetricType;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * 单条健康测量记录
 * 由调用方提供，分析过程中只读
 */
@Value
@Builder
@Jacksonized
public class Measurement {

    @NonNull
    LocalDateTime timestamp;

    double value;

    @NonNull
    MetricType metricType;

    public static Measurement of(LocalDateTime timestamp, double value, MetricType metricType) {
        return Measurement.builder()
                .timestamp(timestamp)
                .value(value)
                .metricType(metricType)
                .build();
    }
}
