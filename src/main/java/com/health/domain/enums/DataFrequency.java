package com.health.domain.enums;

import java.time.Duration;

import lombok.Getter;

/**
 * 数据采集的预期频率，用于数据缺口识别
 */
@Getter
public enum DataFrequency {

    DAILY("每日", Duration.ofDays(1)),
    WEEKLY("每周", Duration.ofDays(7)),
    MONTHLY("每月", Duration.ofDays(30)),
    /**
     * 不定期采集，不报告缺口
     */
    IRREGULAR("不定期", null);

    private final String displayName;
    private final Duration expectedInterval;

    DataFrequency(String displayName, Duration expectedInterval) {
        this.displayName = displayName;
        this.expectedInterval = expectedInterval;
    }

    public boolean isRegular() {
        return expectedInterval != null;
    }

    public static DataFrequency fromName(String name) {
        for (DataFrequency frequency : values()) {
            if (frequency.name().equalsIgnoreCase(name)) {
                return frequency;
            }
        }
        throw new IllegalArgumentException("未知的采集频率: " + name);
    }
}
