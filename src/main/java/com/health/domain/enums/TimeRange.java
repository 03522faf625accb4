package com.health.domain.enums;

import lombok.Getter;

/**
 * 预设的相对时间范围
 * 每个范围对应回溯天数和移动平均窗口大小
 */
@Getter
public enum TimeRange {

    WEEK("一周", 7, 7),
    MONTH("一个月", 30, 7),
    QUARTER("一个季度", 90, 14),
    YEAR("一年", 365, 30);

    private final String displayName;
    private final int days;
    private final int movingAverageWindow;

    TimeRange(String displayName, int days, int movingAverageWindow) {
        this.displayName = displayName;
        this.days = days;
        this.movingAverageWindow = movingAverageWindow;
    }

    public static TimeRange fromName(String name) {
        for (TimeRange range : values()) {
            if (range.name().equalsIgnoreCase(name)) {
                return range;
            }
        }
        throw new IllegalArgumentException("未知的时间范围: " + name);
    }
}
