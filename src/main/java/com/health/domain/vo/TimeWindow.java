package com.health.domain.vo;

import com.health.domain.enums.TimeRange;
import com.health.exception.TrendAnalysisException;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * 分析时间窗口
 * <p>
 * 两种形式二选一：
 * <ul>
 *   <li>相对窗口：从当前时间回溯 {@code days} 天，移动平均窗口由调用方指定</li>
 *   <li>显式窗口：指定 {@link DateRange}，移动平均窗口按记录数自动推导</li>
 * </ul>
 * </p>
 */
@Getter
@ToString
@EqualsAndHashCode
public final class TimeWindow {

    private final int days;
    private final int movingAverageWindow;
    private final DateRange dateRange;

    private TimeWindow(int days, int movingAverageWindow, DateRange dateRange) {
        this.days = days;
        this.movingAverageWindow = movingAverageWindow;
        this.dateRange = dateRange;
    }

    /**
     * 相对窗口
     *
     * @param days                回溯天数，必须为正
     * @param movingAverageWindow 移动平均窗口大小，必须为正
     */
    public static TimeWindow relative(int days, int movingAverageWindow) {
        if (days <= 0) {
            throw TrendAnalysisException.invalidPeriod("回溯天数必须为正数: " + days);
        }
        if (movingAverageWindow <= 0) {
            throw TrendAnalysisException.invalidPeriod("移动平均窗口必须为正数: " + movingAverageWindow);
        }
        return new TimeWindow(days, movingAverageWindow, null);
    }

    public static TimeWindow of(TimeRange timeRange) {
        if (timeRange == null) {
            throw TrendAnalysisException.invalidPeriod("时间范围不能为空");
        }
        return relative(timeRange.getDays(), timeRange.getMovingAverageWindow());
    }

    public static TimeWindow between(DateRange dateRange) {
        if (dateRange == null) {
            throw TrendAnalysisException.invalidTimeframe("日期范围不能为空");
        }
        return new TimeWindow(0, 0, dateRange);
    }

    public boolean isExplicit() {
        return dateRange != null;
    }
}
