package com.health.domain.vo;

import java.time.Duration;
import java.time.LocalDateTime;

import com.health.exception.TrendAnalysisException;

/**
 * 闭区间时间范围 [start, end]
 *
 * @param start 开始时间
 * @param end   结束时间，不得早于开始时间
 */
public record DateRange(LocalDateTime start, LocalDateTime end) {

    public DateRange {
        if (start == null || end == null) {
            throw TrendAnalysisException.invalidTimeframe("开始时间和结束时间不能为空");
        }
        if (start.isAfter(end)) {
            throw TrendAnalysisException.invalidTimeframe(
                    String.format("开始时间 %s 晚于结束时间 %s", start, end));
        }
    }

    public static DateRange of(LocalDateTime start, LocalDateTime end) {
        return new DateRange(start, end);
    }

    public boolean contains(LocalDateTime timestamp) {
        return !timestamp.isBefore(start) && !timestamp.isAfter(end);
    }

    public Duration duration() {
        return Duration.between(start, end);
    }
}
