package com.health.exception;

/**
 * 趋势分析错误类型
 * 所有错误均可由调用方恢复，不会导致进程退出
 */
public enum TrendAnalysisErrorType {

    INSUFFICIENT_DATA("TRD_001", "数据点不足"),
    INVALID_PERIOD("TRD_002", "无效的分析周期"),
    INVALID_TIMEFRAME("TRD_003", "无效的时间范围"),
    CALCULATION_FAILED("TRD_004", "计算失败");

    private final String code;
    private final String description;

    TrendAnalysisErrorType(String code, String description) {
        this.code = code;
        this.description = description;
    }

    public String getCode() {
        return code;
    }

    public String getDescription() {
        return description;
    }
}
