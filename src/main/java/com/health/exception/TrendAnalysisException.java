package com.health.exception;

/**
 * 趋势分析异常
 * 通过 {@link TrendAnalysisErrorType} 区分失败类型，调用方可据此决定如何处理
 */
public class TrendAnalysisException extends RuntimeException {

    private final TrendAnalysisErrorType errorType;

    public TrendAnalysisException(TrendAnalysisErrorType errorType, String message) {
        super(String.format("[%s] %s: %s", errorType.getCode(), errorType.getDescription(), message));
        this.errorType = errorType;
    }

    public TrendAnalysisException(TrendAnalysisErrorType errorType, String message, Throwable cause) {
        super(String.format("[%s] %s: %s", errorType.getCode(), errorType.getDescription(), message), cause);
        this.errorType = errorType;
    }

    public TrendAnalysisErrorType getErrorType() {
        return errorType;
    }

    /**
     * 数据点不足
     */
    public static TrendAnalysisException insufficientData(String message) {
        return new TrendAnalysisException(TrendAnalysisErrorType.INSUFFICIENT_DATA, message);
    }

    /**
     * 分析周期参数非法
     */
    public static TrendAnalysisException invalidPeriod(String message) {
        return new TrendAnalysisException(TrendAnalysisErrorType.INVALID_PERIOD, message);
    }

    /**
     * 时间范围非法（例如开始时间晚于结束时间）
     */
    public static TrendAnalysisException invalidTimeframe(String message) {
        return new TrendAnalysisException(TrendAnalysisErrorType.INVALID_TIMEFRAME, message);
    }

    /**
     * 计算失败（带异常）
     */
    public static TrendAnalysisException calculationFailed(String reason, Throwable cause) {
        return new TrendAnalysisException(TrendAnalysisErrorType.CALCULATION_FAILED, reason, cause);
    }
}
