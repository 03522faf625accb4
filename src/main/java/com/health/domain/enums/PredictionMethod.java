package com.health.domain.enums;

import lombok.Getter;

/**
 * 单值预测方法
 */
@Getter
public enum PredictionMethod {

    LINEAR_REGRESSION("linear-regression", "线性回归"),
    EXPONENTIAL_SMOOTHING("exponential-smoothing", "指数平滑"),
    MOVING_AVERAGE("moving-average", "移动平均"),
    SEASONAL_DECOMPOSITION("seasonal-decomposition", "季节分解");

    private final String code;
    private final String displayName;

    PredictionMethod(String code, String displayName) {
        this.code = code;
        this.displayName = displayName;
    }

    public static PredictionMethod fromCode(String code) {
        for (PredictionMethod method : values()) {
            if (method.code.equalsIgnoreCase(code) || method.name().equalsIgnoreCase(code)) {
                return method;
            }
        }
        throw new IllegalArgumentException("未知的预测方法: " + code);
    }
}
