package com.health.domain.enums;

import lombok.Getter;

/**
 * 离群值检测方法
 */
@Getter
public enum OutlierDetectionMethod {

    Z_SCORE("z-score", "Z分数法"),
    IQR("iqr", "四分位距法"),
    MODIFIED_Z_SCORE("modified-z-score", "修正Z分数法"),
    /**
     * 目前以Z分数法作为基线实现，并非真正的孤立森林
     */
    ISOLATION("isolation", "孤立法");

    private final String code;
    private final String displayName;

    OutlierDetectionMethod(String code, String displayName) {
        this.code = code;
        this.displayName = displayName;
    }

    public static OutlierDetectionMethod fromCode(String code) {
        for (OutlierDetectionMethod method : values()) {
            if (method.code.equalsIgnoreCase(code) || method.name().equalsIgnoreCase(code)) {
                return method;
            }
        }
        throw new IllegalArgumentException("未知的离群值检测方法: " + code);
    }
}
