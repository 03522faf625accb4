package com.health.domain.enums;

import com.fasterxml.jackson.annotation.JsonCreator;
import lombok.Getter;

/**
 * 健康指标类型枚举
 * 每种指标携带显示名称、单位以及合理取值范围，用于数据准确性评估
 */
@Getter
public enum MetricType {

    /**
     * 体重，必须为正值
     */
    WEIGHT("体重", "kg", 0, 500, false),

    /**
     * 步数
     */
    STEPS("步数", "步", 0, 100000, true),

    /**
     * 消耗热量
     */
    CALORIES("热量", "kcal", 0, 10000, true),

    /**
     * 心率
     */
    HEART_RATE("心率", "bpm", 30, 220, true),

    /**
     * 血糖
     */
    BLOOD_GLUCOSE("血糖", "mg/dL", 0, 600, true);

    /**
     * 中文名称
     */
    private final String displayName;

    /**
     * 计量单位
     */
    private final String unit;

    /**
     * 合理范围下限
     */
    private final double minimumPlausible;

    /**
     * 合理范围上限（含）
     */
    private final double maximumPlausible;

    /**
     * 下限是否为闭区间
     */
    private final boolean lowerBoundInclusive;

    MetricType(String displayName, String unit, double minimumPlausible, double maximumPlausible,
               boolean lowerBoundInclusive) {
        this.displayName = displayName;
        this.unit = unit;
        this.minimumPlausible = minimumPlausible;
        this.maximumPlausible = maximumPlausible;
        this.lowerBoundInclusive = lowerBoundInclusive;
    }

    /**
     * 判断数值是否处于该指标的合理范围内
     *
     * @param value 测量值
     * @return 合理返回true
     */
    public boolean isPlausible(double value) {
        boolean aboveMinimum = lowerBoundInclusive ? value >= minimumPlausible : value > minimumPlausible;
        return aboveMinimum && value <= maximumPlausible;
    }

    /**
     * 根据名称解析指标类型，兼容 heartRate / heart-rate / HEART_RATE 等写法
     *
     * @param name 指标名称
     * @return 指标类型
     * @throws IllegalArgumentException 无法识别时抛出
     */
    @JsonCreator
    public static MetricType fromName(String name) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("指标类型不能为空");
        }
        String normalized = name.trim()
                .replaceAll("([a-z])([A-Z])", "$1_$2")
                .replace('-', '_')
                .toUpperCase();
        for (MetricType type : values()) {
            if (type.name().equals(normalized)) {
                return type;
            }
        }
        throw new IllegalArgumentException("未知的指标类型: " + name);
    }
}
