package com.health.domain.enums;

import lombok.Getter;

/**
 * 异常点严重程度
 * <p>
 * 按Z分数分档，阈值单调递增：
 * LOW [2.0, 2.5), MEDIUM [2.5, 3.0), HIGH [3.0, 4.0), CRITICAL [4.0, ∞)。
 * 低于2.0的Z分数（仅在调用方使用更低灵敏度时出现）归入LOW。
 * </p>
 */
@Getter
public enum AnomalySeverity {

    LOW("轻微", 2.0),
    MEDIUM("中等", 2.5),
    HIGH("严重", 3.0),
    CRITICAL("危急", 4.0);

    private final String displayName;

    /**
     * 该档位的Z分数下限
     */
    private final double threshold;

    AnomalySeverity(String displayName, double threshold) {
        this.displayName = displayName;
        this.threshold = threshold;
    }

    /**
     * 根据Z分数确定严重程度，Z分数越高档位不会越低
     *
     * @param zScore 偏离程度（非负）
     * @return 严重程度
     */
    public static AnomalySeverity fromZScore(double zScore) {
        if (zScore >= CRITICAL.threshold) {
            return CRITICAL;
        }
        if (zScore >= HIGH.threshold) {
            return HIGH;
        }
        if (zScore >= MEDIUM.threshold) {
            return MEDIUM;
        }
        return LOW;
    }
}
