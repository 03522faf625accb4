package com.health.domain.enums;

import lombok.Getter;

/**
 * 趋势方向
 */
@Getter
public enum TrendDirection {

    INCREASING("上升", "upward"),
    DECREASING("下降", "downward"),
    STABLE("平稳", "stable"),
    /**
     * 波动过大，斜率不再具有参考意义
     */
    VOLATILE("剧烈波动", "volatile");

    private final String displayName;
    private final String label;

    TrendDirection(String displayName, String label) {
        this.displayName = displayName;
        this.label = label;
    }
}
