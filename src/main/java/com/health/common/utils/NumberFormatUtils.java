package com.health.common.utils;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * 数值展示工具类
 * 统一控制台输出的精度和舍入规则
 */
public final class NumberFormatUtils {

    private static final int DEFAULT_SCALE = 2;
    private static final RoundingMode DEFAULT_ROUNDING_MODE = RoundingMode.HALF_UP;

    private NumberFormatUtils() {}

    /**
     * 按默认精度(2位)四舍五入
     */
    public static BigDecimal scale(double value) {
        return scale(value, DEFAULT_SCALE);
    }

    public static BigDecimal scale(double value, int scale) {
        if (Double.isNaN(value) || Double.isInfinite(value)) {
            return BigDecimal.ZERO.setScale(scale, DEFAULT_ROUNDING_MODE);
        }
        return BigDecimal.valueOf(value).setScale(scale, DEFAULT_ROUNDING_MODE);
    }

    /**
     * 比例值转为百分比文本，例如 0.8567 → "85.67%"
     */
    public static String percent(double ratio) {
        return scale(ratio * 100).toPlainString() + "%";
    }
}
