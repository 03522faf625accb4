package com.health.domain.vo;

/**
 * 离散程度指标
 *
 * @param variance               样本方差（n-1）
 * @param standardDeviation      样本标准差
 * @param coefficientOfVariation 变异系数 std/|mean|，均值为0时取0
 * @param range                  极差
 * @param interquartileRange     四分位距
 */
public record VariabilityMetrics(
        double variance,
        double standardDeviation,
        double coefficientOfVariation,
        double range,
        double interquartileRange
) {

    private static final VariabilityMetrics EMPTY = new VariabilityMetrics(0, 0, 0, 0, 0);

    public static VariabilityMetrics empty() {
        return EMPTY;
    }
}
