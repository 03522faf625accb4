package com.health.domain.vo;

/**
 * 最小二乘线性回归结果
 *
 * @param slope         斜率
 * @param intercept     截距
 * @param correlation   皮尔逊相关系数 [-1, 1]
 * @param rSquared      决定系数，等于 correlation 的平方
 * @param standardError 残差标准误 sqrt(SSR / (n - 2))
 */
public record LinearRegressionResult(
        double slope,
        double intercept,
        double correlation,
        double rSquared,
        double standardError
) {

    private static final LinearRegressionResult EMPTY = new LinearRegressionResult(0, 0, 0, 0, 0);

    /**
     * 数据不足时的退化结果
     */
    public static LinearRegressionResult empty() {
        return EMPTY;
    }

    public double predictValue(double x) {
        return slope * x + intercept;
    }
}
