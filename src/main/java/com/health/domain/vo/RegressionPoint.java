package com.health.domain.vo;

/**
 * 回归输入点
 *
 * @param x 自变量
 * @param y 因变量
 */
public record RegressionPoint(double x, double y) {
}
