package com.health.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * 趋势分析引擎参数
 * <p>
 * 默认值即引擎的固定默认参数，可通过 {@code health.trend.*} 覆盖。
 * </p>
 */
@Data
@ConfigurationProperties(prefix = "health.trend")
public class HealthTrendProperties {

    /**
     * 趋势平稳判定阈值（归一化斜率）
     */
    private double classificationThreshold = 0.1;

    /**
     * 异常检测灵敏度（Z分数阈值）
     */
    private double anomalySensitivity = 2.0;

    /**
     * 变异系数超过该值时判定为剧烈波动
     */
    private double volatilityThreshold = 0.3;

    /**
     * 最新数据超过该天数视为过期
     */
    private int staleDataDays = 7;

    /**
     * 时效性得分衰减到0所需的天数
     */
    private int timelinessHorizonDays = 30;

    /**
     * 离群值比例超过该值时报告不一致问题
     */
    private double outlierRatioWarning = 0.1;

    /**
     * 预测置信度衰减系数
     */
    private double predictionConfidenceFactor = 0.8;

    private double minimumPredictionConfidence = 0.1;

    private double maximumPredictionConfidence = 0.9;
}
