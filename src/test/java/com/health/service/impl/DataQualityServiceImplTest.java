package com.health.service.impl;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

import java.time.Clock;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import com.health.analysis.AnomalyDetector;
import com.health.analysis.StatisticsCalculator;
import com.health.config.HealthTrendProperties;
import com.health.domain.enums.DataFrequency;
import com.health.domain.enums.DataQualityIssueSeverity;
import com.health.domain.enums.DataQualityIssueType;
import com.health.domain.enums.MetricType;
import com.health.domain.vo.DataQualityAssessment;
import com.health.domain.vo.DataQualityIssue;
import com.health.domain.vo.DateRange;
import com.health.domain.vo.Measurement;

@DisplayName("数据质量评估服务测试")
class DataQualityServiceImplTest {

    private static final LocalDateTime NOW = LocalDateTime.of(2024, 1, 11, 8, 0);

    private DataQualityServiceImpl dataQualityService;

    @BeforeEach
    void setUp() {
        Clock clock = Clock.fixed(NOW.toInstant(ZoneOffset.UTC), ZoneOffset.UTC);
        dataQualityService = new DataQualityServiceImpl(
                new AnomalyDetector(new StatisticsCalculator()), new HealthTrendProperties(), clock);
    }

    @Test
    @DisplayName("空数据返回全零评估")
    void testEmptyInput() {
        DataQualityAssessment assessment = dataQualityService.assessDataQuality(Collections.emptyList());

        assertThat(assessment.getOverallScore()).isEqualTo(0.0);
        assertThat(assessment.getCompleteness()).isEqualTo(0.0);
        assertThat(assessment.getIssues()).isEmpty();
    }

    @Test
    @DisplayName("连续且新鲜的数据得分接近满分")
    void testCleanData() {
        List<Measurement> measurements = dailyWeights(NOW.minusDays(10), 70, 70, 70, 70, 70, 70, 70, 70, 70, 70);

        DataQualityAssessment assessment = dataQualityService.assessDataQuality(measurements);

        assertThat(assessment.getCompleteness()).isEqualTo(1.0);
        assertThat(assessment.getConsistency()).isEqualTo(1.0);
        assertThat(assessment.getAccuracy()).isEqualTo(1.0);
        // 最新记录距今1天
        assertThat(assessment.getTimeliness()).isCloseTo(1.0 - 1.0 / 30, within(1e-9));
        assertThat(assessment.getOverallScore()).isCloseTo((3.0 + 1.0 - 1.0 / 30) / 4, within(1e-9));
        assertThat(assessment.hasIssues()).isFalse();
    }

    @Test
    @DisplayName("离群值超过10%时报告数据不一致")
    void testInconsistentData() {
        List<Measurement> measurements = dailyWeights(NOW.minusDays(6), 70, 70, 70, 70, 70, 150);

        DataQualityAssessment assessment = dataQualityService.assessDataQuality(measurements);

        assertThat(assessment.getConsistency()).isCloseTo(1.0 - 1.0 / 6, within(1e-9));
        DataQualityIssue issue = findIssue(assessment, DataQualityIssueType.INCONSISTENT_DATA);
        assertThat(issue.getSeverity()).isEqualTo(DataQualityIssueSeverity.MEDIUM);
        assertThat(issue.getAffectedRecords()).isEqualTo(1);
    }

    @Test
    @DisplayName("超出合理范围的数值降低准确性")
    void testImplausibleValues() {
        List<Measurement> measurements = dailyWeights(NOW.minusDays(4), 70, 0, 71, 600);

        DataQualityAssessment assessment = dataQualityService.assessDataQuality(measurements);

        assertThat(assessment.getAccuracy()).isCloseTo(0.5, within(1e-9));
        DataQualityIssue issue = findIssue(assessment, DataQualityIssueType.OUTLIER_DATA);
        assertThat(issue.getSeverity()).isEqualTo(DataQualityIssueSeverity.HIGH);
        assertThat(issue.getAffectedRecords()).isEqualTo(2);
    }

    @Test
    @DisplayName("最新数据超过7天时报告数据过期")
    void testStaleData() {
        List<Measurement> measurements = dailyWeights(NOW.minusDays(24), 70, 70, 70);

        DataQualityAssessment assessment = dataQualityService.assessDataQuality(measurements);

        // 最新记录距今22天
        assertThat(assessment.getTimeliness()).isCloseTo(1.0 - 22.0 / 30, within(1e-9));
        DataQualityIssue issue = findIssue(assessment, DataQualityIssueType.STALE_DATA);
        assertThat(issue.getAffectedRecords()).isEqualTo(1);
    }

    @Test
    @DisplayName("各项得分始终位于 [0, 1]")
    void testScoreBounds() {
        List<List<Measurement>> inputs = List.of(
                dailyWeights(NOW.minusYears(2), 70),
                dailyWeights(NOW.plusDays(5), 70, 71),
                dailyWeights(NOW.minusDays(3), -5, 0, 900),
                dailyWeights(NOW.minusDays(40), 70, 72, 65, 80, 71, 69, 90, 70, 68, 55, 300, 0));

        for (List<Measurement> measurements : inputs) {
            DataQualityAssessment assessment = dataQualityService.assessDataQuality(measurements);
            for (double score : new double[]{assessment.getCompleteness(), assessment.getConsistency(),
                    assessment.getAccuracy(), assessment.getTimeliness(), assessment.getOverallScore()}) {
                assertThat(score).isBetween(0.0, 1.0);
            }
        }
    }

    @Test
    @DisplayName("相隔10天的两条日数据产生一个缺口")
    void testDailyGap() {
        List<Measurement> measurements = List.of(
                Measurement.of(LocalDateTime.of(2024, 1, 11, 8, 0), 70, MetricType.WEIGHT),
                Measurement.of(LocalDateTime.of(2024, 1, 1, 8, 0), 70, MetricType.WEIGHT));

        List<DateRange> gaps = dataQualityService.identifyDataGaps(measurements, DataFrequency.DAILY);

        assertThat(gaps).containsExactly(DateRange.of(
                LocalDateTime.of(2024, 1, 2, 8, 0), LocalDateTime.of(2024, 1, 10, 8, 0)));
    }

    @Test
    @DisplayName("相隔1天的两条日数据没有缺口")
    void testNoDailyGap() {
        List<Measurement> measurements = dailyWeights(NOW.minusDays(2), 70, 71);

        assertThat(dataQualityService.identifyDataGaps(measurements, DataFrequency.DAILY)).isEmpty();
    }

    @Test
    @DisplayName("间隔不足两天时缺口区间为空，不报告")
    void testInvertedGapSkipped() {
        List<Measurement> measurements = List.of(
                Measurement.of(LocalDateTime.of(2024, 1, 1, 8, 0), 70, MetricType.WEIGHT),
                Measurement.of(LocalDateTime.of(2024, 1, 2, 20, 0), 70, MetricType.WEIGHT));

        assertThat(dataQualityService.identifyDataGaps(measurements, DataFrequency.DAILY)).isEmpty();
    }

    @Test
    @DisplayName("周频数据按10.5天容差检测缺口，不规则频率不检测")
    void testOtherFrequencies() {
        List<Measurement> measurements = List.of(
                Measurement.of(LocalDateTime.of(2024, 1, 1, 8, 0), 70, MetricType.WEIGHT),
                Measurement.of(LocalDateTime.of(2024, 1, 8, 8, 0), 70, MetricType.WEIGHT),
                Measurement.of(LocalDateTime.of(2024, 1, 22, 8, 0), 70, MetricType.WEIGHT));

        assertThat(dataQualityService.identifyDataGaps(measurements, DataFrequency.WEEKLY)).hasSize(1);
        assertThat(dataQualityService.identifyDataGaps(measurements, DataFrequency.IRREGULAR)).isEmpty();
        assertThat(dataQualityService.identifyDataGaps(measurements.subList(0, 1), DataFrequency.DAILY)).isEmpty();
    }

    private static DataQualityIssue findIssue(DataQualityAssessment assessment, DataQualityIssueType type) {
        return assessment.getIssues().stream()
                .filter(issue -> issue.getType() == type)
                .findFirst()
                .orElseThrow(() -> new AssertionError("未找到问题类型: " + type));
    }

    private static List<Measurement> dailyWeights(LocalDateTime start, double... values) {
        List<Measurement> measurements = new ArrayList<>();
        for (int i = 0; i < values.length; i++) {
            measurements.add(Measurement.of(start.plusDays(i), values[i], MetricType.WEIGHT));
        }
        return measurements;
    }
}
