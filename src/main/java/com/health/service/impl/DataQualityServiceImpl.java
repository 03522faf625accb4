package com.health.service.impl;

import java.time.Clock;
import java.time.Duration;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.stream.Collectors;

import org.springframework.stereotype.Service;

import com.health.analysis.AnomalyDetector;
import com.health.config.HealthTrendProperties;
import com.health.domain.enums.DataFrequency;
import com.health.domain.enums.DataQualityIssueSeverity;
import com.health.domain.enums.DataQualityIssueType;
import com.health.domain.enums.OutlierDetectionMethod;
import com.health.domain.vo.DataQualityAssessment;
import com.health.domain.vo.DataQualityIssue;
import com.health.domain.vo.DateRange;
import com.health.domain.vo.Measurement;
import com.health.service.DataQualityService;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

@Service
@Slf4j
@RequiredArgsConstructor
public class DataQualityServiceImpl implements DataQualityService {

    private static final double GAP_TOLERANCE_FACTOR = 1.5;
    private static final double MILLIS_PER_DAY = Duration.ofDays(1).toMillis();

    private final AnomalyDetector anomalyDetector;
    private final HealthTrendProperties properties;
    private final Clock clock;

    @Override
    public DataQualityAssessment assessDataQuality(List<Measurement> measurements) {
        if (measurements == null || measurements.isEmpty()) {
            return DataQualityAssessment.empty();
        }
        log.debug("开始评估数据质量: count={}", measurements.size());

        int total = measurements.size();
        DataQualityAssessment.DataQualityAssessmentBuilder builder = DataQualityAssessment.builder();

        // 完整性：只统计已存在的记录
        double completeness = 1.0;

        // 一致性
        List<Double> values = measurements.stream().map(Measurement::getValue).collect(Collectors.toList());
        int outlierCount = anomalyDetector.detectOutliers(values, OutlierDetectionMethod.Z_SCORE).size();
        double consistency = 1.0 - (double) outlierCount / total;
        if (outlierCount > total * properties.getOutlierRatioWarning()) {
            builder.issue(DataQualityIssue.builder()
                    .type(DataQualityIssueType.INCONSISTENT_DATA)
                    .description("离群值数量过多")
                    .severity(DataQualityIssueSeverity.MEDIUM)
                    .affectedRecords(outlierCount)
                    .suggestedAction("检查数据采集流程")
                    .build());
        }

        // 准确性
        long implausibleCount = measurements.stream()
                .filter(m -> !m.getMetricType().isPlausible(m.getValue()))
                .count();
        double accuracy = 1.0 - (double) implausibleCount / total;
        if (implausibleCount > 0) {
            builder.issue(DataQualityIssue.builder()
                    .type(DataQualityIssueType.OUTLIER_DATA)
                    .description("存在超出合理范围的数值")
                    .severity(DataQualityIssueSeverity.HIGH)
                    .affectedRecords((int) implausibleCount)
                    .suggestedAction("核对设备校准和手工录入数据")
                    .build());
        }

        // 时效性
        LocalDateTime latest = measurements.stream()
                .map(Measurement::getTimestamp)
                .max(Comparator.naturalOrder())
                .orElseThrow();
        double daysSinceLatest = Duration.between(latest, LocalDateTime.now(clock)).toMillis() / MILLIS_PER_DAY;
        double timeliness = clamp(1.0 - daysSinceLatest / properties.getTimelinessHorizonDays());
        if (daysSinceLatest > properties.getStaleDataDays()) {
            builder.issue(DataQualityIssue.builder()
                    .type(DataQualityIssueType.STALE_DATA)
                    .description(String.format("最新数据已超过 %d 天", properties.getStaleDataDays()))
                    .severity(DataQualityIssueSeverity.MEDIUM)
                    .affectedRecords(1)
                    .suggestedAction("提高数据采集频率")
                    .build());
        }

        double overallScore = (completeness + consistency + accuracy + timeliness) / 4.0;

        DataQualityAssessment assessment = builder
                .completeness(completeness)
                .consistency(consistency)
                .accuracy(accuracy)
                .timeliness(timeliness)
                .overallScore(overallScore)
                .build();
        log.debug("数据质量评估完成: overall={}, issues={}", overallScore, assessment.getIssues().size());
        return assessment;
    }

    @Override
    public List<DateRange> identifyDataGaps(List<Measurement> measurements, DataFrequency expectedFrequency) {
        if (measurements == null || measurements.size() < 2 || !expectedFrequency.isRegular()) {
            return Collections.emptyList();
        }
        log.debug("开始查找数据缺口: count={}, frequency={}", measurements.size(), expectedFrequency);

        List<Measurement> sorted = measurements.stream()
                .sorted(Comparator.comparing(Measurement::getTimestamp))
                .collect(Collectors.toList());
        double toleratedMillis = expectedFrequency.getExpectedInterval().toMillis() * GAP_TOLERANCE_FACTOR;

        List<DateRange> gaps = new ArrayList<>();
        for (int i = 0; i < sorted.size() - 1; i++) {
            LocalDateTime current = sorted.get(i).getTimestamp();
            LocalDateTime next = sorted.get(i + 1).getTimestamp();

            if (Duration.between(current, next).toMillis() > toleratedMillis) {
                LocalDateTime gapStart = current.plusDays(1);
                LocalDateTime gapEnd = next.minusDays(1);
                // 间隔不足两天时两端相交，不构成有效区间
                if (gapStart.isAfter(gapEnd)) {
                    continue;
                }
                gaps.add(DateRange.of(gapStart, gapEnd));
            }
        }
        return gaps;
    }

    private static double clamp(double value) {
        return Math.max(0.0, Math.min(1.0, value));
    }
}
