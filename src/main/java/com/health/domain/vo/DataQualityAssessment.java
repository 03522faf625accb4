package com.health.domain.vo;

import java.util.List;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

/**
 * 数据质量评估结果
 * 四个分项得分及综合得分均位于 [0, 1]，综合得分为四项的算术平均
 */
@Value
@Builder
public class DataQualityAssessment {

    double completeness;
    double consistency;
    double accuracy;
    double timeliness;
    double overallScore;

    @Singular
    List<DataQualityIssue> issues;

    /**
     * 空数据对应的全零评估
     */
    public static DataQualityAssessment empty() {
        return DataQualityAssessment.builder().build();
    }

    public boolean hasIssues() {
        return !issues.isEmpty();
    }

    /**
     * 获取中文摘要
     */
    public String getChineseSummary() {
        StringBuilder sb = new StringBuilder();
        sb.append(String.format("综合质量得分: %.2f\n", overallScore));
        sb.append(String.format("完整性: %.2f  一致性: %.2f  准确性: %.2f  时效性: %.2f\n",
                completeness, consistency, accuracy, timeliness));
        for (DataQualityIssue issue : issues) {
            sb.append(String.format("[%s] %s (影响 %d 条记录) 建议: %s\n",
                    issue.getSeverity().getDisplayName(), issue.getDescription(),
                    issue.getAffectedRecords(), issue.getSuggestedAction()));
        }
        return sb.toString();
    }
}
