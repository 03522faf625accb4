package com.health.domain.vo;

import com.health.domain.enums.DataQualityIssueSeverity;
import com.health.domain.enums.DataQualityIssueType;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class DataQualityIssue {
    DataQualityIssueType type;
    String description;
    DataQualityIssueSeverity severity;
    int affectedRecords;
    String suggestedAction;
}
