package com.health.domain.enums;

import lombok.Getter;

@Getter
public enum DataQualityIssueType {

    MISSING_DATA("数据缺失"),
    DUPLICATE_DATA("重复数据"),
    INCONSISTENT_DATA("数据不一致"),
    OUTLIER_DATA("超出合理范围"),
    STALE_DATA("数据过期");

    private final String displayName;

    DataQualityIssueType(String displayName) {
        this.displayName = displayName;
    }
}
