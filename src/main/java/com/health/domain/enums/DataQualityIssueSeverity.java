package com.health.domain.enums;

import lombok.Getter;

@Getter
public enum DataQualityIssueSeverity {

    LOW("轻微"),
    MEDIUM("中等"),
    HIGH("严重"),
    CRITICAL("危急");

    private final String displayName;

    DataQualityIssueSeverity(String displayName) {
        this.displayName = displayName;
    }
}
