package com.svcdebug.analyzer.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * 严重级别。声明顺序就是文本摘要里的输出顺序：high → medium → low。
 */
public enum AnomalySeverity {
    HIGH("high"),
    MEDIUM("medium"),
    LOW("low");

    private final String wireName;

    AnomalySeverity(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }

    @Override
    public String toString() {
        return wireName;
    }
}
