package com.svcdebug.analyzer.model;

import com.fasterxml.jackson.annotation.JsonValue;

public enum AnomalyKind {
    ERROR_SPIKE("error_spike"),
    FREQUENCY_SPIKE("frequency_spike"),
    SOURCE_SILENCE("source_silence"),
    DUPLICATE_MESSAGE("duplicate_message"),
    SUSPICIOUS_PATTERN("suspicious_pattern");

    private final String wireName;

    AnomalyKind(String wireName) {
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
