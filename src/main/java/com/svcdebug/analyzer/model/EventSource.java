package com.svcdebug.analyzer.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * 事件来源：由哪个采集器产生。
 * 顺序即合并顺序（log → trace → capture → other），时间相同的事件按这个顺序排。
 */
public enum EventSource {
    LOG("log"),
    TRACE("trace"),
    CAPTURE("capture"),
    OTHER("other");

    private final String wireName;

    EventSource(String wireName) {
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
