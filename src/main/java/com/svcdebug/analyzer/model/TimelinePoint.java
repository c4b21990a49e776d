package com.svcdebug.analyzer.model;

import lombok.Builder;
import lombok.Value;

/**
 * 前端时间线使用的点：x 为时间，y 为关联组序号。
 */
@Value
@Builder
public class TimelinePoint {
    String x;
    int y;
    String text;
    String hoverText;
    EventSource source;
    String serviceId;
    int correlationId;
}
