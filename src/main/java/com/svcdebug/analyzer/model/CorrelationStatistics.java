package com.svcdebug.analyzer.model;

import lombok.Builder;
import lombok.Value;

import java.util.Set;

@Value
@Builder
public class CorrelationStatistics {
    int totalGroups;
    double avgEventsPerGroup;
    String mostActiveService;   // 没有任何组带 serviceId 时为 null
    String earliest;            // HH:mm:ss.SSS
    String latest;
    String timeRange;           // "earliest - latest"
    Set<EventSource> sourcesInvolved;
    int totalEvents;            // 包含没有时间戳的事件
    int timestampedEvents;
    int correlatedEvents;       // 出现在任意组中的不同事件数
    int groupMemberships;       // 各组 size 之和（事件可重复计）
    double correlationRate;     // correlatedEvents / timestampedEvents * 100
}
