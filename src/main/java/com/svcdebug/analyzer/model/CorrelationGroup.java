package com.svcdebug.analyzer.model;

import lombok.Builder;
import lombok.Value;

import java.util.List;
import java.util.Set;

/**
 * 一个关联组：时间窗内被判定为相关的一组事件（至少 2 个）。
 */
@Value
@Builder
public class CorrelationGroup {

    /** 本次分析内唯一，按发现顺序从 1 开始 */
    int id;

    /** 按时间排序的成员 */
    List<UnifiedEvent> events;

    /** 最早与最晚成员之间的毫秒数 */
    double timeSpanMs;

    Set<EventSource> sourcesInvolved;

    /** 只包含非 null 的 serviceId */
    Set<String> serviceIdsInvolved;

    /** 关联强度 [0.0, 1.0] */
    double strength;

    public int size() {
        return events.size();
    }
}
