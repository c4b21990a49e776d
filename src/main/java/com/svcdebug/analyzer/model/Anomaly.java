package com.svcdebug.analyzer.model;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

import java.util.Map;

/**
 * 单个检测器产出的一条异常，创建后不可变。
 */
@Value
@Builder
public class Anomaly {

    @NonNull
    AnomalyKind kind;

    @NonNull
    AnomalySeverity severity;

    @NonNull
    EventSource source;

    /**
     * 与 kind 相关的指标，保持插入顺序：
     * timeWindow / errorRate / count / serviceId / pattern ...
     */
    @NonNull
    Map<String, Object> metrics;

    /** 一行人类可读描述 */
    @NonNull
    String description;
}
