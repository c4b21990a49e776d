package com.svcdebug.analyzer.model;

import lombok.Builder;
import lombok.Value;

/**
 * 一次分析的完整输出：
 * {
 *   correlation: { groups, statistics, timeline },
 *   anomalies:   { anomalies, summary },
 *   anomalyDigest: "ANOMALY DETECTION REPORT ..."
 * }
 * 每次调用新建，构造后不再修改。
 */
@Value
@Builder
public class AnalysisResult {
    /** 本次分析限定的服务；null 表示不过滤 */
    String serviceId;
    long timeWindowMs;
    int totalEvents;
    CorrelationResult correlation;
    AnomalyReport anomalies;
    String anomalyDigest;
}
