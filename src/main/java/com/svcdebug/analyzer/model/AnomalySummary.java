package com.svcdebug.analyzer.model;

import lombok.Builder;
import lombok.Value;

import java.util.List;
import java.util.Map;

@Value
@Builder
public class AnomalySummary {
    int totalAnomalies;
    Map<AnomalySeverity, Integer> bySeverity;   // high / medium / low 三个键始终存在
    Map<AnomalyKind, Integer> byKind;
    Map<EventSource, Integer> bySource;
    List<String> recommendations;
}
