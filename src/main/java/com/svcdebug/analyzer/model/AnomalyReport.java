package com.svcdebug.analyzer.model;

import lombok.Builder;
import lombok.Value;

import java.util.List;

@Value
@Builder
public class AnomalyReport {
    List<Anomaly> anomalies;
    AnomalySummary summary;
}
