package com.svcdebug.analyzer.model;

import lombok.Builder;
import lombok.Value;

import java.util.List;

@Value
@Builder
public class CorrelationResult {
    List<CorrelationGroup> groups;
    CorrelationStatistics statistics;
    List<TimelinePoint> timeline;
}
