package com.svcdebug.analyzer.anomaly;

import com.svcdebug.analyzer.model.*;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.*;

/**
 * 异常检测入口：对每个来源跑全部检测器，然后汇总成 AnomalyReport。
 *
 * 检测器之间互不依赖，按 {@link AnomalyKind} 的声明顺序执行，保证输出顺序稳定。
 * 每次调用都返回新的结果对象，不在实例上累积状态。
 */
@Component
@Slf4j
public class AnomalyEngine {

    static final String REC_NORMAL = "No anomalies detected. System appears to be operating normally.";
    static final String REC_HIGH = "High severity anomalies detected - immediate attention required";
    static final String REC_ERROR_SPIKE = "Investigate error spikes - check system logs and service health";
    static final String REC_FREQUENCY = "Monitor message frequency patterns - possible performance issues";
    static final String REC_SILENCE = "Check silent services - they may have stopped or crashed";
    static final String REC_MINOR = "Minor anomalies detected - monitor for trends";

    private final List<AnomalyDetector> detectors;

    public AnomalyEngine(List<AnomalyDetector> detectors) {
        List<AnomalyDetector> ordered = new ArrayList<>(detectors);
        ordered.sort(Comparator.comparing(AnomalyDetector::kind));
        this.detectors = List.copyOf(ordered);
    }

    public AnomalyReport detect(Map<EventSource, List<UnifiedEvent>> eventsBySource) {
        List<Anomaly> anomalies = new ArrayList<>();

        for (AnomalyDetector detector : detectors) {
            for (EventSource source : EventSource.values()) {
                List<UnifiedEvent> events = eventsBySource == null ? null : eventsBySource.get(source);
                // 空来源直接跳过，不算错误
                if (events == null || events.isEmpty()) {
                    continue;
                }
                List<Anomaly> found = detector.detect(source, events);
                if (!found.isEmpty()) {
                    log.debug("{} found {} anomalies in {}", detector.kind(), found.size(), source);
                }
                anomalies.addAll(found);
            }
        }

        return AnomalyReport.builder()
                .anomalies(List.copyOf(anomalies))
                .summary(summarize(anomalies))
                .build();
    }

    public static AnomalySummary summarize(List<Anomaly> anomalies) {
        Map<AnomalySeverity, Integer> bySeverity = new EnumMap<>(AnomalySeverity.class);
        for (AnomalySeverity s : AnomalySeverity.values()) {
            bySeverity.put(s, 0);
        }
        Map<AnomalyKind, Integer> byKind = new EnumMap<>(AnomalyKind.class);
        Map<EventSource, Integer> bySource = new EnumMap<>(EventSource.class);

        for (Anomaly a : anomalies) {
            bySeverity.merge(a.getSeverity(), 1, Integer::sum);
            byKind.merge(a.getKind(), 1, Integer::sum);
            bySource.merge(a.getSource(), 1, Integer::sum);
        }

        return AnomalySummary.builder()
                .totalAnomalies(anomalies.size())
                .bySeverity(Collections.unmodifiableMap(bySeverity))
                .byKind(Collections.unmodifiableMap(byKind))
                .bySource(Collections.unmodifiableMap(bySource))
                .recommendations(recommend(anomalies.isEmpty(), bySeverity, byKind))
                .build();
    }

    private static List<String> recommend(boolean none,
                                          Map<AnomalySeverity, Integer> bySeverity,
                                          Map<AnomalyKind, Integer> byKind) {
        if (none) {
            return List.of(REC_NORMAL);
        }

        List<String> recs = new ArrayList<>();
        if (bySeverity.get(AnomalySeverity.HIGH) > 0) {
            recs.add(REC_HIGH);
        }
        if (byKind.containsKey(AnomalyKind.ERROR_SPIKE)) {
            recs.add(REC_ERROR_SPIKE);
        }
        if (byKind.containsKey(AnomalyKind.FREQUENCY_SPIKE)) {
            recs.add(REC_FREQUENCY);
        }
        if (byKind.containsKey(AnomalyKind.SOURCE_SILENCE)) {
            recs.add(REC_SILENCE);
        }
        if (recs.isEmpty()) {
            recs.add(REC_MINOR);
        }
        return List.copyOf(recs);
    }
}
