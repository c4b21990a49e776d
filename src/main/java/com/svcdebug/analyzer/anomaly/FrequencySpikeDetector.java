package com.svcdebug.analyzer.anomaly;

import com.svcdebug.analyzer.config.AnalyzerProperties;
import com.svcdebug.analyzer.model.*;
import org.springframework.stereotype.Component;

import java.util.*;

/**
 * 按 (serviceId, 分钟) 计数，某服务最忙的那一分钟远高于它自己的平均值时报 frequency_spike。
 * 没有 serviceId 的事件不参与分组。
 */
@Component
public class FrequencySpikeDetector implements AnomalyDetector {

    private final AnalyzerProperties.Anomaly cfg;

    public FrequencySpikeDetector(AnalyzerProperties properties) {
        this.cfg = properties.getAnomaly();
    }

    @Override
    public AnomalyKind kind() {
        return AnomalyKind.FREQUENCY_SPIKE;
    }

    @Override
    public List<Anomaly> detect(EventSource source, List<UnifiedEvent> events) {
        Map<String, Map<String, Integer>> perService = new LinkedHashMap<>();
        for (UnifiedEvent e : events) {
            if (!e.hasServiceId()) {
                continue;
            }
            perService.computeIfAbsent(e.getServiceId(), k -> new LinkedHashMap<>())
                    .merge(DetectorSupport.minuteKey(e, cfg.getBucketMode()), 1, Integer::sum);
        }

        List<Anomaly> found = new ArrayList<>();
        for (var entry : perService.entrySet()) {
            Map<String, Integer> buckets = entry.getValue();
            // 只有一个桶时没有“平均值”可比
            if (buckets.size() < 2) {
                continue;
            }

            double avg = buckets.values().stream().mapToInt(Integer::intValue).average().orElse(0.0);
            String busiest = null;
            int max = -1;
            for (var b : buckets.entrySet()) {
                if (b.getValue() > max) {
                    max = b.getValue();
                    busiest = b.getKey();
                }
            }

            if (max > avg * cfg.getFrequencySpikeMultiplier() && max > cfg.getFrequencySpikeMinCount()) {
                String serviceId = entry.getKey();
                Map<String, Object> metrics = new LinkedHashMap<>();
                metrics.put("serviceId", serviceId);
                metrics.put("timeWindow", busiest);
                metrics.put("messageCount", max);
                metrics.put("averageCount", DetectorSupport.round2(avg));

                found.add(Anomaly.builder()
                        .kind(AnomalyKind.FREQUENCY_SPIKE)
                        .severity(AnomalySeverity.MEDIUM)
                        .source(source)
                        .metrics(Collections.unmodifiableMap(metrics))
                        .description(String.format(Locale.ROOT,
                                "Message frequency spike for %s in %s: %d messages (avg: %.1f)",
                                serviceId, source, max, avg))
                        .build());
            }
        }
        return found;
    }
}
