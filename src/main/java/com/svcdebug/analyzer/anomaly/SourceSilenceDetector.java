package com.svcdebug.analyzer.anomaly;

import com.svcdebug.analyzer.config.AnalyzerProperties;
import com.svcdebug.analyzer.model.*;
import org.springframework.stereotype.Component;

import java.util.*;

/**
 * 某个服务在观测集合里几乎没出声（条数太少），可能已经挂了。
 * 只看本次输入，不依赖历史基线。
 */
@Component
public class SourceSilenceDetector implements AnomalyDetector {

    private final AnalyzerProperties.Anomaly cfg;

    public SourceSilenceDetector(AnalyzerProperties properties) {
        this.cfg = properties.getAnomaly();
    }

    @Override
    public AnomalyKind kind() {
        return AnomalyKind.SOURCE_SILENCE;
    }

    @Override
    public List<Anomaly> detect(EventSource source, List<UnifiedEvent> events) {
        Map<String, Integer> counts = new LinkedHashMap<>();
        for (UnifiedEvent e : events) {
            if (e.hasServiceId()) {
                counts.merge(e.getServiceId(), 1, Integer::sum);
            }
        }

        List<Anomaly> found = new ArrayList<>();
        counts.forEach((serviceId, count) -> {
            if (count >= cfg.getSilenceMaxMessages()) {
                return;
            }
            Map<String, Object> metrics = new LinkedHashMap<>();
            metrics.put("serviceId", serviceId);
            metrics.put("messageCount", count);

            found.add(Anomaly.builder()
                    .kind(AnomalyKind.SOURCE_SILENCE)
                    .severity(AnomalySeverity.LOW)
                    .source(source)
                    .metrics(Collections.unmodifiableMap(metrics))
                    .description(String.format(Locale.ROOT,
                            "Service %s in %s has very few messages (%d)", serviceId, source, count))
                    .build());
        });
        return found;
    }
}
