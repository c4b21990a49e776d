package com.svcdebug.analyzer.anomaly;

import com.svcdebug.analyzer.config.AnalyzerProperties;
import com.svcdebug.analyzer.model.*;
import org.springframework.stereotype.Component;

import java.util.*;

/**
 * 按 1 分钟桶统计 ERROR / FATAL 占比，超过阈值即报 error_spike。
 */
@Component
public class ErrorSpikeDetector implements AnomalyDetector {

    private final AnalyzerProperties.Anomaly cfg;

    public ErrorSpikeDetector(AnalyzerProperties properties) {
        this.cfg = properties.getAnomaly();
    }

    @Override
    public AnomalyKind kind() {
        return AnomalyKind.ERROR_SPIKE;
    }

    @Override
    public List<Anomaly> detect(EventSource source, List<UnifiedEvent> events) {
        Map<String, Integer> totals = new LinkedHashMap<>();
        Map<String, Integer> errors = new HashMap<>();

        for (UnifiedEvent e : events) {
            String minute = DetectorSupport.minuteKey(e, cfg.getBucketMode());
            totals.merge(minute, 1, Integer::sum);
            if (DetectorSupport.isErrorLevel(e.getLevel())) {
                errors.merge(minute, 1, Integer::sum);
            }
        }

        List<Anomaly> found = new ArrayList<>();
        for (var entry : totals.entrySet()) {
            String minute = entry.getKey();
            int total = entry.getValue();
            int errorCount = errors.getOrDefault(minute, 0);
            double rate = (double) errorCount / total;
            if (rate <= cfg.getErrorRateThreshold()) {
                continue;
            }

            Map<String, Object> metrics = new LinkedHashMap<>();
            metrics.put("timeWindow", minute);
            metrics.put("errorRate", DetectorSupport.round2(rate * 100));
            metrics.put("errorCount", errorCount);
            metrics.put("totalCount", total);

            found.add(Anomaly.builder()
                    .kind(AnomalyKind.ERROR_SPIKE)
                    .severity(rate > cfg.getHighErrorRateThreshold() ? AnomalySeverity.HIGH : AnomalySeverity.MEDIUM)
                    .source(source)
                    .metrics(Collections.unmodifiableMap(metrics))
                    .description(String.format(Locale.ROOT,
                            "High error rate (%.1f%%) detected in %s at %s", rate * 100, source, minute))
                    .build());
        }
        return found;
    }
}
