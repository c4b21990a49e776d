package com.svcdebug.analyzer.anomaly;

import com.svcdebug.analyzer.config.AnalyzerProperties;
import com.svcdebug.analyzer.model.*;
import org.springframework.stereotype.Component;

import java.util.*;

/**
 * 按 {@link SuspiciousPattern} 表统计各类关键字出现的消息数。
 * 一条消息可以同时命中多个类别。
 */
@Component
public class SuspiciousPatternDetector implements AnomalyDetector {

    private final AnalyzerProperties.Anomaly cfg;

    public SuspiciousPatternDetector(AnalyzerProperties properties) {
        this.cfg = properties.getAnomaly();
    }

    @Override
    public AnomalyKind kind() {
        return AnomalyKind.SUSPICIOUS_PATTERN;
    }

    @Override
    public List<Anomaly> detect(EventSource source, List<UnifiedEvent> events) {
        Map<SuspiciousPattern, Integer> counts = new EnumMap<>(SuspiciousPattern.class);
        for (UnifiedEvent e : events) {
            String lower = e.getMessage().toLowerCase(Locale.ROOT);
            for (SuspiciousPattern p : SuspiciousPattern.values()) {
                if (p.matches(lower)) {
                    counts.merge(p, 1, Integer::sum);
                }
            }
        }

        List<Anomaly> found = new ArrayList<>();
        counts.forEach((pattern, count) -> {
            if (count <= cfg.getPatternThreshold()) {
                return;
            }
            Map<String, Object> metrics = new LinkedHashMap<>();
            metrics.put("patternType", pattern.category());
            metrics.put("count", count);

            found.add(Anomaly.builder()
                    .kind(AnomalyKind.SUSPICIOUS_PATTERN)
                    .severity(count > cfg.getPatternMediumCount() ? AnomalySeverity.MEDIUM : AnomalySeverity.LOW)
                    .source(source)
                    .metrics(Collections.unmodifiableMap(metrics))
                    .description(String.format(Locale.ROOT,
                            "Suspicious pattern \"%s\" found %d times in %s", pattern.category(), count, source))
                    .build());
        });
        return found;
    }
}
