package com.svcdebug.analyzer.anomaly;

import com.svcdebug.analyzer.config.AnalyzerProperties;
import com.svcdebug.analyzer.model.*;
import org.springframework.stereotype.Component;

import java.util.*;
import java.util.regex.Pattern;

/**
 * 重复消息：先把 HH:MM:SS 和 [数字] 这类可变部分替换成占位符，再按文本计数。
 */
@Component
public class DuplicateMessageDetector implements AnomalyDetector {

    private static final Pattern CLOCK_PATTERN = Pattern.compile("\\d{2}:\\d{2}:\\d{2}");
    private static final Pattern BRACKET_NUMBER_PATTERN = Pattern.compile("\\[\\d+]");

    private static final int PATTERN_DISPLAY_LIMIT = 100;

    private final AnalyzerProperties.Anomaly cfg;

    public DuplicateMessageDetector(AnalyzerProperties properties) {
        this.cfg = properties.getAnomaly();
    }

    @Override
    public AnomalyKind kind() {
        return AnomalyKind.DUPLICATE_MESSAGE;
    }

    @Override
    public List<Anomaly> detect(EventSource source, List<UnifiedEvent> events) {
        Map<String, Integer> counts = new LinkedHashMap<>();
        for (UnifiedEvent e : events) {
            if (e.getMessage().isEmpty()) {
                continue;
            }
            counts.merge(normalize(e.getMessage()), 1, Integer::sum);
        }

        List<Anomaly> found = new ArrayList<>();
        counts.forEach((message, count) -> {
            if (count <= cfg.getDuplicateThreshold()) {
                return;
            }
            Map<String, Object> metrics = new LinkedHashMap<>();
            metrics.put("messagePattern", abbreviate(message));
            metrics.put("count", count);

            found.add(Anomaly.builder()
                    .kind(AnomalyKind.DUPLICATE_MESSAGE)
                    .severity(count < cfg.getDuplicateMediumCount() ? AnomalySeverity.LOW : AnomalySeverity.MEDIUM)
                    .source(source)
                    .metrics(Collections.unmodifiableMap(metrics))
                    .description(String.format(Locale.ROOT,
                            "Duplicate message pattern repeated %d times in %s", count, source))
                    .build());
        });
        return found;
    }

    static String normalize(String message) {
        String s = CLOCK_PATTERN.matcher(message).replaceAll("TIME");
        return BRACKET_NUMBER_PATTERN.matcher(s).replaceAll("[NUM]");
    }

    private static String abbreviate(String message) {
        return message.length() > PATTERN_DISPLAY_LIMIT
                ? message.substring(0, PATTERN_DISPLAY_LIMIT) + "..."
                : message;
    }
}
