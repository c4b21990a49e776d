package com.svcdebug.analyzer.report;

import com.svcdebug.analyzer.model.Anomaly;
import com.svcdebug.analyzer.model.AnomalySeverity;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * 异常的纯文本摘要，按 high → medium → low 分段，每条一行。
 * 报告生成方直接把这段文本拼进最终报告。
 */
@Component
public class AnomalyDigestRenderer {

    static final String EMPTY_DIGEST = "No anomalies detected.";

    private static final String RULE = "-".repeat(40);

    public String render(List<Anomaly> anomalies) {
        if (anomalies == null || anomalies.isEmpty()) {
            return EMPTY_DIGEST;
        }

        Map<AnomalySeverity, List<Anomaly>> bySeverity = new EnumMap<>(AnomalySeverity.class);
        for (Anomaly a : anomalies) {
            bySeverity.computeIfAbsent(a.getSeverity(), k -> new ArrayList<>()).add(a);
        }

        StringBuilder sb = new StringBuilder();
        sb.append("ANOMALY DETECTION REPORT\n");
        sb.append("========================\n\n");
        sb.append("Total anomalies detected: ").append(anomalies.size()).append("\n\n");

        // EnumMap 按声明顺序遍历：HIGH, MEDIUM, LOW
        for (var entry : bySeverity.entrySet()) {
            List<Anomaly> items = entry.getValue();
            sb.append(entry.getKey().wireName().toUpperCase(Locale.ROOT))
                    .append(" SEVERITY (")
                    .append(items.size())
                    .append(" items):\n");
            sb.append(RULE).append("\n");
            for (Anomaly a : items) {
                sb.append("• ").append(a.getDescription()).append("\n");
            }
            sb.append("\n");
        }

        return sb.toString();
    }
}
