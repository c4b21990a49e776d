package com.svcdebug.analyzer.report;

import com.svcdebug.analyzer.model.*;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class AnomalyDigestRendererTest {

    private final AnomalyDigestRenderer renderer = new AnomalyDigestRenderer();

    @Test
    void emptyListRendersFixedLine() {
        assertThat(renderer.render(List.of())).isEqualTo("No anomalies detected.");
        assertThat(renderer.render(null)).isEqualTo(AnomalyDigestRenderer.EMPTY_DIGEST);
    }

    @Test
    void groupsBySeverityFromHighToLow() {
        List<Anomaly> anomalies = List.of(
                anomaly(AnomalySeverity.LOW, "quiet service"),
                anomaly(AnomalySeverity.HIGH, "errors everywhere"),
                anomaly(AnomalySeverity.LOW, "repeated heartbeat"));

        String digest = renderer.render(anomalies);

        String rule = "-".repeat(40);
        assertThat(digest).isEqualTo("ANOMALY DETECTION REPORT\n"
                + "========================\n\n"
                + "Total anomalies detected: 3\n\n"
                + "HIGH SEVERITY (1 items):\n"
                + rule + "\n"
                + "• errors everywhere\n\n"
                + "LOW SEVERITY (2 items):\n"
                + rule + "\n"
                + "• quiet service\n"
                + "• repeated heartbeat\n\n");
    }

    @Test
    void absentSeveritiesHaveNoSection() {
        String digest = renderer.render(List.of(anomaly(AnomalySeverity.MEDIUM, "spike")));

        assertThat(digest).contains("MEDIUM SEVERITY (1 items):").doesNotContain("HIGH SEVERITY", "LOW SEVERITY");
    }

    private static Anomaly anomaly(AnomalySeverity severity, String description) {
        return Anomaly.builder()
                .kind(AnomalyKind.SOURCE_SILENCE)
                .severity(severity)
                .source(EventSource.LOG)
                .metrics(Map.of())
                .description(description)
                .build();
    }
}
