package com.svcdebug.analyzer.anomaly;

import com.svcdebug.analyzer.config.AnalyzerProperties;
import com.svcdebug.analyzer.model.*;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static com.svcdebug.analyzer.TestEvents.event;
import static org.assertj.core.api.Assertions.assertThat;

class SuspiciousPatternDetectorTest {

    private final SuspiciousPatternDetector detector = new SuspiciousPatternDetector(new AnalyzerProperties());

    @Test
    void fiveMatchesAreBelowThreshold() {
        assertThat(detector.detect(EventSource.LOG, messages("connection timeout", 5))).isEmpty();
    }

    @Test
    void sixMatchesAreLowSeverity() {
        List<Anomaly> found = detector.detect(EventSource.LOG, messages("Connection TIMEOUT", 6));

        assertThat(found).singleElement().satisfies(a -> {
            assertThat(a.getKind()).isEqualTo(AnomalyKind.SUSPICIOUS_PATTERN);
            assertThat(a.getSeverity()).isEqualTo(AnomalySeverity.LOW);
            assertThat(a.getMetrics()).containsEntry("patternType", "timeout_pattern").containsEntry("count", 6);
            assertThat(a.getDescription()).isEqualTo("Suspicious pattern \"timeout_pattern\" found 6 times in log");
        });
    }

    @Test
    void elevenMatchesAreMediumSeverity() {
        assertThat(detector.detect(EventSource.LOG, messages("connection timeout", 11)))
                .singleElement()
                .extracting(Anomaly::getSeverity)
                .isEqualTo(AnomalySeverity.MEDIUM);
    }

    @Test
    void oneMessageCanHitSeveralCategories() {
        List<Anomaly> found = detector.detect(EventSource.OTHER, messages("error: request timed out, link disconnected", 6));

        assertThat(found)
                .extracting(a -> a.getMetrics().get("patternType"))
                .containsExactly("error_pattern", "timeout_pattern", "connection_issue");
    }

    @Test
    void connectionLostMayHaveTextInBetween() {
        assertThat(SuspiciousPattern.CONNECTION_ISSUE.matches("connection to 10.0.0.2 lost")).isTrue();
        assertThat(SuspiciousPattern.MEMORY_ISSUE.matches("oom killer invoked")).isTrue();
        assertThat(SuspiciousPattern.CRASH_PATTERN.matches("all good")).isFalse();
    }

    private static List<UnifiedEvent> messages(String message, int count) {
        List<UnifiedEvent> events = new ArrayList<>();
        for (int i = 0; i < count; i++) {
            events.add(event(EventSource.LOG, i).message(message).build());
        }
        return events;
    }
}
