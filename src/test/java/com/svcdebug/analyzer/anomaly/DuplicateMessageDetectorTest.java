package com.svcdebug.analyzer.anomaly;

import com.svcdebug.analyzer.config.AnalyzerProperties;
import com.svcdebug.analyzer.model.*;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.util.ArrayList;
import java.util.List;

import static com.svcdebug.analyzer.TestEvents.event;
import static org.assertj.core.api.Assertions.assertThat;

class DuplicateMessageDetectorTest {

    private final DuplicateMessageDetector detector = new DuplicateMessageDetector(new AnalyzerProperties());

    @Test
    void tenRepeatsAreStillFine() {
        assertThat(detector.detect(EventSource.LOG, repeated("heartbeat", 10))).isEmpty();
    }

    @ParameterizedTest
    @CsvSource({"11, LOW", "15, LOW", "19, LOW", "20, MEDIUM", "50, MEDIUM"})
    void severityGrowsWithRepeatCount(int count, AnomalySeverity expected) {
        List<Anomaly> found = detector.detect(EventSource.LOG, repeated("heartbeat", count));

        assertThat(found).singleElement().satisfies(a -> {
            assertThat(a.getSeverity()).isEqualTo(expected);
            assertThat(a.getMetrics()).containsEntry("messagePattern", "heartbeat").containsEntry("count", count);
            assertThat(a.getDescription()).isEqualTo("Duplicate message pattern repeated " + count + " times in log");
        });
    }

    @Test
    void clockTimesAndBracketedNumbersAreMasked() {
        List<UnifiedEvent> events = new ArrayList<>();
        for (int i = 0; i < 11; i++) {
            String clock = String.format("12:%02d:%02d", i, i);
            events.add(event(EventSource.LOG, i).message("[" + (1000 + i) + "] retry at " + clock).build());
        }

        List<Anomaly> found = detector.detect(EventSource.LOG, events);

        assertThat(found).singleElement()
                .satisfies(a -> assertThat(a.getMetrics()).containsEntry("messagePattern", "[NUM] retry at TIME"));
    }

    @Test
    void longPatternsAreAbbreviated() {
        List<Anomaly> found = detector.detect(EventSource.LOG, repeated("y".repeat(120), 11));

        String pattern = (String) found.get(0).getMetrics().get("messagePattern");
        assertThat(pattern).hasSize(103).endsWith("...");
    }

    @Test
    void emptyMessagesAreSkipped() {
        assertThat(detector.detect(EventSource.LOG, repeated("", 30))).isEmpty();
    }

    @Test
    void normalizeMasksVariableParts() {
        assertThat(DuplicateMessageDetector.normalize("[42] done 08:15:00, id [7]"))
                .isEqualTo("[NUM] done TIME, id [NUM]");
    }

    private static List<UnifiedEvent> repeated(String message, int count) {
        List<UnifiedEvent> events = new ArrayList<>();
        for (int i = 0; i < count; i++) {
            events.add(event(EventSource.LOG, i).message(message).build());
        }
        return events;
    }
}
