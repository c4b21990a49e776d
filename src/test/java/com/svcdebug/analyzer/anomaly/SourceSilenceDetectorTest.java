package com.svcdebug.analyzer.anomaly;

import com.svcdebug.analyzer.config.AnalyzerProperties;
import com.svcdebug.analyzer.model.*;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.svcdebug.analyzer.TestEvents.event;
import static com.svcdebug.analyzer.TestEvents.service;
import static org.assertj.core.api.Assertions.assertThat;

class SourceSilenceDetectorTest {

    private final SourceSilenceDetector detector = new SourceSilenceDetector(new AnalyzerProperties());

    @Test
    void serviceWithTwoMessagesIsSilent() {
        List<UnifiedEvent> events = List.of(
                service(EventSource.TRACE, 0, "0x5678"),
                service(EventSource.TRACE, 10, "0x5678"));

        List<Anomaly> found = detector.detect(EventSource.TRACE, events);

        assertThat(found).hasSize(1);
        Anomaly a = found.get(0);
        assertThat(a.getKind()).isEqualTo(AnomalyKind.SOURCE_SILENCE);
        assertThat(a.getSeverity()).isEqualTo(AnomalySeverity.LOW);
        assertThat(a.getMetrics()).containsEntry("serviceId", "0x5678").containsEntry("messageCount", 2);
        assertThat(a.getDescription()).isEqualTo("Service 0x5678 in trace has very few messages (2)");
    }

    @Test
    void threeMessagesAreEnough() {
        List<UnifiedEvent> events = List.of(
                service(EventSource.LOG, 0, "0x5678"),
                service(EventSource.LOG, 10, "0x5678"),
                service(EventSource.LOG, 20, "0x5678"));

        assertThat(detector.detect(EventSource.LOG, events)).isEmpty();
    }

    @Test
    void eventsWithoutServiceIdAreIgnored() {
        List<UnifiedEvent> events = List.of(event(EventSource.LOG, 0).message("anon").build());

        assertThat(detector.detect(EventSource.LOG, events)).isEmpty();
    }

    @Test
    void servicesAreReportedInFirstSeenOrder() {
        List<UnifiedEvent> events = List.of(
                service(EventSource.LOG, 0, "0xB"),
                service(EventSource.LOG, 10, "0xA"));

        assertThat(detector.detect(EventSource.LOG, events))
                .extracting(a -> a.getMetrics().get("serviceId"))
                .containsExactly("0xB", "0xA");
    }
}
