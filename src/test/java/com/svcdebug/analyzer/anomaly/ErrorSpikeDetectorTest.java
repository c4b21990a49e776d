package com.svcdebug.analyzer.anomaly;

import com.svcdebug.analyzer.config.AnalyzerProperties;
import com.svcdebug.analyzer.config.AnalyzerProperties.BucketMode;
import com.svcdebug.analyzer.model.*;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static com.svcdebug.analyzer.TestEvents.event;
import static com.svcdebug.analyzer.TestEvents.untimed;
import static org.assertj.core.api.Assertions.assertThat;

class ErrorSpikeDetectorTest {

    private AnalyzerProperties properties;
    private ErrorSpikeDetector detector;

    @BeforeEach
    void setUp() {
        properties = new AnalyzerProperties();
        detector = new ErrorSpikeDetector(properties);
    }

    @Test
    void oneThirdErrorsInAMinuteIsHighSeverity() {
        List<Anomaly> found = detector.detect(EventSource.LOG, minute(12, 4, 0));

        assertThat(found).hasSize(1);
        Anomaly a = found.get(0);
        assertThat(a.getKind()).isEqualTo(AnomalyKind.ERROR_SPIKE);
        assertThat(a.getSeverity()).isEqualTo(AnomalySeverity.HIGH);
        assertThat(a.getSource()).isEqualTo(EventSource.LOG);
        assertThat(a.getMetrics())
                .containsEntry("timeWindow", "2024-05-01 12:00")
                .containsEntry("errorRate", 33.33)
                .containsEntry("errorCount", 4)
                .containsEntry("totalCount", 12);
        assertThat(a.getDescription()).isEqualTo("High error rate (33.3%) detected in log at 2024-05-01 12:00");
    }

    @Test
    void moderateErrorRateIsMediumSeverity() {
        List<Anomaly> found = detector.detect(EventSource.TRACE, minute(10, 2, 0));

        assertThat(found).singleElement()
                .extracting(Anomaly::getSeverity)
                .isEqualTo(AnomalySeverity.MEDIUM);
    }

    @Test
    void rateAtThresholdDoesNotTrigger() {
        assertThat(detector.detect(EventSource.LOG, minute(10, 1, 0))).isEmpty();
    }

    @Test
    void fatalAndLowercaseLevelsCountAsErrors() {
        List<UnifiedEvent> events = new ArrayList<>();
        events.add(event(EventSource.LOG, 0).level("fatal").message("a").build());
        events.add(event(EventSource.LOG, 1).level("Error").message("b").build());
        events.add(event(EventSource.LOG, 2).level("INFO").message("c").build());

        List<Anomaly> found = detector.detect(EventSource.LOG, events);

        assertThat(found).singleElement()
                .satisfies(a -> assertThat(a.getMetrics()).containsEntry("errorCount", 2));
    }

    @Test
    void eachMinuteIsJudgedSeparately() {
        List<UnifiedEvent> events = new ArrayList<>(minute(10, 0, 0));
        events.addAll(minute(10, 5, 1));

        List<Anomaly> found = detector.detect(EventSource.LOG, events);

        assertThat(found).singleElement()
                .satisfies(a -> assertThat(a.getMetrics()).containsEntry("timeWindow", "2024-05-01 12:01"));
    }

    @Test
    void untimedEventsFallIntoUnknownBucket() {
        List<UnifiedEvent> events = List.of(
                untimed(EventSource.LOG, "0x1").toBuilder().level("ERROR").build(),
                untimed(EventSource.LOG, "0x1"));

        List<Anomaly> found = detector.detect(EventSource.LOG, events);

        assertThat(found).singleElement()
                .satisfies(a -> assertThat(a.getMetrics()).containsEntry("timeWindow", "unknown"));
    }

    @Test
    void displayPrefixModeBucketsByClockPrefix() {
        properties.getAnomaly().setBucketMode(BucketMode.DISPLAY_PREFIX);
        ErrorSpikeDetector legacy = new ErrorSpikeDetector(properties);

        List<Anomaly> found = legacy.detect(EventSource.LOG, minute(4, 2, 0));

        assertThat(found).singleElement()
                .satisfies(a -> assertThat(a.getMetrics()).containsEntry("timeWindow", "12:00"));
    }

    /** 第 minute 分钟内的 total 条事件，前 errors 条为 ERROR */
    private static List<UnifiedEvent> minute(int total, int errors, int minute) {
        List<UnifiedEvent> events = new ArrayList<>();
        for (int i = 0; i < total; i++) {
            events.add(event(EventSource.LOG, minute * 60_000L + i * 100L)
                    .serviceId("0xABCD")
                    .level(i < errors ? "ERROR" : "INFO")
                    .message("tick " + i)
                    .build());
        }
        return events;
    }
}
