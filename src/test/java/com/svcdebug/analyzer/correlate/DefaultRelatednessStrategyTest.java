package com.svcdebug.analyzer.correlate;

import com.svcdebug.analyzer.model.EventSource;
import com.svcdebug.analyzer.model.UnifiedEvent;
import org.junit.jupiter.api.Test;

import static com.svcdebug.analyzer.TestEvents.event;
import static org.assertj.core.api.Assertions.assertThat;

class DefaultRelatednessStrategyTest {

    private final DefaultRelatednessStrategy strategy = new DefaultRelatednessStrategy();

    @Test
    void sameServiceIdIsRelated() {
        UnifiedEvent a = event(EventSource.LOG, 0).serviceId("0x1234").message("alpha").build();
        UnifiedEvent b = event(EventSource.CAPTURE, 10).serviceId("0x1234").message("beta").build();

        assertThat(strategy.related(a, b)).isTrue();
    }

    @Test
    void absentServiceIdsNeverMatchEachOther() {
        UnifiedEvent a = event(EventSource.LOG, 0).message("alpha").build();
        UnifiedEvent b = event(EventSource.LOG, 10).message("beta").build();

        assertThat(strategy.related(a, b)).isFalse();
    }

    @Test
    void sameComponentIsRelated() {
        UnifiedEvent a = event(EventSource.LOG, 0).component("ServiceManager").message("alpha").build();
        UnifiedEvent b = event(EventSource.TRACE, 10).component("ServiceManager").message("beta").build();
        UnifiedEvent c = event(EventSource.TRACE, 10).component("Other").message("gamma").build();

        assertThat(strategy.related(a, b)).isTrue();
        assertThat(strategy.related(a, c)).isFalse();
    }

    @Test
    void twoSharedWordsAreEnough() {
        UnifiedEvent a = event(EventSource.LOG, 0).message("Connection reset by peer").build();
        UnifiedEvent b = event(EventSource.OTHER, 10).message("peer connection closed").build();

        assertThat(strategy.related(a, b)).isTrue();
    }

    @Test
    void oneSharedWordIsNotEnough() {
        UnifiedEvent a = event(EventSource.LOG, 0).message("connection reset").build();
        UnifiedEvent b = event(EventSource.OTHER, 10).message("connection closed").build();

        assertThat(strategy.related(a, b)).isFalse();
    }

    @Test
    void emptyMessagesShareNothing() {
        UnifiedEvent a = event(EventSource.LOG, 0).build();
        UnifiedEvent b = event(EventSource.OTHER, 10).build();

        assertThat(strategy.related(a, b)).isFalse();
    }

    @Test
    void tokenizeLowercasesAndSplitsOnNonWordCharacters() {
        assertThat(DefaultRelatednessStrategy.tokenize("Offer SENT, offer_id=42!"))
                .containsExactlyInAnyOrder("offer", "sent", "offer_id", "42");
        assertThat(DefaultRelatednessStrategy.tokenize(null)).isEmpty();
    }
}
