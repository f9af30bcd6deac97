package me.internalizable.conduit.event;

import me.internalizable.conduit.api.event.Event;
import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class EventHistoryTest {

    private static Event event(String type, int seq) {
        return Event.builder(type).payload("seq", seq).build();
    }

    @Test
    void dropsOldestWhenFull() {
        EventHistory history = new EventHistory(2);

        history.record(event("a", 1));
        history.record(event("a", 2));
        history.record(event("a", 3));

        assertThat(history.size()).isEqualTo(2);
        assertThat(history.recent(null, 0)).extracting(e -> e.getPayloadValue("seq")).containsExactly(2, 3);
    }

    @Test
    void limitKeepsMostRecentMatches() {
        EventHistory history = new EventHistory(10);
        history.record(event("a", 1));
        history.record(event("b", 2));
        history.record(event("a", 3));
        history.record(event("a", 4));

        assertThat(history.recent("a", 2)).extracting(e -> e.getPayloadValue("seq")).containsExactly(3, 4);
        assertThat(history.recent("b", 5)).extracting(e -> e.getPayloadValue("seq")).containsExactly(2);
        assertThat(history.recent("c", 5)).isEmpty();
        assertThat(history.recent(null, -1)).hasSize(4);
    }

    @Test
    void evictsByAge() {
        Instant now = Instant.parse("2024-05-01T12:00:00Z");
        EventHistory history = new EventHistory(10);
        history.record(Event.builder("a").createdAt(now.minusSeconds(3600)).build());
        history.record(Event.builder("a").createdAt(now.minusSeconds(60)).build());
        history.record(Event.builder("a").createdAt(now).build());

        int removed = history.evictOlderThan(now.minusSeconds(120));

        assertThat(removed).isEqualTo(1);
        assertThat(history.size()).isEqualTo(2);
    }

    @Test
    void rejectsNonPositiveCapacity() {
        assertThatThrownBy(() -> new EventHistory(0)).isInstanceOf(IllegalArgumentException.class);
    }
}
