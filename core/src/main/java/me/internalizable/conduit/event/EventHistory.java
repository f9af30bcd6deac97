package me.internalizable.conduit.event;

import com.google.common.collect.EvictingQueue;
import me.internalizable.conduit.api.event.Event;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Bounded, in-memory record of published events.
 *
 * <p>Holds at most {@code capacity} events; recording one more drops the oldest.
 * Events can also be dropped by age with {@link #evictOlderThan(Instant)}.</p>
 */
public final class EventHistory {

    private final int capacity;
    private final EvictingQueue<Event> events;

    public EventHistory(int capacity) {
        if (capacity < 1) {
            throw new IllegalArgumentException("capacity must be at least 1, got " + capacity);
        }
        this.capacity = capacity;
        this.events = EvictingQueue.create(capacity);
    }

    public synchronized void record(@Nonnull Event event) {
        events.add(event);
    }

    /**
     * Get the most recent events, oldest first.
     *
     * @param type only return events of this type, or null for all
     * @param limit the maximum number of events; zero or less returns all matches
     * @return the events
     */
    @Nonnull
    public synchronized List<Event> recent(@Nullable String type, int limit) {
        List<Event> matches = new ArrayList<>(events.size());
        for (Event event : events) {
            if (type == null || type.equals(event.getType())) {
                matches.add(event);
            }
        }
        if (limit > 0 && matches.size() > limit) {
            return List.copyOf(matches.subList(matches.size() - limit, matches.size()));
        }
        return List.copyOf(matches);
    }

    /**
     * Drop every event created before the cutoff.
     *
     * @param cutoff the oldest creation time to keep
     * @return the number of events dropped
     */
    public synchronized int evictOlderThan(@Nonnull Instant cutoff) {
        int before = events.size();
        events.removeIf(event -> event.getCreatedAt().isBefore(cutoff));
        return before - events.size();
    }

    public synchronized void clear() {
        events.clear();
    }

    public synchronized int size() {
        return events.size();
    }

    public int getCapacity() {
        return capacity;
    }
}
