package me.internalizable.conduit.event;

import me.internalizable.conduit.api.event.Event;
import me.internalizable.conduit.api.event.EventHandler;
import me.internalizable.conduit.api.event.EventPriority;

import java.util.List;
import java.util.Set;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Handler that records what it sees and optionally fails.
 */
class RecordingHandler implements EventHandler {

    private final Set<String> eventTypes;
    private final EventPriority priority;
    private final Object result;

    final List<Event> handled = new CopyOnWriteArrayList<>();
    final List<Throwable> errors = new CopyOnWriteArrayList<>();

    volatile Exception failure;

    RecordingHandler(EventPriority priority, Object result, String... eventTypes) {
        this.eventTypes = Set.of(eventTypes);
        this.priority = priority;
        this.result = result;
    }

    RecordingHandler(String... eventTypes) {
        this(EventPriority.NORMAL, null, eventTypes);
    }

    @Override
    public Set<String> getEventTypes() {
        return eventTypes;
    }

    @Override
    public EventPriority getPriority() {
        return priority;
    }

    @Override
    public Object handle(Event event) throws Exception {
        handled.add(event);
        if (failure != null) {
            throw failure;
        }
        return result;
    }

    @Override
    public void onError(Event event, Throwable error) {
        errors.add(error);
    }
}
