package me.internalizable.conduit.event;

import me.internalizable.conduit.api.event.EventHandler;
import me.internalizable.conduit.api.event.EventPriority;

import javax.annotation.Nonnull;

/**
 * A handler registered under one event type, with the priority it had at registration.
 */
public final class HandlerRegistration implements Comparable<HandlerRegistration> {

    private final EventHandler handler;
    private final String eventType;
    private final EventPriority priority;

    public HandlerRegistration(@Nonnull EventHandler handler, @Nonnull String eventType,
                               @Nonnull EventPriority priority) {
        this.handler = handler;
        this.eventType = eventType;
        this.priority = priority;
    }

    public EventHandler getHandler() {
        return handler;
    }

    public String getEventType() {
        return eventType;
    }

    public EventPriority getPriority() {
        return priority;
    }

    @Override
    public int compareTo(@Nonnull HandlerRegistration other) {
        return Integer.compare(this.priority.getValue(), other.priority.getValue());
    }

    @Override
    public String toString() {
        return String.format("HandlerRegistration{handler=%s, event=%s, priority=%s}",
            handler.getClass().getSimpleName(), eventType, priority);
    }
}
