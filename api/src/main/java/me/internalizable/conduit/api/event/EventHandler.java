package me.internalizable.conduit.api.event;

import org.slf4j.LoggerFactory;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.Set;

/**
 * Reacts to events of one or more types.
 *
 * <p>The bus keeps a non-owning reference to the handler under each of its
 * {@link #getEventTypes() event types}. Whoever creates the handler (usually a
 * plugin) is responsible for unregistering it.</p>
 *
 * <p>Any exception thrown by {@link #handle(Event)} is caught by the bus and passed
 * to {@link #onError(Event, Throwable)} of the same handler; other handlers of
 * the same event are not affected.</p>
 */
public interface EventHandler {

    /**
     * Get the event types this handler is registered for.
     *
     * @return the event types, never empty for a useful handler
     */
    @Nonnull
    Set<String> getEventTypes();

    /**
     * Get the priority used to sort this handler among the handlers of a type.
     *
     * @return the priority, {@link EventPriority#NORMAL} by default
     */
    @Nonnull
    default EventPriority getPriority() {
        return EventPriority.NORMAL;
    }

    /**
     * Handle an event.
     *
     * @param event the event
     * @return an optional result, returned to callers of {@link EventBus#publishAndWait(Event)}
     * @throws Exception if handling fails
     */
    @Nullable
    Object handle(@Nonnull Event event) throws Exception;

    /**
     * Called when {@link #handle(Event)} fails or times out. Logs by default.
     *
     * @param event the event that was being handled
     * @param error the failure
     */
    default void onError(@Nonnull Event event, @Nonnull Throwable error) {
        LoggerFactory.getLogger(getClass()).error("Event handler {} failed for event {}",
            getClass().getSimpleName(), event.getType(), error);
    }
}
