package me.internalizable.conduit.api.event;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.List;
import java.util.Set;

/**
 * Routes published events to the handlers registered for their type.
 *
 * <h2>Publishing</h2>
 * <p>Both publish operations first record the event in a bounded history, then
 * run every {@link EventMiddleware} in registration order, then hand the
 * (possibly replaced) event to every handler registered for its type. Handlers
 * run concurrently; a failing handler is reported to its own
 * {@link EventHandler#onError(Event, Throwable)} and never to the publisher.</p>
 * <ul>
 *   <li>{@link #publishAndWait(Event)} blocks until every handler has finished and
 *       returns their results.</li>
 *   <li>{@link #publish(Event)} returns immediately. The batch runs unobserved;
 *       failures are visible only through handler callbacks and logs.</li>
 * </ul>
 *
 * <h2>Example</h2>
 * <pre>{@code
 * eventBus.registerHandler(new AuditHandler());
 * eventBus.addMiddleware(EventMiddleware.rejecting(e -> e.getType().startsWith("blocked.")));
 *
 * List<HandlerResult> results = eventBus.publishAndWait(new TaskCreatedEvent(...));
 * }</pre>
 *
 * <h2>Thread Safety</h2>
 * <p>All methods are thread-safe.</p>
 */
public interface EventBus {

    /**
     * Register a handler under every type it declares.
     *
     * <p>Registering the same handler twice results in duplicate delivery.</p>
     *
     * @param handler the handler
     */
    void registerHandler(@Nonnull EventHandler handler);

    /**
     * Remove a handler from every type it declares. Does nothing if it is not registered.
     *
     * @param handler the handler
     */
    void unregisterHandler(@Nonnull EventHandler handler);

    /**
     * Append a middleware to the chain.
     *
     * @param middleware the middleware
     */
    void addMiddleware(@Nonnull EventMiddleware middleware);

    /**
     * Publish an event without waiting for its handlers.
     *
     * @param event the event
     */
    void publish(@Nonnull Event event);

    /**
     * Publish an event and wait until every handler has completed.
     *
     * @param event the event
     * @return one result per handler in priority order; empty if cancelled or unhandled
     */
    @Nonnull
    List<HandlerResult> publishAndWait(@Nonnull Event event);

    /**
     * Get recent events, oldest first.
     *
     * @param type only return events of this type, or null for all types
     * @param limit maximum number of events to return; zero or less returns all
     * @return the matching events
     */
    @Nonnull
    List<Event> getEventHistory(@Nullable String type, int limit);

    /**
     * Get the last 100 events of any type.
     *
     * @return the events, oldest first
     */
    @Nonnull
    default List<Event> getEventHistory() {
        return getEventHistory(null, 100);
    }

    /**
     * Discard all recorded events.
     */
    void clearHistory();

    /**
     * Get the handlers registered for a type, in priority order.
     *
     * @param type the event type
     * @return a snapshot of the handlers
     */
    @Nonnull
    List<EventHandler> getHandlers(@Nonnull String type);

    /**
     * Get all event types that have at least one registered handler.
     *
     * @return a snapshot of the types
     */
    @Nonnull
    Set<String> getRegisteredEventTypes();
}
