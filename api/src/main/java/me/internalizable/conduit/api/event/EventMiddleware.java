package me.internalizable.conduit.api.event;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.Objects;
import java.util.function.Predicate;

/**
 * A step applied to every published event before it is dispatched.
 *
 * <p>Middleware run in registration order. Each receives the event returned by the
 * previous one and may return it unchanged, return a replacement, or return
 * {@code null} to cancel the publish so that no handler runs.</p>
 *
 * <p>A middleware that throws is logged and skipped; the chain continues with the
 * event it was given.</p>
 */
@FunctionalInterface
public interface EventMiddleware {

    /**
     * Process an event.
     *
     * @param event the event to process
     * @return the event to pass on, or null to cancel the publish
     * @throws Exception if processing fails
     */
    @Nullable
    Event apply(@Nonnull Event event) throws Exception;

    /**
     * Create a middleware that cancels every event matching the filter.
     *
     * <pre>{@code
     * eventBus.addMiddleware(EventMiddleware.rejecting(e -> e.getType().startsWith("blocked.")));
     * }</pre>
     *
     * @param filter events to cancel
     * @return the middleware
     */
    @Nonnull
    static EventMiddleware rejecting(@Nonnull Predicate<Event> filter) {
        Objects.requireNonNull(filter, "filter");
        return event -> filter.test(event) ? null : event;
    }
}
