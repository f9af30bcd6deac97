package me.internalizable.conduit.api.plugin.capability;

import me.internalizable.conduit.api.event.Event;
import me.internalizable.conduit.api.event.EventHandler;
import me.internalizable.conduit.api.plugin.Plugin;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.Objects;
import java.util.Set;

/**
 * Bridges a generic {@link Event} to a plugin's typed callback.
 *
 * <p>Events of the registered type that are not instances of the expected event
 * class are ignored, as are events {@link #accepts(Event) rejected} by the
 * subclass. One adapter instance belongs to exactly one plugin instance.</p>
 *
 * @param <E> the event class the plugin expects
 * @param <P> the plugin class
 */
public abstract class TypedEventAdapter<E extends Event, P extends Plugin> implements EventHandler {

    private static final Logger LOGGER = LoggerFactory.getLogger(TypedEventAdapter.class);

    private final P plugin;
    private final Class<E> eventClass;
    private final Set<String> eventTypes;

    protected TypedEventAdapter(@Nonnull P plugin, @Nonnull Class<E> eventClass, @Nonnull String eventType) {
        this.plugin = Objects.requireNonNull(plugin, "plugin");
        this.eventClass = Objects.requireNonNull(eventClass, "eventClass");
        this.eventTypes = Set.of(Objects.requireNonNull(eventType, "eventType"));
    }

    @Nonnull
    @Override
    public final Set<String> getEventTypes() {
        return eventTypes;
    }

    @Nullable
    @Override
    public final Object handle(@Nonnull Event event) throws Exception {
        if (!eventClass.isInstance(event)) {
            return null;
        }
        E typed = eventClass.cast(event);
        if (!accepts(typed)) {
            return null;
        }
        return process(typed);
    }

    /**
     * Hand the failure to {@link Plugin#onError(Throwable)}. The bus has already
     * logged it.
     */
    @Override
    public void onError(@Nonnull Event event, @Nonnull Throwable error) {
        LOGGER.debug("Forwarding failure of event {} to plugin {}", event.getType(), plugin.getMetadata().getName());
        plugin.onError(error);
    }

    @Nonnull
    public final P getPlugin() {
        return plugin;
    }

    /**
     * Decide whether the plugin should see this event at all.
     *
     * @param event the narrowed event
     * @return true to call {@link #process(Event)}
     * @throws Exception if the check fails
     */
    protected abstract boolean accepts(@Nonnull E event) throws Exception;

    /**
     * Delegate to the plugin and apply the side effect of its return value.
     *
     * @param event the narrowed event
     * @return the handler result
     * @throws Exception if processing fails
     */
    @Nullable
    protected abstract Object process(@Nonnull E event) throws Exception;
}
