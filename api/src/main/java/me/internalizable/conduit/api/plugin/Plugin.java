package me.internalizable.conduit.api.plugin;

import me.internalizable.conduit.api.event.EventBus;
import me.internalizable.conduit.api.event.EventHandler;
import org.slf4j.LoggerFactory;

import javax.annotation.Nonnull;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Base class of all plugins.
 *
 * <p>A plugin is a self-contained feature module. It is loaded by the
 * {@link PluginManager} once every plugin named in its
 * {@link PluginMetadata#getDependencies() dependencies} is loaded and initialized,
 * and it cannot be unloaded while another loaded plugin depends on it.</p>
 *
 * <h2>Lifecycle</h2>
 * <ul>
 *   <li>{@link #onLoad()} - allocate resources, register handlers with
 *       {@link #registerEventHandler(EventHandler)}</li>
 *   <li>{@link #onUnload()} - release resources; the base implementation
 *       unregisters every handler registered through this plugin</li>
 *   <li>{@link #onError(Throwable)} - called when either hook throws</li>
 * </ul>
 *
 * <h2>Example</h2>
 * <pre>{@code
 * public final class AuditPlugin extends Plugin {
 *
 *     private static final PluginMetadata METADATA = PluginMetadata.builder("audit")
 *         .version("1.2.0")
 *         .author("platform")
 *         .dependencies("storage")
 *         .build();
 *
 *     @Override
 *     public PluginMetadata getMetadata() {
 *         return METADATA;
 *     }
 *
 *     @Override
 *     public void onLoad() {
 *         registerEventHandler(new AuditHandler());
 *     }
 * }
 * }</pre>
 */
public abstract class Plugin {

    private final List<EventHandler> eventHandlers = new CopyOnWriteArrayList<>();
    private volatile PluginState state = PluginState.UNLOADED;
    private volatile PluginContext context;

    @Nonnull
    public abstract PluginMetadata getMetadata();

    /**
     * Called when the plugin is loaded, after its dependencies are initialized.
     *
     * @throws Exception if loading fails; the plugin is then not registered
     */
    public void onLoad() throws Exception {
    }

    /**
     * Called when the plugin is unloaded. Subclasses that override this must call
     * {@code super.onUnload()} to release their event handlers.
     *
     * @throws Exception if unloading fails
     */
    public void onUnload() throws Exception {
        releaseEventHandlers();
    }

    /**
     * Called when {@link #onLoad()}, {@link #onUnload()} or one of the plugin's typed
     * event callbacks throws. Logs by default.
     *
     * @param error the failure
     */
    public void onError(@Nonnull Throwable error) {
        LoggerFactory.getLogger(getClass()).error("Plugin {} failed", getMetadata().getName(), error);
    }

    /**
     * Register a handler with the event bus and track it, so that it is
     * unregistered when this plugin unloads.
     *
     * @param handler the handler
     */
    protected final void registerEventHandler(@Nonnull EventHandler handler) {
        Objects.requireNonNull(handler, "handler");
        EventBus eventBus = getContext().getEventBus();
        eventHandlers.add(handler);
        eventBus.registerHandler(handler);
    }

    /**
     * Unregister every handler this plugin registered.
     *
     * <p>Handlers are forgotten one by one as they are unregistered, so calling this
     * again after a partial failure only touches what is left.</p>
     */
    public final void releaseEventHandlers() {
        PluginContext current = context;
        if (current == null) {
            eventHandlers.clear();
            return;
        }
        for (EventHandler handler : eventHandlers) {
            current.getEventBus().unregisterHandler(handler);
            eventHandlers.remove(handler);
        }
    }

    /**
     * Get the handlers registered through this plugin that are still tracked.
     *
     * @return a snapshot of the handlers
     */
    @Nonnull
    public final List<EventHandler> getEventHandlers() {
        return List.copyOf(eventHandlers);
    }

    /**
     * Get the services bound by the plugin manager.
     *
     * @return the context
     * @throws IllegalStateException if the plugin has never been handed to a manager
     */
    @Nonnull
    protected final PluginContext getContext() {
        PluginContext current = context;
        if (current == null) {
            throw new IllegalStateException("Plugin " + getMetadata().getName() + " is not attached to a plugin manager");
        }
        return current;
    }

    @Nonnull
    public final PluginState getState() {
        return state;
    }

    public final boolean isInitialized() {
        return state == PluginState.INITIALIZED;
    }

    /**
     * Bind the services of the loading manager. Called by the {@link PluginManager}.
     *
     * @param context the context
     */
    public final void attach(@Nonnull PluginContext context) {
        this.context = Objects.requireNonNull(context, "context");
    }

    /**
     * Move the plugin to a new lifecycle state. Called by the {@link PluginManager}.
     *
     * @param state the new state
     */
    public final void transitionTo(@Nonnull PluginState state) {
        this.state = Objects.requireNonNull(state, "state");
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "{name=" + getMetadata().getName() + ", state=" + state + "}";
    }
}
