package me.internalizable.conduit.api.plugin;

import me.internalizable.conduit.api.event.EventBus;

import javax.annotation.Nonnull;

/**
 * Services available to a plugin while it is loaded.
 *
 * <p>Bound by the {@link PluginManager} before {@link Plugin#onLoad()} is called.</p>
 */
public interface PluginContext {

    @Nonnull
    EventBus getEventBus();

    @Nonnull
    PluginManager getPluginManager();
}
