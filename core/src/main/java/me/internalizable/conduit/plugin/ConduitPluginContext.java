package me.internalizable.conduit.plugin;

import me.internalizable.conduit.api.event.EventBus;
import me.internalizable.conduit.api.plugin.PluginContext;
import me.internalizable.conduit.api.plugin.PluginManager;

import javax.annotation.Nonnull;

final class ConduitPluginContext implements PluginContext {

    private final EventBus eventBus;
    private final PluginManager pluginManager;

    ConduitPluginContext(EventBus eventBus, PluginManager pluginManager) {
        this.eventBus = eventBus;
        this.pluginManager = pluginManager;
    }

    @Override
    @Nonnull
    public EventBus getEventBus() {
        return eventBus;
    }

    @Override
    @Nonnull
    public PluginManager getPluginManager() {
        return pluginManager;
    }
}
