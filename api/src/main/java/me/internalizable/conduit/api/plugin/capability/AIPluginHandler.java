package me.internalizable.conduit.api.plugin.capability;

import me.internalizable.conduit.api.event.types.AIResponseEvent;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;

/**
 * Feeds non-empty {@link AIResponseEvent}s to an {@link AIPlugin}.
 */
public final class AIPluginHandler extends TypedEventAdapter<AIResponseEvent, AIPlugin> {

    public AIPluginHandler(@Nonnull AIPlugin plugin) {
        super(plugin, AIResponseEvent.class, AIResponseEvent.TYPE);
    }

    @Override
    protected boolean accepts(@Nonnull AIResponseEvent event) {
        return !event.getResponse().isEmpty();
    }

    @Nullable
    @Override
    protected Object process(@Nonnull AIResponseEvent event) throws Exception {
        return getPlugin().processAIResponse(event.getResponse(), event);
    }
}
