package me.internalizable.conduit.api.plugin.capability;

import me.internalizable.conduit.api.event.types.AIResponseEvent;
import me.internalizable.conduit.api.plugin.Plugin;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.Map;

/**
 * A plugin that post-processes AI responses.
 */
public abstract class AIPlugin extends Plugin {

    @Override
    public void onLoad() throws Exception {
        registerEventHandler(new AIPluginHandler(this));
    }

    /**
     * Process a non-empty AI response.
     *
     * @param response the response text
     * @param event the event carrying it
     * @return extra data to return as the handler result, or null
     * @throws Exception if processing fails
     */
    @Nullable
    public abstract Map<String, Object> processAIResponse(@Nonnull String response,
                                                          @Nonnull AIResponseEvent event) throws Exception;
}
