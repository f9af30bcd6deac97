package me.internalizable.conduit.api.plugin.capability;

import me.internalizable.conduit.api.chat.InboundMessage;
import me.internalizable.conduit.api.event.types.MessageReceivedEvent;
import me.internalizable.conduit.api.plugin.Plugin;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;

/**
 * A plugin that reacts to incoming chat messages.
 *
 * <p>On load it registers a {@link MessagePluginHandler}; a non-empty string
 * returned from {@link #processMessage(InboundMessage, MessageReceivedEvent)} is
 * sent as a reply to the message.</p>
 */
public abstract class MessagePlugin extends Plugin {

    @Override
    public void onLoad() throws Exception {
        registerEventHandler(new MessagePluginHandler(this));
    }

    /**
     * Process a message.
     *
     * @param message the message
     * @param event the event carrying it
     * @return the reply text, or null for no reply
     * @throws Exception if processing fails
     */
    @Nullable
    public abstract String processMessage(@Nonnull InboundMessage message,
                                          @Nonnull MessageReceivedEvent event) throws Exception;

    /**
     * Decide whether this plugin should process a message. Accepts every message by default.
     *
     * @param message the message
     * @return true to process it
     * @throws Exception if the check fails
     */
    public boolean shouldProcess(@Nonnull InboundMessage message) throws Exception {
        return true;
    }
}
