package me.internalizable.conduit.api.plugin.capability;

import me.internalizable.conduit.api.chat.InboundMessage;
import me.internalizable.conduit.api.event.types.MessageReceivedEvent;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;

/**
 * Feeds {@link MessageReceivedEvent}s to a {@link MessagePlugin} and sends its replies.
 */
public final class MessagePluginHandler extends TypedEventAdapter<MessageReceivedEvent, MessagePlugin> {

    public MessagePluginHandler(@Nonnull MessagePlugin plugin) {
        super(plugin, MessageReceivedEvent.class, MessageReceivedEvent.TYPE);
    }

    @Override
    protected boolean accepts(@Nonnull MessageReceivedEvent event) throws Exception {
        return getPlugin().shouldProcess(event.getMessage());
    }

    @Nullable
    @Override
    protected Object process(@Nonnull MessageReceivedEvent event) throws Exception {
        InboundMessage message = event.getMessage();
        String reply = getPlugin().processMessage(message, event);
        if (reply != null && !reply.isEmpty()) {
            message.reply(reply);
        }
        return reply;
    }
}
