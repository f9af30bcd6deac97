package me.internalizable.conduit.api.event.types;

import me.internalizable.conduit.api.chat.InboundMessage;
import me.internalizable.conduit.api.event.Event;
import me.internalizable.conduit.api.event.EventPriority;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.Map;
import java.util.Objects;

/**
 * Fired for every chat message the host receives.
 */
public class MessageReceivedEvent extends Event {

    public static final String TYPE = "message.received";

    private final InboundMessage message;

    public MessageReceivedEvent(@Nonnull InboundMessage message, long userId, long chatId) {
        this(message, userId, chatId, null, "text", null);
    }

    /**
     * @param message the received message
     * @param userId the sender
     * @param chatId the chat the message was sent in
     * @param text the text to process, defaults to the message text
     * @param messageType {@code text}, {@code photo}, {@code document}, {@code voice}, ...
     * @param metadata extra routing hints
     */
    public MessageReceivedEvent(@Nonnull InboundMessage message, long userId, long chatId,
                                @Nullable String text, @Nonnull String messageType,
                                @Nullable Map<String, ?> metadata) {
        super(Event.builder(TYPE)
            .payload("text", text != null ? text : Objects.requireNonNull(message, "message").getText())
            .payload("messageType", Objects.requireNonNull(messageType, "messageType"))
            .payload("messageId", message.getMessageId())
            .originUser(userId)
            .originConversation(chatId)
            .priority(EventPriority.NORMAL)
            .metadata(metadata));
        this.message = message;
    }

    @Nonnull
    public InboundMessage getMessage() {
        return message;
    }

    @Nullable
    public String getText() {
        return (String) getPayloadValue("text");
    }

    @Nonnull
    public String getMessageType() {
        return (String) getPayloadValue("messageType");
    }
}
