package me.internalizable.conduit.api.event.types;

import me.internalizable.conduit.api.chat.InboundCallback;
import me.internalizable.conduit.api.event.Event;
import me.internalizable.conduit.api.event.EventPriority;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.Map;
import java.util.Objects;

/**
 * Fired when a user presses an inline keyboard button.
 */
public class CallbackQueryEvent extends Event {

    public static final String TYPE = "callback.query";

    private final InboundCallback callback;

    public CallbackQueryEvent(@Nonnull InboundCallback callback, long userId,
                              @Nonnull String callbackData, @Nullable Map<String, ?> metadata) {
        super(Event.builder(TYPE)
            .payload("callbackData", Objects.requireNonNull(callbackData, "callbackData"))
            .payload("messageId", Objects.requireNonNull(callback, "callback").getMessageId())
            .originUser(userId)
            .originConversation(callback.getChatId())
            .priority(EventPriority.NORMAL)
            .metadata(metadata));
        this.callback = callback;
    }

    @Nonnull
    public InboundCallback getCallback() {
        return callback;
    }

    @Nonnull
    public String getCallbackData() {
        return (String) getPayloadValue("callbackData");
    }

    @Nullable
    public Long getMessageId() {
        return (Long) getPayloadValue("messageId");
    }
}
