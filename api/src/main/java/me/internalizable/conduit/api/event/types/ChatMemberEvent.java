package me.internalizable.conduit.api.event.types;

import me.internalizable.conduit.api.event.Event;
import me.internalizable.conduit.api.event.EventPriority;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.Map;
import java.util.Objects;

/**
 * Fired when a chat member joins, leaves, or has their rights changed.
 */
public class ChatMemberEvent extends Event {

    public static final String TYPE = "chat.member.updated";

    /**
     * @param userId the member
     * @param chatId the chat
     * @param action {@code joined}, {@code left}, {@code promoted} or {@code restricted}
     * @param oldStatus the member status before the change
     * @param newStatus the member status after the change
     * @param metadata extra routing hints
     */
    public ChatMemberEvent(long userId, long chatId, @Nonnull String action,
                           @Nonnull String oldStatus, @Nonnull String newStatus,
                           @Nullable Map<String, ?> metadata) {
        super(Event.builder(TYPE)
            .payload("action", Objects.requireNonNull(action, "action"))
            .payload("oldStatus", Objects.requireNonNull(oldStatus, "oldStatus"))
            .payload("newStatus", Objects.requireNonNull(newStatus, "newStatus"))
            .originUser(userId)
            .originConversation(chatId)
            .priority(EventPriority.NORMAL)
            .metadata(metadata));
    }

    @Nonnull
    public String getAction() {
        return (String) getPayloadValue("action");
    }

    @Nonnull
    public String getOldStatus() {
        return (String) getPayloadValue("oldStatus");
    }

    @Nonnull
    public String getNewStatus() {
        return (String) getPayloadValue("newStatus");
    }
}
