package me.internalizable.conduit.api.event.types;

import me.internalizable.conduit.api.chat.InboundMessage;
import me.internalizable.conduit.api.event.Event;
import me.internalizable.conduit.api.event.EventPriority;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Fired when a user asks for a summary of recent chat messages.
 */
public class ChatSummaryRequestEvent extends Event {

    public static final String TYPE = "chat.summary.request";

    private final List<InboundMessage> messages;

    /**
     * @param chatId the chat to summarize
     * @param messages the messages to summarize
     * @param requestedBy the requesting user
     * @param timeRange a human readable range such as {@code "24h"}, or null
     * @param metadata extra routing hints
     */
    public ChatSummaryRequestEvent(long chatId, @Nonnull List<InboundMessage> messages, long requestedBy,
                                   @Nullable String timeRange, @Nullable Map<String, ?> metadata) {
        super(Event.builder(TYPE)
            .payload("messagesCount", Objects.requireNonNull(messages, "messages").size())
            .payload("timeRange", timeRange)
            .originUser(requestedBy)
            .originConversation(chatId)
            .priority(EventPriority.HIGH)
            .metadata(metadata));
        this.messages = List.copyOf(messages);
    }

    @Nonnull
    public List<InboundMessage> getMessages() {
        return messages;
    }

    public int getMessagesCount() {
        return (Integer) getPayloadValue("messagesCount");
    }

    @Nullable
    public String getTimeRange() {
        return (String) getPayloadValue("timeRange");
    }
}
