package me.internalizable.conduit.api.event.types;

import me.internalizable.conduit.api.chat.InboundMessage;
import me.internalizable.conduit.api.event.Event;
import me.internalizable.conduit.api.event.EventPriority;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.Map;
import java.util.Objects;

/**
 * Fired when a chat message looks like a task that should be tracked.
 */
public class AutoTaskDetectedEvent extends Event {

    public static final String TYPE = "ai.auto_task.detected";

    private final InboundMessage sourceMessage;

    /**
     * @param chatId the chat the message came from
     * @param detectedTask the task text extracted from the message
     * @param confidence detection confidence between 0 and 1
     * @param sourceMessage the message the task was detected in
     * @param suggestedAssignee the suggested assignee, or null
     * @param metadata extra routing hints
     */
    public AutoTaskDetectedEvent(long chatId, @Nonnull String detectedTask, double confidence,
                                 @Nonnull InboundMessage sourceMessage, @Nullable String suggestedAssignee,
                                 @Nullable Map<String, ?> metadata) {
        super(Event.builder(TYPE)
            .payload("detectedTask", Objects.requireNonNull(detectedTask, "detectedTask"))
            .payload("confidence", confidence)
            .payload("suggestedAssignee", suggestedAssignee)
            .originUser(Objects.requireNonNull(sourceMessage, "sourceMessage").getSenderId())
            .originConversation(chatId)
            .priority(EventPriority.HIGH)
            .metadata(metadata));
        this.sourceMessage = sourceMessage;
    }

    @Nonnull
    public String getDetectedTask() {
        return (String) getPayloadValue("detectedTask");
    }

    public double getConfidence() {
        return (Double) getPayloadValue("confidence");
    }

    @Nonnull
    public InboundMessage getSourceMessage() {
        return sourceMessage;
    }

    @Nullable
    public String getSuggestedAssignee() {
        return (String) getPayloadValue("suggestedAssignee");
    }
}
