package me.internalizable.conduit.api.event.types;

import me.internalizable.conduit.api.event.Event;
import me.internalizable.conduit.api.event.EventPriority;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.time.Duration;
import java.util.Map;
import java.util.Objects;

/**
 * Fired when an AI provider produced a response.
 */
public class AIResponseEvent extends Event {

    public static final String TYPE = "ai.response";

    public AIResponseEvent(@Nonnull String response, long userId, long chatId, @Nonnull String model) {
        this(response, userId, chatId, model, null, null, null);
    }

    public AIResponseEvent(@Nonnull String response, long userId, long chatId, @Nonnull String model,
                           @Nullable Integer tokensUsed, @Nullable Duration processingTime,
                           @Nullable Map<String, ?> metadata) {
        super(Event.builder(TYPE)
            .payload("response", Objects.requireNonNull(response, "response"))
            .payload("model", Objects.requireNonNull(model, "model"))
            .payload("tokensUsed", tokensUsed)
            .payload("processingTime", processingTime)
            .originUser(userId)
            .originConversation(chatId)
            .priority(EventPriority.HIGH)
            .metadata(metadata));
    }

    @Nonnull
    public String getResponse() {
        return (String) getPayloadValue("response");
    }

    @Nonnull
    public String getModel() {
        return (String) getPayloadValue("model");
    }

    @Nullable
    public Integer getTokensUsed() {
        return (Integer) getPayloadValue("tokensUsed");
    }

    @Nullable
    public Duration getProcessingTime() {
        return (Duration) getPayloadValue("processingTime");
    }
}
