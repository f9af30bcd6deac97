package me.internalizable.conduit.api.event.types;

import me.internalizable.conduit.api.event.Event;
import me.internalizable.conduit.api.event.EventPriority;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Fired when a prompt should be sent to an AI provider.
 */
public class AIRequestEvent extends Event {

    public static final String TYPE = "ai.request";
    public static final String DEFAULT_MODEL = "gpt-4";

    /**
     * @param prompt the prompt text
     * @param userId the requesting user
     * @param chatId the chat the request came from
     * @param context previous conversation turns, each a {@code role}/{@code content} map
     * @param model the model to use, {@value #DEFAULT_MODEL} if null
     * @param metadata extra routing hints
     */
    public AIRequestEvent(@Nonnull String prompt, long userId, long chatId,
                          @Nullable List<Map<String, String>> context, @Nullable String model,
                          @Nullable Map<String, ?> metadata) {
        super(Event.builder(TYPE)
            .payload("prompt", Objects.requireNonNull(prompt, "prompt"))
            .payload("context", context != null ? List.copyOf(context) : List.of())
            .payload("model", model != null ? model : DEFAULT_MODEL)
            .originUser(userId)
            .originConversation(chatId)
            .priority(EventPriority.HIGH)
            .metadata(metadata));
    }

    @Nonnull
    public String getPrompt() {
        return (String) getPayloadValue("prompt");
    }

    @Nonnull
    @SuppressWarnings("unchecked")
    public List<Map<String, String>> getContext() {
        return (List<Map<String, String>>) getPayloadValue("context");
    }

    @Nonnull
    public String getModel() {
        return (String) getPayloadValue("model");
    }
}
