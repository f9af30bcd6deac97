package me.internalizable.conduit.api.event.types;

import me.internalizable.conduit.api.event.Event;
import me.internalizable.conduit.api.event.EventPriority;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.Map;
import java.util.Objects;

/**
 * Fired when a collaborator wants to report an error to interested handlers.
 *
 * <p>Only the error's class name and message are carried, not the throwable itself.</p>
 */
public class ErrorEvent extends Event {

    public static final String TYPE = "system.error";

    public ErrorEvent(@Nonnull Throwable error, @Nonnull String context, @Nullable Long userId,
                      @Nullable Long chatId, @Nullable Map<String, ?> metadata) {
        super(Event.builder(TYPE)
            .payload("errorType", Objects.requireNonNull(error, "error").getClass().getSimpleName())
            .payload("errorMessage", String.valueOf(error.getMessage()))
            .payload("context", Objects.requireNonNull(context, "context"))
            .originUser(userId)
            .originConversation(chatId)
            .priority(EventPriority.CRITICAL)
            .metadata(metadata));
    }

    @Nonnull
    public String getErrorType() {
        return (String) getPayloadValue("errorType");
    }

    @Nonnull
    public String getErrorMessage() {
        return (String) getPayloadValue("errorMessage");
    }

    @Nonnull
    public String getContext() {
        return (String) getPayloadValue("context");
    }
}
