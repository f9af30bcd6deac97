package me.internalizable.conduit.api.event.types;

import me.internalizable.conduit.api.event.Event;
import me.internalizable.conduit.api.event.EventPriority;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.Map;

/**
 * Fired after a user passed authorization.
 */
public class UserAuthenticatedEvent extends Event {

    public static final String TYPE = "user.authenticated";
    public static final String DEFAULT_ROLE = "user";

    public UserAuthenticatedEvent(long userId, @Nullable String username, @Nullable String role,
                                  @Nullable Map<String, ?> metadata) {
        super(Event.builder(TYPE)
            .payload("username", username)
            .payload("role", role != null ? role : DEFAULT_ROLE)
            .originUser(userId)
            .priority(EventPriority.NORMAL)
            .metadata(metadata));
    }

    @Nullable
    public String getUsername() {
        return (String) getPayloadValue("username");
    }

    @Nonnull
    public String getRole() {
        return (String) getPayloadValue("role");
    }
}
