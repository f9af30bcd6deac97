package me.internalizable.conduit.api.event.types;

import me.internalizable.conduit.api.event.Event;
import me.internalizable.conduit.api.event.EventPriority;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.Map;
import java.util.Objects;

/**
 * Fired after a work journal entry was saved.
 */
public class WorkJournalEntryEvent extends Event {

    public static final String TYPE = "work_journal.entry.created";

    public WorkJournalEntryEvent(long entryId, long userId, @Nonnull String company,
                                 @Nonnull String duration, @Nonnull String description,
                                 @Nullable Map<String, ?> metadata) {
        super(Event.builder(TYPE)
            .payload("entryId", entryId)
            .payload("company", Objects.requireNonNull(company, "company"))
            .payload("duration", Objects.requireNonNull(duration, "duration"))
            .payload("description", Objects.requireNonNull(description, "description"))
            .originUser(userId)
            .priority(EventPriority.NORMAL)
            .metadata(metadata));
    }

    public long getEntryId() {
        return (Long) getPayloadValue("entryId");
    }

    @Nonnull
    public String getCompany() {
        return (String) getPayloadValue("company");
    }

    @Nonnull
    public String getDuration() {
        return (String) getPayloadValue("duration");
    }

    @Nonnull
    public String getDescription() {
        return (String) getPayloadValue("description");
    }
}
