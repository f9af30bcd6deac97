package me.internalizable.conduit.api.event;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Something that happened, routed by the {@link EventBus} to every handler
 * registered for its {@link #getType() type}.
 *
 * <p>Events are read-only once built. The payload is opaque to the bus; concrete
 * subclasses in {@code me.internalizable.conduit.api.event.types} give it a fixed
 * shape and typed accessors.</p>
 *
 * <h2>Building an event</h2>
 * <pre>{@code
 * Event event = Event.builder("message.received")
 *     .payload("text", "hello")
 *     .originUser(42L)
 *     .priority(EventPriority.HIGH)
 *     .build();
 * eventBus.publish(event);
 * }</pre>
 *
 * <p>A middleware that wants to change an event returns a modified copy. The
 * {@link #withMetadata(String, Object)} and {@link #withPriority(EventPriority)}
 * copies keep the event's class; {@link #builder(Event)} always yields a plain
 * {@code Event}.</p>
 */
public class Event implements Cloneable {

    private final String type;
    private final Map<String, Object> payload;
    private final Instant createdAt;
    private final Long originUser;
    private final Long originConversation;
    // Reassigned only on fresh clones
    private EventPriority priority;
    private Map<String, Object> metadata;

    protected Event(@Nonnull Builder builder) {
        Objects.requireNonNull(builder, "builder");
        this.type = builder.type;
        this.payload = Collections.unmodifiableMap(new LinkedHashMap<>(builder.payload));
        this.createdAt = builder.createdAt != null ? builder.createdAt : Instant.now();
        this.originUser = builder.originUser;
        this.originConversation = builder.originConversation;
        this.priority = builder.priority;
        this.metadata = Collections.unmodifiableMap(new LinkedHashMap<>(builder.metadata));
    }

    /**
     * Start building an event of the given type.
     *
     * @param type the routing key, e.g. {@code "ai.response"}
     * @return a new builder
     * @throws IllegalArgumentException if the type is blank
     */
    @Nonnull
    public static Builder builder(@Nonnull String type) {
        return new Builder(type);
    }

    /**
     * Start building a copy of an existing event.
     *
     * <p>The copy is a plain {@code Event}, not an instance of the template's subclass.
     * Use {@link #withMetadata(String, Object)} to annotate a typed event.</p>
     *
     * @param template the event to copy
     * @return a builder pre-filled with the template's fields
     */
    @Nonnull
    public static Builder builder(@Nonnull Event template) {
        Objects.requireNonNull(template, "template");
        return new Builder(template.type)
            .payload(template.payload)
            .createdAt(template.createdAt)
            .originUser(template.originUser)
            .originConversation(template.originConversation)
            .priority(template.priority)
            .metadata(template.metadata);
    }

    @Nonnull
    public String getType() {
        return type;
    }

    @Nonnull
    public Map<String, Object> getPayload() {
        return payload;
    }

    /**
     * Get a single payload value.
     *
     * @param key the payload key
     * @return the value, or null if absent
     */
    @Nullable
    public Object getPayloadValue(@Nonnull String key) {
        return payload.get(key);
    }

    @Nonnull
    public Instant getCreatedAt() {
        return createdAt;
    }

    /**
     * Get the id of the user whose action produced this event.
     */
    @Nonnull
    public Optional<Long> getOriginUser() {
        return Optional.ofNullable(originUser);
    }

    /**
     * Get the id of the chat or conversation this event belongs to.
     */
    @Nonnull
    public Optional<Long> getOriginConversation() {
        return Optional.ofNullable(originConversation);
    }

    @Nonnull
    public EventPriority getPriority() {
        return priority;
    }

    @Nonnull
    public Map<String, Object> getMetadata() {
        return metadata;
    }

    /**
     * Copy this event with one more metadata entry, replacing any previous value
     * for the key.
     *
     * <p>The copy has the same class as this event and shares everything else
     * with it, including the fields of subclasses.</p>
     *
     * @param key the metadata key
     * @param value the metadata value
     * @return the copy
     */
    @Nonnull
    public Event withMetadata(@Nonnull String key, @Nullable Object value) {
        Objects.requireNonNull(key, "key");
        Map<String, Object> merged = new LinkedHashMap<>(metadata);
        merged.put(key, value);
        Event copy = copy();
        copy.metadata = Collections.unmodifiableMap(merged);
        return copy;
    }

    /**
     * Copy this event with additional metadata entries.
     *
     * @param values entries to add or replace
     * @return the copy, of the same class as this event
     */
    @Nonnull
    public Event withMetadata(@Nonnull Map<String, ?> values) {
        Objects.requireNonNull(values, "values");
        Map<String, Object> merged = new LinkedHashMap<>(metadata);
        merged.putAll(values);
        Event copy = copy();
        copy.metadata = Collections.unmodifiableMap(merged);
        return copy;
    }

    /**
     * Copy this event with a different priority.
     *
     * @param priority the new priority
     * @return the copy, of the same class as this event
     */
    @Nonnull
    public Event withPriority(@Nonnull EventPriority priority) {
        Objects.requireNonNull(priority, "priority");
        Event copy = copy();
        copy.priority = priority;
        return copy;
    }

    private Event copy() {
        try {
            return (Event) super.clone();
        } catch (CloneNotSupportedException e) {
            throw new AssertionError(e);
        }
    }

    @Override
    public String toString() {
        return String.format("%s{type=%s, priority=%s, user=%s, conversation=%s, createdAt=%s}",
            getClass().getSimpleName(), type, priority, originUser, originConversation, createdAt);
    }

    /**
     * Builder for {@link Event}. Subclasses pass a configured builder to the
     * protected {@link Event#Event(Builder)} constructor.
     */
    public static final class Builder {

        private final String type;
        private final Map<String, Object> payload = new LinkedHashMap<>();
        private final Map<String, Object> metadata = new LinkedHashMap<>();
        private Instant createdAt;
        private Long originUser;
        private Long originConversation;
        private EventPriority priority = EventPriority.NORMAL;

        private Builder(String type) {
            Objects.requireNonNull(type, "type");
            if (type.isBlank()) {
                throw new IllegalArgumentException("Event type must not be blank");
            }
            this.type = type;
        }

        @Nonnull
        public Builder payload(@Nonnull String key, @Nullable Object value) {
            payload.put(Objects.requireNonNull(key, "key"), value);
            return this;
        }

        @Nonnull
        public Builder payload(@Nonnull Map<String, ?> values) {
            payload.putAll(Objects.requireNonNull(values, "values"));
            return this;
        }

        @Nonnull
        public Builder createdAt(@Nullable Instant createdAt) {
            this.createdAt = createdAt;
            return this;
        }

        @Nonnull
        public Builder originUser(@Nullable Long originUser) {
            this.originUser = originUser;
            return this;
        }

        @Nonnull
        public Builder originConversation(@Nullable Long originConversation) {
            this.originConversation = originConversation;
            return this;
        }

        @Nonnull
        public Builder priority(@Nonnull EventPriority priority) {
            this.priority = Objects.requireNonNull(priority, "priority");
            return this;
        }

        @Nonnull
        public Builder metadata(@Nonnull String key, @Nullable Object value) {
            metadata.put(Objects.requireNonNull(key, "key"), value);
            return this;
        }

        @Nonnull
        public Builder metadata(@Nullable Map<String, ?> values) {
            if (values != null) {
                metadata.putAll(values);
            }
            return this;
        }

        @Nonnull
        public Event build() {
            return new Event(this);
        }
    }
}
