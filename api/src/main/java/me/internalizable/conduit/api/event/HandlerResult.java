package me.internalizable.conduit.api.event;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.Objects;
import java.util.Optional;

/**
 * Outcome of one handler for one published event.
 *
 * <p>{@link EventBus#publishAndWait(Event)} returns one result per handler, in the
 * handlers' priority order. A failed handler yields a result carrying the captured
 * error instead of raising it.</p>
 */
public final class HandlerResult {

    private final EventHandler handler;
    private final Object value;
    private final Throwable error;

    private HandlerResult(EventHandler handler, Object value, Throwable error) {
        this.handler = handler;
        this.value = value;
        this.error = error;
    }

    @Nonnull
    public static HandlerResult success(@Nonnull EventHandler handler, @Nullable Object value) {
        return new HandlerResult(Objects.requireNonNull(handler, "handler"), value, null);
    }

    @Nonnull
    public static HandlerResult failure(@Nonnull EventHandler handler, @Nonnull Throwable error) {
        return new HandlerResult(Objects.requireNonNull(handler, "handler"), null,
            Objects.requireNonNull(error, "error"));
    }

    @Nonnull
    public EventHandler getHandler() {
        return handler;
    }

    /**
     * Get the value returned by the handler. Always null for a failure.
     */
    @Nullable
    public Object getValue() {
        return value;
    }

    @Nonnull
    public Optional<Throwable> getError() {
        return Optional.ofNullable(error);
    }

    public boolean isSuccess() {
        return error == null;
    }

    @Override
    public String toString() {
        return isSuccess()
            ? String.format("HandlerResult{handler=%s, value=%s}", handler.getClass().getSimpleName(), value)
            : String.format("HandlerResult{handler=%s, error=%s}", handler.getClass().getSimpleName(), error);
    }
}
