package me.internalizable.conduit.api.event;

/**
 * Priority of an event or an event handler.
 *
 * <p>Handlers registered for the same event type are kept sorted by ascending
 * {@link #getValue() value}, so {@link #CRITICAL} handlers come first. The bus
 * dispatches a batch concurrently: priority decides iteration and result order,
 * not which handler starts or finishes first.</p>
 */
public enum EventPriority {

    /**
     * Security problems, system errors.
     */
    CRITICAL(0),

    /**
     * AI processing, user-facing notifications.
     */
    HIGH(1),

    /**
     * Logging, statistics.
     */
    NORMAL(2),

    /**
     * Analytics, cache warming.
     */
    LOW(3);

    private final int value;

    EventPriority(int value) {
        this.value = value;
    }

    /**
     * Get the sort value of this priority. Lower values sort first.
     *
     * @return the sort value
     */
    public int getValue() {
        return value;
    }
}
