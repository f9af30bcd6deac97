package me.internalizable.conduit.api.chat;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;

/**
 * A button press on an inline keyboard, as seen by plugins.
 */
public interface InboundCallback {

    long getSenderId();

    /**
     * Get the id of the message carrying the pressed button.
     *
     * @return the message id, or null if the message is no longer available
     */
    @Nullable
    Long getMessageId();

    /**
     * Get the chat of the message carrying the pressed button.
     *
     * @return the chat id, or null if the message is no longer available
     */
    @Nullable
    Long getChatId();

    @Nonnull
    String getData();

    /**
     * Answer the callback, showing the text to the user.
     *
     * @param text the answer text
     * @param showAlert show a modal alert instead of a transient notification
     * @throws Exception if the messenger rejects the answer
     */
    void answer(@Nonnull String text, boolean showAlert) throws Exception;
}
