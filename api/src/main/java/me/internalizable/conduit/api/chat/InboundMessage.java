package me.internalizable.conduit.api.chat;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;

/**
 * A chat message received by the host, as seen by plugins.
 *
 * <p>Implemented by the messenger integration, which wraps its own message object.</p>
 */
public interface InboundMessage {

    long getMessageId();

    long getChatId();

    long getSenderId();

    /**
     * Get the text or caption of the message.
     *
     * @return the text, or null for messages without text
     */
    @Nullable
    String getText();

    /**
     * Reply to this message in its chat.
     *
     * @param text the reply text
     * @throws Exception if the messenger rejects the reply
     */
    void reply(@Nonnull String text) throws Exception;
}
