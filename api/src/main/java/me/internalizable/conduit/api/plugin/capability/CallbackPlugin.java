package me.internalizable.conduit.api.plugin.capability;

import me.internalizable.conduit.api.chat.InboundCallback;
import me.internalizable.conduit.api.event.types.CallbackQueryEvent;
import me.internalizable.conduit.api.plugin.Plugin;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;

/**
 * A plugin that reacts to inline keyboard button presses.
 *
 * <p>A non-empty string returned from
 * {@link #processCallback(InboundCallback, CallbackQueryEvent)} is shown to the
 * user as an alert.</p>
 */
public abstract class CallbackPlugin extends Plugin {

    @Override
    public void onLoad() throws Exception {
        registerEventHandler(new CallbackPluginHandler(this));
    }

    /**
     * Process a button press.
     *
     * @param callback the callback
     * @param event the event carrying it
     * @return the answer text, or null for no answer
     * @throws Exception if processing fails
     */
    @Nullable
    public abstract String processCallback(@Nonnull InboundCallback callback,
                                           @Nonnull CallbackQueryEvent event) throws Exception;

    /**
     * Decide whether this plugin should process a callback. Accepts every callback by default.
     *
     * @param callback the callback
     * @return true to process it
     * @throws Exception if the check fails
     */
    public boolean shouldProcess(@Nonnull InboundCallback callback) throws Exception {
        return true;
    }
}
