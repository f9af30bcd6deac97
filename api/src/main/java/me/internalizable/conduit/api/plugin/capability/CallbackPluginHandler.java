package me.internalizable.conduit.api.plugin.capability;

import me.internalizable.conduit.api.chat.InboundCallback;
import me.internalizable.conduit.api.event.types.CallbackQueryEvent;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;

/**
 * Feeds {@link CallbackQueryEvent}s to a {@link CallbackPlugin} and shows its answers.
 */
public final class CallbackPluginHandler extends TypedEventAdapter<CallbackQueryEvent, CallbackPlugin> {

    public CallbackPluginHandler(@Nonnull CallbackPlugin plugin) {
        super(plugin, CallbackQueryEvent.class, CallbackQueryEvent.TYPE);
    }

    @Override
    protected boolean accepts(@Nonnull CallbackQueryEvent event) throws Exception {
        return getPlugin().shouldProcess(event.getCallback());
    }

    @Nullable
    @Override
    protected Object process(@Nonnull CallbackQueryEvent event) throws Exception {
        InboundCallback callback = event.getCallback();
        String answer = getPlugin().processCallback(callback, event);
        if (answer != null && !answer.isEmpty()) {
            callback.answer(answer, true);
        }
        return answer;
    }
}
