/**
 * Plugin bases for reacting to one class of events.
 *
 * <p>Extending {@link MessagePlugin}, {@link CallbackPlugin} or {@link AIPlugin}
 * registers a matching {@link TypedEventAdapter} on load; the base
 * {@link me.internalizable.conduit.api.plugin.Plugin#onUnload()} removes it.</p>
 */
package me.internalizable.conduit.api.plugin.capability;
