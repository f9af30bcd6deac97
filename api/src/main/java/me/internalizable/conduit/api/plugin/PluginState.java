package me.internalizable.conduit.api.plugin;

/**
 * Lifecycle state of a {@link Plugin}.
 *
 * <pre>
 * UNLOADED -> LOADING -> INITIALIZED -> UNLOADING -> UNLOADED
 * </pre>
 *
 * <p>A failed load returns the plugin to {@link #UNLOADED}; a failed unload returns
 * it to {@link #INITIALIZED}.</p>
 */
public enum PluginState {
    UNLOADED,
    LOADING,
    INITIALIZED,
    UNLOADING
}
