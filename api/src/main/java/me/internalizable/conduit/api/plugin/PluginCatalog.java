package me.internalizable.conduit.api.plugin;

import javax.annotation.Nonnull;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.function.Supplier;

/**
 * An explicit, ordered registry of plugin factories, assembled at startup.
 *
 * <pre>{@code
 * PluginCatalog catalog = new PluginCatalog()
 *     .register("ai-assistant", AiAssistantPlugin::new)
 *     .register("task-reports", TaskReportsPlugin::new);
 * pluginManager.loadPlugins(catalog);
 * }</pre>
 *
 * <p>Not thread-safe; build it on one thread, then hand it to the manager.</p>
 */
public final class PluginCatalog {

    private final Map<String, Supplier<? extends Plugin>> factories = new LinkedHashMap<>();

    /**
     * Register a plugin factory.
     *
     * @param name the name the factory is known by, usually the plugin name
     * @param factory creates a new plugin instance
     * @return this catalog
     * @throws IllegalArgumentException if the name is already registered
     */
    @Nonnull
    public PluginCatalog register(@Nonnull String name, @Nonnull Supplier<? extends Plugin> factory) {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(factory, "factory");
        if (factories.putIfAbsent(name, factory) != null) {
            throw new IllegalArgumentException("Plugin factory already registered: " + name);
        }
        return this;
    }

    /**
     * Get the registered factories in registration order.
     *
     * @return an unmodifiable view of name to factory
     */
    @Nonnull
    public Map<String, Supplier<? extends Plugin>> getFactories() {
        return Collections.unmodifiableMap(factories);
    }

    public boolean contains(@Nonnull String name) {
        return factories.containsKey(name);
    }

    public int size() {
        return factories.size();
    }
}
