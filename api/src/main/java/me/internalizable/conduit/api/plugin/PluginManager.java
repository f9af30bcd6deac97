package me.internalizable.conduit.api.plugin;

import javax.annotation.Nonnull;
import java.nio.file.Path;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

/**
 * Loads, unloads and reloads plugins while respecting their dependencies.
 *
 * <h2>Dependency Gating</h2>
 * <ul>
 *   <li>A plugin loads only if every plugin it depends on is loaded and initialized.</li>
 *   <li>A plugin unloads only if no loaded plugin depends on it.</li>
 * </ul>
 *
 * <h2>Failure Reporting</h2>
 * <p>Nothing thrown by a plugin escapes the manager. Dependency violations and
 * lifecycle hook failures are logged, hook failures are passed to
 * {@link Plugin#onError(Throwable)}, and the operation returns {@code false}.</p>
 */
public interface PluginManager {

    /**
     * Load a plugin.
     *
     * @param plugin the plugin instance
     * @return true if the plugin is now loaded and initialized
     */
    boolean loadPlugin(@Nonnull Plugin plugin);

    /**
     * Unload a plugin.
     *
     * @param name the plugin name
     * @return true if the plugin was loaded and is now unloaded
     */
    boolean unloadPlugin(@Nonnull String name);

    /**
     * Unload a plugin and load the same instance again.
     *
     * @param name the plugin name
     * @return true if both steps succeeded
     */
    boolean reloadPlugin(@Nonnull String name);

    /**
     * Load several plugins, dependencies first. Disabled plugins are skipped and one
     * plugin's failure does not stop the others.
     *
     * @param plugins the plugin instances
     * @return the number of plugins loaded
     */
    int loadPlugins(@Nonnull Collection<? extends Plugin> plugins);

    /**
     * Instantiate every factory of a catalog and load the results as
     * {@link #loadPlugins(Collection)} does.
     *
     * @param catalog the catalog
     * @return the number of plugins loaded
     */
    int loadPlugins(@Nonnull PluginCatalog catalog);

    /**
     * Load the plugins of every jar in a directory. See {@link PluginProvider}.
     *
     * @param directory the directory to scan
     * @return the number of plugins loaded
     */
    int loadPluginsFromDirectory(@Nonnull Path directory);

    /**
     * Unload every plugin, dependents before their dependencies.
     */
    void unloadAll();

    @Nonnull
    Optional<Plugin> getPlugin(@Nonnull String name);

    /**
     * Get all loaded plugins.
     *
     * @return an unmodifiable snapshot
     */
    @Nonnull
    Collection<Plugin> getPlugins();

    @Nonnull
    Optional<PluginMetadata> getPluginInfo(@Nonnull String name);

    boolean isLoaded(@Nonnull String name);

    /**
     * Get the loaded plugins that declare a dependency on the given plugin.
     *
     * @param name the plugin name
     * @return the names of the dependent plugins
     */
    @Nonnull
    List<String> getDependents(@Nonnull String name);

    int getLoadedPluginCount();
}
