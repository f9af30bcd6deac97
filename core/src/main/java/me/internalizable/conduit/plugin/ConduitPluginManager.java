package me.internalizable.conduit.plugin;

import me.internalizable.conduit.api.event.EventBus;
import me.internalizable.conduit.api.plugin.*;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.Nonnull;
import java.io.IOException;
import java.nio.file.Path;
import java.util.*;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * Plugin manager implementation.
 *
 * <p>Lifecycle operations are serialized by a re-entrant lock, so a plugin hook may
 * call back into the manager. Lookups read the registry without taking the lock.</p>
 */
public class ConduitPluginManager implements PluginManager {

    private static final Logger LOGGER = LoggerFactory.getLogger(ConduitPluginManager.class);

    private final ReentrantLock lifecycleLock = new ReentrantLock();

    private final Map<String, Plugin> plugins = new ConcurrentHashMap<>();
    private final PluginDependencyGraph dependencyGraph = new PluginDependencyGraph();

    // Class loaders of directory jars, closed once every plugin is unloaded
    private final List<PluginJar> pluginJars = new CopyOnWriteArrayList<>();

    private final PluginContext context;
    private final PluginJarLoader jarLoader;

    public ConduitPluginManager(@Nonnull EventBus eventBus) {
        this(eventBus, ConduitPluginManager.class.getClassLoader());
    }

    public ConduitPluginManager(@Nonnull EventBus eventBus, @Nonnull ClassLoader parentLoader) {
        Objects.requireNonNull(eventBus, "eventBus");
        this.context = new ConduitPluginContext(eventBus, this);
        this.jarLoader = new PluginJarLoader(parentLoader);
    }

    // ==================== Lifecycle ====================

    @Override
    public boolean loadPlugin(@Nonnull Plugin plugin) {
        Objects.requireNonNull(plugin, "plugin");
        PluginMetadata metadata = plugin.getMetadata();
        String name = metadata.getName();

        lifecycleLock.lock();
        try {
            if (plugins.containsKey(name)) {
                LOGGER.error("Cannot load plugin {}: a plugin with that name is already loaded", name);
                return false;
            }
            if (plugin.getState() != PluginState.UNLOADED) {
                LOGGER.error("Cannot load plugin {}: it is {}", name, plugin.getState());
                return false;
            }

            for (String dependency : metadata.getDependencies()) {
                Plugin loaded = plugins.get(dependency);
                if (loaded == null) {
                    LOGGER.error("Cannot load plugin {}: dependency {} is not loaded", name, dependency);
                    return false;
                }
                if (!loaded.isInitialized()) {
                    LOGGER.error("Cannot load plugin {}: dependency {} is not initialized ({})",
                        name, dependency, loaded.getState());
                    return false;
                }
            }

            LOGGER.info("Loading plugin: {} v{}", name, metadata.getVersion());
            plugin.attach(context);
            plugin.transitionTo(PluginState.LOADING);
            try {
                plugin.onLoad();
            } catch (Exception | LinkageError e) {
                LOGGER.error("Failed to load plugin: {}", name, e);
                notifyError(plugin, e);
                rollBackLoad(plugin);
                return false;
            }

            plugin.transitionTo(PluginState.INITIALIZED);
            plugins.put(name, plugin);
            dependencyGraph.add(name, metadata.getDependencies());
            LOGGER.info("Loaded plugin: {}", name);
            return true;
        } finally {
            lifecycleLock.unlock();
        }
    }

    private void rollBackLoad(Plugin plugin) {
        try {
            plugin.releaseEventHandlers();
        } catch (RuntimeException e) {
            LOGGER.error("Failed to release handlers of plugin {}", plugin.getMetadata().getName(), e);
        }
        plugin.transitionTo(PluginState.UNLOADED);
    }

    @Override
    public boolean unloadPlugin(@Nonnull String name) {
        Objects.requireNonNull(name, "name");

        lifecycleLock.lock();
        try {
            Plugin plugin = plugins.get(name);
            if (plugin == null) {
                LOGGER.warn("Cannot unload plugin {}: it is not loaded", name);
                return false;
            }
            if (!plugin.isInitialized()) {
                LOGGER.error("Cannot unload plugin {}: it is {}", name, plugin.getState());
                return false;
            }

            List<String> dependents = dependencyGraph.getDependents(name);
            if (!dependents.isEmpty()) {
                LOGGER.error("Cannot unload plugin {}: required by {}", name, dependents);
                return false;
            }

            LOGGER.info("Unloading plugin: {}", name);
            plugin.transitionTo(PluginState.UNLOADING);
            try {
                plugin.onUnload();
            } catch (Exception | LinkageError e) {
                // Stays registered so that the unload can be retried
                LOGGER.error("Failed to unload plugin: {}", name, e);
                notifyError(plugin, e);
                plugin.transitionTo(PluginState.INITIALIZED);
                return false;
            }

            plugins.remove(name);
            dependencyGraph.remove(name);
            plugin.transitionTo(PluginState.UNLOADED);
            LOGGER.info("Unloaded plugin: {}", name);
            return true;
        } finally {
            lifecycleLock.unlock();
        }
    }

    @Override
    public boolean reloadPlugin(@Nonnull String name) {
        Objects.requireNonNull(name, "name");

        lifecycleLock.lock();
        try {
            Plugin plugin = plugins.get(name);
            if (plugin == null) {
                LOGGER.warn("Cannot reload plugin {}: it is not loaded", name);
                return false;
            }
            if (!unloadPlugin(name)) {
                return false;
            }
            return loadPlugin(plugin);
        } finally {
            lifecycleLock.unlock();
        }
    }

    private static void notifyError(Plugin plugin, Throwable error) {
        try {
            plugin.onError(error);
        } catch (RuntimeException | LinkageError e) {
            LOGGER.error("Error callback of plugin {} failed", plugin.getMetadata().getName(), e);
        }
    }

    // ==================== Bulk Loading ====================

    @Override
    public int loadPlugins(@Nonnull Collection<? extends Plugin> candidates) {
        Objects.requireNonNull(candidates, "candidates");

        List<Plugin> enabled = new ArrayList<>(candidates.size());
        for (Plugin plugin : candidates) {
            if (plugin.getMetadata().isEnabled()) {
                enabled.add(plugin);
            } else {
                LOGGER.info("Skipping disabled plugin: {}", plugin.getMetadata().getName());
            }
        }

        lifecycleLock.lock();
        try {
            int loaded = 0;
            for (Plugin plugin : PluginDependencyGraph.sortByDependencies(enabled, plugins.keySet())) {
                try {
                    if (loadPlugin(plugin)) {
                        loaded++;
                    }
                } catch (RuntimeException | LinkageError e) {
                    LOGGER.error("Failed to load plugin: {}", plugin, e);
                }
            }
            LOGGER.info("Loaded {} of {} plugin(s)", loaded, candidates.size());
            return loaded;
        } finally {
            lifecycleLock.unlock();
        }
    }

    @Override
    public int loadPlugins(@Nonnull PluginCatalog catalog) {
        Objects.requireNonNull(catalog, "catalog");
        return loadPlugins(instantiate(catalog));
    }

    @Override
    public int loadPluginsFromDirectory(@Nonnull Path directory) {
        Objects.requireNonNull(directory, "directory");

        List<Plugin> discovered = new ArrayList<>();
        for (PluginJar jar : jarLoader.discover(directory)) {
            pluginJars.add(jar);
            discovered.addAll(instantiate(jar.getCatalog()));
        }
        return loadPlugins(discovered);
    }

    private static List<Plugin> instantiate(PluginCatalog catalog) {
        List<Plugin> created = new ArrayList<>(catalog.size());
        for (Map.Entry<String, Supplier<? extends Plugin>> entry : catalog.getFactories().entrySet()) {
            try {
                Plugin plugin = entry.getValue().get();
                if (plugin == null) {
                    LOGGER.error("Plugin factory {} returned null", entry.getKey());
                    continue;
                }
                if (!entry.getKey().equals(plugin.getMetadata().getName())) {
                    LOGGER.debug("Plugin factory {} created plugin {}", entry.getKey(), plugin.getMetadata().getName());
                }
                created.add(plugin);
            } catch (RuntimeException | LinkageError e) {
                LOGGER.error("Failed to create plugin: {}", entry.getKey(), e);
            }
        }
        return created;
    }

    @Override
    public void unloadAll() {
        lifecycleLock.lock();
        try {
            LOGGER.info("Unloading {} plugin(s)...", plugins.size());
            for (String name : dependencyGraph.unloadOrder()) {
                try {
                    unloadPlugin(name);
                } catch (RuntimeException | LinkageError e) {
                    LOGGER.error("Error unloading plugin: {}", name, e);
                }
            }

            if (plugins.isEmpty()) {
                closePluginJars();
            } else {
                LOGGER.warn("Plugins still loaded after unloading all: {}", plugins.keySet());
            }
        } finally {
            lifecycleLock.unlock();
        }
    }

    private void closePluginJars() {
        for (PluginJar jar : pluginJars) {
            try {
                jar.close();
            } catch (IOException e) {
                LOGGER.error("Failed to close plugin jar: {}", jar.getPath(), e);
            }
        }
        pluginJars.clear();
    }

    // ==================== Lookups ====================

    @Override
    @Nonnull
    public Optional<Plugin> getPlugin(@Nonnull String name) {
        return Optional.ofNullable(plugins.get(name));
    }

    @Override
    @Nonnull
    public Collection<Plugin> getPlugins() {
        return List.copyOf(plugins.values());
    }

    @Override
    @Nonnull
    public Optional<PluginMetadata> getPluginInfo(@Nonnull String name) {
        return getPlugin(name).map(Plugin::getMetadata);
    }

    @Override
    public boolean isLoaded(@Nonnull String name) {
        return plugins.containsKey(name);
    }

    @Override
    @Nonnull
    public List<String> getDependents(@Nonnull String name) {
        return dependencyGraph.getDependents(name);
    }

    @Override
    public int getLoadedPluginCount() {
        return plugins.size();
    }

    /**
     * Get the jars opened from plugin directories that are still open.
     */
    @Nonnull
    public List<PluginJar> getPluginJars() {
        return List.copyOf(pluginJars);
    }
}
