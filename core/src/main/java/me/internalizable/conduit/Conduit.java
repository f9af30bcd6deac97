package me.internalizable.conduit;

import me.internalizable.conduit.api.event.EventBus;
import me.internalizable.conduit.api.plugin.PluginCatalog;
import me.internalizable.conduit.api.plugin.PluginManager;
import me.internalizable.conduit.config.ConduitConfig;
import me.internalizable.conduit.event.ConduitEventBus;
import me.internalizable.conduit.plugin.ConduitPluginManager;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.Nonnull;
import java.nio.file.Paths;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Owns the event bus and the plugin manager of one host process.
 *
 * <pre>{@code
 * Conduit conduit = new Conduit(ConduitConfig.load(Paths.get("conduit.yml")));
 * conduit.start(new PluginCatalog()
 *     .register("ai-assistant", AiAssistantPlugin::new));
 * ...
 * conduit.shutdown();
 * }</pre>
 */
public class Conduit {

    private static final Logger LOGGER = LoggerFactory.getLogger(Conduit.class);

    private final ConduitConfig config;
    private final ConduitEventBus eventBus;
    private final ConduitPluginManager pluginManager;

    private final AtomicBoolean started = new AtomicBoolean(false);
    private final AtomicBoolean stopped = new AtomicBoolean(false);

    public Conduit() {
        this(new ConduitConfig());
    }

    public Conduit(@Nonnull ConduitConfig config) {
        this(config, new ConduitEventBus(config));
    }

    public Conduit(@Nonnull ConduitConfig config, @Nonnull ConduitEventBus eventBus) {
        this.config = Objects.requireNonNull(config, "config");
        this.eventBus = Objects.requireNonNull(eventBus, "eventBus");
        this.pluginManager = new ConduitPluginManager(eventBus);
    }

    /**
     * Start history cleanup and load plugins: first the catalog, then the plugins
     * directory when enabled.
     *
     * @param catalog the built-in plugins
     * @return the number of plugins loaded
     * @throws IllegalStateException if already started
     */
    public int start(@Nonnull PluginCatalog catalog) {
        Objects.requireNonNull(catalog, "catalog");
        if (!started.compareAndSet(false, true)) {
            throw new IllegalStateException("Conduit is already started");
        }

        LOGGER.info("Starting Conduit...");
        eventBus.startHistoryCleanup(config.historyCleanupInterval());

        int loaded = pluginManager.loadPlugins(catalog);
        if (config.isLoadPluginsFromDirectory()) {
            loaded += pluginManager.loadPluginsFromDirectory(Paths.get(config.getPluginsDirectory()));
        }

        LOGGER.info("Conduit started with {} plugin(s)", loaded);
        return loaded;
    }

    /**
     * Unload every plugin, then shut the event bus down. Safe to call more than once.
     */
    public void shutdown() {
        if (!stopped.compareAndSet(false, true)) {
            return;
        }
        LOGGER.info("Shutting down Conduit...");
        pluginManager.unloadAll();
        eventBus.shutdown();
        LOGGER.info("Conduit shut down");
    }

    public boolean isRunning() {
        return started.get() && !stopped.get();
    }

    @Nonnull
    public ConduitConfig getConfig() {
        return config;
    }

    @Nonnull
    public EventBus getEventBus() {
        return eventBus;
    }

    @Nonnull
    public PluginManager getPluginManager() {
        return pluginManager;
    }
}
