package me.internalizable.conduit.config;

import org.yaml.snakeyaml.DumperOptions;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.Constructor;
import org.yaml.snakeyaml.introspector.Property;
import org.yaml.snakeyaml.nodes.NodeTuple;
import org.yaml.snakeyaml.nodes.Tag;
import org.yaml.snakeyaml.representer.Representer;

import java.io.IOException;
import java.io.InputStream;
import java.io.Writer;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Configuration for the event bus and plugin manager.
 */
public class ConduitConfig {

    // Event history
    private int historyCapacity = 1000;
    private int historyTtlMinutes = 60;
    private int historyCleanupIntervalMinutes = 30;

    // Dispatch
    private int dispatchThreads = 0;
    private long handlerTimeoutMillis = 0;
    private int shutdownTimeoutSeconds = 5;

    // Plugins
    private String pluginsDirectory = "plugins";
    private boolean loadPluginsFromDirectory = false;

    // ==================== Load / Save ====================

    public static ConduitConfig load(Path path) throws IOException {
        if (!Files.exists(path)) {
            ConduitConfig config = new ConduitConfig();
            config.save(path);
            return config;
        }

        LoaderOptions options = new LoaderOptions();
        Yaml yaml = new Yaml(new Constructor(ConduitConfig.class, options));
        try (InputStream is = Files.newInputStream(path)) {
            ConduitConfig config = yaml.load(is);
            return config != null ? config : new ConduitConfig();
        }
    }

    public void save(Path path) throws IOException {
        Path parent = path.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }

        DumperOptions dumperOptions = new DumperOptions();
        dumperOptions.setDefaultFlowStyle(DumperOptions.FlowStyle.BLOCK);
        dumperOptions.setPrettyFlow(true);
        dumperOptions.setIndent(2);

        Representer representer = new Representer(dumperOptions) {
            @Override
            protected NodeTuple representJavaBeanProperty(Object javaBean, Property property,
                                                          Object propertyValue, Tag customTag) {
                if (propertyValue == null) {
                    return null;
                }
                return super.representJavaBeanProperty(javaBean, property, propertyValue, customTag);
            }

            @Override
            protected Set<Property> getProperties(Class<?> type) {
                Set<Property> props = super.getProperties(type);
                if (type != ConduitConfig.class) {
                    return props;
                }
                Set<Property> ordered = new LinkedHashSet<>();
                for (String name : new String[]{
                    "historyCapacity", "historyTtlMinutes", "historyCleanupIntervalMinutes",
                    "dispatchThreads", "handlerTimeoutMillis", "shutdownTimeoutSeconds",
                    "pluginsDirectory", "loadPluginsFromDirectory"}) {
                    for (Property p : props) {
                        if (p.getName().equals(name)) {
                            ordered.add(p);
                            break;
                        }
                    }
                }
                ordered.addAll(props);
                return ordered;
            }
        };

        representer.addClassTag(ConduitConfig.class, Tag.MAP);

        Yaml yaml = new Yaml(representer, dumperOptions);

        try (Writer writer = Files.newBufferedWriter(path)) {
            writer.write("# Conduit Configuration\n");
            writer.write("# dispatchThreads: 0 sizes the pool from the CPU count\n");
            writer.write("# handlerTimeoutMillis: 0 disables the per-handler timeout\n\n");
            yaml.dump(this, writer);
        }
    }

    /**
     * Check that every value is in range.
     *
     * @throws IllegalStateException naming the first invalid value
     */
    public void validate() {
        if (historyCapacity < 1) {
            throw new IllegalStateException("historyCapacity must be at least 1, got " + historyCapacity);
        }
        if (historyTtlMinutes < 1) {
            throw new IllegalStateException("historyTtlMinutes must be at least 1, got " + historyTtlMinutes);
        }
        if (historyCleanupIntervalMinutes < 1) {
            throw new IllegalStateException("historyCleanupIntervalMinutes must be at least 1, got "
                + historyCleanupIntervalMinutes);
        }
        if (dispatchThreads < 0) {
            throw new IllegalStateException("dispatchThreads must not be negative, got " + dispatchThreads);
        }
        if (handlerTimeoutMillis < 0) {
            throw new IllegalStateException("handlerTimeoutMillis must not be negative, got " + handlerTimeoutMillis);
        }
        if (shutdownTimeoutSeconds < 0) {
            throw new IllegalStateException("shutdownTimeoutSeconds must not be negative, got " + shutdownTimeoutSeconds);
        }
        if (pluginsDirectory == null || pluginsDirectory.isBlank()) {
            throw new IllegalStateException("pluginsDirectory must not be empty");
        }
    }

    // ==================== Derived Values ====================

    public int resolveDispatchThreads() {
        return dispatchThreads > 0 ? dispatchThreads : Math.max(2, Runtime.getRuntime().availableProcessors() / 2);
    }

    public Duration historyTtl() {
        return Duration.ofMinutes(historyTtlMinutes);
    }

    public Duration historyCleanupInterval() {
        return Duration.ofMinutes(historyCleanupIntervalMinutes);
    }

    public Duration handlerTimeout() {
        return Duration.ofMillis(handlerTimeoutMillis);
    }

    public Duration shutdownTimeout() {
        return Duration.ofSeconds(shutdownTimeoutSeconds);
    }

    // ==================== History Getters/Setters ====================

    public int getHistoryCapacity() { return historyCapacity; }
    public void setHistoryCapacity(int historyCapacity) { this.historyCapacity = historyCapacity; }

    public int getHistoryTtlMinutes() { return historyTtlMinutes; }
    public void setHistoryTtlMinutes(int historyTtlMinutes) { this.historyTtlMinutes = historyTtlMinutes; }

    public int getHistoryCleanupIntervalMinutes() { return historyCleanupIntervalMinutes; }
    public void setHistoryCleanupIntervalMinutes(int historyCleanupIntervalMinutes) { this.historyCleanupIntervalMinutes = historyCleanupIntervalMinutes; }

    // ==================== Dispatch Getters/Setters ====================

    public int getDispatchThreads() { return dispatchThreads; }
    public void setDispatchThreads(int dispatchThreads) { this.dispatchThreads = dispatchThreads; }

    public long getHandlerTimeoutMillis() { return handlerTimeoutMillis; }
    public void setHandlerTimeoutMillis(long handlerTimeoutMillis) { this.handlerTimeoutMillis = handlerTimeoutMillis; }

    public int getShutdownTimeoutSeconds() { return shutdownTimeoutSeconds; }
    public void setShutdownTimeoutSeconds(int shutdownTimeoutSeconds) { this.shutdownTimeoutSeconds = shutdownTimeoutSeconds; }

    // ==================== Plugin Getters/Setters ====================

    public String getPluginsDirectory() { return pluginsDirectory; }
    public void setPluginsDirectory(String pluginsDirectory) { this.pluginsDirectory = pluginsDirectory; }

    public boolean isLoadPluginsFromDirectory() { return loadPluginsFromDirectory; }
    public void setLoadPluginsFromDirectory(boolean loadPluginsFromDirectory) { this.loadPluginsFromDirectory = loadPluginsFromDirectory; }
}
