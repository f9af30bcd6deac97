package me.internalizable.conduit.plugin;

import me.internalizable.conduit.api.plugin.Plugin;
import me.internalizable.conduit.api.plugin.PluginMetadata;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.Nonnull;
import java.util.*;

/**
 * Declared dependencies of the loaded plugins.
 *
 * <p>Edges point from a plugin to the plugins it depends on. Since a plugin only
 * loads once its dependencies are loaded, the graph of loaded plugins has no cycles.</p>
 */
public final class PluginDependencyGraph {

    private static final Logger LOGGER = LoggerFactory.getLogger(PluginDependencyGraph.class);

    // name -> declared dependencies, in load order
    private final Map<String, List<String>> dependencies = new LinkedHashMap<>();

    public synchronized void add(@Nonnull String name, @Nonnull List<String> dependsOn) {
        dependencies.put(name, List.copyOf(dependsOn));
    }

    public synchronized void remove(@Nonnull String name) {
        dependencies.remove(name);
    }

    public synchronized boolean contains(@Nonnull String name) {
        return dependencies.containsKey(name);
    }

    @Nonnull
    public synchronized List<String> getDependencies(@Nonnull String name) {
        return dependencies.getOrDefault(name, List.of());
    }

    /**
     * Get the plugins that declare a dependency on the given one.
     *
     * @param name the plugin name
     * @return the dependent names, in load order
     */
    @Nonnull
    public synchronized List<String> getDependents(@Nonnull String name) {
        List<String> dependents = new ArrayList<>();
        for (Map.Entry<String, List<String>> entry : dependencies.entrySet()) {
            if (entry.getValue().contains(name)) {
                dependents.add(entry.getKey());
            }
        }
        return dependents;
    }

    /**
     * Get every plugin in an order where each one comes before the plugins it depends on.
     *
     * @return the names, safe to unload front to back
     */
    @Nonnull
    public synchronized List<String> unloadOrder() {
        List<String> order = new ArrayList<>(dependencies.size());
        Set<String> placed = new HashSet<>();

        // Load order with dependencies resolved among the loaded plugins only
        while (order.size() < dependencies.size()) {
            boolean progress = false;
            for (Map.Entry<String, List<String>> entry : dependencies.entrySet()) {
                if (placed.contains(entry.getKey())) {
                    continue;
                }
                boolean ready = entry.getValue().stream()
                    .allMatch(d -> placed.contains(d) || !dependencies.containsKey(d));
                if (ready) {
                    order.add(entry.getKey());
                    placed.add(entry.getKey());
                    progress = true;
                }
            }
            if (!progress) {
                for (String name : dependencies.keySet()) {
                    if (placed.add(name)) {
                        order.add(name);
                    }
                }
            }
        }

        Collections.reverse(order);
        return order;
    }

    /**
     * Order plugins so that each comes after the plugins it depends on.
     *
     * <p>A dependency counts as satisfied if it is earlier in the result or already
     * loaded. Plugins whose dependencies cannot be satisfied (missing names or cycles)
     * are appended in their original order; loading them fails their dependency check.</p>
     *
     * @param plugins the plugins to order
     * @param loaded the names of the plugins loaded already
     * @return a new list holding the same plugins
     */
    @Nonnull
    public static List<Plugin> sortByDependencies(@Nonnull Collection<? extends Plugin> plugins,
                                                  @Nonnull Set<String> loaded) {
        List<Plugin> sorted = new ArrayList<>(plugins.size());
        Set<Plugin> placed = Collections.newSetFromMap(new IdentityHashMap<>());
        Set<String> available = new HashSet<>(loaded);

        while (sorted.size() < plugins.size()) {
            boolean progress = false;
            for (Plugin plugin : plugins) {
                if (placed.contains(plugin)) {
                    continue;
                }

                PluginMetadata metadata = plugin.getMetadata();
                if (available.containsAll(metadata.getDependencies())) {
                    sorted.add(plugin);
                    placed.add(plugin);
                    available.add(metadata.getName());
                    progress = true;
                }
            }

            if (!progress) {
                for (Plugin plugin : plugins) {
                    if (placed.add(plugin)) {
                        LOGGER.warn("Plugin {} has unresolved dependencies {}",
                            plugin.getMetadata().getName(), plugin.getMetadata().getDependencies());
                        sorted.add(plugin);
                    }
                }
                break;
            }
        }

        return sorted;
    }
}
