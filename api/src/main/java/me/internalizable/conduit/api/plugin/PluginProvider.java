package me.internalizable.conduit.api.plugin;

import javax.annotation.Nonnull;

/**
 * Entry point of a plugin jar.
 *
 * <p>A jar dropped into the plugins directory names its providers in
 * {@code META-INF/services/me.internalizable.conduit.api.plugin.PluginProvider},
 * one fully qualified class name per line. Each provider needs a public no-arg
 * constructor.</p>
 *
 * <pre>{@code
 * public final class ReportsProvider implements PluginProvider {
 *     @Override
 *     public void register(PluginCatalog catalog) {
 *         catalog.register("task-reports", TaskReportsPlugin::new);
 *     }
 * }
 * }</pre>
 */
public interface PluginProvider {

    /**
     * Register the factories of every plugin this jar contains.
     *
     * @param catalog the catalog to register into
     */
    void register(@Nonnull PluginCatalog catalog);
}
