package me.internalizable.conduit.plugin;

import me.internalizable.conduit.api.plugin.PluginCatalog;

import javax.annotation.Nonnull;
import java.io.Closeable;
import java.io.IOException;
import java.net.URLClassLoader;
import java.nio.file.Path;

/**
 * A plugin jar opened from the plugins directory: its class loader and the
 * factories its providers registered.
 */
public final class PluginJar implements Closeable {

    private final Path path;
    private final URLClassLoader classLoader;
    private final PluginCatalog catalog;

    public PluginJar(@Nonnull Path path, @Nonnull URLClassLoader classLoader, @Nonnull PluginCatalog catalog) {
        this.path = path;
        this.classLoader = classLoader;
        this.catalog = catalog;
    }

    @Nonnull
    public Path getPath() {
        return path;
    }

    @Nonnull
    public ClassLoader getClassLoader() {
        return classLoader;
    }

    @Nonnull
    public PluginCatalog getCatalog() {
        return catalog;
    }

    @Override
    public void close() throws IOException {
        classLoader.close();
    }

    @Override
    public String toString() {
        return "PluginJar{path=" + path + ", plugins=" + catalog.getFactories().keySet() + "}";
    }
}
