package me.internalizable.conduit.plugin;

import me.internalizable.conduit.api.plugin.PluginCatalog;
import me.internalizable.conduit.api.plugin.PluginProvider;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.Nonnull;
import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.net.URL;
import java.net.URLClassLoader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.jar.JarEntry;
import java.util.jar.JarFile;
import java.util.stream.Stream;

/**
 * Scans a directory for plugin jars.
 *
 * <p>Each jar gets its own class loader. Its providers are read from the jar's own
 * {@code META-INF/services} entry, so providers visible through the parent loader
 * are never picked up twice.</p>
 */
public class PluginJarLoader {

    private static final Logger LOGGER = LoggerFactory.getLogger(PluginJarLoader.class);

    static final String PROVIDERS_ENTRY = "META-INF/services/" + PluginProvider.class.getName();

    private final ClassLoader parentLoader;

    public PluginJarLoader(@Nonnull ClassLoader parentLoader) {
        this.parentLoader = Objects.requireNonNull(parentLoader, "parentLoader");
    }

    /**
     * Open every jar in the directory and collect the factories its providers register.
     * Jars that fail to open or register nothing are logged and skipped.
     *
     * @param directory the plugins directory, created if missing
     * @return the opened jars, sorted by file name
     */
    @Nonnull
    public List<PluginJar> discover(@Nonnull Path directory) {
        LOGGER.info("Loading plugins from: {}", directory);

        try {
            Files.createDirectories(directory);
        } catch (IOException e) {
            LOGGER.error("Failed to create plugins directory", e);
            return List.of();
        }

        List<Path> jarFiles = new ArrayList<>();
        try (Stream<Path> paths = Files.list(directory)) {
            paths.filter(p -> p.getFileName().toString().endsWith(".jar"))
                .filter(Files::isRegularFile)
                .sorted()
                .forEach(jarFiles::add);
        } catch (IOException e) {
            LOGGER.error("Failed to scan plugins directory", e);
            return List.of();
        }

        List<PluginJar> jars = new ArrayList<>();
        for (Path jarPath : jarFiles) {
            try {
                PluginJar jar = open(jarPath);
                if (jar != null) {
                    jars.add(jar);
                }
            } catch (Exception e) {
                LOGGER.error("Failed to discover plugins in: {}", jarPath, e);
            }
        }
        return jars;
    }

    private PluginJar open(Path jarPath) throws IOException {
        List<String> providerClasses = readProviderNames(jarPath);
        if (providerClasses.isEmpty()) {
            LOGGER.warn("Jar {} declares no plugin providers, skipping", jarPath.getFileName());
            return null;
        }

        URLClassLoader classLoader = new URLClassLoader(new URL[]{jarPath.toUri().toURL()}, parentLoader);
        PluginCatalog catalog = new PluginCatalog();

        for (String className : providerClasses) {
            try {
                Class<?> providerClass = Class.forName(className, true, classLoader);
                if (!PluginProvider.class.isAssignableFrom(providerClass)) {
                    LOGGER.error("{} in {} does not implement {}", className, jarPath.getFileName(),
                        PluginProvider.class.getSimpleName());
                    continue;
                }
                PluginProvider provider = (PluginProvider) providerClass.getDeclaredConstructor().newInstance();
                provider.register(catalog);
            } catch (Exception | LinkageError e) {
                LOGGER.error("Failed to run plugin provider {} in {}", className, jarPath.getFileName(), e);
            }
        }

        if (catalog.size() == 0) {
            LOGGER.warn("Jar {} registered no plugins, skipping", jarPath.getFileName());
            classLoader.close();
            return null;
        }

        LOGGER.info("Discovered {} plugin(s) in {}", catalog.size(), jarPath.getFileName());
        return new PluginJar(jarPath, classLoader, catalog);
    }

    private static List<String> readProviderNames(Path jarPath) throws IOException {
        List<String> names = new ArrayList<>();
        try (JarFile jarFile = new JarFile(jarPath.toFile())) {
            JarEntry entry = jarFile.getJarEntry(PROVIDERS_ENTRY);
            if (entry == null) {
                return names;
            }
            try (InputStream is = jarFile.getInputStream(entry);
                 BufferedReader reader = new BufferedReader(new InputStreamReader(is, StandardCharsets.UTF_8))) {
                String line;
                while ((line = reader.readLine()) != null) {
                    int comment = line.indexOf('#');
                    String name = (comment >= 0 ? line.substring(0, comment) : line).trim();
                    if (!name.isEmpty() && !names.contains(name)) {
                        names.add(name);
                    }
                }
            }
        }
        return names;
    }
}
