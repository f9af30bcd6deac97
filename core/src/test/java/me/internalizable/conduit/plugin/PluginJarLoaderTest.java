package me.internalizable.conduit.plugin;

import me.internalizable.conduit.config.ConduitConfig;
import me.internalizable.conduit.event.ConduitEventBus;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.jar.JarEntry;
import java.util.jar.JarOutputStream;

import static org.assertj.core.api.Assertions.assertThat;

class PluginJarLoaderTest {

    @TempDir
    Path pluginsDirectory;

    private ConduitEventBus eventBus;
    private ConduitPluginManager pluginManager;

    @BeforeEach
    void setUp() {
        ConduitConfig config = new ConduitConfig();
        config.setDispatchThreads(2);
        config.setShutdownTimeoutSeconds(1);
        eventBus = new ConduitEventBus(config);
        pluginManager = new ConduitPluginManager(eventBus);
    }

    @AfterEach
    void tearDown() {
        pluginManager.unloadAll();
        eventBus.shutdown();
    }

    private Path writeJar(String fileName, String providers) throws IOException {
        Path jar = pluginsDirectory.resolve(fileName);
        try (JarOutputStream out = new JarOutputStream(Files.newOutputStream(jar))) {
            if (providers != null) {
                out.putNextEntry(new JarEntry(PluginJarLoader.PROVIDERS_ENTRY));
                out.write(providers.getBytes(StandardCharsets.UTF_8));
                out.closeEntry();
            }
            out.putNextEntry(new JarEntry("README.txt"));
            out.write("plugin".getBytes(StandardCharsets.UTF_8));
            out.closeEntry();
        }
        return jar;
    }

    @Test
    void discoversProvidersNamedInServicesEntry() throws IOException {
        writeJar("reports.jar", "# providers\n" + JarTestProvider.class.getName() + "\n\n");

        List<PluginJar> jars = new PluginJarLoader(getClass().getClassLoader()).discover(pluginsDirectory);

        assertThat(jars).singleElement().satisfies(jar -> {
            assertThat(jar.getPath().getFileName().toString()).isEqualTo("reports.jar");
            assertThat(jar.getCatalog().contains("jar-plugin")).isTrue();
        });
        for (PluginJar jar : jars) {
            jar.close();
        }
    }

    @Test
    void brokenJarsAndProvidersAreSkipped() throws IOException {
        writeJar("a-good.jar", JarTestProvider.class.getName()
            + "\ncom.example.MissingProvider\njava.lang.String\n");
        writeJar("b-no-services.jar", null);
        writeJar("c-only-missing.jar", "com.example.MissingProvider\n");
        Files.write(pluginsDirectory.resolve("d-corrupt.jar"), new byte[]{1, 2, 3, 4});
        Files.writeString(pluginsDirectory.resolve("notes.txt"), "not a jar");

        int loaded = pluginManager.loadPluginsFromDirectory(pluginsDirectory);

        assertThat(loaded).isEqualTo(1);
        assertThat(pluginManager.isLoaded("jar-plugin")).isTrue();
        assertThat(pluginManager.getPluginJars()).hasSize(1);
    }

    @Test
    void unloadAllClosesPluginJars() throws IOException {
        writeJar("reports.jar", JarTestProvider.class.getName());
        pluginManager.loadPluginsFromDirectory(pluginsDirectory);

        pluginManager.unloadAll();

        assertThat(pluginManager.getLoadedPluginCount()).isZero();
        assertThat(pluginManager.getPluginJars()).isEmpty();
    }

    @Test
    void missingDirectoryIsCreated() {
        Path missing = pluginsDirectory.resolve("nested/plugins");

        int loaded = pluginManager.loadPluginsFromDirectory(missing);

        assertThat(loaded).isZero();
        assertThat(missing).isDirectory();
    }
}
