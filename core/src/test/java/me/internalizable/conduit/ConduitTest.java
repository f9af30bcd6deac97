package me.internalizable.conduit;

import me.internalizable.conduit.api.event.Event;
import me.internalizable.conduit.api.event.EventHandler;
import me.internalizable.conduit.api.plugin.Plugin;
import me.internalizable.conduit.api.plugin.PluginCatalog;
import me.internalizable.conduit.api.plugin.PluginMetadata;
import me.internalizable.conduit.config.ConduitConfig;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ConduitTest {

    @TempDir
    Path pluginsDirectory;

    private ConduitConfig config;
    private Conduit conduit;

    @BeforeEach
    void setUp() {
        config = new ConduitConfig();
        config.setDispatchThreads(2);
        config.setShutdownTimeoutSeconds(1);
        config.setPluginsDirectory(pluginsDirectory.toString());
        conduit = new Conduit(config);
    }

    @AfterEach
    void tearDown() {
        conduit.shutdown();
    }

    private static final class GreeterPlugin extends Plugin {

        private final String name;

        GreeterPlugin(String name) {
            this.name = name;
        }

        @Override
        public PluginMetadata getMetadata() {
            return PluginMetadata.builder(name).build();
        }

        @Override
        public void onLoad() {
            registerEventHandler(new EventHandler() {
                @Override
                public Set<String> getEventTypes() {
                    return Set.of("user.greeted");
                }

                @Override
                public Object handle(Event event) {
                    return name;
                }
            });
        }
    }

    @Test
    void startLoadsCatalogPlugins() {
        int loaded = conduit.start(new PluginCatalog()
            .register("en", () -> new GreeterPlugin("en"))
            .register("fr", () -> new GreeterPlugin("fr")));

        assertThat(loaded).isEqualTo(2);
        assertThat(conduit.isRunning()).isTrue();
        assertThat(conduit.getEventBus().publishAndWait(Event.builder("user.greeted").build())).hasSize(2);
    }

    @Test
    void startScansPluginsDirectoryWhenEnabled() {
        config.setLoadPluginsFromDirectory(true);

        int loaded = conduit.start(new PluginCatalog());

        assertThat(loaded).isZero();
        assertThat(pluginsDirectory).isEmptyDirectory();
    }

    @Test
    void startTwiceFails() {
        conduit.start(new PluginCatalog());

        assertThatThrownBy(() -> conduit.start(new PluginCatalog()))
            .isInstanceOf(IllegalStateException.class);
    }

    @Test
    void shutdownUnloadsPluginsAndStopsBus() {
        conduit.start(new PluginCatalog().register("en", () -> new GreeterPlugin("en")));

        conduit.shutdown();
        conduit.shutdown();

        assertThat(conduit.isRunning()).isFalse();
        assertThat(conduit.getPluginManager().getLoadedPluginCount()).isZero();
        assertThat(conduit.getEventBus().getRegisteredEventTypes()).isEmpty();
        assertThat(conduit.getEventBus().publishAndWait(Event.builder("user.greeted").build())).isEmpty();
    }
}
