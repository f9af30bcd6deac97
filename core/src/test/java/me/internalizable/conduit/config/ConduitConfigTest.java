package me.internalizable.conduit.config;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ConduitConfigTest {

    @TempDir
    Path directory;

    @Test
    void missingFileIsCreatedWithDefaults() throws IOException {
        Path path = directory.resolve("config/conduit.yml");

        ConduitConfig config = ConduitConfig.load(path);

        assertThat(path).exists();
        assertThat(config.getHistoryCapacity()).isEqualTo(1000);
        assertThat(config.getHistoryTtlMinutes()).isEqualTo(60);
        assertThat(config.getHistoryCleanupIntervalMinutes()).isEqualTo(30);
        assertThat(config.getPluginsDirectory()).isEqualTo("plugins");
        assertThat(config.isLoadPluginsFromDirectory()).isFalse();
        assertThat(Files.readString(path))
            .startsWith("# Conduit Configuration")
            .contains("historyCapacity: 1000")
            .doesNotContain("!!");
    }

    @Test
    void savedValuesAreLoadedBack() throws IOException {
        Path path = directory.resolve("conduit.yml");
        ConduitConfig config = new ConduitConfig();
        config.setHistoryCapacity(50);
        config.setHandlerTimeoutMillis(2500);
        config.setPluginsDirectory("/opt/conduit/plugins");
        config.setLoadPluginsFromDirectory(true);

        config.save(path);
        ConduitConfig loaded = ConduitConfig.load(path);

        assertThat(loaded.getHistoryCapacity()).isEqualTo(50);
        assertThat(loaded.handlerTimeout()).isEqualTo(Duration.ofMillis(2500));
        assertThat(loaded.getPluginsDirectory()).isEqualTo("/opt/conduit/plugins");
        assertThat(loaded.isLoadPluginsFromDirectory()).isTrue();
    }

    @Test
    void partialFileKeepsDefaultsForMissingKeys() throws IOException {
        Path path = directory.resolve("conduit.yml");
        Files.writeString(path, "dispatchThreads: 3\n");

        ConduitConfig config = ConduitConfig.load(path);

        assertThat(config.resolveDispatchThreads()).isEqualTo(3);
        assertThat(config.getShutdownTimeoutSeconds()).isEqualTo(5);
    }

    @Test
    void emptyFileGivesDefaults() throws IOException {
        Path path = directory.resolve("conduit.yml");
        Files.writeString(path, "");

        assertThat(ConduitConfig.load(path).getHistoryCapacity()).isEqualTo(1000);
    }

    @Test
    void autoDispatchThreadsUsesAtLeastTwo() {
        assertThat(new ConduitConfig().resolveDispatchThreads()).isGreaterThanOrEqualTo(2);
    }

    @Test
    void validateRejectsOutOfRangeValues() {
        ConduitConfig config = new ConduitConfig();
        config.setHandlerTimeoutMillis(-1);

        assertThatThrownBy(config::validate)
            .isInstanceOf(IllegalStateException.class)
            .hasMessageContaining("handlerTimeoutMillis");
    }
}
