package me.internalizable.conduit.api.plugin;

import javax.annotation.Nonnull;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/**
 * Describes a plugin: its unique name, version, author and the names of the
 * plugins it depends on.
 */
public final class PluginMetadata {

    private final String name;
    private final String version;
    private final String description;
    private final String author;
    private final List<String> dependencies;
    private final boolean enabled;

    private PluginMetadata(Builder builder) {
        this.name = builder.name;
        this.version = builder.version;
        this.description = builder.description;
        this.author = builder.author;
        this.dependencies = List.copyOf(builder.dependencies);
        this.enabled = builder.enabled;
    }

    @Nonnull
    public static Builder builder(@Nonnull String name) {
        return new Builder(name);
    }

    /**
     * Get the plugin name. Unique among loaded plugins.
     */
    @Nonnull
    public String getName() {
        return name;
    }

    @Nonnull
    public String getVersion() {
        return version;
    }

    @Nonnull
    public String getDescription() {
        return description;
    }

    @Nonnull
    public String getAuthor() {
        return author;
    }

    /**
     * Get the names of the plugins that must be loaded and initialized before this one.
     *
     * @return the dependency names in declaration order
     */
    @Nonnull
    public List<String> getDependencies() {
        return dependencies;
    }

    /**
     * Whether bulk loading should pick this plugin up.
     */
    public boolean isEnabled() {
        return enabled;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof PluginMetadata)) return false;
        PluginMetadata that = (PluginMetadata) o;
        return enabled == that.enabled
            && name.equals(that.name)
            && version.equals(that.version)
            && description.equals(that.description)
            && author.equals(that.author)
            && dependencies.equals(that.dependencies);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, version, description, author, dependencies, enabled);
    }

    @Override
    public String toString() {
        return String.format("PluginMetadata{name=%s, version=%s, author=%s, dependencies=%s, enabled=%s}",
            name, version, author, dependencies, enabled);
    }

    public static final class Builder {

        private final String name;
        private String version = "1.0.0";
        private String description = "";
        private String author = "";
        private List<String> dependencies = List.of();
        private boolean enabled = true;

        private Builder(String name) {
            Objects.requireNonNull(name, "name");
            if (name.isBlank()) {
                throw new IllegalArgumentException("Plugin name must not be blank");
            }
            this.name = name;
        }

        @Nonnull
        public Builder version(@Nonnull String version) {
            this.version = Objects.requireNonNull(version, "version");
            return this;
        }

        @Nonnull
        public Builder description(@Nonnull String description) {
            this.description = Objects.requireNonNull(description, "description");
            return this;
        }

        @Nonnull
        public Builder author(@Nonnull String author) {
            this.author = Objects.requireNonNull(author, "author");
            return this;
        }

        @Nonnull
        public Builder dependencies(@Nonnull String... dependencies) {
            return dependencies(Arrays.asList(dependencies));
        }

        @Nonnull
        public Builder dependencies(@Nonnull List<String> dependencies) {
            this.dependencies = List.copyOf(Objects.requireNonNull(dependencies, "dependencies"));
            return this;
        }

        @Nonnull
        public Builder enabled(boolean enabled) {
            this.enabled = enabled;
            return this;
        }

        @Nonnull
        public PluginMetadata build() {
            return new PluginMetadata(this);
        }
    }
}
