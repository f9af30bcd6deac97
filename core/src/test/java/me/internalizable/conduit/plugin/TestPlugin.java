package me.internalizable.conduit.plugin;

import me.internalizable.conduit.api.event.Event;
import me.internalizable.conduit.api.event.EventHandler;
import me.internalizable.conduit.api.plugin.Plugin;
import me.internalizable.conduit.api.plugin.PluginContext;
import me.internalizable.conduit.api.plugin.PluginMetadata;

import java.util.List;
import java.util.Set;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Plugin with scriptable hooks. Each load registers one handler for
 * {@code <name>.ping} that answers with the plugin name.
 */
class TestPlugin extends Plugin {

    interface Hook {
        void run(PluginContext context) throws Exception;
    }

    private final PluginMetadata metadata;
    private final List<String> journal;

    final List<Throwable> errors = new CopyOnWriteArrayList<>();

    volatile Exception loadFailure;
    volatile Exception unloadFailure;
    volatile Hook unloadHook;

    TestPlugin(PluginMetadata metadata, List<String> journal) {
        this.metadata = metadata;
        this.journal = journal;
    }

    TestPlugin(String name, List<String> journal, String... dependencies) {
        this(PluginMetadata.builder(name).dependencies(dependencies).build(), journal);
    }

    static String pingType(String name) {
        return name + ".ping";
    }

    @Override
    public PluginMetadata getMetadata() {
        return metadata;
    }

    @Override
    public void onLoad() throws Exception {
        journal.add("load:" + metadata.getName());
        registerEventHandler(new PingHandler(metadata.getName()));
        if (loadFailure != null) {
            throw loadFailure;
        }
    }

    @Override
    public void onUnload() throws Exception {
        journal.add("unload:" + metadata.getName());
        Hook hook = unloadHook;
        if (hook != null) {
            hook.run(getContext());
        }
        if (unloadFailure != null) {
            throw unloadFailure;
        }
        super.onUnload();
    }

    @Override
    public void onError(Throwable error) {
        errors.add(error);
    }

    static final class PingHandler implements EventHandler {

        private final String name;

        PingHandler(String name) {
            this.name = name;
        }

        @Override
        public Set<String> getEventTypes() {
            return Set.of(pingType(name));
        }

        @Override
        public Object handle(Event event) {
            return name;
        }
    }
}
