package me.internalizable.conduit.plugin;

import me.internalizable.conduit.api.plugin.Plugin;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;

class PluginDependencyGraphTest {

    private final List<String> journal = new ArrayList<>();

    @Test
    void dependentsAreTrackedUntilRemoved() {
        PluginDependencyGraph graph = new PluginDependencyGraph();
        graph.add("storage", List.of());
        graph.add("tasks", List.of("storage"));
        graph.add("reports", List.of("tasks", "storage"));

        assertThat(graph.getDependents("storage")).containsExactly("tasks", "reports");
        assertThat(graph.getDependencies("reports")).containsExactly("tasks", "storage");

        graph.remove("reports");
        assertThat(graph.getDependents("storage")).containsExactly("tasks");
        assertThat(graph.contains("reports")).isFalse();
        assertThat(graph.getDependencies("reports")).isEmpty();
    }

    @Test
    void unloadOrderPutsDependentsFirst() {
        PluginDependencyGraph graph = new PluginDependencyGraph();
        graph.add("storage", List.of());
        graph.add("tasks", List.of("storage"));
        graph.add("reports", List.of("tasks"));

        assertThat(graph.unloadOrder()).containsExactly("reports", "tasks", "storage");
    }

    @Test
    void sortTreatsLoadedPluginsAsSatisfied() {
        TestPlugin reports = new TestPlugin("reports", journal, "tasks", "storage");
        TestPlugin tasks = new TestPlugin("tasks", journal, "storage");

        List<Plugin> sorted = PluginDependencyGraph.sortByDependencies(List.of(reports, tasks), Set.of("storage"));

        assertThat(sorted).containsExactly(tasks, reports);
    }

    @Test
    void sortAppendsUnresolvablePluginsInOriginalOrder() {
        TestPlugin cyclicA = new TestPlugin("a", journal, "b");
        TestPlugin cyclicB = new TestPlugin("b", journal, "a");
        TestPlugin free = new TestPlugin("free", journal);

        List<Plugin> sorted = PluginDependencyGraph.sortByDependencies(List.of(cyclicA, cyclicB, free), Set.of());

        assertThat(sorted).containsExactly(free, cyclicA, cyclicB);
    }
}
