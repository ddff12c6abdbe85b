package work.diplomacy.kernel.runtime;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Declarative description of a module tree, as read from a design file.
 */
public record DesignSpec(
    String name,
    Optional<String> moduleType,
    List<Node> nodes,
    List<DesignSpec> modules,
    List<Connection> connections
) {
    public DesignSpec {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(moduleType, "moduleType");
        nodes = List.copyOf(nodes);
        modules = List.copyOf(modules);
        connections = List.copyOf(connections);
    }

    public record Node(String name, String kind, String type) {}

    /**
     * {@code to} (a sink) is driven by {@code from} (a source). Paths are dot-separated child
     * module names ending in a node name, relative to the declaring module.
     */
    public record Connection(String from, String to) {}
}
