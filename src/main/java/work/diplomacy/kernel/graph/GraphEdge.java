package work.diplomacy.kernel.graph;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import work.diplomacy.kernel.node.BaseNode;
import work.diplomacy.kernel.node.ResolvedLink;
import work.diplomacy.kernel.runtime.ElaborationContext;
import work.diplomacy.kernel.runtime.LazyModule;

/**
 * Directed edge between two rendered nodes, from the supplying side to the receiving side.
 * Endpoint ids are {@code <module id>::<node serial>}.
 */
public record GraphEdge(String source, String target, String label) {

    static String nodeId(LazyModule module, BaseNode node) {
        return module.id() + "::" + node.serial();
    }

    /**
     * Every link closed anywhere under {@code root}, in pre-order, skipping omitted nodes.
     */
    static List<GraphEdge> collect(LazyModule root) {
        ElaborationContext ctx = root.context();
        List<GraphEdge> edges = new ArrayList<>();
        root.nodeIterator(module -> {
            for (ResolvedLink link : module.links()) {
                var from = endpoint(ctx, link.key().serial());
                var to = endpoint(ctx, link.receiver().sink().serial());
                if (from.isPresent() && to.isPresent()) {
                    edges.add(new GraphEdge(from.get(), to.get(), link.label()));
                }
            }
        });
        return edges;
    }

    private static Optional<String> endpoint(ElaborationContext ctx, int serial) {
        return ctx.ownerOf(serial).flatMap(owner -> owner.nodes().stream()
            .filter(node -> node.serial() == serial && !node.omitGraph())
            .findFirst()
            .map(node -> nodeId(owner, node)));
    }
}
