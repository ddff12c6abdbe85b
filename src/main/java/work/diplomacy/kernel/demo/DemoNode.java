package work.diplomacy.kernel.demo;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import work.diplomacy.kernel.node.BaseNode;
import work.diplomacy.kernel.node.Dangle;
import work.diplomacy.kernel.node.HalfEdge;
import work.diplomacy.kernel.runtime.ElaborationContext;
import work.diplomacy.kernel.runtime.LazyModule;
import work.diplomacy.kernel.runtime.ScopeViolationException;

/**
 * Point-to-point node used by the demo designs and the test suites.
 *
 * <p>A sink is bound to a source with {@link #bind(DemoNode)}; every binding is one edge keyed by
 * the source's serial and output index. A node without bindings produces a single dangle keyed by
 * its own serial, which ends up on the boundary of its module.
 */
public final class DemoNode implements BaseNode {
    public enum Kind {
        SOURCE,
        SINK;

        public static Kind from(String value) {
            try {
                return Kind.valueOf(Objects.requireNonNull(value, "kind").trim().toUpperCase(Locale.ROOT));
            } catch (IllegalArgumentException ex) {
                throw new IllegalArgumentException("Unsupported node kind: " + value);
            }
        }
    }

    private final int serial;
    private final String name;
    private final Kind kind;
    private final String typeName;
    private final List<Edge> edges = new ArrayList<>();
    private List<Dangle> dangles;
    private boolean finished;

    private DemoNode(int serial, String name, Kind kind, String typeName) {
        this.serial = serial;
        this.name = Objects.requireNonNull(name, "name");
        this.kind = kind;
        this.typeName = Objects.requireNonNull(typeName, "typeName");
    }

    public static DemoNode source(ElaborationContext ctx, String name, String typeName) {
        return create(ctx, name, Kind.SOURCE, typeName);
    }

    public static DemoNode sink(ElaborationContext ctx, String name, String typeName) {
        return create(ctx, name, Kind.SINK, typeName);
    }

    public static DemoNode create(ElaborationContext ctx, String name, Kind kind, String typeName) {
        LazyModule owner = ctx.current()
            .orElseThrow(() -> new ScopeViolationException("Node " + name + " declared outside a lazy module"));
        return owner.register(new DemoNode(ctx.nextSerial(), name, kind, typeName));
    }

    /**
     * Drives this sink from {@code source}.
     */
    public DemoNode bind(DemoNode source) {
        if (kind != Kind.SINK || source.kind != Kind.SOURCE) {
            throw new IllegalArgumentException("Cannot bind " + kind + " " + name + " to " + source.kind + " " + source.name);
        }
        if (dangles != null || source.dangles != null) {
            throw new IllegalStateException("Cannot bind " + name + " to " + source.name + " after instantiation");
        }
        var edge = new Edge(new HalfEdge(source.serial, source.edges.size()), new HalfEdge(serial, edges.size()));
        source.edges.add(edge);
        edges.add(edge);
        return this;
    }

    @Override
    public int serial() {
        return serial;
    }

    @Override
    public String name() {
        return name;
    }

    public Kind kind() {
        return kind;
    }

    public String typeName() {
        return typeName;
    }

    public int edgeCount() {
        return edges.size();
    }

    public boolean isFinished() {
        return finished;
    }

    @Override
    public List<Dangle> instantiate() {
        if (dangles != null) {
            throw new IllegalStateException("Node " + name + " instantiated twice");
        }
        boolean flipped = kind == Kind.SINK;
        List<Dangle> out = new ArrayList<>();
        if (edges.isEmpty()) {
            var self = new HalfEdge(serial, 0);
            out.add(new Dangle(self, self, flipped, name, new DemoSignal(typeName)));
        }
        for (int i = 0; i < edges.size(); i++) {
            Edge edge = edges.get(i);
            String dangleName = edges.size() == 1 ? name : name + "_" + i;
            out.add(new Dangle(edge.source(), edge.sink(), flipped, dangleName, new DemoSignal(typeName)));
        }
        dangles = List.copyOf(out);
        return dangles;
    }

    /**
     * Signals handed out by {@link #instantiate()}, in edge order.
     */
    public List<DemoSignal> signals() {
        if (dangles == null) {
            throw new IllegalStateException("Node " + name + " has not been instantiated");
        }
        return dangles.stream().map(d -> (DemoSignal) d.data()).toList();
    }

    @Override
    public void finishInstantiate() {
        if (dangles == null) {
            throw new IllegalStateException("Node " + name + " finished before it was instantiated");
        }
        finished = true;
    }

    @Override
    public String describe() {
        return kind.name().toLowerCase(Locale.ROOT) + " " + name + ": " + typeName;
    }

    @Override
    public String toString() {
        return "DemoNode(" + describe() + ", serial " + serial + ")";
    }

    private record Edge(HalfEdge source, HalfEdge sink) {}
}
