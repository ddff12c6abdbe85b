package work.diplomacy.kernel.runtime;

import java.util.Optional;
import work.diplomacy.kernel.demo.DemoNode;
import work.diplomacy.kernel.node.BaseNode;

/**
 * Declares the module tree described by a {@link DesignSpec} using {@link DemoNode}s.
 */
public final class DesignBuilder {
    private DesignBuilder() {}

    public static LazyModule build(ElaborationContext ctx, DesignSpec spec) {
        return build(ctx, spec, Optional.empty());
    }

    public static LazyModule build(ElaborationContext ctx, DesignSpec spec, Optional<String> topName) {
        return ctx.module(topName.orElse(spec.name()), new DesignModule(ctx, spec));
    }

    static final class DesignModule extends LazyModule {
        private final Optional<String> moduleType;

        DesignModule(ElaborationContext ctx, DesignSpec spec) {
            super(ctx);
            this.moduleType = spec.moduleType();
            for (DesignSpec.Node node : spec.nodes()) {
                DemoNode.create(ctx, node.name(), DemoNode.Kind.from(node.kind()), node.type());
            }
            for (DesignSpec child : spec.modules()) {
                ctx.module(child.name(), new DesignModule(ctx, child));
            }
            for (DesignSpec.Connection connection : spec.connections()) {
                DemoNode source = resolve(connection.from());
                DemoNode sink = resolve(connection.to());
                sink.bind(source);
            }
        }

        @Override
        public String desiredName() {
            return moduleType.orElseGet(super::desiredName);
        }

        private DemoNode resolve(String path) {
            String[] segments = path.split("\\.");
            LazyModule cursor = this;
            for (int i = 0; i < segments.length - 1; i++) {
                String childName = segments[i];
                cursor = cursor.children().stream()
                    .filter(child -> child.name().equals(childName))
                    .findFirst()
                    .orElseThrow(() -> new IllegalArgumentException("Unknown module '" + childName + "' in path " + path + " of " + name()));
            }
            String nodeName = segments[segments.length - 1];
            BaseNode node = cursor.nodes().stream()
                .filter(candidate -> candidate.name().equals(nodeName))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unknown node '" + nodeName + "' in path " + path + " of " + name()));
            if (!(node instanceof DemoNode demo)) {
                throw new IllegalArgumentException("Node " + path + " cannot be bound from a design file");
            }
            return demo;
        }
    }
}
