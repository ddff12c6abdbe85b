package work.diplomacy.kernel.support;

import java.nio.file.Path;
import java.util.List;
import java.util.function.Consumer;
import work.diplomacy.kernel.node.BaseNode;
import work.diplomacy.kernel.node.Dangle;
import work.diplomacy.kernel.runtime.ElaborationContext;
import work.diplomacy.kernel.runtime.LazyModule;

/**
 * Shared helpers for the elaboration suites: a module whose body is a lambda, a node with canned
 * dangles and the location of the YAML fixtures.
 */
public final class ElaborationTestSupport {
    private ElaborationTestSupport() {}

    public static Path design(String fileName) {
        return Path.of("src", "test", "resources", "designs", fileName).toAbsolutePath();
    }

    /**
     * Declares a closed module named {@code name} whose constructor runs {@code body}.
     */
    public static Block block(ElaborationContext ctx, String name, Consumer<Block> body) {
        return ctx.module(name, new Block(ctx, body));
    }

    public static class Block extends LazyModule {
        public Block(ElaborationContext ctx) {
            this(ctx, self -> {});
        }

        public Block(ElaborationContext ctx, Consumer<Block> body) {
            super(ctx);
            body.accept(this);
        }
    }

    /**
     * Node that hands out a fixed list of dangles, for wiring shapes the demo nodes cannot express.
     */
    public static final class FixedNode implements BaseNode {
        private final int serial;
        private final String name;
        private final List<Dangle> dangles;
        private boolean finished;

        public FixedNode(int serial, String name, List<Dangle> dangles) {
            this.serial = serial;
            this.name = name;
            this.dangles = List.copyOf(dangles);
        }

        @Override
        public int serial() {
            return serial;
        }

        @Override
        public String name() {
            return name;
        }

        @Override
        public List<Dangle> instantiate() {
            return dangles;
        }

        @Override
        public void finishInstantiate() {
            finished = true;
        }

        @Override
        public boolean omitGraph() {
            return true;
        }

        public boolean isFinished() {
            return finished;
        }
    }
}
