package work.diplomacy.kernel.runtime;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Consumer;
import java.util.function.Supplier;
import work.diplomacy.kernel.bundle.AutoBundle;
import work.diplomacy.kernel.node.BaseNode;
import work.diplomacy.kernel.node.Dangle;
import work.diplomacy.kernel.node.ResolvedLink;

/**
 * Declaration-time handle of a module whose ports and wiring are produced later.
 *
 * <p>Constructing a lazy module registers it with the innermost open scope of its context and
 * opens a new scope for it; everything the subclass constructor declares (child modules, nodes,
 * deferred bodies) lands in this module. The author then closes it with
 * {@link ElaborationContext#module(LazyModule)}:
 *
 * <pre>{@code
 * class Soc extends LazyModule {
 *     Soc(ElaborationContext ctx) {
 *         super(ctx);
 *         Cpu cpu = ctx.module("cpu", new Cpu(ctx));
 *         Ram ram = ctx.module("ram", new Ram(ctx));
 *         ram.port().bind(cpu.mem());
 *     }
 * }
 * Soc soc = ctx.module(new Soc(ctx));
 * soc.instantiate();
 * }</pre>
 *
 * <p>Nothing is wired until {@link #instantiate()} is forced on a root.
 */
public abstract class LazyModule {
    private final ElaborationContext ctx;
    private final int id;
    private final Integer parentId;
    private final List<Integer> childIds = new ArrayList<>();
    private final List<BaseNode> nodes = new ArrayList<>();
    private final List<ModuleValue<?>> deferred = new ArrayList<>();
    private String suggestedName;
    private SourceInfo info = SourceInfo.unknown();
    private boolean closed;
    private ModuleState state = ModuleState.DECLARED;
    private Instantiation instantiation;

    protected LazyModule(ElaborationContext ctx) {
        this.ctx = Objects.requireNonNull(ctx, "ctx");
        Optional<LazyModule> parent = ctx.current();
        this.parentId = parent.map(LazyModule::id).orElse(null);
        this.id = ctx.adopt(this);
        parent.ifPresent(p -> p.register(this));
        ctx.enter(this);
    }

    public final int id() {
        return id;
    }

    public final ElaborationContext context() {
        return ctx;
    }

    public final Optional<LazyModule> parent() {
        return parentId == null ? Optional.empty() : ctx.lookup(parentId);
    }

    /**
     * Enclosing modules, nearest first.
     */
    public final List<LazyModule> parents() {
        List<LazyModule> chain = new ArrayList<>();
        Optional<LazyModule> cursor = parent();
        while (cursor.isPresent()) {
            chain.add(cursor.get());
            cursor = cursor.get().parent();
        }
        return chain;
    }

    public final List<LazyModule> children() {
        return childIds.stream().map(childId -> ctx.lookup(childId).orElseThrow()).toList();
    }

    public final List<BaseNode> nodes() {
        return Collections.unmodifiableList(nodes);
    }

    public final ModuleState state() {
        return state;
    }

    public final boolean isClosed() {
        return closed;
    }

    public final SourceInfo info() {
        return info;
    }

    // Registration hooks; each one requires this module to be the open scope.

    public final void register(LazyModule child) {
        requireOpenScope("register " + child.name());
        if (!Objects.equals(child.parentId, id)) {
            throw new IllegalArgumentException(child.name() + " was not declared inside " + name());
        }
        if (childIds.contains(child.id())) {
            throw new DoubleApplicationException(child.name() + " registered twice with " + name(), child);
        }
        childIds.add(child.id());
    }

    public final <N extends BaseNode> N register(N node) {
        Objects.requireNonNull(node, "node");
        requireOpenScope("register node " + node.name());
        ctx.claim(this, node);
        nodes.add(node);
        return node;
    }

    public final ModuleValue<Void> defer(Runnable action) {
        Objects.requireNonNull(action, "action");
        return deferValue(() -> {
            action.run();
            return null;
        });
    }

    public final <T> ModuleValue<T> deferValue(Supplier<T> body) {
        requireOpenScope("defer");
        return enqueue(body);
    }

    <T> ModuleValue<T> enqueue(Supplier<T> body) {
        requireDeclaring("defer");
        var value = new ModuleValue<T>(this, body);
        deferred.add(value);
        return value;
    }

    private void requireOpenScope(String action) {
        requireDeclaring(action);
        LazyModule top = ctx.current().orElse(null);
        if (top == null) {
            throw new ScopeViolationException("Cannot " + action + " on " + name() + ": no module is being declared", this);
        }
        if (top != this) {
            throw new ScopeViolationException("Cannot " + action + " on " + name() + " while " + top.name() + " is the open scope", this);
        }
    }

    // Children, nodes and deferred bodies are frozen once instantiation starts.
    private void requireDeclaring(String action) {
        if (state != ModuleState.DECLARED) {
            throw new ScopeViolationException("Cannot " + action + " on " + name() + " after instantiation started (state " + state + ")", this);
        }
    }

    // Naming

    public final String className() {
        return findClassName(getClass());
    }

    private static String findClassName(Class<?> type) {
        return type.isAnonymousClass() ? findClassName(type.getSuperclass()) : type.getSimpleName();
    }

    public String desiredName() {
        return className();
    }

    public final Optional<String> suggestedName() {
        return Optional.ofNullable(suggestedName);
    }

    public final LazyModule suggestName(String name) {
        return suggestName(Optional.of(name));
    }

    /**
     * Replaces the suggested name; empty values are ignored. Names freeze once instantiation starts.
     */
    public final LazyModule suggestName(Optional<String> name) {
        if (name.isEmpty()) {
            return this;
        }
        if (state != ModuleState.DECLARED) {
            throw new IllegalStateException("Cannot rename " + name() + " to " + name.get() + " after instantiation started");
        }
        suggestedName = name.get();
        return this;
    }

    public final String name() {
        return suggestedName != null ? suggestedName : className();
    }

    // Available only after instantiation

    public final String moduleName() {
        requireDone("moduleName");
        return desiredName();
    }

    public final String pathName() {
        requireDone("pathName");
        List<LazyModule> chain = new ArrayList<>(parents());
        Collections.reverse(chain);
        StringBuilder path = new StringBuilder();
        for (LazyModule ancestor : chain) {
            path.append(ancestor.name()).append('.');
        }
        return path.append(name()).toString();
    }

    public final String instanceName() {
        String path = pathName();
        return path.substring(path.lastIndexOf('.') + 1);
    }

    public final Instantiation instantiation() {
        requireDone("instantiation");
        return instantiation;
    }

    public final AutoBundle auto() {
        return instantiation().auto();
    }

    public final List<Dangle> dangles() {
        return instantiation().dangles();
    }

    public final List<ResolvedLink> links() {
        return instantiation().links();
    }

    private void requireDone(String property) {
        if (state != ModuleState.DONE) {
            throw new PrematureAccessException(name() + "." + property + " is only available after instantiation (state " + state + ")", this);
        }
    }

    // Traversal

    public final boolean omitGraph() {
        return nodes.stream().allMatch(BaseNode::omitGraph) && children().stream().allMatch(LazyModule::omitGraph);
    }

    /**
     * Visits this module and then its subtree in declaration order.
     */
    public final void nodeIterator(Consumer<LazyModule> visitor) {
        visitor.accept(this);
        for (LazyModule child : children()) {
            child.nodeIterator(visitor);
        }
    }

    public final Instantiation instantiate() {
        return ctx.instantiator().instantiate(this);
    }

    // Engine callbacks

    void markClosed(SourceInfo site) {
        closed = true;
        info = site;
    }

    void transition(ModuleState next) {
        if (next.ordinal() != state.ordinal() + 1) {
            throw new IllegalStateException(name() + " cannot move from " + state + " to " + next);
        }
        state = next;
    }

    void runDeferred() {
        for (ModuleValue<?> value : deferred) {
            value.execute();
        }
    }

    void complete(Instantiation result) {
        this.instantiation = result;
        transition(ModuleState.DONE);
    }

    @Override
    public String toString() {
        return className() + " named " + name() + " #" + id;
    }
}
