package work.diplomacy.kernel.runtime;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import work.diplomacy.kernel.node.BaseNode;

/**
 * Declaration state for one elaboration: the open-scope stack, the module arena and node serials.
 *
 * <p>A context is confined to a single thread. Modules refer to each other by id through the
 * arena; ids start at 1 and are never reused.
 */
public final class ElaborationContext {
    private static final Logger log = LoggerFactory.getLogger(ElaborationContext.class);

    private final Deque<LazyModule> scopeStack = new ArrayDeque<>();
    private final List<LazyModule> arena = new ArrayList<>();
    private final Map<Integer, LazyModule> nodeOwners = new HashMap<>();
    private final ModuleInstantiator instantiator = new ModuleInstantiator(this);
    private int nextSerial;

    public Optional<LazyModule> current() {
        return Optional.ofNullable(scopeStack.peek());
    }

    public int depth() {
        return scopeStack.size();
    }

    public void enter(LazyModule module) {
        Objects.requireNonNull(module, "module");
        scopeStack.push(module);
        log.trace("enter {} (depth {})", module.name(), scopeStack.size());
    }

    public void exit(LazyModule module) {
        Objects.requireNonNull(module, "module");
        LazyModule top = scopeStack.peek();
        if (top == null) {
            throw new ScopeViolationException("Scope " + module.name() + " tried to exit, but scope was empty", module);
        }
        if (top != module) {
            throw new ScopeViolationException("Scope " + module.name() + " exited before " + top.name() + " was closed", top);
        }
        scopeStack.pop();
        log.trace("exit {} (depth {})", module.name(), scopeStack.size());
    }

    /**
     * Runs {@code body} with {@code scope} as the open module and restores the previous scope.
     *
     * <p>The body must close every module it opens. If it throws, the stack is reset to its state
     * before the call and the exception propagates.
     */
    public <T> T withScope(LazyModule scope, Supplier<T> body) {
        int saved = scopeStack.size();
        enter(scope);
        T out;
        try {
            out = body.get();
        } catch (RuntimeException | Error ex) {
            while (scopeStack.size() > saved) {
                scopeStack.pop();
            }
            throw ex;
        }
        exit(scope);
        return out;
    }

    public void withScope(LazyModule scope, Runnable body) {
        withScope(scope, () -> {
            body.run();
            return null;
        });
    }

    /**
     * Declares a {@link LazyScope} named {@code name} under the current scope and evaluates
     * {@code body} inside it.
     */
    public <T> T scope(String name, Supplier<T> body) {
        LazyScope scope = module(name, new LazyScope(this));
        return withScope(scope, body);
    }

    /**
     * Closes the declaration of {@code module}, which must be the innermost open scope.
     */
    public <T extends LazyModule> T module(T module) {
        return close(module, null);
    }

    public <T extends LazyModule> T module(String name, T module) {
        return close(module, Objects.requireNonNull(name, "name"));
    }

    private <T extends LazyModule> T close(T module, String name) {
        Objects.requireNonNull(module, "module");
        if (module.isClosed()) {
            throw new DoubleApplicationException("module() applied to " + module.name() + " twice", module);
        }
        LazyModule top = scopeStack.peek();
        if (top == null) {
            throw new ScopeViolationException("module() applied to " + module.name() + " outside of its declaration scope", module);
        }
        if (top != module) {
            throw new ScopeViolationException("module() applied to " + module.name() + " before " + top.name() + " was closed", top);
        }
        exit(module);
        module.markClosed(SourceInfo.capture());
        if (name != null && module.suggestedName().isEmpty()) {
            module.suggestName(name);
        }
        return module;
    }

    /**
     * Queues {@code body} on the innermost open module; it runs once that module is wired.
     */
    public <T> ModuleValue<T> inModuleBody(Supplier<T> body) {
        LazyModule scope = scopeStack.peek();
        if (scope == null) {
            throw new ScopeViolationException("inModuleBody invoked outside a lazy module");
        }
        return scope.enqueue(body);
    }

    public int nextSerial() {
        return nextSerial++;
    }

    public Optional<LazyModule> lookup(int id) {
        if (id < 1 || id > arena.size()) {
            return Optional.empty();
        }
        return Optional.of(arena.get(id - 1));
    }

    public List<LazyModule> modules() {
        return Collections.unmodifiableList(arena);
    }

    public List<LazyModule> roots() {
        return arena.stream().filter(m -> m.parent().isEmpty()).toList();
    }

    public Optional<LazyModule> ownerOf(int serial) {
        return Optional.ofNullable(nodeOwners.get(serial));
    }

    ModuleInstantiator instantiator() {
        return instantiator;
    }

    int adopt(LazyModule module) {
        arena.add(module);
        return arena.size();
    }

    void claim(LazyModule module, BaseNode node) {
        LazyModule owner = nodeOwners.putIfAbsent(node.serial(), module);
        if (owner != null) {
            throw new DoubleApplicationException("Node " + node.name() + " (serial " + node.serial() + ") is already owned by " + owner.name(), module);
        }
    }
}
