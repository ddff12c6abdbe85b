package work.diplomacy.kernel.runtime;

import java.util.Objects;
import java.util.function.Supplier;

/**
 * Result of a body deferred until its module is instantiated.
 */
public final class ModuleValue<T> {
    private final LazyModule owner;
    private final Supplier<T> body;
    private boolean executed;
    private T result;

    ModuleValue(LazyModule owner, Supplier<T> body) {
        this.owner = owner;
        this.body = Objects.requireNonNull(body, "body");
    }

    void execute() {
        if (executed) {
            throw new IllegalStateException("Deferred body of " + owner.name() + " already ran");
        }
        result = body.get();
        executed = true;
    }

    public boolean isAvailable() {
        return executed;
    }

    public T get() {
        if (!executed) {
            throw new PrematureAccessException("Deferred contents of " + owner.name() + " were requested before the module was instantiated", owner);
        }
        return result;
    }
}
