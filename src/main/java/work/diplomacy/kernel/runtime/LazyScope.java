package work.diplomacy.kernel.runtime;

/**
 * Grouping module created by {@link ElaborationContext#scope(String, java.util.function.Supplier)}.
 */
public final class LazyScope extends SimpleLazyModule {
    LazyScope(ElaborationContext ctx) {
        super(ctx);
    }

    @Override
    public String toString() {
        return "LazyScope named " + name();
    }
}
