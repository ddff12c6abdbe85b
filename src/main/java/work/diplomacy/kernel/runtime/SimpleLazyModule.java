package work.diplomacy.kernel.runtime;

/**
 * Lazy module with no behaviour of its own beyond what is declared inside it.
 */
public class SimpleLazyModule extends LazyModule {
    public SimpleLazyModule(ElaborationContext ctx) {
        super(ctx);
    }
}
