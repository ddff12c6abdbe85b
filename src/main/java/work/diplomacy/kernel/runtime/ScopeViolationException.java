package work.diplomacy.kernel.runtime;

/**
 * Declaration scopes were opened or closed out of order, or a registration happened outside the
 * scope it targets.
 */
public final class ScopeViolationException extends ElaborationException {
    public ScopeViolationException(String message) {
        super("scope_violation", message);
    }

    public ScopeViolationException(String message, LazyModule module) {
        super("scope_violation", message, module.name(), module.info());
    }
}
