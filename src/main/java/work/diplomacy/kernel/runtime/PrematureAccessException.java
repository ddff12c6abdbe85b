package work.diplomacy.kernel.runtime;

/**
 * A value that only exists after instantiation was read too early.
 */
public final class PrematureAccessException extends ElaborationException {
    public PrematureAccessException(String message) {
        super("premature_access", message);
    }

    public PrematureAccessException(String message, LazyModule module) {
        super("premature_access", message, module.name(), module.info());
    }
}
