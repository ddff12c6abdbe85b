package work.diplomacy.kernel.runtime;

/**
 * A module was finalized or instantiated twice, or a node was registered twice.
 */
public final class DoubleApplicationException extends ElaborationException {
    public DoubleApplicationException(String message, LazyModule module) {
        super("double_application", message, module.name(), module.info());
    }
}
