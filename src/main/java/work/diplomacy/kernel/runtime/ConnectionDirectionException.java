package work.diplomacy.kernel.runtime;

/**
 * Dangles sharing a source key cannot be paired: both supply, both receive, or more than two
 * ends claim the key. Indicates a broken {@link work.diplomacy.kernel.node.BaseNode}.
 */
public final class ConnectionDirectionException extends ElaborationException {
    public ConnectionDirectionException(String message, LazyModule module) {
        super("connection_direction", message, module.name(), module.info());
    }
}
