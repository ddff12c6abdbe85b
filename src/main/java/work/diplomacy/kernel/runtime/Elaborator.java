package work.diplomacy.kernel.runtime;

import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import work.diplomacy.kernel.node.Dangle;

/**
 * Top-level driver: forces a root module, runs its final node pass and applies the
 * {@link UnresolvedRootPolicy} to whatever the root could not resolve.
 */
public final class Elaborator {
    private static final Logger log = LoggerFactory.getLogger(Elaborator.class);

    private final UnresolvedRootPolicy policy;

    public Elaborator() {
        this(UnresolvedRootPolicy.DISCARD);
    }

    public Elaborator(UnresolvedRootPolicy policy) {
        this.policy = Objects.requireNonNull(policy, "policy");
    }

    public Instantiation elaborate(LazyModule root) {
        if (root.parent().isPresent()) {
            throw new IllegalArgumentException(root.name() + " is not a root module (parent " + root.parent().get().name() + ")");
        }
        Instantiation result = root.instantiate();
        root.context().instantiator().finishInstantiate(root);
        if (!result.dangles().isEmpty()) {
            handleUnresolved(root, result);
        }
        return result;
    }

    private void handleUnresolved(LazyModule root, Instantiation result) {
        var names = result.dangles().stream().map(Dangle::name).toList();
        switch (policy) {
            case DISCARD -> log.debug("Discarding {} unresolved dangles on root {}: {}", names.size(), root.name(), names);
            case WARN -> log.warn("Root {} left {} dangles unresolved: {}", root.name(), names.size(), names);
            case FAIL -> throw new ElaborationException(
                "unresolved_root",
                "Root " + root.name() + " left " + names.size() + " dangles unresolved: " + names,
                root.name(),
                root.info()
            );
        }
    }
}
