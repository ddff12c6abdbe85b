package work.diplomacy.kernel.bundle;

import java.util.Objects;
import work.diplomacy.kernel.node.Signal;

/**
 * Named element of an {@link AutoBundle}.
 */
public record BoundaryPort(String name, Signal signal, PortDirection direction) {
    public BoundaryPort {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(signal, "signal");
        Objects.requireNonNull(direction, "direction");
    }

    public String typeName() {
        return signal.typeName();
    }
}
