package work.diplomacy.kernel.demo;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import work.diplomacy.kernel.node.Signal;

/**
 * In-memory signal that remembers what drives it.
 */
public final class DemoSignal implements Signal {
    private final String typeName;
    private final boolean flipped;
    private final List<Signal> drivers = new ArrayList<>();

    public DemoSignal(String typeName) {
        this(typeName, false);
    }

    private DemoSignal(String typeName, boolean flipped) {
        this.typeName = Objects.requireNonNull(typeName, "typeName");
        this.flipped = flipped;
    }

    @Override
    public String typeName() {
        return typeName;
    }

    @Override
    public Signal cloneType() {
        return new DemoSignal(typeName, flipped);
    }

    @Override
    public Signal flip() {
        return new DemoSignal(typeName, !flipped);
    }

    @Override
    public void connect(Signal driver) {
        drivers.add(Objects.requireNonNull(driver, "driver"));
    }

    public boolean isFlipped() {
        return flipped;
    }

    public List<Signal> drivers() {
        return Collections.unmodifiableList(drivers);
    }

    public Optional<Signal> driver() {
        return drivers.isEmpty() ? Optional.empty() : Optional.of(drivers.get(0));
    }

    @Override
    public String toString() {
        return (flipped ? "Flipped(" + typeName + ")" : typeName) + "@" + Integer.toHexString(System.identityHashCode(this));
    }
}
