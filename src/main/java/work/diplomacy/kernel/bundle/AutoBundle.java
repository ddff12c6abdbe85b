package work.diplomacy.kernel.bundle;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import work.diplomacy.kernel.node.Signal;

/**
 * Boundary ports synthesized for a module from its unresolved dangles.
 *
 * <p>Elements keep the order of the input entries. Each port is a fresh clone of the dangle's
 * payload, flipped when the dangle receives.
 */
public final class AutoBundle {
    private static final AutoBundle EMPTY = new AutoBundle(List.of());

    private final Map<String, BoundaryPort> elements;

    private AutoBundle(List<BoundaryPort> ports) {
        var ordered = new LinkedHashMap<String, BoundaryPort>();
        for (BoundaryPort port : ports) {
            ordered.put(port.name(), port);
        }
        if (ordered.size() != ports.size()) {
            throw new IllegalStateException("Duplicate boundary port names in " + ports);
        }
        this.elements = Collections.unmodifiableMap(ordered);
    }

    public static AutoBundle empty() {
        return EMPTY;
    }

    public static AutoBundle of(List<Entry> entries) {
        if (entries.isEmpty()) {
            return EMPTY;
        }
        List<String> names = PortNameAllocator.allocate(entries.stream().map(Entry::name).toList());
        List<BoundaryPort> ports = new ArrayList<>(entries.size());
        for (int i = 0; i < entries.size(); i++) {
            Entry entry = entries.get(i);
            Signal element = entry.flipped() ? entry.data().cloneType().flip() : entry.data().cloneType();
            ports.add(new BoundaryPort(names.get(i), element, PortDirection.of(entry.flipped())));
        }
        return new AutoBundle(ports);
    }

    public Map<String, BoundaryPort> elements() {
        return elements;
    }

    public List<BoundaryPort> ports() {
        return List.copyOf(elements.values());
    }

    public Optional<BoundaryPort> port(String name) {
        return Optional.ofNullable(elements.get(name));
    }

    public int size() {
        return elements.size();
    }

    public boolean isEmpty() {
        return elements.isEmpty();
    }

    @Override
    public String toString() {
        return "AutoBundle" + elements.keySet();
    }

    /**
     * Raw bundle input: the dangle's name, payload and orientation.
     */
    public record Entry(String name, Signal data, boolean flipped) {}
}
