package work.diplomacy.kernel.node;

import java.util.Objects;

/**
 * One still-unconnected end of an edge. {@code flipped} ends receive, the others supply.
 */
public record Dangle(HalfEdge source, HalfEdge sink, boolean flipped, String name, Signal data) {
    public Dangle {
        Objects.requireNonNull(source, "source");
        Objects.requireNonNull(sink, "sink");
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(data, "data");
    }

    public Dangle withData(Signal replacement) {
        return new Dangle(source, sink, flipped, name, replacement);
    }

    public Dangle withName(String replacement) {
        return new Dangle(source, sink, flipped, replacement, data);
    }
}
