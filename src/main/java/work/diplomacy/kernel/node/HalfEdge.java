package work.diplomacy.kernel.node;

import java.util.Comparator;

/**
 * Ordering key naming the node ({@code serial}) and edge ({@code index}) that produced a dangle.
 */
public record HalfEdge(int serial, int index) implements Comparable<HalfEdge> {
    private static final Comparator<HalfEdge> ORDER = Comparator
        .comparingInt(HalfEdge::serial)
        .thenComparingInt(HalfEdge::index);

    @Override
    public int compareTo(HalfEdge other) {
        return ORDER.compare(this, other);
    }

    @Override
    public String toString() {
        return serial + ":" + index;
    }
}
