package work.diplomacy.kernel.node;

/**
 * A pair of dangles joined inside a module: {@code receiver} is driven by {@code supplier}.
 */
public record ResolvedLink(HalfEdge key, Dangle receiver, Dangle supplier) {
    public String label() {
        return supplier.data().typeName();
    }
}
