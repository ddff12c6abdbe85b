package work.diplomacy.kernel.node;

import java.util.List;

/**
 * Connection point owned by exactly one lazy module.
 *
 * <p>{@link #instantiate()} is called once while the owning module is instantiated and returns the
 * node's dangles in edge order. {@link #finishInstantiate()} runs after the owning module (and its
 * whole subtree) has been wired.
 */
public interface BaseNode {
    int serial();

    String name();

    List<Dangle> instantiate();

    default void finishInstantiate() {}

    default boolean omitGraph() {
        return false;
    }

    default String describe() {
        return name();
    }
}
