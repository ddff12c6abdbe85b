package work.diplomacy.kernel.node;

/**
 * Opaque circuit value carried by a dangle. The kernel only clones, flips and connects it.
 */
public interface Signal {
    /**
     * Human readable payload type, e.g. {@code UInt<8>}.
     */
    String typeName();

    /**
     * Fresh, unconnected signal of the same type and orientation.
     */
    Signal cloneType();

    /**
     * Fresh signal of the same type with the opposite orientation.
     */
    Signal flip();

    /**
     * Drives this signal from {@code driver}.
     */
    void connect(Signal driver);
}
