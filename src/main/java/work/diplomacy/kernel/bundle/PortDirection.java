package work.diplomacy.kernel.bundle;

/**
 * Direction of a boundary port as seen from outside the module.
 */
public enum PortDirection {
    INPUT,
    OUTPUT;

    public static PortDirection of(boolean flipped) {
        return flipped ? INPUT : OUTPUT;
    }
}
