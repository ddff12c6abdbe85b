package work.diplomacy.kernel.runtime;

/**
 * Instantiation progress of a lazy module. Transitions only move forward.
 */
public enum ModuleState {
    DECLARED,
    INSTANTIATING,
    DONE
}
