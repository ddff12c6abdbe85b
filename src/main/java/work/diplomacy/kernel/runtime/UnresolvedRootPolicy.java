package work.diplomacy.kernel.runtime;

import java.util.Locale;

/**
 * What the top-level driver does with dangles left on a root module.
 */
public enum UnresolvedRootPolicy {
    DISCARD,
    WARN,
    FAIL;

    public static UnresolvedRootPolicy from(String value) {
        if (value == null || value.isBlank()) {
            return DISCARD;
        }
        try {
            return UnresolvedRootPolicy.valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException ex) {
            throw new IllegalArgumentException("Unsupported unresolved-root policy: " + value);
        }
    }
}
