package work.diplomacy.kernel.api;

import java.util.Locale;
import java.util.Optional;
import work.diplomacy.kernel.graph.GraphExporter;
import work.diplomacy.kernel.graph.GraphMlExporter;
import work.diplomacy.kernel.graph.JsonGraphExporter;

/**
 * Diagnostic graph output produced after a successful elaboration.
 */
public enum GraphFormat {
    NONE,
    GRAPHML,
    JSON;

    public static GraphFormat from(String value) {
        if (value == null || value.isBlank()) {
            return NONE;
        }
        try {
            return GraphFormat.valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException ex) {
            throw new IllegalArgumentException("Unsupported graph format: " + value);
        }
    }

    public Optional<GraphExporter> exporter() {
        return switch (this) {
            case NONE -> Optional.empty();
            case GRAPHML -> Optional.of(new GraphMlExporter());
            case JSON -> Optional.of(new JsonGraphExporter());
        };
    }
}
