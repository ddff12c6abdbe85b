package work.diplomacy.kernel.runtime;

import java.util.List;
import work.diplomacy.kernel.bundle.AutoBundle;
import work.diplomacy.kernel.node.Dangle;
import work.diplomacy.kernel.node.ResolvedLink;

/**
 * Outcome of instantiating one module: its boundary ports, the dangles it hands to its parent
 * (one per port, in port order) and the links it closed internally.
 */
public record Instantiation(AutoBundle auto, List<Dangle> dangles, List<ResolvedLink> links) {
    public Instantiation {
        dangles = List.copyOf(dangles);
        links = List.copyOf(links);
    }
}
