package work.diplomacy.kernel.graph;

import work.diplomacy.kernel.runtime.LazyModule;

/**
 * Renders an instantiated module tree for inspection. Exporters never mutate the tree.
 */
public interface GraphExporter {
    String export(LazyModule root);

    String fileExtension();
}
