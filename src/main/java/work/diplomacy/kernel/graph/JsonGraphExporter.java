package work.diplomacy.kernel.graph;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectWriter;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import work.diplomacy.kernel.bundle.BoundaryPort;
import work.diplomacy.kernel.node.BaseNode;
import work.diplomacy.kernel.node.ResolvedLink;
import work.diplomacy.kernel.runtime.LazyModule;

/**
 * JSON rendering of the same content as {@link GraphMlExporter}, plus boundary ports and link keys.
 */
public final class JsonGraphExporter implements GraphExporter {
    private static final ObjectWriter WRITER = new ObjectMapper().writerWithDefaultPrettyPrinter();

    @Override
    public String export(LazyModule root) {
        return write(toSerializableMap(root));
    }

    @Override
    public String fileExtension() {
        return "json";
    }

    public Map<String, Object> toSerializableMap(LazyModule root) {
        Map<String, Object> graph = new LinkedHashMap<>();
        graph.put("root", module(root));
        List<Map<String, Object>> edges = new ArrayList<>();
        for (GraphEdge edge : GraphEdge.collect(root)) {
            Map<String, Object> entry = new LinkedHashMap<>();
            entry.put("source", edge.source());
            entry.put("target", edge.target());
            entry.put("label", edge.label());
            edges.add(entry);
        }
        graph.put("edges", edges);
        return graph;
    }

    private Map<String, Object> module(LazyModule module) {
        Map<String, Object> out = new LinkedHashMap<>();
        out.put("id", module.id());
        out.put("name", module.instanceName());
        out.put("module", module.moduleName());
        out.put("path", module.pathName());

        List<Map<String, Object>> nodes = new ArrayList<>();
        for (BaseNode node : module.nodes()) {
            if (node.omitGraph()) {
                continue;
            }
            Map<String, Object> entry = new LinkedHashMap<>();
            entry.put("id", GraphEdge.nodeId(module, node));
            entry.put("name", node.name());
            entry.put("description", node.describe());
            nodes.add(entry);
        }
        out.put("nodes", nodes);

        List<Map<String, Object>> ports = new ArrayList<>();
        for (BoundaryPort port : module.auto().ports()) {
            Map<String, Object> entry = new LinkedHashMap<>();
            entry.put("name", port.name());
            entry.put("type", port.typeName());
            entry.put("direction", port.direction().name().toLowerCase(Locale.ROOT));
            ports.add(entry);
        }
        out.put("ports", ports);

        List<Map<String, Object>> links = new ArrayList<>();
        for (ResolvedLink link : module.links()) {
            Map<String, Object> entry = new LinkedHashMap<>();
            entry.put("key", link.key().toString());
            entry.put("supplier", link.supplier().name());
            entry.put("receiver", link.receiver().name());
            entry.put("type", link.label());
            links.add(entry);
        }
        out.put("links", links);

        List<Map<String, Object>> children = new ArrayList<>();
        for (LazyModule child : module.children()) {
            if (!child.omitGraph()) {
                children.add(module(child));
            }
        }
        out.put("children", children);
        return out;
    }

    private static String write(Map<String, Object> graph) {
        try {
            return WRITER.writeValueAsString(graph);
        } catch (JsonProcessingException ex) {
            throw new IllegalStateException("Unable to serialize module graph: " + ex.getMessage(), ex);
        }
    }
}
