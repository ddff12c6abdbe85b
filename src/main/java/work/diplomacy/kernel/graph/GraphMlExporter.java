package work.diplomacy.kernel.graph;

import work.diplomacy.kernel.node.BaseNode;
import work.diplomacy.kernel.runtime.LazyModule;

/**
 * yEd-flavoured GraphML: one nested graph per module, an ellipse per node and a directed edge per
 * resolved link.
 */
public final class GraphMlExporter implements GraphExporter {
    @Override
    public String export(LazyModule root) {
        var buf = new StringBuilder();
        buf.append("<?xml version=\"1.0\" encoding=\"UTF-8\"?>\n");
        buf.append("<graphml xmlns=\"http://graphml.graphdrawing.org/xmlns\" xmlns:y=\"http://www.yworks.com/xml/graphml\">\n");
        buf.append("  <key for=\"node\" id=\"n\" yfiles.type=\"nodegraphics\"/>\n");
        buf.append("  <key for=\"edge\" id=\"e\" yfiles.type=\"edgegraphics\"/>\n");
        buf.append("  <key for=\"node\" id=\"d\" attr.name=\"Description\" attr.type=\"string\"/>\n");
        buf.append("  <graph id=\"G\" edgedefault=\"directed\">\n");
        if (!root.omitGraph()) {
            nodes(buf, root, "    ");
        }
        for (GraphEdge edge : GraphEdge.collect(root)) {
            edge(buf, edge, "    ");
        }
        buf.append("  </graph>\n");
        buf.append("</graphml>\n");
        return buf.toString();
    }

    @Override
    public String fileExtension() {
        return "graphml";
    }

    private void nodes(StringBuilder buf, LazyModule module, String pad) {
        int index = module.id();
        buf.append(pad).append("<node id=\"").append(index).append("\">\n");
        buf.append(pad).append("  <data key=\"n\"><y:ShapeNode><y:NodeLabel modelName=\"sides\" modelPosition=\"w\" rotationAngle=\"270.0\">")
            .append(escape(module.instanceName())).append("</y:NodeLabel></y:ShapeNode></data>\n");
        buf.append(pad).append("  <data key=\"d\">").append(escape(module.moduleName()))
            .append(" (").append(escape(module.pathName())).append(")</data>\n");
        buf.append(pad).append("  <graph id=\"").append(index).append("::\" edgedefault=\"directed\">\n");
        for (BaseNode node : module.nodes()) {
            if (node.omitGraph()) {
                continue;
            }
            buf.append(pad).append("    <node id=\"").append(GraphEdge.nodeId(module, node)).append("\">\n");
            buf.append(pad).append("      <data key=\"e\"><y:ShapeNode><y:Shape type=\"Ellipse\"/></y:ShapeNode></data>\n");
            buf.append(pad).append("      <data key=\"d\">").append(escape(node.describe())).append("</data>\n");
            buf.append(pad).append("    </node>\n");
        }
        for (LazyModule child : module.children()) {
            if (!child.omitGraph()) {
                nodes(buf, child, pad + "    ");
            }
        }
        buf.append(pad).append("  </graph>\n");
        buf.append(pad).append("</node>\n");
    }

    private void edge(StringBuilder buf, GraphEdge edge, String pad) {
        buf.append(pad).append("<edge source=\"").append(edge.source()).append("\" target=\"").append(edge.target()).append("\">");
        buf.append("<data key=\"e\"><y:PolyLineEdge>");
        buf.append("<y:Arrows source=\"none\" target=\"standard\"/>");
        buf.append("<y:LineStyle color=\"#000000\" type=\"line\" width=\"1.0\"/>");
        buf.append("<y:EdgeLabel modelName=\"centered\" rotationAngle=\"270.0\">").append(escape(edge.label())).append("</y:EdgeLabel>");
        buf.append("</y:PolyLineEdge></data></edge>\n");
    }

    private static String escape(String raw) {
        return raw.replace("&", "&amp;")
            .replace("<", "&lt;")
            .replace(">", "&gt;")
            .replace("\"", "&quot;");
    }
}
