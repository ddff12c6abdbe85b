package work.diplomacy.kernel.runtime;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Loads YAML design files into {@link DesignSpec} trees.
 */
public final class DesignLoader {
    private static final ObjectMapper YAML_MAPPER = new ObjectMapper(new YAMLFactory());
    private static final String DEFAULT_NODE_TYPE = "UInt";

    private DesignLoader() {}

    public static DesignSpec loadFromFile(Path path) {
        try (var in = Files.newInputStream(path)) {
            return parse(in);
        } catch (IOException ex) {
            throw new IllegalStateException("Failed to read design " + path + ": " + ex.getMessage(), ex);
        }
    }

    public static DesignSpec parse(InputStream in) throws IOException {
        var root = YAML_MAPPER.readTree(in);
        if (root == null || !root.hasNonNull("design")) {
            throw new IOException("Design file has no top-level 'design' entry");
        }
        return toModule(root.get("design"), "design");
    }

    private static DesignSpec toModule(JsonNode node, String where) throws IOException {
        if (!node.isObject()) {
            throw new IOException("Module at " + where + " must be an object: " + node);
        }
        String name = requireText(node, "name", where);
        String path = where + "." + name;
        Optional<String> moduleType = Optional.ofNullable(node.get("module"))
            .filter(JsonNode::isTextual)
            .map(JsonNode::asText);

        List<DesignSpec.Node> nodes = new ArrayList<>();
        for (var item : array(node, "nodes", path)) {
            if (!item.isObject()) {
                throw new IOException("Node in " + path + " must be an object: " + item);
            }
            String nodeName = requireText(item, "name", path);
            String kind = requireText(item, "kind", path + "." + nodeName);
            String type = item.hasNonNull("type") ? item.get("type").asText() : DEFAULT_NODE_TYPE;
            nodes.add(new DesignSpec.Node(nodeName, kind, type));
        }

        List<DesignSpec> modules = new ArrayList<>();
        for (var item : array(node, "modules", path)) {
            modules.add(toModule(item, path));
        }

        List<DesignSpec.Connection> connections = new ArrayList<>();
        for (var item : array(node, "connections", path)) {
            if (!item.isObject()) {
                throw new IOException("Connection in " + path + " must be an object: " + item);
            }
            connections.add(new DesignSpec.Connection(requireText(item, "from", path), requireText(item, "to", path)));
        }
        return new DesignSpec(name, moduleType, nodes, modules, connections);
    }

    private static List<JsonNode> array(JsonNode node, String field, String where) throws IOException {
        var value = node.get(field);
        if (value == null || value.isNull()) {
            return List.of();
        }
        if (!value.isArray()) {
            throw new IOException("'" + field + "' in " + where + " must be a list");
        }
        List<JsonNode> items = new ArrayList<>();
        value.forEach(items::add);
        return items;
    }

    private static String requireText(JsonNode node, String field, String where) throws IOException {
        var value = node.get(field);
        if (value == null || !value.isValueNode() || value.asText().isBlank()) {
            throw new IOException("Missing '" + field + "' in " + where);
        }
        return value.asText();
    }
}
