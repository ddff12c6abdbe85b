package work.diplomacy.kernel.api;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import work.diplomacy.kernel.bundle.BoundaryPort;
import work.diplomacy.kernel.node.Dangle;
import work.diplomacy.kernel.runtime.DesignBuilder;
import work.diplomacy.kernel.runtime.DesignLoader;
import work.diplomacy.kernel.runtime.ElaborationContext;
import work.diplomacy.kernel.runtime.ElaborationException;
import work.diplomacy.kernel.runtime.Elaborator;
import work.diplomacy.kernel.runtime.Instantiation;
import work.diplomacy.kernel.runtime.LazyModule;

/**
 * Public entry point for elaborating a design file.
 */
public final class ElaborationRunner {
    private static final Logger log = LoggerFactory.getLogger(ElaborationRunner.class);

    public RunResult run(ElaborationConfiguration configuration) {
        var started = Instant.now();
        log.info("Elaborating {}", configuration.design());
        try {
            var spec = DesignLoader.loadFromFile(configuration.design());
            var ctx = new ElaborationContext();
            LazyModule root = DesignBuilder.build(ctx, spec, configuration.top());
            Instantiation result = new Elaborator(configuration.unresolvedPolicy()).elaborate(root);

            var metadata = new LinkedHashMap<String, Object>();
            metadata.put("design", configuration.design().toString());
            metadata.put("top", root.name());
            metadata.put("modules", ctx.modules().size());
            metadata.put("ports", describePorts(result));
            metadata.put("links", countLinks(root));
            metadata.put("unresolved", result.dangles().stream().map(Dangle::name).toList());
            exportGraph(configuration, root, metadata);
            metadata.put("status", "ok");
            log.info("Elaborated {}: {} modules, {} boundary ports", root.name(), ctx.modules().size(), result.auto().size());
            return RunResult.success(metadata, started);
        } catch (Exception ex) {
            var errorMeta = new LinkedHashMap<String, Object>();
            errorMeta.put("design", configuration.design().toString());
            if (ex instanceof ElaborationException elaboration) {
                errorMeta.put("code", elaboration.code());
                elaboration.moduleName().ifPresent(name -> errorMeta.put("module", name));
            }
            if (ex.getMessage() != null && !ex.getMessage().isBlank()) {
                errorMeta.put("error", ex.getMessage());
            }
            log.debug("Elaboration of {} failed", configuration.design(), ex);
            return RunResult.failure(ex.getMessage(), errorMeta, started);
        }
    }

    public String runToJson(ElaborationConfiguration configuration) {
        return run(configuration).toPrettyJson();
    }

    private List<Map<String, Object>> describePorts(Instantiation result) {
        List<Map<String, Object>> ports = new ArrayList<>();
        for (BoundaryPort port : result.auto().ports()) {
            Map<String, Object> entry = new LinkedHashMap<>();
            entry.put("name", port.name());
            entry.put("type", port.typeName());
            entry.put("direction", port.direction().name().toLowerCase(Locale.ROOT));
            ports.add(entry);
        }
        return ports;
    }

    private int countLinks(LazyModule root) {
        int[] total = {0};
        root.nodeIterator(module -> total[0] += module.links().size());
        return total[0];
    }

    private void exportGraph(ElaborationConfiguration configuration, LazyModule root, Map<String, Object> metadata) throws IOException {
        var exporter = configuration.graphFormat().exporter();
        if (exporter.isEmpty()) {
            return;
        }
        String rendered = exporter.get().export(root);
        if (configuration.graphOutput().isEmpty()) {
            metadata.put("graph", rendered);
            return;
        }
        Path output = configuration.graphOutput().get();
        Path parent = output.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        Files.writeString(output, rendered);
        metadata.put("graphOutput", output.toString());
        log.info("Wrote {} graph to {}", configuration.graphFormat().name().toLowerCase(Locale.ROOT), output);
    }
}
