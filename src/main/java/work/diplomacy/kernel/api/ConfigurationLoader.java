package work.diplomacy.kernel.api;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;
import java.util.stream.Collectors;
import org.tomlj.Toml;
import org.tomlj.TomlParseResult;
import org.tomlj.TomlTable;
import work.diplomacy.kernel.runtime.UnresolvedRootPolicy;

/**
 * Reads {@code elaboration.toml} into a configuration builder. Keys that are absent leave the
 * builder untouched; relative paths resolve against the file's directory.
 */
public final class ConfigurationLoader {
    public static final String DEFAULT_FILE_NAME = "elaboration.toml";

    private ConfigurationLoader() {}

    public static ElaborationConfiguration.Builder load(Path file, ElaborationConfiguration.Builder builder) {
        TomlParseResult result;
        try {
            result = Toml.parse(Files.readString(file));
        } catch (IOException ex) {
            throw new IllegalStateException("Failed to read configuration " + file + ": " + ex.getMessage(), ex);
        }
        if (result.hasErrors()) {
            String errors = result.errors().stream().map(Object::toString).collect(Collectors.joining("; "));
            throw new IllegalArgumentException("Invalid configuration " + file + ": " + errors);
        }
        Path base = Optional.ofNullable(file.toAbsolutePath().getParent()).orElse(Path.of(""));

        TomlTable elaboration = result.getTable("elaboration");
        if (elaboration != null) {
            text(elaboration, "design").ifPresent(design -> builder.design(base.resolve(design).normalize()));
            text(elaboration, "top").ifPresent(top -> builder.top(Optional.of(top)));
            text(elaboration, "unresolved").ifPresent(raw -> builder.unresolvedPolicy(UnresolvedRootPolicy.from(raw)));
            text(elaboration, "log-level").ifPresent(raw -> builder.logLevel(LogLevel.from(raw)));
        }

        TomlTable graph = result.getTable("graph");
        if (graph != null) {
            text(graph, "format").ifPresent(raw -> builder.graphFormat(GraphFormat.from(raw)));
            text(graph, "output").ifPresent(output -> builder.graphOutput(Optional.of(base.resolve(output).normalize())));
        }
        return builder;
    }

    private static Optional<String> text(TomlTable table, String key) {
        if (!table.contains(key)) {
            return Optional.empty();
        }
        if (!table.isString(key)) {
            throw new IllegalArgumentException("Configuration key '" + key + "' must be a string");
        }
        return Optional.ofNullable(table.getString(key)).filter(value -> !value.isBlank());
    }
}
