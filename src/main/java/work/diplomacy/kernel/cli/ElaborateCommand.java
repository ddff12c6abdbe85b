package work.diplomacy.kernel.cli;

import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Optional;
import java.util.concurrent.Callable;
import java.util.function.Supplier;
import picocli.CommandLine;
import work.diplomacy.kernel.api.ConfigurationLoader;
import work.diplomacy.kernel.api.ElaborationConfiguration;
import work.diplomacy.kernel.api.ElaborationRunner;
import work.diplomacy.kernel.api.GraphFormat;
import work.diplomacy.kernel.api.LogLevel;
import work.diplomacy.kernel.api.LoggingConfigurator;
import work.diplomacy.kernel.api.RunResult;
import work.diplomacy.kernel.runtime.UnresolvedRootPolicy;

@CommandLine.Command(
    name = "diplomacy-elaborate",
    description = "Elaborate a lazy-module design and report its boundary ports.",
    mixinStandardHelpOptions = true,
    versionProvider = VersionProvider.class,
    showDefaultValues = true
)
final class ElaborateCommand implements Callable<Integer> {
    @CommandLine.Spec
    private CommandLine.Model.CommandSpec spec;

    @CommandLine.Option(
        names = {"-d", "--design"},
        description = "Design file (YAML). May also come from [elaboration].design in the config.",
        defaultValue = CommandLine.Option.NULL_VALUE
    )
    private String design;

    @CommandLine.Option(
        names = {"-c", "--config"},
        description = "Configuration file (default: " + ConfigurationLoader.DEFAULT_FILE_NAME + " next to the design).",
        defaultValue = CommandLine.Option.NULL_VALUE
    )
    private String config;

    @CommandLine.Option(
        names = "--top",
        description = "Instance name for the root module (default: the design name).",
        defaultValue = CommandLine.Option.NULL_VALUE
    )
    private String top;

    @CommandLine.Option(
        names = "--unresolved",
        description = "What to do with dangles left on the root (discard|warn|fail).",
        defaultValue = CommandLine.Option.NULL_VALUE
    )
    private String unresolved;

    @CommandLine.Option(
        names = "--graph-format",
        description = "Diagnostic graph output (none|graphml|json).",
        defaultValue = CommandLine.Option.NULL_VALUE
    )
    private String graphFormat;

    @CommandLine.Option(
        names = "--graph-output",
        description = "File receiving the graph; embedded in the JSON result when omitted.",
        defaultValue = CommandLine.Option.NULL_VALUE
    )
    private String graphOutput;

    @CommandLine.Option(
        names = "--log-level",
        description = "Log threshold (trace|debug|info|warn|error|off).",
        defaultValue = CommandLine.Option.NULL_VALUE
    )
    private String logLevel;

    @Override
    public Integer call() {
        ElaborationConfiguration configuration = resolveConfiguration();
        LoggingConfigurator.apply(configuration.logLevel());

        RunResult result = new ElaborationRunner().run(configuration);
        spec.commandLine().getOut().println(result.toPrettyJson());
        return result.status().exitCode();
    }

    ElaborationConfiguration resolveConfiguration() {
        var builder = ElaborationConfiguration.builder();
        Optional<Path> designPath = Optional.ofNullable(design).map(this::absolute);
        resolveConfigFile(designPath).ifPresent(file -> ConfigurationLoader.load(file, builder));

        designPath.ifPresent(builder::design);
        if (top != null) {
            builder.top(Optional.of(top));
        }
        if (unresolved != null) {
            builder.unresolvedPolicy(parse(() -> UnresolvedRootPolicy.from(unresolved)));
        }
        if (graphFormat != null) {
            builder.graphFormat(parse(() -> GraphFormat.from(graphFormat)));
        }
        if (graphOutput != null) {
            builder.graphOutput(Optional.of(absolute(graphOutput)));
        }
        if (logLevel != null) {
            builder.logLevel(parse(() -> LogLevel.from(logLevel)));
        }

        if (!builder.hasDesign()) {
            throw new CommandLine.ParameterException(spec.commandLine(),
                "No design given: pass --design or set [elaboration].design in the configuration.");
        }
        return builder.build();
    }

    private Optional<Path> resolveConfigFile(Optional<Path> designPath) {
        if (config != null) {
            Path explicit = absolute(config);
            if (!Files.isRegularFile(explicit)) {
                throw new CommandLine.ParameterException(spec.commandLine(), "Configuration file not found: " + explicit);
            }
            return Optional.of(explicit);
        }
        return designPath
            .map(Path::getParent)
            .map(dir -> dir.resolve(ConfigurationLoader.DEFAULT_FILE_NAME))
            .filter(Files::isRegularFile);
    }

    private <T> T parse(Supplier<T> parser) {
        try {
            return parser.get();
        } catch (IllegalArgumentException ex) {
            throw new CommandLine.ParameterException(spec.commandLine(), ex.getMessage());
        }
    }

    private Path absolute(String raw) {
        return Paths.get(raw).toAbsolutePath().normalize();
    }
}
