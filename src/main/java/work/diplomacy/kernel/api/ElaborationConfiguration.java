package work.diplomacy.kernel.api;

import java.nio.file.Path;
import java.util.Objects;
import java.util.Optional;
import work.diplomacy.kernel.runtime.UnresolvedRootPolicy;

/**
 * Immutable configuration for one elaboration run.
 */
public record ElaborationConfiguration(
    Path design,
    Optional<String> top,
    UnresolvedRootPolicy unresolvedPolicy,
    GraphFormat graphFormat,
    Optional<Path> graphOutput,
    LogLevel logLevel
) {
    public ElaborationConfiguration {
        Objects.requireNonNull(design, "design");
        Objects.requireNonNull(top, "top");
        Objects.requireNonNull(unresolvedPolicy, "unresolvedPolicy");
        Objects.requireNonNull(graphFormat, "graphFormat");
        Objects.requireNonNull(graphOutput, "graphOutput");
        Objects.requireNonNull(logLevel, "logLevel");
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private Path design;
        private Optional<String> top = Optional.empty();
        private UnresolvedRootPolicy unresolvedPolicy = UnresolvedRootPolicy.DISCARD;
        private GraphFormat graphFormat = GraphFormat.NONE;
        private Optional<Path> graphOutput = Optional.empty();
        private LogLevel logLevel = LogLevel.WARN;

        public Builder design(Path design) {
            this.design = design;
            return this;
        }

        public Builder top(Optional<String> top) {
            this.top = top;
            return this;
        }

        public Builder unresolvedPolicy(UnresolvedRootPolicy unresolvedPolicy) {
            this.unresolvedPolicy = unresolvedPolicy;
            return this;
        }

        public Builder graphFormat(GraphFormat graphFormat) {
            this.graphFormat = graphFormat;
            return this;
        }

        public Builder graphOutput(Optional<Path> graphOutput) {
            this.graphOutput = graphOutput;
            return this;
        }

        public Builder logLevel(LogLevel logLevel) {
            this.logLevel = logLevel;
            return this;
        }

        public boolean hasDesign() {
            return design != null;
        }

        public ElaborationConfiguration build() {
            return new ElaborationConfiguration(design, top, unresolvedPolicy, graphFormat, graphOutput, logLevel);
        }
    }
}
