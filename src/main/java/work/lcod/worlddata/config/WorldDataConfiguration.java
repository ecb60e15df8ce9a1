package work.lcod.worlddata.config;

import java.nio.file.Path;
import java.util.Objects;
import java.util.Optional;
import work.lcod.worlddata.api.LogLevel;

/**
 * Immutable configuration for loading a world data directory.
 */
public record WorldDataConfiguration(
    Path dataRoot,
    Optional<Path> definitionsFile,
    LogLevel logLevel
) {
    public WorldDataConfiguration {
        Objects.requireNonNull(dataRoot, "dataRoot");
        Objects.requireNonNull(definitionsFile, "definitionsFile");
        Objects.requireNonNull(logLevel, "logLevel");
    }

    public static Builder builder() {
        return new Builder();
    }

    public Builder toBuilder() {
        return new Builder()
            .dataRoot(dataRoot)
            .definitionsFile(definitionsFile.orElse(null))
            .logLevel(logLevel);
    }

    public static final class Builder {
        private Path dataRoot;
        private Path definitionsFile;
        private LogLevel logLevel = LogLevel.WARN;

        public Builder dataRoot(Path dataRoot) {
            this.dataRoot = dataRoot;
            return this;
        }

        /**
         * Registry file; {@code null} loads without one, skipping the registry dependent definitions.
         */
        public Builder definitionsFile(Path definitionsFile) {
            this.definitionsFile = definitionsFile;
            return this;
        }

        public Builder logLevel(LogLevel logLevel) {
            this.logLevel = logLevel;
            return this;
        }

        public WorldDataConfiguration build() {
            return new WorldDataConfiguration(
                dataRoot,
                Optional.ofNullable(definitionsFile),
                logLevel
            );
        }
    }
}
