package work.cinit.trace.api;

import java.nio.file.Path;
import java.util.Objects;
import java.util.Optional;

/**
 * Immutable configuration of one extraction run.
 */
public record ExtractionConfiguration(
    Path catalogFile,
    Path treeFile,
    Optional<Path> settingsFile,
    Optional<Path> outputFile,
    LogLevel logLevel
) {
    public ExtractionConfiguration {
        Objects.requireNonNull(catalogFile, "catalogFile");
        Objects.requireNonNull(treeFile, "treeFile");
        Objects.requireNonNull(settingsFile, "settingsFile");
        Objects.requireNonNull(outputFile, "outputFile");
        Objects.requireNonNull(logLevel, "logLevel");
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private Path catalogFile;
        private Path treeFile;
        private Optional<Path> settingsFile = Optional.empty();
        private Optional<Path> outputFile = Optional.empty();
        private LogLevel logLevel = LogLevel.WARN;

        public Builder catalogFile(Path catalogFile) {
            this.catalogFile = catalogFile;
            return this;
        }

        public Builder treeFile(Path treeFile) {
            this.treeFile = treeFile;
            return this;
        }

        public Builder settingsFile(Path settingsFile) {
            this.settingsFile = Optional.ofNullable(settingsFile);
            return this;
        }

        public Builder outputFile(Path outputFile) {
            this.outputFile = Optional.ofNullable(outputFile);
            return this;
        }

        public Builder logLevel(LogLevel logLevel) {
            this.logLevel = logLevel;
            return this;
        }

        public ExtractionConfiguration build() {
            return new ExtractionConfiguration(catalogFile, treeFile, settingsFile, outputFile, logLevel);
        }
    }
}
