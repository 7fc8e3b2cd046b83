package work.sdgen.core.api;

import java.nio.file.Path;
import java.util.Objects;
import java.util.Optional;
import work.sdgen.core.batch.ImageBackend;
import work.sdgen.core.orchestrator.RunRequest;
import work.sdgen.core.session.ConfigOverrides;
import work.sdgen.core.shared.CancellationToken;

/**
 * Immutable configuration passed to {@link SdgenRunner}. A {@code backend} replaces the default Stable Diffusion
 * WebUI client; embedding callers and tests use it to plug their own submission capability.
 */
public record SdgenRunConfiguration(
    Path templatePath,
    ConfigOverrides overrides,
    Optional<Path> configFile,
    Optional<LogLevel> logLevel,
    CancellationToken cancellation,
    Optional<ImageBackend> backend,
    Path homeDir
) {
    public SdgenRunConfiguration {
        Objects.requireNonNull(templatePath, "templatePath");
        Objects.requireNonNull(overrides, "overrides");
        Objects.requireNonNull(configFile, "configFile");
        Objects.requireNonNull(logLevel, "logLevel");
        Objects.requireNonNull(cancellation, "cancellation");
        Objects.requireNonNull(backend, "backend");
        Objects.requireNonNull(homeDir, "homeDir");
    }

    public RunRequest toRequest() {
        return new RunRequest(templatePath, overrides, configFile, cancellation, homeDir);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private Path templatePath;
        private ConfigOverrides overrides = ConfigOverrides.none();
        private Optional<Path> configFile = Optional.empty();
        private Optional<LogLevel> logLevel = Optional.empty();
        private CancellationToken cancellation = new CancellationToken();
        private Optional<ImageBackend> backend = Optional.empty();
        private Path homeDir = RunRequest.userHome();

        public Builder templatePath(Path templatePath) {
            this.templatePath = templatePath;
            return this;
        }

        public Builder overrides(ConfigOverrides overrides) {
            this.overrides = overrides;
            return this;
        }

        public Builder configFile(Optional<Path> configFile) {
            this.configFile = configFile;
            return this;
        }

        public Builder logLevel(LogLevel logLevel) {
            this.logLevel = Optional.ofNullable(logLevel);
            return this;
        }

        public Builder cancellation(CancellationToken cancellation) {
            this.cancellation = cancellation;
            return this;
        }

        public Builder backend(ImageBackend backend) {
            this.backend = Optional.ofNullable(backend);
            return this;
        }

        public Builder homeDir(Path homeDir) {
            this.homeDir = homeDir;
            return this;
        }

        public SdgenRunConfiguration build() {
            return new SdgenRunConfiguration(templatePath, overrides, configFile, logLevel, cancellation, backend, homeDir);
        }
    }
}
