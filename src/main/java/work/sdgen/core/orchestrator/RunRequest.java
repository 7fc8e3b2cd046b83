package work.sdgen.core.orchestrator;

import java.nio.file.Path;
import java.util.Objects;
import java.util.Optional;
import work.sdgen.core.session.ConfigOverrides;
import work.sdgen.core.shared.CancellationToken;

/**
 * Input of one orchestrated run.
 */
public record RunRequest(
    Path templatePath,
    ConfigOverrides overrides,
    Optional<Path> configFile,
    CancellationToken cancellation,
    Path homeDir
) {
    public RunRequest {
        Objects.requireNonNull(templatePath, "templatePath");
        Objects.requireNonNull(overrides, "overrides");
        Objects.requireNonNull(configFile, "configFile");
        Objects.requireNonNull(cancellation, "cancellation");
        Objects.requireNonNull(homeDir, "homeDir");
    }

    public static RunRequest of(Path templatePath, ConfigOverrides overrides) {
        return new RunRequest(templatePath, overrides, Optional.empty(), new CancellationToken(), userHome());
    }

    public static Path userHome() {
        return Path.of(System.getProperty("user.home", "."));
    }
}
