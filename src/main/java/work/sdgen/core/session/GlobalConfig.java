package work.sdgen.core.session;

import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Machine-level defaults read from {@code sdgen.toml}.
 */
public record GlobalConfig(
    Optional<Path> source,
    Optional<Path> outputDir,
    Optional<String> apiUrl,
    Optional<Integer> workers,
    Optional<Duration> pollInterval,
    Optional<Duration> pollTimeout,
    List<Path> templateRoots
) {
    public GlobalConfig {
        Objects.requireNonNull(source, "source");
        Objects.requireNonNull(outputDir, "outputDir");
        Objects.requireNonNull(apiUrl, "apiUrl");
        Objects.requireNonNull(workers, "workers");
        Objects.requireNonNull(pollInterval, "pollInterval");
        Objects.requireNonNull(pollTimeout, "pollTimeout");
        templateRoots = List.copyOf(templateRoots);
    }

    public static GlobalConfig empty() {
        return new GlobalConfig(
            Optional.empty(), Optional.empty(), Optional.empty(), Optional.empty(),
            Optional.empty(), Optional.empty(), List.of()
        );
    }
}
