package work.sdgen.core.session;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.tomlj.Toml;
import org.tomlj.TomlArray;
import org.tomlj.TomlParseResult;
import work.sdgen.core.error.ConfigException;
import work.sdgen.core.error.Violation;
import work.sdgen.core.shared.DurationParser;

/**
 * Locates and parses {@code sdgen.toml}: explicit path, else the nearest one above the template, else
 * {@code ~/.sdgen/sdgen.toml}.
 */
public final class GlobalConfigLoader {
    private static final Logger log = LoggerFactory.getLogger(GlobalConfigLoader.class);
    public static final String FILE_NAME = "sdgen.toml";

    private GlobalConfigLoader() {}

    public static GlobalConfig load(Optional<Path> explicit, Path templateDir, Path homeDir) {
        if (explicit.isPresent()) {
            Path path = explicit.get();
            if (!Files.isRegularFile(path)) {
                throw ConfigException.single("config", "configuration file not found: " + path);
            }
            return parse(path);
        }
        Optional<Path> found = findUpwards(templateDir);
        if (found.isEmpty() && homeDir != null) {
            Path home = homeDir.resolve(".sdgen").resolve(FILE_NAME);
            if (Files.isRegularFile(home)) {
                found = Optional.of(home);
            }
        }
        return found.map(GlobalConfigLoader::parse).orElseGet(GlobalConfig::empty);
    }

    static Optional<Path> findUpwards(Path start) {
        Path current = start == null ? null : start.toAbsolutePath().normalize();
        while (current != null) {
            Path candidate = current.resolve(FILE_NAME);
            if (Files.isRegularFile(candidate)) {
                return Optional.of(candidate);
            }
            current = current.getParent();
        }
        return Optional.empty();
    }

    public static GlobalConfig parse(Path path) {
        TomlParseResult toml;
        try {
            toml = Toml.parse(Files.readString(path));
        } catch (IOException ex) {
            throw ConfigException.single("config", "unable to read " + path + ": " + ex.getMessage());
        }
        var violations = new ArrayList<Violation>();
        if (toml.hasErrors()) {
            toml.errors().forEach(error -> violations.add(new Violation("config", error.toString())));
            throw new ConfigException(violations);
        }
        Path base = path.toAbsolutePath().getParent();
        Optional<Path> outputDir = string(toml, "output_dir", violations).map(base::resolve);
        Optional<String> apiUrl = string(toml, "api_url", violations);
        Optional<Integer> workers = Optional.empty();
        Object rawWorkers = toml.get("workers");
        if (rawWorkers instanceof Long count) {
            workers = Optional.of(count.intValue());
        } else if (rawWorkers != null) {
            violations.add(new Violation("workers", "must be an integer"));
        }
        Optional<Duration> pollInterval = duration(toml, "poll_interval", violations);
        Optional<Duration> pollTimeout = duration(toml, "poll_timeout", violations);
        var roots = new ArrayList<Path>();
        Object rawRoots = toml.get("template_roots");
        if (rawRoots instanceof TomlArray array) {
            for (int i = 0; i < array.size(); i++) {
                if (array.get(i) instanceof String root) {
                    roots.add(base.resolve(root).normalize());
                } else {
                    violations.add(new Violation("template_roots[" + i + "]", "must be a string"));
                }
            }
        } else if (rawRoots != null) {
            violations.add(new Violation("template_roots", "must be an array of paths"));
        }
        if (!violations.isEmpty()) {
            throw new ConfigException(violations);
        }
        log.debug("Loaded global configuration from {}", path);
        return new GlobalConfig(Optional.of(path), outputDir, apiUrl, workers, pollInterval, pollTimeout, roots);
    }

    private static Optional<String> string(TomlParseResult toml, String key, List<Violation> violations) {
        Object value = toml.get(key);
        if (value == null) {
            return Optional.empty();
        }
        if (value instanceof String text) {
            return Optional.of(text);
        }
        violations.add(new Violation(key, "must be a string"));
        return Optional.empty();
    }

    private static Optional<Duration> duration(TomlParseResult toml, String key, List<Violation> violations) {
        Object value = toml.get(key);
        if (value == null) {
            return Optional.empty();
        }
        if (value instanceof Long millis) {
            return Optional.of(Duration.ofMillis(millis));
        }
        if (value instanceof String text) {
            try {
                return DurationParser.parse(text);
            } catch (IllegalArgumentException ex) {
                violations.add(new Violation(key, ex.getMessage()));
                return Optional.empty();
            }
        }
        violations.add(new Violation(key, "must be a duration such as \"2s\""));
        return Optional.empty();
    }
}
