package work.sdgen.core.session;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Optional;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import work.sdgen.core.error.ConfigException;
import work.sdgen.core.error.Violation;
import work.sdgen.core.support.SdgenTestSupport;

class GlobalConfigLoaderTest {
    @TempDir
    Path workspace;

    @TempDir
    Path home;

    @Test
    void findsTheNearestFileAboveTheTemplate() {
        SdgenTestSupport.write(workspace, "sdgen.toml",
            "output_dir = \"renders\"",
            "api_url = \"http://gpu:7860\"",
            "workers = 3",
            "poll_interval = \"500ms\"",
            "poll_timeout = 60000",
            "template_roots = [\"shared\"]");
        Path templates = workspace.resolve("projects").resolve("cats");

        var config = GlobalConfigLoader.load(Optional.empty(), templates, home);

        assertEquals(Optional.of(workspace.resolve("renders").toAbsolutePath()), config.outputDir());
        assertEquals(Optional.of("http://gpu:7860"), config.apiUrl());
        assertEquals(Optional.of(3), config.workers());
        assertEquals(Optional.of(Duration.ofMillis(500)), config.pollInterval());
        assertEquals(Optional.of(Duration.ofMinutes(1)), config.pollTimeout());
        assertEquals(List.of(workspace.resolve("shared").toAbsolutePath().normalize()), config.templateRoots());
    }

    @Test
    void fallsBackToTheHomeDirectory() {
        SdgenTestSupport.write(home, ".sdgen/sdgen.toml", "workers = 2");

        var config = GlobalConfigLoader.load(Optional.empty(), workspace, home);

        assertEquals(Optional.of(2), config.workers());
        assertEquals(Optional.of(home.resolve(".sdgen").resolve("sdgen.toml")), config.source());
    }

    @Test
    void noFileMeansEmptyDefaults() {
        var config = GlobalConfigLoader.load(Optional.empty(), workspace, home);

        assertTrue(config.source().isEmpty());
        assertTrue(config.templateRoots().isEmpty());
    }

    @Test
    void explicitFileMustExist() {
        var ex = assertThrows(ConfigException.class,
            () -> GlobalConfigLoader.load(Optional.of(workspace.resolve("absent.toml")), workspace, home));
        assertEquals("config", ex.violations().get(0).field());
    }

    @Test
    void collectsTypeErrors() {
        Path file = SdgenTestSupport.write(workspace, "custom.toml",
            "workers = \"many\"", "poll_timeout = \"soon\"", "template_roots = \"shared\"");

        var ex = assertThrows(ConfigException.class,
            () -> GlobalConfigLoader.load(Optional.of(file), workspace, home));
        var fields = ex.violations().stream().map(Violation::field).toList();
        assertEquals(List.of("workers", "poll_timeout", "template_roots"), fields);
    }
}
