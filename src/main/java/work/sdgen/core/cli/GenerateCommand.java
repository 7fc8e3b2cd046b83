package work.sdgen.core.cli;

import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;
import work.sdgen.core.api.LogLevel;
import work.sdgen.core.api.RunResult;
import work.sdgen.core.api.SdgenRunConfiguration;
import work.sdgen.core.api.SdgenRunner;
import work.sdgen.core.error.StructuralException;
import work.sdgen.core.session.ConfigOverrides;
import work.sdgen.core.shared.CancellationToken;
import work.sdgen.core.shared.DurationParser;
import work.sdgen.core.template.DocumentLoader;

@CommandLine.Command(
    name = "sdgen-run",
    description = "Resolve a prompt template and generate its images through an image-generation backend.",
    mixinStandardHelpOptions = true,
    versionProvider = VersionProvider.class,
    showDefaultValues = true
)
final class GenerateCommand implements Callable<Integer> {
    private static final Logger log = LoggerFactory.getLogger(GenerateCommand.class);
    private static final long SHUTDOWN_GRACE_SECONDS = 30;

    @CommandLine.Option(names = {"-t", "--template"}, required = true, description = "Template (.prompt.yaml) to run.")
    private Path template;

    @CommandLine.Option(names = {"-o", "--output-dir"}, description = "Root directory for session folders.")
    private Path outputDir;

    @CommandLine.Option(names = {"-n", "--count"}, description = "Maximum number of images (generation.max_images).")
    private Integer count;

    @CommandLine.Option(names = "--mode", description = "Generation mode (combinatorial|random).")
    private String mode;

    @CommandLine.Option(names = "--seed-mode", description = "Seed mode (fixed|progressive|random|sweep).")
    private String seedMode;

    @CommandLine.Option(names = "--seed", description = "Base seed.")
    private Long seed;

    @CommandLine.Option(names = "--seeds", description = "Seed sweep: 1000,1005 | 1000-1019 | 20#1000.")
    private String seeds;

    @CommandLine.Option(names = "--filename-keys", split = ",", description = "Placeholders embedded in filenames.")
    private List<String> filenameKeys;

    @CommandLine.Option(names = "--use-fixed", paramLabel = "NAME=KEY[,NAME=KEY]", description = "Pin placeholders to one entry key.")
    private List<String> fixed = new ArrayList<>();

    @CommandLine.Option(names = "--session-name", description = "Session name (defaults to the template name).")
    private String sessionName;

    @CommandLine.Option(names = "--api-url", description = "Backend base URL.")
    private String apiUrl;

    @CommandLine.Option(names = "--workers", description = "Concurrent submissions.")
    private Integer workers;

    @CommandLine.Option(names = "--poll-interval", description = "Delay between status polls (e.g. 500ms, 2s).")
    private String pollInterval;

    @CommandLine.Option(names = "--poll-timeout", description = "Per-job timeout (e.g. 30s, 10m).")
    private String pollTimeout;

    @CommandLine.Option(names = "--max-attempts", description = "Random-mode sampling attempt budget.")
    private Integer maxAttempts;

    @CommandLine.Option(names = "--weighted", description = "Order combinatorial loops by placeholder weight.")
    private Boolean weighted;

    @CommandLine.Option(names = "--draw-random-seeds", description = "Draw concrete seeds in random seed mode instead of -1.")
    private Boolean drawRandomSeeds;

    @CommandLine.Option(names = "--sampling-seed", description = "Seed for every random draw of the run.")
    private Long samplingSeed;

    @CommandLine.Option(names = "-P", paramLabel = "KEY=VALUE", description = "Backend parameter override (YAML scalar).")
    private Map<String, String> parameters = new LinkedHashMap<>();

    @CommandLine.Option(names = "--config", description = "Global sdgen.toml (default: nearest, then ~/.sdgen/sdgen.toml).")
    private Path config;

    @CommandLine.Option(names = "--dry-run", description = "Resolve and list prompts without contacting the backend.")
    private boolean dryRun;

    @CommandLine.Option(names = "--log-level", description = "Log threshold (trace|debug|info|warn|error|fatal).")
    private String logLevelRaw;

    @CommandLine.Spec
    private CommandLine.Model.CommandSpec spec;

    private final SdgenRunner runner;

    GenerateCommand() {
        this(new SdgenRunner());
    }

    GenerateCommand(SdgenRunner runner) {
        this.runner = runner;
    }

    @Override
    public Integer call() {
        var configuration = SdgenRunConfiguration.builder()
            .templatePath(template)
            .overrides(overrides())
            .configFile(Optional.ofNullable(config))
            .logLevel(resolveLogLevel())
            .cancellation(new CancellationToken())
            .build();

        var finished = new CountDownLatch(1);
        Thread hook = new Thread(() -> {
            configuration.cancellation().cancel("interrupted by signal");
            try {
                finished.await(SHUTDOWN_GRACE_SECONDS, TimeUnit.SECONDS);
            } catch (InterruptedException ex) {
                Thread.currentThread().interrupt();
            }
        }, "sdgen-shutdown");
        Runtime.getRuntime().addShutdownHook(hook);
        RunResult result;
        try {
            result = runner.run(configuration);
        } finally {
            finished.countDown();
            removeHook(hook);
        }
        spec.commandLine().getOut().println(result.toPrettyJson());
        spec.commandLine().getOut().flush();
        return result.status().exitCode();
    }

    ConfigOverrides overrides() {
        var builder = ConfigOverrides.builder()
            .outputDir(outputDir)
            .sessionName(sessionName)
            .filenameKeys(filenameKeys)
            .mode(mode)
            .seedMode(seedMode)
            .seed(seed)
            .seeds(seeds)
            .maxImages(count)
            .maxAttempts(maxAttempts)
            .weightedOrdering(weighted)
            .drawRandomSeeds(drawRandomSeeds)
            .samplingSeed(samplingSeed)
            .apiUrl(apiUrl)
            .workers(workers)
            .pollInterval(duration("--poll-interval", pollInterval))
            .pollTimeout(duration("--poll-timeout", pollTimeout))
            .dryRun(dryRun);
        parameters.forEach((key, raw) -> builder.parameter(key, scalar(raw)));
        for (String group : fixed) {
            for (String pair : group.split(",")) {
                if (pair.isBlank()) {
                    continue;
                }
                int eq = pair.indexOf('=');
                if (eq <= 0 || eq == pair.length() - 1) {
                    throw new CommandLine.ParameterException(spec.commandLine(), "--use-fixed expects NAME=KEY but got '" + pair + "'");
                }
                builder.fix(pair.substring(0, eq).trim(), pair.substring(eq + 1).trim());
            }
        }
        return builder.build();
    }

    private Duration duration(String option, String raw) {
        try {
            return DurationParser.parse(raw).orElse(null);
        } catch (IllegalArgumentException ex) {
            throw new CommandLine.ParameterException(spec.commandLine(), option + ": " + ex.getMessage());
        }
    }

    /** {@code -P steps=30} yields an integer, {@code -P sampler=Euler a} a string. */
    static Object scalar(String raw) {
        if (raw == null || raw.isBlank()) {
            return raw;
        }
        Object parsed;
        try {
            parsed = DocumentLoader.parseTree(raw);
        } catch (StructuralException ex) {
            log.debug("Parameter value '{}' is kept as text: {}", raw, ex.getMessage());
            return raw;
        }
        return parsed instanceof Map<?, ?> || parsed instanceof List<?> || parsed == null ? raw : parsed;
    }

    private LogLevel resolveLogLevel() {
        String candidate = logLevelRaw;
        if (candidate == null || candidate.isBlank()) {
            candidate = System.getenv("SDGEN_LOG_LEVEL");
        }
        if (candidate == null || candidate.isBlank()) {
            return null;
        }
        try {
            return LogLevel.from(candidate);
        } catch (IllegalArgumentException ex) {
            throw new CommandLine.ParameterException(spec.commandLine(), ex.getMessage());
        }
    }

    private static void removeHook(Thread hook) {
        try {
            Runtime.getRuntime().removeShutdownHook(hook);
        } catch (IllegalStateException ex) {
            log.debug("JVM is shutting down; keeping the cancellation hook: {}", ex.getMessage());
        }
    }
}
