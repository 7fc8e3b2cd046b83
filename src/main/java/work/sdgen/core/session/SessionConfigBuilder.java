package work.sdgen.core.session;

import java.net.URI;
import java.net.URISyntaxException;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import work.sdgen.core.error.ConfigException;
import work.sdgen.core.error.Violation;
import work.sdgen.core.prompt.GenerationMode;
import work.sdgen.core.prompt.SeedMode;
import work.sdgen.core.shared.SeedSpecParser;
import work.sdgen.core.shared.TextNormalizer;
import work.sdgen.core.shared.TreeValues;
import work.sdgen.core.template.TemplateChain;

/**
 * Merges run overrides, template defaults and global defaults into a {@link SessionConfig}.
 * Precedence: override &gt; template &gt; global &gt; built-in. Every violation is reported together.
 */
public final class SessionConfigBuilder {
    public static final String DEFAULT_API_URL = "http://127.0.0.1:7860";
    static final int DEFAULT_WORKERS = 1;
    static final Duration DEFAULT_POLL_INTERVAL = Duration.ofSeconds(1);
    static final Duration DEFAULT_POLL_TIMEOUT = Duration.ofMinutes(10);

    private SessionConfigBuilder() {}

    public static SessionConfig build(TemplateChain chain, GlobalConfig global, ConfigOverrides overrides, Instant createdAt) {
        var violations = new ArrayList<Violation>();
        Map<String, Object> generation = chain.mergedSection("generation");
        Map<String, Object> output = chain.mergedSection("output");
        Path templatePath = chain.leaf().path();

        Path outputRoot = null;
        if (overrides.outputDir() != null) {
            outputRoot = overrides.outputDir();
        } else if (output.get("directory") instanceof String directory) {
            outputRoot = chain.leaf().directory().resolve(directory);
        } else if (global.outputDir().isPresent()) {
            outputRoot = global.outputDir().get();
        } else {
            violations.add(new Violation("output_dir", "is required (command line, output.directory or sdgen.toml)"));
        }

        String rawMode = first(overrides.mode(), generation.get("mode"), GenerationMode.COMBINATORIAL.label());
        GenerationMode mode = GenerationMode.parse(rawMode).orElse(null);
        if (mode == null) {
            violations.add(new Violation("mode", "unknown generation mode '" + rawMode + "'"));
        }

        String seedSpec = overrides.seeds();
        if (seedSpec == null && generation.get("seeds") != null) {
            Object seeds = generation.get("seeds");
            seedSpec = seeds instanceof List<?> list ? String.join(",", list.stream().map(String::valueOf).toList()) : String.valueOf(seeds);
        }
        String rawSeedMode = overrides.seedMode() != null
            ? overrides.seedMode()
            : overrides.seeds() != null ? SeedMode.SWEEP.label() : first(null, generation.get("seed_mode"), SeedMode.RANDOM.label());
        SeedMode seedMode = SeedMode.parse(rawSeedMode).orElse(null);
        if (seedMode == null) {
            violations.add(new Violation("seed_mode", "unknown seed mode '" + rawSeedMode + "'"));
        }

        Optional<Long> seed = Optional.ofNullable(overrides.seed())
            .or(() -> integral(generation, "seed", violations));
        if (seedMode != null && seedMode.needsBaseSeed() && seed.isEmpty()) {
            violations.add(new Violation("seed", "is required for seed mode " + seedMode.label()));
        }
        List<Long> sweepSeeds = List.of();
        if (seedMode == SeedMode.SWEEP) {
            if (seedSpec == null) {
                violations.add(new Violation("seeds", "is required for seed mode sweep"));
            } else {
                try {
                    sweepSeeds = SeedSpecParser.parse(seedSpec);
                } catch (IllegalArgumentException ex) {
                    violations.add(new Violation("seeds", ex.getMessage()));
                }
            }
        }

        Optional<Integer> maxImages = positive("max_images", overrides.maxImages(), generation, violations);
        if (mode == GenerationMode.RANDOM && maxImages.isEmpty()) {
            violations.add(new Violation("max_images", "is required in random mode"));
        }
        Optional<Integer> maxAttempts = positive("max_attempts", overrides.maxAttempts(), generation, violations);
        boolean weighted = flag("weighted_ordering", overrides.weightedOrdering(), generation, violations);
        boolean drawSeeds = flag("draw_random_seeds", overrides.drawRandomSeeds(), generation, violations);
        Optional<Long> samplingSeed = Optional.ofNullable(overrides.samplingSeed())
            .or(() -> integral(generation, "sampling_seed", violations));

        List<String> filenameKeys = List.of();
        if (overrides.filenameKeys() != null) {
            filenameKeys = overrides.filenameKeys();
        } else if (output.get("filename_keys") != null) {
            var keys = TreeValues.stringList(output.get("filename_keys"));
            if (keys.isPresent()) {
                filenameKeys = keys.get();
            } else {
                violations.add(new Violation("filename_keys", "must be a list of placeholder names"));
            }
        }

        String rawName = first(overrides.sessionName(), output.get("session_name"), chain.name());
        String sessionName = TextNormalizer.safeName(rawName);
        if (sessionName.isEmpty()) {
            sessionName = "session";
        }

        String rawUrl = overrides.apiUrl() != null ? overrides.apiUrl() : global.apiUrl().orElse(DEFAULT_API_URL);
        URI apiUrl = null;
        try {
            apiUrl = new URI(rawUrl.trim());
            if (!"http".equalsIgnoreCase(apiUrl.getScheme()) && !"https".equalsIgnoreCase(apiUrl.getScheme())) {
                violations.add(new Violation("api_url", "must be an http(s) URL: " + rawUrl));
            }
        } catch (URISyntaxException ex) {
            violations.add(new Violation("api_url", "is not a valid URL: " + rawUrl));
        }

        int workers = overrides.workers() != null ? overrides.workers() : global.workers().orElse(DEFAULT_WORKERS);
        if (workers < 1) {
            violations.add(new Violation("workers", "must be at least 1"));
        }
        Duration pollInterval = overrides.pollInterval() != null
            ? overrides.pollInterval()
            : global.pollInterval().orElse(DEFAULT_POLL_INTERVAL);
        if (pollInterval.isNegative() || pollInterval.isZero()) {
            violations.add(new Violation("poll_interval", "must be positive"));
        }
        Duration pollTimeout = overrides.pollTimeout() != null
            ? overrides.pollTimeout()
            : global.pollTimeout().orElse(DEFAULT_POLL_TIMEOUT);
        if (pollTimeout.isNegative() || pollTimeout.isZero()) {
            violations.add(new Violation("poll_timeout", "must be positive"));
        }

        if (!violations.isEmpty()) {
            throw new ConfigException(violations);
        }
        return new SessionConfig(
            templatePath,
            outputRoot.toAbsolutePath().normalize(),
            sessionName,
            filenameKeys,
            mode,
            seedMode,
            seed.orElse(0L),
            sweepSeeds,
            maxImages,
            maxAttempts,
            weighted,
            drawSeeds,
            samplingSeed,
            TreeValues.merge(chain.mergedSection("parameters"), overrides.parameters()),
            overrides.fixedPlaceholders(),
            apiUrl,
            overrides.dryRun(),
            workers,
            pollInterval,
            pollTimeout,
            global.templateRoots(),
            createdAt
        );
    }

    private static String first(String override, Object templateValue, String fallback) {
        if (override != null && !override.isBlank()) {
            return override;
        }
        if (templateValue != null && !(templateValue instanceof Map<?, ?>) && !(templateValue instanceof List<?>)) {
            return String.valueOf(templateValue);
        }
        return fallback;
    }

    private static Optional<Long> integral(Map<String, Object> section, String key, List<Violation> violations) {
        Object value = section.get(key);
        if (value == null) {
            return Optional.empty();
        }
        if (!TreeValues.isIntegral(value)) {
            violations.add(new Violation(key, "must be an integer"));
            return Optional.empty();
        }
        return TreeValues.longValue(value);
    }

    private static Optional<Integer> positive(String key, Integer override, Map<String, Object> section, List<Violation> violations) {
        Optional<Long> value = override != null ? Optional.of(override.longValue()) : integral(section, key, violations);
        if (value.isEmpty()) {
            return Optional.empty();
        }
        if (value.get() <= 0 || value.get() > Integer.MAX_VALUE) {
            violations.add(new Violation(key, "must be a positive integer"));
            return Optional.empty();
        }
        return Optional.of(value.get().intValue());
    }

    private static boolean flag(String key, Boolean override, Map<String, Object> section, List<Violation> violations) {
        if (override != null) {
            return override;
        }
        Object value = section.get(key);
        if (value == null) {
            return false;
        }
        var parsed = TreeValues.booleanValue(value);
        if (parsed.isEmpty()) {
            violations.add(new Violation(key, "must be a boolean"));
            return false;
        }
        return parsed.get();
    }
}
