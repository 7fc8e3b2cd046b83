package work.sdgen.core.session;

import java.net.URI;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import work.sdgen.core.prompt.GenerationMode;
import work.sdgen.core.prompt.GenerationSettings;
import work.sdgen.core.prompt.SeedMode;
import work.sdgen.core.shared.DurationParser;

/**
 * Immutable configuration of one run, built once in the configuration phase.
 */
public record SessionConfig(
    Path templatePath,
    Path outputRoot,
    String sessionName,
    List<String> filenameKeys,
    GenerationMode mode,
    SeedMode seedMode,
    long baseSeed,
    List<Long> sweepSeeds,
    Optional<Integer> maxImages,
    Optional<Integer> maxAttempts,
    boolean weightedOrdering,
    boolean drawRandomSeeds,
    Optional<Long> samplingSeed,
    Map<String, Object> parameters,
    Map<String, String> fixedPlaceholders,
    URI apiUrl,
    boolean dryRun,
    int workers,
    Duration pollInterval,
    Duration pollTimeout,
    List<Path> templateRoots,
    Instant createdAt
) {
    public static final String MANIFEST_FILE = "manifest.json";
    private static final DateTimeFormatter FOLDER_TIMESTAMP = DateTimeFormatter.ofPattern("yyyyMMdd_HHmmss");

    public SessionConfig {
        Objects.requireNonNull(templatePath, "templatePath");
        Objects.requireNonNull(outputRoot, "outputRoot");
        Objects.requireNonNull(sessionName, "sessionName");
        Objects.requireNonNull(mode, "mode");
        Objects.requireNonNull(seedMode, "seedMode");
        Objects.requireNonNull(maxImages, "maxImages");
        Objects.requireNonNull(maxAttempts, "maxAttempts");
        Objects.requireNonNull(samplingSeed, "samplingSeed");
        Objects.requireNonNull(apiUrl, "apiUrl");
        Objects.requireNonNull(pollInterval, "pollInterval");
        Objects.requireNonNull(pollTimeout, "pollTimeout");
        Objects.requireNonNull(createdAt, "createdAt");
        filenameKeys = List.copyOf(filenameKeys);
        sweepSeeds = List.copyOf(sweepSeeds);
        parameters = Collections.unmodifiableMap(new LinkedHashMap<>(parameters));
        fixedPlaceholders = Collections.unmodifiableMap(new LinkedHashMap<>(fixedPlaceholders));
        templateRoots = List.copyOf(templateRoots);
    }

    public String folderName() {
        return FOLDER_TIMESTAMP.format(createdAt.atZone(ZoneId.systemDefault())) + "_" + sessionName;
    }

    public Path sessionDirectory() {
        return outputRoot.resolve(folderName());
    }

    public Path manifestPath() {
        return sessionDirectory().resolve(MANIFEST_FILE);
    }

    public GenerationSettings generationSettings() {
        return new GenerationSettings(
            mode,
            seedMode,
            baseSeed,
            sweepSeeds,
            maxImages,
            maxAttempts,
            weightedOrdering,
            drawRandomSeeds,
            filenameKeys
        );
    }

    /**
     * Snapshot persisted in the manifest. Field names are part of the manifest format.
     */
    public Map<String, Object> toSnapshot() {
        var generation = new LinkedHashMap<String, Object>();
        generation.put("mode", mode.label());
        generation.put("seed_mode", seedMode.label());
        generation.put("seed", baseSeed);
        if (seedMode == SeedMode.SWEEP) {
            generation.put("seeds", sweepSeeds);
        }
        generation.put("max_images", maxImages.orElse(null));
        generation.put("weighted_ordering", weightedOrdering);
        samplingSeed.ifPresent(seed -> generation.put("sampling_seed", seed));

        var snapshot = new LinkedHashMap<String, Object>();
        snapshot.put("template", templatePath.toString());
        snapshot.put("session_name", sessionName);
        snapshot.put("output_dir", sessionDirectory().toString());
        snapshot.put("filename_keys", filenameKeys);
        snapshot.put("generation", generation);
        snapshot.put("parameters", parameters);
        snapshot.put("fixed_placeholders", fixedPlaceholders);
        snapshot.put("api_url", apiUrl.toString());
        snapshot.put("workers", workers);
        snapshot.put("poll_interval", DurationParser.format(pollInterval));
        snapshot.put("poll_timeout", DurationParser.format(pollTimeout));
        return snapshot;
    }
}
