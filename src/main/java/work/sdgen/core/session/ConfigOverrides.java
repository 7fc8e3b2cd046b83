package work.sdgen.core.session;

import java.nio.file.Path;
import java.time.Duration;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Run-level settings from the command line or an embedding caller. A {@code null} component is not overridden.
 */
public record ConfigOverrides(
    Path outputDir,
    String sessionName,
    List<String> filenameKeys,
    String mode,
    String seedMode,
    Long seed,
    String seeds,
    Integer maxImages,
    Integer maxAttempts,
    Boolean weightedOrdering,
    Boolean drawRandomSeeds,
    Long samplingSeed,
    Map<String, Object> parameters,
    Map<String, String> fixedPlaceholders,
    String apiUrl,
    Integer workers,
    Duration pollInterval,
    Duration pollTimeout,
    boolean dryRun
) {
    public ConfigOverrides {
        filenameKeys = filenameKeys == null ? null : List.copyOf(filenameKeys);
        parameters = parameters == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(parameters));
        fixedPlaceholders = fixedPlaceholders == null
            ? Map.of()
            : Collections.unmodifiableMap(new LinkedHashMap<>(fixedPlaceholders));
    }

    public static ConfigOverrides none() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private Path outputDir;
        private String sessionName;
        private List<String> filenameKeys;
        private String mode;
        private String seedMode;
        private Long seed;
        private String seeds;
        private Integer maxImages;
        private Integer maxAttempts;
        private Boolean weightedOrdering;
        private Boolean drawRandomSeeds;
        private Long samplingSeed;
        private final Map<String, Object> parameters = new LinkedHashMap<>();
        private final Map<String, String> fixedPlaceholders = new LinkedHashMap<>();
        private String apiUrl;
        private Integer workers;
        private Duration pollInterval;
        private Duration pollTimeout;
        private boolean dryRun;

        public Builder outputDir(Path outputDir) {
            this.outputDir = outputDir;
            return this;
        }

        public Builder sessionName(String sessionName) {
            this.sessionName = sessionName;
            return this;
        }

        public Builder filenameKeys(List<String> filenameKeys) {
            this.filenameKeys = filenameKeys;
            return this;
        }

        public Builder mode(String mode) {
            this.mode = mode;
            return this;
        }

        public Builder seedMode(String seedMode) {
            this.seedMode = seedMode;
            return this;
        }

        public Builder seed(Long seed) {
            this.seed = seed;
            return this;
        }

        public Builder seeds(String seeds) {
            this.seeds = seeds;
            return this;
        }

        public Builder maxImages(Integer maxImages) {
            this.maxImages = maxImages;
            return this;
        }

        public Builder maxAttempts(Integer maxAttempts) {
            this.maxAttempts = maxAttempts;
            return this;
        }

        public Builder weightedOrdering(Boolean weightedOrdering) {
            this.weightedOrdering = weightedOrdering;
            return this;
        }

        public Builder drawRandomSeeds(Boolean drawRandomSeeds) {
            this.drawRandomSeeds = drawRandomSeeds;
            return this;
        }

        public Builder samplingSeed(Long samplingSeed) {
            this.samplingSeed = samplingSeed;
            return this;
        }

        public Builder parameter(String key, Object value) {
            this.parameters.put(key, value);
            return this;
        }

        public Builder parameters(Map<String, Object> parameters) {
            this.parameters.putAll(parameters);
            return this;
        }

        public Builder fix(String placeholder, String key) {
            this.fixedPlaceholders.put(placeholder, key);
            return this;
        }

        public Builder fixedPlaceholders(Map<String, String> fixedPlaceholders) {
            this.fixedPlaceholders.putAll(fixedPlaceholders);
            return this;
        }

        public Builder apiUrl(String apiUrl) {
            this.apiUrl = apiUrl;
            return this;
        }

        public Builder workers(Integer workers) {
            this.workers = workers;
            return this;
        }

        public Builder pollInterval(Duration pollInterval) {
            this.pollInterval = pollInterval;
            return this;
        }

        public Builder pollTimeout(Duration pollTimeout) {
            this.pollTimeout = pollTimeout;
            return this;
        }

        public Builder dryRun(boolean dryRun) {
            this.dryRun = dryRun;
            return this;
        }

        public ConfigOverrides build() {
            return new ConfigOverrides(
                outputDir,
                sessionName,
                filenameKeys,
                mode,
                seedMode,
                seed,
                seeds,
                maxImages,
                maxAttempts,
                weightedOrdering,
                drawRandomSeeds,
                samplingSeed,
                parameters,
                fixedPlaceholders,
                apiUrl,
                workers,
                pollInterval,
                pollTimeout,
                dryRun
            );
        }
    }
}
