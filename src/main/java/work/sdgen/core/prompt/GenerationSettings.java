package work.sdgen.core.prompt;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Prompt generation knobs derived from the session configuration.
 */
public record GenerationSettings(
    GenerationMode mode,
    SeedMode seedMode,
    long baseSeed,
    List<Long> sweepSeeds,
    Optional<Integer> maxImages,
    Optional<Integer> maxAttempts,
    boolean weightedOrdering,
    boolean drawRandomSeeds,
    List<String> filenameKeys
) {
    public GenerationSettings {
        Objects.requireNonNull(mode, "mode");
        Objects.requireNonNull(seedMode, "seedMode");
        Objects.requireNonNull(maxImages, "maxImages");
        Objects.requireNonNull(maxAttempts, "maxAttempts");
        sweepSeeds = List.copyOf(sweepSeeds);
        filenameKeys = List.copyOf(filenameKeys);
        if (seedMode == SeedMode.SWEEP && sweepSeeds.isEmpty()) {
            throw new IllegalArgumentException("sweep seed mode needs at least one seed");
        }
    }
}
