package work.sdgen.core.prompt;

import java.time.Duration;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Counters collected while generating prompts.
 */
public record GenerationStatistics(
    GenerationMode mode,
    Map<String, Integer> candidatesPerAxis,
    long combinationSpace,
    Map<String, Map<String, Integer>> distribution,
    int imagesGenerated,
    int attempts,
    boolean attemptsExhausted,
    Duration elapsed
) {
    public GenerationStatistics {
        candidatesPerAxis = Collections.unmodifiableMap(new LinkedHashMap<>(candidatesPerAxis));
        var copy = new LinkedHashMap<String, Map<String, Integer>>();
        distribution.forEach((axis, counts) -> copy.put(axis, Collections.unmodifiableMap(new LinkedHashMap<>(counts))));
        distribution = Collections.unmodifiableMap(copy);
    }

    public Map<String, Object> toSerializableMap() {
        var map = new LinkedHashMap<String, Object>();
        map.put("mode", mode.label());
        map.put("candidates_per_axis", candidatesPerAxis);
        map.put("combination_space", combinationSpace);
        map.put("images_generated", imagesGenerated);
        map.put("attempts", attempts);
        map.put("attempts_exhausted", attemptsExhausted);
        map.put("distribution", distribution);
        map.put("elapsed_ms", elapsed.toMillis());
        return map;
    }
}
