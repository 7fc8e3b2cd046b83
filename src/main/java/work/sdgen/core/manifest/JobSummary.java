package work.sdgen.core.manifest;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import work.sdgen.core.batch.JobRecord;
import work.sdgen.core.batch.JobState;
import work.sdgen.core.prompt.ResolvedPrompt;

/**
 * Manifest entry of one image.
 */
public record JobSummary(
    int index,
    long seed,
    Optional<Long> backendSeed,
    Map<String, String> keys,
    Map<String, String> values,
    String filename,
    String prompt,
    String negativePrompt,
    JobState status,
    Optional<String> error
) {
    public JobSummary {
        Objects.requireNonNull(filename, "filename");
        Objects.requireNonNull(status, "status");
        Objects.requireNonNull(backendSeed, "backendSeed");
        Objects.requireNonNull(error, "error");
        keys = Collections.unmodifiableMap(new LinkedHashMap<>(keys));
        values = Collections.unmodifiableMap(new LinkedHashMap<>(values));
    }

    public static JobSummary planned(ResolvedPrompt prompt) {
        return new JobSummary(
            prompt.index(),
            prompt.seed(),
            Optional.empty(),
            prompt.keys(),
            prompt.values(),
            prompt.filename(),
            prompt.prompt(),
            prompt.negativePrompt(),
            JobState.PENDING,
            Optional.empty()
        );
    }

    public JobSummary update(JobRecord record) {
        return new JobSummary(
            index, seed, record.backendSeed(), keys, values, filename, prompt, negativePrompt,
            record.state(), record.error()
        );
    }

    public Map<String, Object> toSerializableMap() {
        var map = new LinkedHashMap<String, Object>();
        map.put("index", index);
        map.put("seed", seed);
        backendSeed.ifPresent(value -> map.put("backend_seed", value));
        map.put("keys", keys);
        map.put("values", values);
        map.put("filename", filename);
        map.put("prompt", prompt);
        map.put("negative_prompt", negativePrompt);
        map.put("status", status.label());
        error.ifPresent(value -> map.put("error", value));
        return map;
    }
}
