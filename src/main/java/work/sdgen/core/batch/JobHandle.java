package work.sdgen.core.batch;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Backend view of a job. Synchronous backends return an already terminal handle from {@code submit}.
 */
public record JobHandle(String id, JobStatus status, Map<String, Object> result, Optional<String> error) {
    public JobHandle {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(status, "status");
        Objects.requireNonNull(error, "error");
        result = result == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(result));
    }

    public static JobHandle pending(String id) {
        return new JobHandle(id, JobStatus.PENDING, Map.of(), Optional.empty());
    }

    public static JobHandle succeeded(String id, Map<String, Object> result) {
        return new JobHandle(id, JobStatus.SUCCEEDED, result, Optional.empty());
    }

    public static JobHandle failed(String id, String error) {
        return new JobHandle(id, JobStatus.FAILED, Map.of(), Optional.of(error));
    }

    /**
     * Seed the backend reports it actually used, when present in the result.
     */
    public Optional<Long> reportedSeed() {
        Object seed = result.get("seed");
        if (seed instanceof Number number) {
            return Optional.of(number.longValue());
        }
        return Optional.empty();
    }
}
