package work.sdgen.core.manifest;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import work.sdgen.core.batch.JobState;

/**
 * Immutable snapshot of a run's manifest. The serialized field names are a compatibility contract.
 */
public record Manifest(
    String version,
    Instant createdAt,
    ManifestStatus status,
    Map<String, Object> session,
    List<JobSummary> jobs,
    Map<String, Object> statistics,
    Optional<Instant> finishedAt,
    Optional<String> abortReason
) {
    public static final String FORMAT_VERSION = "1.0";

    public Manifest {
        Objects.requireNonNull(version, "version");
        Objects.requireNonNull(createdAt, "createdAt");
        Objects.requireNonNull(status, "status");
        Objects.requireNonNull(finishedAt, "finishedAt");
        Objects.requireNonNull(abortReason, "abortReason");
        session = Collections.unmodifiableMap(new LinkedHashMap<>(session));
        jobs = List.copyOf(jobs);
        statistics = Collections.unmodifiableMap(new LinkedHashMap<>(statistics));
    }

    public int imagesRequested() {
        return jobs.size();
    }

    public int imagesGenerated() {
        return (int) jobs.stream().filter(job -> job.status() == JobState.SUCCEEDED).count();
    }

    public Map<String, Object> toSerializableMap() {
        var map = new LinkedHashMap<String, Object>();
        map.put("version", version);
        map.put("created_at", createdAt.toString());
        map.put("status", status.label());
        map.put("session", session);
        map.put("images_requested", imagesRequested());
        map.put("images_generated", imagesGenerated());
        var serializedJobs = new ArrayList<Map<String, Object>>();
        jobs.forEach(job -> serializedJobs.add(job.toSerializableMap()));
        map.put("jobs", serializedJobs);
        map.put("statistics", statistics);
        finishedAt.ifPresent(value -> map.put("finished_at", value.toString()));
        abortReason.ifPresent(value -> map.put("abort_reason", value));
        return map;
    }
}
