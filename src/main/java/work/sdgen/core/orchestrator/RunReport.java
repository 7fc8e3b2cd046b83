package work.sdgen.core.orchestrator;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import work.sdgen.core.batch.BatchOutcome;
import work.sdgen.core.events.RunEvent;
import work.sdgen.core.manifest.Manifest;
import work.sdgen.core.manifest.ManifestStatus;
import work.sdgen.core.prompt.GenerationStatistics;
import work.sdgen.core.prompt.ResolvedPrompt;
import work.sdgen.core.session.SessionConfig;

/**
 * What a run produced. {@code manifest} is empty for dry runs.
 */
public record RunReport(
    String runId,
    boolean dryRun,
    SessionConfig session,
    List<ResolvedPrompt> prompts,
    GenerationStatistics statistics,
    Optional<BatchOutcome> batch,
    Optional<Manifest> manifest,
    List<RunEvent> events
) {
    public RunReport {
        Objects.requireNonNull(runId, "runId");
        Objects.requireNonNull(session, "session");
        Objects.requireNonNull(statistics, "statistics");
        Objects.requireNonNull(batch, "batch");
        Objects.requireNonNull(manifest, "manifest");
        prompts = List.copyOf(prompts);
        events = List.copyOf(events);
    }

    public Optional<ManifestStatus> status() {
        return manifest.map(Manifest::status);
    }

    public Optional<Path> manifestPath() {
        return manifest.map(ignored -> session.manifestPath());
    }

    public Map<String, Object> toSerializableMap() {
        var map = new LinkedHashMap<String, Object>();
        map.put("run_id", runId);
        map.put("dry_run", dryRun);
        status().ifPresent(value -> map.put("manifest_status", value.label()));
        manifestPath().ifPresent(path -> map.put("manifest", path.toString()));
        manifest.flatMap(Manifest::abortReason).ifPresent(reason -> map.put("abort_reason", reason));
        map.put("session_dir", session.sessionDirectory().toString());
        map.put("images_requested", prompts.size());
        batch.ifPresent(outcome -> map.put("batch", outcome.toSerializableMap()));
        map.put("statistics", statistics.toSerializableMap());
        if (dryRun) {
            var planned = new ArrayList<Map<String, Object>>();
            prompts.forEach(prompt -> planned.add(prompt.toSerializableMap()));
            map.put("prompts", planned);
        }
        return map;
    }
}
