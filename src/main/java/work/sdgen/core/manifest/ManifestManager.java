package work.sdgen.core.manifest;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import work.sdgen.core.batch.JobRecord;
import work.sdgen.core.prompt.ResolvedPrompt;

/**
 * Owns the manifest of one run and its lifecycle: {@code ongoing -> completed | aborted}.
 * Creation and the final transition are persisted immediately. Job updates are written at most once per
 * {@code flushInterval}; {@link #flush()} writes the pending ones.
 */
public final class ManifestManager {
    private static final Logger log = LoggerFactory.getLogger(ManifestManager.class);
    public static final Duration DEFAULT_FLUSH_INTERVAL = Duration.ofSeconds(1);

    private final ManifestStore store;
    private final Clock clock;
    private final Duration flushInterval;
    private Manifest manifest;
    private Instant lastSaved;
    private boolean dirty;

    public ManifestManager(ManifestStore store) {
        this(store, Clock.systemUTC());
    }

    public ManifestManager(ManifestStore store, Clock clock) {
        this(store, clock, DEFAULT_FLUSH_INTERVAL);
    }

    public ManifestManager(ManifestStore store, Clock clock, Duration flushInterval) {
        this.store = store;
        this.clock = clock;
        this.flushInterval = flushInterval;
    }

    public synchronized Manifest create(Map<String, Object> sessionSnapshot, List<ResolvedPrompt> prompts) {
        if (manifest != null) {
            throw new IllegalStateException("Manifest already created (status " + manifest.status().label() + ")");
        }
        var jobs = new ArrayList<JobSummary>();
        prompts.forEach(prompt -> jobs.add(JobSummary.planned(prompt)));
        manifest = new Manifest(
            Manifest.FORMAT_VERSION,
            clock.instant(),
            ManifestStatus.ONGOING,
            sessionSnapshot,
            jobs,
            Map.of(),
            Optional.empty(),
            Optional.empty()
        );
        persist();
        return manifest;
    }

    /**
     * Folds a job update into the manifest. Returns {@code false} when the manifest is already terminal.
     */
    public synchronized boolean recordJob(JobRecord record) {
        requireCreated();
        if (manifest.status().isTerminal()) {
            log.warn("Ignoring update of job {} ({}): manifest is already {}",
                record.index(), record.state().label(), manifest.status().label());
            return false;
        }
        var jobs = new ArrayList<>(manifest.jobs());
        jobs.set(record.index(), jobs.get(record.index()).update(record));
        manifest = new Manifest(
            manifest.version(), manifest.createdAt(), manifest.status(), manifest.session(), jobs,
            manifest.statistics(), manifest.finishedAt(), manifest.abortReason()
        );
        dirty = true;
        if (lastSaved == null || !clock.instant().isBefore(lastSaved.plus(flushInterval))) {
            persist();
        }
        return true;
    }

    /**
     * Writes job updates that are not on disk yet.
     */
    public synchronized void flush() {
        requireCreated();
        if (dirty) {
            persist();
        }
    }

    public synchronized Manifest complete(Map<String, Object> statistics) {
        return finish(ManifestStatus.COMPLETED, statistics, Optional.empty());
    }

    public synchronized Manifest abort(String reason, Map<String, Object> statistics) {
        return finish(ManifestStatus.ABORTED, statistics, Optional.of(reason));
    }

    private Manifest finish(ManifestStatus target, Map<String, Object> statistics, Optional<String> reason) {
        requireCreated();
        if (manifest.status().isTerminal()) {
            throw new IllegalStateException(
                "Manifest is already " + manifest.status().label() + "; cannot move to " + target.label());
        }
        manifest = new Manifest(
            manifest.version(), manifest.createdAt(), target, manifest.session(), manifest.jobs(),
            new LinkedHashMap<>(statistics), Optional.of(clock.instant()), reason
        );
        log.info("Manifest {}{}", target.label(), reason.map(r -> ": " + r).orElse(""));
        persist();
        return manifest;
    }

    public synchronized boolean isCreated() {
        return manifest != null;
    }

    public synchronized boolean isTerminal() {
        return manifest != null && manifest.status().isTerminal();
    }

    public synchronized Optional<Manifest> snapshot() {
        return Optional.ofNullable(manifest);
    }

    private void requireCreated() {
        if (manifest == null) {
            throw new IllegalStateException("Manifest has not been created");
        }
    }

    private void persist() {
        try {
            store.save(manifest);
            lastSaved = clock.instant();
            dirty = false;
        } catch (IOException ex) {
            throw new UncheckedIOException("Unable to persist manifest: " + ex.getMessage(), ex);
        }
    }
}
