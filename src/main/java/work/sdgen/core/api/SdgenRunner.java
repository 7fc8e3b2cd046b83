package work.sdgen.core.api;

import java.time.Clock;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Function;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import work.sdgen.core.batch.FileImageSink;
import work.sdgen.core.batch.ImageBackend;
import work.sdgen.core.batch.SdWebUiBackend;
import work.sdgen.core.error.SdgenException;
import work.sdgen.core.events.EventLog;
import work.sdgen.core.events.RunEvent;
import work.sdgen.core.manifest.Manifest;
import work.sdgen.core.manifest.ManifestStatus;
import work.sdgen.core.orchestrator.GenerationOrchestrator;
import work.sdgen.core.orchestrator.RunReport;
import work.sdgen.core.session.SessionConfig;

/**
 * Public entry point for embedding the generator.
 */
public final class SdgenRunner {
    private static final Logger log = LoggerFactory.getLogger(SdgenRunner.class);

    private final Clock clock;

    public SdgenRunner() {
        this(Clock.systemUTC());
    }

    public SdgenRunner(Clock clock) {
        this.clock = clock;
    }

    public RunResult run(SdgenRunConfiguration configuration) {
        return run(configuration, new EventLog(clock));
    }

    /**
     * Runs with a caller-owned event log so the caller can follow progress as it happens.
     */
    public RunResult run(SdgenRunConfiguration configuration, EventLog events) {
        var started = Instant.now(clock);
        configuration.logLevel().ifPresent(LogLevel::apply);
        Function<SessionConfig, ImageBackend> backends = session -> configuration.backend()
            .orElseGet(() -> new SdWebUiBackend(session.apiUrl(), session.pollTimeout()));
        var orchestrator = new GenerationOrchestrator(
            backends, session -> new FileImageSink(session.sessionDirectory()), clock);
        try {
            RunReport report = orchestrator.orchestrate(configuration.toRequest(), events);
            var metadata = new LinkedHashMap<String, Object>();
            metadata.put("template", configuration.templatePath().toString());
            metadata.putAll(report.toSerializableMap());
            if (report.dryRun()) {
                return RunResult.planned(metadata, started);
            }
            if (report.status().orElse(ManifestStatus.ABORTED) == ManifestStatus.COMPLETED) {
                return RunResult.success(metadata, started);
            }
            String reason = report.manifest()
                .flatMap(Manifest::abortReason)
                .orElse("run aborted");
            return RunResult.failure(reason, metadata, started);
        } catch (RuntimeException ex) {
            var errorMeta = new LinkedHashMap<String, Object>();
            errorMeta.put("template", configuration.templatePath().toString());
            String message = ex.getMessage() == null || ex.getMessage().isBlank()
                ? ex.getClass().getSimpleName()
                : ex.getMessage();
            errorMeta.put("error", message);
            if (ex instanceof SdgenException sdgen) {
                errorMeta.put("error_code", sdgen.code());
                if (!sdgen.details().isEmpty()) {
                    errorMeta.put("details", sdgen.details());
                }
            } else {
                log.error("Unexpected failure", ex);
            }
            errorMeta.put("events", summarize(events));
            if (Boolean.getBoolean("sdgen.debug")) {
                ex.printStackTrace();
            }
            return RunResult.failure(message, errorMeta, started);
        }
    }

    private static List<Map<String, Object>> summarize(EventLog events) {
        return events.events().stream().map(RunEvent::toSerializableMap).toList();
    }
}
