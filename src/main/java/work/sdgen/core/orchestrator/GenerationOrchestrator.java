package work.sdgen.core.orchestrator;

import java.nio.file.Path;
import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Function;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import work.sdgen.core.batch.BatchOutcome;
import work.sdgen.core.batch.BatchSettings;
import work.sdgen.core.batch.FileImageSink;
import work.sdgen.core.batch.ImageBackend;
import work.sdgen.core.batch.ImageGenerator;
import work.sdgen.core.batch.ImageSink;
import work.sdgen.core.batch.JobRecord;
import work.sdgen.core.batch.SdWebUiBackend;
import work.sdgen.core.error.RunCancelledException;
import work.sdgen.core.error.SdgenException;
import work.sdgen.core.events.EventLog;
import work.sdgen.core.events.EventType;
import work.sdgen.core.manifest.JsonManifestStore;
import work.sdgen.core.manifest.Manifest;
import work.sdgen.core.manifest.ManifestManager;
import work.sdgen.core.manifest.ManifestStore;
import work.sdgen.core.prompt.PlanBuilder;
import work.sdgen.core.prompt.PromptGenerator;
import work.sdgen.core.session.GlobalConfig;
import work.sdgen.core.session.GlobalConfigLoader;
import work.sdgen.core.session.SessionConfig;
import work.sdgen.core.session.SessionConfigBuilder;
import work.sdgen.core.template.DocumentLocator;
import work.sdgen.core.template.ImportNamespace;
import work.sdgen.core.template.ImportResolver;
import work.sdgen.core.template.InheritanceResolver;
import work.sdgen.core.template.ResolvedTemplate;
import work.sdgen.core.template.TemplateChain;
import work.sdgen.core.template.TemplateValidator;
import work.sdgen.core.variation.SelectorEvaluator;

/**
 * Runs the eight phases of a generation run in order. Phase 1 to 5 failures propagate before any manifest
 * exists; once the manifest is created every exit path leaves it {@code completed} or {@code aborted}.
 *
 * <p>An orchestrator instance runs one request at a time.
 */
public final class GenerationOrchestrator {
    private static final Logger log = LoggerFactory.getLogger(GenerationOrchestrator.class);

    private final Function<SessionConfig, ImageBackend> backendFactory;
    private final Function<SessionConfig, ImageSink> sinkFactory;
    private final Function<Path, ManifestStore> storeFactory;
    private final Clock clock;
    private final AtomicBoolean running = new AtomicBoolean();

    public GenerationOrchestrator() {
        this(
            session -> new SdWebUiBackend(session.apiUrl(), session.pollTimeout()),
            session -> new FileImageSink(session.sessionDirectory()),
            Clock.systemUTC()
        );
    }

    public GenerationOrchestrator(
        Function<SessionConfig, ImageBackend> backendFactory,
        Function<SessionConfig, ImageSink> sinkFactory,
        Clock clock
    ) {
        this(backendFactory, sinkFactory, JsonManifestStore::new, clock);
    }

    public GenerationOrchestrator(
        Function<SessionConfig, ImageBackend> backendFactory,
        Function<SessionConfig, ImageSink> sinkFactory,
        Function<Path, ManifestStore> storeFactory,
        Clock clock
    ) {
        this.backendFactory = backendFactory;
        this.sinkFactory = sinkFactory;
        this.storeFactory = storeFactory;
        this.clock = clock;
    }

    public RunReport orchestrate(RunRequest request) {
        return orchestrate(request, new EventLog(clock));
    }

    /**
     * Runs {@code request}, publishing progress to {@code events}. Subscribe to the log before calling to follow
     * the run live.
     */
    public RunReport orchestrate(RunRequest request, EventLog events) {
        if (!running.compareAndSet(false, true)) {
            throw new IllegalStateException("A run is already in progress on this orchestrator");
        }
        try {
            var ctx = new RunContext(request, events);
            events.publish(EventType.RUN_STARTED, null, Map.of(
                "run_id", ctx.runId(),
                "template", request.templatePath().toString()
            ));
            log.info("Run {} started for {}", ctx.runId(), request.templatePath());
            RunReport report = execute(ctx);
            var finished = new LinkedHashMap<String, Object>();
            finished.put("run_id", ctx.runId());
            finished.put("dry_run", report.dryRun());
            report.status().ifPresent(status -> finished.put("status", status.label()));
            events.publish(EventType.RUN_FINISHED, null, finished);
            return new RunReport(
                report.runId(), report.dryRun(), report.session(), report.prompts(), report.statistics(),
                report.batch(), report.manifest(), events.events());
        } finally {
            running.set(false);
        }
    }

    private RunReport execute(RunContext ctx) {
        phase(ctx, Phase.CONFIGURATION, () -> configure(ctx));
        phase(ctx, Phase.VALIDATION, () -> {
            TemplateValidator.validate(ctx.chain());
            return Map.of("documents", ctx.chain().documents().size());
        });
        boolean dryRun = ctx.session().dryRun();
        ImageBackend backend = null;
        if (dryRun) {
            log.info("Dry run: backend probe, manifest and image generation are skipped");
        } else {
            backend = backendFactory.apply(ctx.session());
            ImageBackend probed = backend;
            phase(ctx, Phase.API_CONNECTION, () -> {
                probed.probe();
                return Map.of("api_url", ctx.session().apiUrl().toString());
            });
        }
        phase(ctx, Phase.RESOLUTION, () -> resolve(ctx));
        phase(ctx, Phase.PROMPT_GENERATION, () -> {
            var generator = new PromptGenerator(ctx.random());
            ctx.generation(generator.generate(ctx.plan(), ctx.session().generationSettings()));
            return Map.of(
                "prompts", ctx.generation().prompts().size(),
                "combination_space", ctx.generation().statistics().combinationSpace()
            );
        });
        if (dryRun) {
            return report(ctx, true);
        }
        runTracked(ctx, backend);
        return report(ctx, false);
    }

    private Map<String, Object> configure(RunContext ctx) {
        var request = ctx.request();
        var templatePath = request.templatePath().toAbsolutePath().normalize();
        Path templateDir = templatePath.getParent();
        GlobalConfig global = GlobalConfigLoader.load(request.configFile(), templateDir, request.homeDir());
        var locator = new DocumentLocator(global.templateRoots());
        TemplateChain chain = new InheritanceResolver(locator).loadChain(templatePath);
        SessionConfig session = SessionConfigBuilder.build(chain, global, request.overrides(), clock.instant());
        ctx.configured(locator, chain, session);
        var summary = new LinkedHashMap<String, Object>();
        summary.put("session", session.folderName());
        summary.put("mode", session.mode().label());
        summary.put("seed_mode", session.seedMode().label());
        global.source().ifPresent(source -> summary.put("global_config", source.toString()));
        return summary;
    }

    private Map<String, Object> resolve(RunContext ctx) {
        ResolvedTemplate template = new InheritanceResolver(ctx.locator()).merge(ctx.chain());
        ImportNamespace namespace = new ImportResolver(ctx.locator(), ctx.chunks(), ctx.variations()).resolve(template);
        var builder = new PlanBuilder(new SelectorEvaluator(ctx.random()));
        ctx.plan(builder.build(template, namespace, ctx.session().fixedPlaceholders()));
        return Map.of(
            "template", template.displayName(),
            "axes", ctx.plan().axes().size()
        );
    }

    private void runTracked(RunContext ctx, ImageBackend backend) {
        try {
            phase(ctx, Phase.MANIFEST_PREPARATION, () -> prepareManifest(ctx));
            phase(ctx, Phase.IMAGE_GENERATION, () -> generateImages(ctx, backend));
            phase(ctx, Phase.FINALIZATION, () -> finalizeManifest(ctx));
        } catch (RuntimeException | Error ex) {
            abortAfterFailure(ctx, ex);
            throw ex;
        }
    }

    private Map<String, Object> prepareManifest(RunContext ctx) {
        var session = ctx.session();
        var manager = new ManifestManager(storeFactory.apply(session.manifestPath()), clock);
        Manifest manifest = manager.create(session.toSnapshot(), ctx.generation().prompts());
        ctx.manifest(manager);
        ctx.events().publish(EventType.MANIFEST_CREATED, Phase.MANIFEST_PREPARATION.label(), Map.of(
            "manifest", session.manifestPath().toString(),
            "jobs", manifest.imagesRequested()
        ));
        return Map.of("jobs", manifest.imagesRequested());
    }

    private Map<String, Object> generateImages(RunContext ctx, ImageBackend backend) {
        var session = ctx.session();
        var manager = ctx.manifest().orElseThrow();
        var settings = new BatchSettings(session.workers(), session.pollInterval(), session.pollTimeout());
        var generator = new ImageGenerator(backend, sinkFactory.apply(session), settings, ctx.cancellation());
        BatchOutcome outcome = generator.run(ctx.generation().prompts(), session.parameters(), job -> {
            if (manager.recordJob(job)) {
                ctx.events().publish(EventType.JOB_UPDATED, Phase.IMAGE_GENERATION.label(), jobPayload(job));
            }
        });
        ctx.outcome(outcome);
        manager.flush();
        return outcome.toSerializableMap();
    }

    private Map<String, Object> finalizeManifest(RunContext ctx) {
        var manager = ctx.manifest().orElseThrow();
        var outcome = ctx.outcome().orElseThrow();
        var statistics = finalStatistics(ctx);
        Optional<String> abortReason = abortReason(ctx, outcome);
        Manifest manifest = abortReason.isPresent()
            ? manager.abort(abortReason.get(), statistics)
            : manager.complete(statistics);
        publishFinalized(ctx, manifest);
        log.info("Manifest {} ({} of {} images generated)",
            manifest.status().label(), manifest.imagesGenerated(), manifest.imagesRequested());
        return Map.of("status", manifest.status().label());
    }

    private static Optional<String> abortReason(RunContext ctx, BatchOutcome outcome) {
        if (outcome.cancelled() || ctx.cancellation().isCancelled()) {
            return Optional.of("cancelled" + ctx.cancellation().reason().map(reason -> ": " + reason).orElse(""));
        }
        if (outcome.fatal()) {
            return Optional.of("fatal job error: " + outcome.fatalError().orElseThrow());
        }
        if (!outcome.allTerminal()) {
            return Optional.of(outcome.pending() + " job(s) did not finish");
        }
        return Optional.empty();
    }

    private void abortAfterFailure(RunContext ctx, Throwable failure) {
        var manager = ctx.manifest().orElse(null);
        if (manager == null || manager.isTerminal()) {
            return;
        }
        try {
            String message = failure.getMessage() == null ? failure.getClass().getSimpleName() : failure.getMessage();
            Manifest manifest = manager.abort("run failed: " + message, finalStatistics(ctx));
            publishFinalized(ctx, manifest);
            log.warn("Manifest aborted after failure: {}", message);
        } catch (RuntimeException abortFailure) {
            failure.addSuppressed(abortFailure);
        }
    }

    private static void publishFinalized(RunContext ctx, Manifest manifest) {
        var payload = new LinkedHashMap<String, Object>();
        payload.put("status", manifest.status().label());
        payload.put("images_requested", manifest.imagesRequested());
        payload.put("images_generated", manifest.imagesGenerated());
        manifest.abortReason().ifPresent(reason -> payload.put("reason", reason));
        ctx.events().publish(EventType.MANIFEST_FINALIZED, Phase.FINALIZATION.label(), payload);
    }

    private static Map<String, Object> finalStatistics(RunContext ctx) {
        var statistics = new LinkedHashMap<String, Object>(ctx.generation().statistics().toSerializableMap());
        ctx.outcome().ifPresent(outcome -> statistics.put("batch", outcome.toSerializableMap()));
        return statistics;
    }

    private static Map<String, Object> jobPayload(JobRecord job) {
        var payload = new LinkedHashMap<String, Object>();
        payload.put("index", job.index());
        payload.put("state", job.state().label());
        payload.put("filename", job.prompt().filename());
        job.error().ifPresent(error -> payload.put("error", error));
        return payload;
    }

    private RunReport report(RunContext ctx, boolean dryRun) {
        return new RunReport(
            ctx.runId(),
            dryRun,
            ctx.session(),
            ctx.generation().prompts(),
            ctx.generation().statistics(),
            ctx.outcome(),
            ctx.manifest().flatMap(ManifestManager::snapshot),
            ctx.events().events()
        );
    }

    private void phase(RunContext ctx, Phase phase, Supplier<Map<String, Object>> body) {
        if (!phase.ownsManifest() && ctx.cancellation().isCancelled()) {
            var cancelled = new RunCancelledException(phase.label());
            ctx.events().publish(EventType.PHASE_FAILED, phase.label(), failurePayload(phase, cancelled));
            throw cancelled;
        }
        ctx.events().publish(EventType.PHASE_STARTED, phase.label(), Map.of("number", phase.number()));
        log.info("Phase {}/8 {}", phase.number(), phase.label());
        long started = System.nanoTime();
        Map<String, Object> summary;
        try {
            summary = body.get();
        } catch (RuntimeException ex) {
            log.error("Phase {} failed: {}", phase.label(), ex.getMessage());
            ctx.events().publish(EventType.PHASE_FAILED, phase.label(), failurePayload(phase, ex));
            throw ex;
        }
        var payload = new LinkedHashMap<String, Object>();
        payload.put("number", phase.number());
        payload.put("elapsed_ms", (System.nanoTime() - started) / 1_000_000L);
        payload.putAll(summary);
        ctx.events().publish(EventType.PHASE_COMPLETED, phase.label(), payload);
    }

    private static Map<String, Object> failurePayload(Phase phase, RuntimeException ex) {
        var payload = new LinkedHashMap<String, Object>();
        payload.put("number", phase.number());
        payload.put("message", String.valueOf(ex.getMessage()));
        if (ex instanceof SdgenException sdgen) {
            payload.put("error_code", sdgen.code());
            payload.put("details", sdgen.details());
        }
        return payload;
    }
}
