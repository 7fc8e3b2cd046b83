package work.sdgen.core.orchestrator;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;
import java.util.stream.Stream;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import work.sdgen.core.batch.FileImageSink;
import work.sdgen.core.batch.GenerationRequest;
import work.sdgen.core.batch.JobState;
import work.sdgen.core.error.ConnectivityException;
import work.sdgen.core.error.RunCancelledException;
import work.sdgen.core.error.TemplateValidationException;
import work.sdgen.core.events.EventLog;
import work.sdgen.core.events.EventType;
import work.sdgen.core.events.RunEvent;
import work.sdgen.core.manifest.JsonManifestStore;
import work.sdgen.core.manifest.ManifestStatus;
import work.sdgen.core.manifest.ManifestStore;
import work.sdgen.core.session.ConfigOverrides;
import work.sdgen.core.shared.CancellationToken;
import work.sdgen.core.support.FakeBackend;
import work.sdgen.core.support.SdgenTestSupport;

class GenerationOrchestratorTest {
    private static final Clock CLOCK = Clock.fixed(Instant.parse("2026-03-01T10:00:00Z"), ZoneOffset.UTC);

    @TempDir
    Path output;

    @TempDir
    Path home;

    private GenerationOrchestrator orchestrator(FakeBackend backend) {
        return new GenerationOrchestrator(session -> backend, session -> new FileImageSink(session.sessionDirectory()), CLOCK);
    }

    private RunRequest request(Path template, ConfigOverrides.Builder overrides, CancellationToken token) {
        return new RunRequest(template, overrides.outputDir(output).build(), Optional.empty(), token, home);
    }

    private RunRequest portrait(ConfigOverrides.Builder overrides) {
        return request(SdgenTestSupport.portraitTemplate(), overrides, new CancellationToken());
    }

    private static List<String> phasesStarted(List<RunEvent> events) {
        return events.stream()
            .filter(event -> event.type() == EventType.PHASE_STARTED)
            .map(event -> event.phase().orElseThrow())
            .toList();
    }

    @Test
    void completedRunWritesImagesAndManifest() throws IOException {
        var backend = new FakeBackend();

        var report = orchestrator(backend).orchestrate(portrait(ConfigOverrides.builder()));

        assertEquals(Optional.of(ManifestStatus.COMPLETED), report.status());
        assertEquals(8, report.prompts().size());
        assertEquals(1, backend.probes());
        assertEquals(List.of(1000L, 1001L, 1002L, 1003L, 1004L, 1005L, 1006L, 1007L),
            backend.requests().stream().map(GenerationRequest::seed).toList());
        assertEquals(20, backend.requests().get(0).parameters().get("steps"));

        Path session = report.session().sessionDirectory();
        assertTrue(Files.isRegularFile(session.resolve("003_Expression-Smiling.png")));
        var manifest = JsonManifestStore.read(report.manifestPath().orElseThrow());
        assertEquals("completed", manifest.get("status"));
        assertEquals(8, manifest.get("images_generated"));
        assertTrue(report.manifest().orElseThrow().jobs().stream().allMatch(job -> job.status() == JobState.SUCCEEDED));
    }

    @Test
    void eventsFollowThePhaseOrder() {
        var events = new EventLog(CLOCK);

        var report = orchestrator(new FakeBackend()).orchestrate(portrait(ConfigOverrides.builder().maxImages(2)), events);

        assertEquals(List.of("configuration", "validation", "api_connection", "loading_resolution",
            "prompt_generation", "manifest_preparation", "image_generation", "finalization"), phasesStarted(report.events()));
        assertEquals(EventType.RUN_STARTED, report.events().get(0).type());
        assertEquals(EventType.RUN_FINISHED, report.events().get(report.events().size() - 1).type());
        assertEquals(4, report.events().stream().filter(event -> event.type() == EventType.JOB_UPDATED).count());
        assertEquals(1, report.events().stream().filter(event -> event.type() == EventType.MANIFEST_FINALIZED).count());
        assertEquals(events.events(), report.events());
    }

    @Test
    void fatalJobErrorAbortsTheManifest() throws IOException {
        var backend = new FakeBackend().fatal(2);

        var report = orchestrator(backend).orchestrate(portrait(ConfigOverrides.builder()));

        assertEquals(Optional.of(ManifestStatus.ABORTED), report.status());
        assertEquals("fatal job error: Backend answered HTTP 401", report.manifest().orElseThrow().abortReason().orElseThrow());
        assertEquals(3, backend.requests().size());
        assertEquals("aborted", JsonManifestStore.read(report.manifestPath().orElseThrow()).get("status"));
        assertEquals(JobState.PENDING, report.manifest().orElseThrow().jobs().get(7).status());
    }

    @Test
    void partialFailuresStillComplete() {
        var report = orchestrator(new FakeBackend().failing(0, 5)).orchestrate(portrait(ConfigOverrides.builder()));

        assertEquals(Optional.of(ManifestStatus.COMPLETED), report.status());
        assertEquals(6, report.manifest().orElseThrow().imagesGenerated());
    }

    @Test
    void failureDuringGenerationLeavesAnAbortedManifest() throws IOException {
        var manifestPath = new AtomicReference<Path>();
        var events = new EventLog(CLOCK);
        var orchestrator = new GenerationOrchestrator(
            session -> new FakeBackend(),
            session -> new FileImageSink(session.sessionDirectory()),
            path -> {
                manifestPath.set(path);
                var json = new JsonManifestStore(path);
                return (ManifestStore) manifest -> {
                    if (manifest.status() == ManifestStatus.ONGOING && manifest.imagesGenerated() > 0) {
                        throw new IOException("disk full");
                    }
                    json.save(manifest);
                };
            },
            CLOCK
        );

        var ex = assertThrows(UncheckedIOException.class,
            () -> orchestrator.orchestrate(portrait(ConfigOverrides.builder().maxImages(3)), events));

        assertEquals("Unable to persist manifest: disk full", ex.getMessage());
        var failed = events.events().stream().filter(event -> event.type() == EventType.PHASE_FAILED).toList();
        assertEquals(1, failed.size());
        assertEquals(Optional.of("image_generation"), failed.get(0).phase());
        var manifest = JsonManifestStore.read(manifestPath.get());
        assertEquals("aborted", manifest.get("status"));
        assertEquals("run failed: Unable to persist manifest: disk full", manifest.get("abort_reason"));
        assertTrue(events.events().stream().anyMatch(event -> event.type() == EventType.MANIFEST_FINALIZED));
    }

    @Test
    void cancellationDuringGenerationAbortsWithReason() {
        var token = new CancellationToken();
        var backend = new FakeBackend().onSubmit(request -> {
            if (request.index() == 2) {
                token.cancel("stop requested");
            }
        });

        var report = orchestrator(backend).orchestrate(
            request(SdgenTestSupport.portraitTemplate(), ConfigOverrides.builder(), token));

        assertEquals(Optional.of(ManifestStatus.ABORTED), report.status());
        assertEquals("cancelled: stop requested", report.manifest().orElseThrow().abortReason().orElseThrow());
        assertEquals(3, report.manifest().orElseThrow().imagesGenerated());
    }

    @Test
    void cancellationBeforeTheManifestRaises() {
        var token = new CancellationToken();
        token.cancel();
        var events = new EventLog(CLOCK);

        assertThrows(RunCancelledException.class, () -> orchestrator(new FakeBackend()).orchestrate(
            request(SdgenTestSupport.portraitTemplate(), ConfigOverrides.builder(), token), events));

        assertEquals(EventType.PHASE_FAILED, events.events().get(events.events().size() - 1).type());
        assertTrue(isEmpty(output));
    }

    @Test
    void unreachableBackendFailsBeforeAnyManifest() {
        var events = new EventLog(CLOCK);

        var ex = assertThrows(ConnectivityException.class,
            () -> orchestrator(new FakeBackend().unreachable()).orchestrate(portrait(ConfigOverrides.builder()), events));

        assertEquals("connectivity.unreachable", ex.code());
        var failed = events.events().get(events.events().size() - 1);
        assertEquals(EventType.PHASE_FAILED, failed.type());
        assertEquals(Optional.of("api_connection"), failed.phase());
        assertTrue(isEmpty(output));
    }

    @Test
    void invalidTemplateFailsValidation(@TempDir Path workspace) {
        Path template = SdgenTestSupport.write(workspace, "broken.prompt.yaml", "template: 'a cat'", "colour: red");

        var ex = assertThrows(TemplateValidationException.class,
            () -> orchestrator(new FakeBackend()).orchestrate(request(template, ConfigOverrides.builder(), new CancellationToken())));

        assertEquals(2, ex.violations().size());
        assertTrue(isEmpty(output));
    }

    @Test
    void dryRunPlansWithoutTouchingTheBackend() {
        var backend = new FakeBackend().unreachable();

        var report = orchestrator(backend).orchestrate(portrait(ConfigOverrides.builder().dryRun(true)));

        assertTrue(report.dryRun());
        assertEquals(0, backend.probes());
        assertTrue(report.manifest().isEmpty());
        assertEquals(8, report.prompts().size());
        assertFalse(phasesStarted(report.events()).contains("api_connection"));
        assertTrue(report.toSerializableMap().containsKey("prompts"));
        assertTrue(isEmpty(output));
    }

    private static boolean isEmpty(Path dir) {
        try (Stream<Path> entries = Files.list(dir)) {
            return entries.findAny().isEmpty();
        } catch (IOException ex) {
            throw new IllegalStateException(ex);
        }
    }
}
