package work.sdgen.core.batch;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Base64;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.IntStream;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import work.sdgen.core.prompt.ResolvedPrompt;
import work.sdgen.core.shared.CancellationToken;
import work.sdgen.core.support.FakeBackend;

class ImageGeneratorTest {
    private static final BatchSettings ONE_WORKER = new BatchSettings(1, Duration.ofMillis(5), Duration.ofSeconds(5));

    @TempDir
    Path session;

    private static List<ResolvedPrompt> prompts(int count) {
        return IntStream.range(0, count)
            .mapToObj(i -> new ResolvedPrompt(i, "a cat #" + i, "blurry", 100L + i, Map.of("Mood", "m" + i),
                Map.of("Mood", "mood " + i), String.format("%03d.png", i + 1)))
            .toList();
    }

    private BatchOutcome run(FakeBackend backend, BatchSettings settings, CancellationToken token, List<JobRecord> updates) {
        var generator = new ImageGenerator(backend, new FileImageSink(session), settings, token);
        return generator.run(prompts(5), Map.of("steps", 20), updates::add);
    }

    @Test
    void storesEveryImageAndReportsBackendSeeds() throws IOException {
        var backend = new FakeBackend();
        var updates = Collections.synchronizedList(new ArrayList<JobRecord>());

        var outcome = run(backend, ONE_WORKER, new CancellationToken(), updates);

        assertEquals(5, outcome.succeeded());
        assertTrue(outcome.allTerminal());
        assertEquals(10, updates.size());
        assertEquals(Optional.of(107L), outcome.jobs().get(0).backendSeed());
        assertEquals(List.of(0, 1, 2, 3, 4), backend.requests().stream().map(GenerationRequest::index).toList());
        assertEquals(20, backend.requests().get(0).parameters().get("steps"));
        assertArrayEquals(Base64.getDecoder().decode(FakeBackend.PNG_BASE64), Files.readAllBytes(session.resolve("003.png")));
    }

    @Test
    void ordinaryFailuresDoNotStopTheBatch() {
        var backend = new FakeBackend().failing(1, 3);

        var outcome = run(backend, ONE_WORKER, new CancellationToken(), new ArrayList<>());

        assertEquals(3, outcome.succeeded());
        assertEquals(2, outcome.failed());
        assertFalse(outcome.fatal());
        assertEquals("Backend answered HTTP 500", outcome.jobs().get(1).error().orElseThrow());
        assertFalse(Files.exists(session.resolve("002.png")));
    }

    @Test
    void fatalFailureStopsDispatching() {
        var backend = new FakeBackend().fatal(1);

        var outcome = run(backend, ONE_WORKER, new CancellationToken(), new ArrayList<>());

        assertTrue(outcome.fatal());
        assertEquals(1, outcome.succeeded());
        assertEquals(1, outcome.failed());
        assertEquals(3, outcome.pending());
        assertTrue(outcome.jobs().get(1).fatal());
        assertEquals(2, backend.requests().size());
    }

    @Test
    void cancellationLeavesUndispatchedJobsPending() {
        var token = new CancellationToken();
        var backend = new FakeBackend().onSubmit(request -> {
            if (request.index() == 1) {
                token.cancel("user interrupt");
            }
        });

        var outcome = run(backend, ONE_WORKER, token, new ArrayList<>());

        assertTrue(outcome.cancelled());
        assertEquals(2, outcome.succeeded());
        assertEquals(3, outcome.pending());
        assertEquals(JobState.PENDING, outcome.jobs().get(4).state());
    }

    @Test
    void asynchronousJobsArePolledToCompletion() {
        var backend = new FakeBackend().asynchronous();
        var updates = Collections.synchronizedList(new ArrayList<JobRecord>());

        var outcome = run(backend, new BatchSettings(3, Duration.ofMillis(1), Duration.ofSeconds(5)),
            new CancellationToken(), updates);

        assertEquals(5, outcome.succeeded());
        assertEquals(5, backend.polls());
        assertTrue(updates.stream().anyMatch(record -> record.state() == JobState.SUBMITTED));
        assertTrue(outcome.jobs().stream().allMatch(job -> job.backendSeed().isEmpty()));
    }

    @Test
    void pollingErrorsFailOnlyTheirJob() {
        var backend = new FakeBackend().brokenPoll(1);

        var outcome = run(backend, ONE_WORKER, new CancellationToken(), new ArrayList<>());

        assertEquals(4, outcome.succeeded());
        assertEquals(1, outcome.failed());
        assertFalse(outcome.fatal());
        assertTrue(outcome.allTerminal());
        assertEquals("Unexpected backend error: connection reset", outcome.jobs().get(1).error().orElseThrow());
        assertEquals(5, backend.requests().size());
    }

    @Test
    void sinkErrorsFailOnlyTheirJob() {
        ImageSink sink = (filename, result) -> {
            if (filename.equals("002.png")) {
                throw new IllegalArgumentException("no images in result");
            }
        };
        var generator = new ImageGenerator(new FakeBackend(), sink, ONE_WORKER, new CancellationToken());

        var outcome = generator.run(prompts(3), Map.of(), record -> {});

        assertEquals(2, outcome.succeeded());
        assertEquals("Unable to store image: no images in result", outcome.jobs().get(1).error().orElseThrow());
    }

    @Test
    void listenerErrorStopsDispatchingAndPropagates() {
        var backend = new FakeBackend();
        var failure = new IllegalStateException("manifest write failed");
        var generator = new ImageGenerator(backend, ImageSink.discard(), ONE_WORKER, new CancellationToken());

        var thrown = assertThrows(IllegalStateException.class, () -> generator.run(prompts(5), Map.of(), record -> {
            if (record.index() == 1 && record.state() == JobState.SUCCEEDED) {
                throw failure;
            }
        }));

        assertSame(failure, thrown);
        assertEquals(2, backend.requests().size());
    }

    @Test
    void extraImagesGetASuffix() {
        assertEquals("001_1.png", FileImageSink.suffixed("001.png", 1));
        assertEquals("raw_2", FileImageSink.suffixed("raw", 2));
    }
}
