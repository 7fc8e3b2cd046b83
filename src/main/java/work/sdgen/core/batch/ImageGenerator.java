package work.sdgen.core.batch;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Semaphore;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;
import java.util.concurrent.atomic.AtomicReferenceArray;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import work.sdgen.core.error.SubmissionException;
import work.sdgen.core.prompt.ResolvedPrompt;
import work.sdgen.core.shared.CancellationToken;
import work.sdgen.core.shared.DurationParser;

/**
 * Batch driver: submits prompts in generation order with at most {@code workers} jobs in flight.
 * Job failures are recorded and the batch continues, unless the failure is fatal. Cancellation and fatal
 * failures are observed between dispatches; in-flight jobs finish on their own. A listener that throws stops
 * dispatching and its exception is rethrown once the in-flight jobs are done.
 */
public final class ImageGenerator {
    private static final Logger log = LoggerFactory.getLogger(ImageGenerator.class);

    private final ImageBackend backend;
    private final ImageSink sink;
    private final BatchSettings settings;
    private final CancellationToken cancellation;

    public ImageGenerator(ImageBackend backend, ImageSink sink, BatchSettings settings, CancellationToken cancellation) {
        this.backend = backend;
        this.sink = sink;
        this.settings = settings;
        this.cancellation = cancellation;
    }

    public BatchOutcome run(List<ResolvedPrompt> prompts, Map<String, Object> parameters, JobListener listener) {
        var records = new AtomicReferenceArray<JobRecord>(prompts.size());
        for (int i = 0; i < prompts.size(); i++) {
            records.set(i, JobRecord.pending(prompts.get(i)));
        }
        var fatalError = new AtomicReference<String>();
        var listenerFailure = new AtomicReference<RuntimeException>();
        var permits = new Semaphore(settings.workers());
        var futures = new ArrayList<CompletableFuture<Void>>();
        ExecutorService executor = Executors.newFixedThreadPool(settings.workers(), workerThreads());
        try {
            for (ResolvedPrompt prompt : prompts) {
                if (stopRequested(fatalError, listenerFailure)) {
                    break;
                }
                try {
                    permits.acquire();
                } catch (InterruptedException ex) {
                    Thread.currentThread().interrupt();
                    cancellation.cancel("interrupted");
                    break;
                }
                if (stopRequested(fatalError, listenerFailure)) {
                    permits.release();
                    break;
                }
                futures.add(CompletableFuture.runAsync(() -> {
                    try {
                        process(prompt, parameters, records, listener, fatalError);
                    } catch (RuntimeException ex) {
                        listenerFailure.compareAndSet(null, ex);
                    } finally {
                        permits.release();
                    }
                }, executor));
            }
            CompletableFuture.allOf(futures.toArray(new CompletableFuture<?>[0])).join();
        } finally {
            executor.shutdown();
        }
        if (listenerFailure.get() != null) {
            throw listenerFailure.get();
        }
        var jobs = new ArrayList<JobRecord>(prompts.size());
        for (int i = 0; i < prompts.size(); i++) {
            jobs.add(records.get(i));
        }
        var outcome = BatchOutcome.of(jobs, cancellation.isCancelled(), Optional.ofNullable(fatalError.get()));
        log.info("Batch finished: {} succeeded, {} failed, {} pending{}",
            outcome.succeeded(), outcome.failed(), outcome.pending(), outcome.cancelled() ? " (cancelled)" : "");
        return outcome;
    }

    private boolean stopRequested(AtomicReference<String> fatalError, AtomicReference<RuntimeException> listenerFailure) {
        if (cancellation.isCancelled()) {
            log.info("Cancellation requested; no further jobs will be dispatched");
            return true;
        }
        return fatalError.get() != null || listenerFailure.get() != null;
    }

    private void process(
        ResolvedPrompt prompt,
        Map<String, Object> parameters,
        AtomicReferenceArray<JobRecord> records,
        JobListener listener,
        AtomicReference<String> fatalError
    ) {
        int index = prompt.index();
        JobHandle handle;
        try {
            handle = backend.submit(GenerationRequest.of(prompt, parameters));
        } catch (SubmissionException ex) {
            fail(records, index, ex.getMessage(), ex.fatal(), listener, fatalError);
            return;
        } catch (RuntimeException ex) {
            fail(records, index, "Unexpected backend error: " + ex.getMessage(), false, listener, fatalError);
            return;
        }
        update(records, records.get(index).submitted(handle.id()), listener);
        try {
            handle = awaitTerminal(handle);
        } catch (SubmissionException ex) {
            fail(records, index, ex.getMessage(), ex.fatal(), listener, fatalError);
            return;
        } catch (RuntimeException ex) {
            fail(records, index, "Unexpected backend error: " + ex.getMessage(), false, listener, fatalError);
            return;
        }
        if (handle.status() != JobStatus.SUCCEEDED) {
            fail(records, index, handle.error().orElse("Backend reported a failure"), false, listener, fatalError);
            return;
        }
        try {
            sink.store(prompt.filename(), handle.result());
        } catch (IOException | RuntimeException ex) {
            fail(records, index, "Unable to store image: " + ex.getMessage(), false, listener, fatalError);
            return;
        }
        update(records, records.get(index).succeeded(handle.reportedSeed()), listener);
        log.debug("Job {} succeeded ({})", index, prompt.filename());
    }

    private JobHandle awaitTerminal(JobHandle handle) {
        long deadline = System.nanoTime() + settings.pollTimeout().toNanos();
        JobHandle current = handle;
        while (!current.status().isTerminal()) {
            if (System.nanoTime() - deadline > 0) {
                return JobHandle.failed(current.id(), "Timed out after " + DurationParser.format(settings.pollTimeout()));
            }
            try {
                Thread.sleep(Math.max(1L, settings.pollInterval().toMillis()));
            } catch (InterruptedException ex) {
                Thread.currentThread().interrupt();
                return JobHandle.failed(current.id(), "Interrupted while waiting for the backend");
            }
            current = backend.poll(current);
        }
        return current;
    }

    private void fail(
        AtomicReferenceArray<JobRecord> records,
        int index,
        String message,
        boolean fatal,
        JobListener listener,
        AtomicReference<String> fatalError
    ) {
        log.warn("Job {} failed{}: {}", index, fatal ? " (fatal)" : "", message);
        if (fatal) {
            fatalError.compareAndSet(null, message);
        }
        update(records, records.get(index).failed(message, fatal), listener);
    }

    private static void update(AtomicReferenceArray<JobRecord> records, JobRecord record, JobListener listener) {
        records.set(record.index(), record);
        listener.onUpdate(record);
    }

    private static ThreadFactory workerThreads() {
        var counter = new AtomicInteger();
        return runnable -> {
            var thread = new Thread(runnable, "sdgen-worker-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }
}
