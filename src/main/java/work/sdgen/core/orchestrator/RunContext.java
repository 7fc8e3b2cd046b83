package work.sdgen.core.orchestrator;

import java.util.Optional;
import java.util.Random;
import java.util.UUID;
import work.sdgen.core.batch.BatchOutcome;
import work.sdgen.core.events.EventLog;
import work.sdgen.core.manifest.ManifestManager;
import work.sdgen.core.prompt.GenerationResult;
import work.sdgen.core.prompt.ResolutionPlan;
import work.sdgen.core.session.SessionConfig;
import work.sdgen.core.shared.CancellationToken;
import work.sdgen.core.template.ChunkRegistry;
import work.sdgen.core.template.DocumentLocator;
import work.sdgen.core.template.TemplateChain;
import work.sdgen.core.variation.VariationLoader;

/**
 * State owned by a single run. Created when the run starts and handed from phase to phase; nothing in here
 * outlives the run or is shared with another one.
 */
final class RunContext {
    private final String runId = UUID.randomUUID().toString();
    private final RunRequest request;
    private final EventLog events;

    private DocumentLocator locator;
    private TemplateChain chain;
    private SessionConfig session;
    private Random random;
    private ChunkRegistry chunks;
    private VariationLoader variations;
    private ResolutionPlan plan;
    private GenerationResult generation;
    private ManifestManager manifest;
    private BatchOutcome outcome;

    RunContext(RunRequest request, EventLog events) {
        this.request = request;
        this.events = events;
    }

    String runId() {
        return runId;
    }

    RunRequest request() {
        return request;
    }

    EventLog events() {
        return events;
    }

    CancellationToken cancellation() {
        return request.cancellation();
    }

    void configured(DocumentLocator locator, TemplateChain chain, SessionConfig session) {
        this.locator = locator;
        this.chain = chain;
        this.session = session;
        this.random = session.samplingSeed().map(Random::new).orElseGet(Random::new);
        this.chunks = new ChunkRegistry(locator);
        this.variations = new VariationLoader();
    }

    DocumentLocator locator() {
        return locator;
    }

    TemplateChain chain() {
        return chain;
    }

    SessionConfig session() {
        return session;
    }

    Random random() {
        return random;
    }

    ChunkRegistry chunks() {
        return chunks;
    }

    VariationLoader variations() {
        return variations;
    }

    ResolutionPlan plan() {
        return plan;
    }

    void plan(ResolutionPlan plan) {
        this.plan = plan;
    }

    GenerationResult generation() {
        return generation;
    }

    void generation(GenerationResult generation) {
        this.generation = generation;
    }

    Optional<ManifestManager> manifest() {
        return Optional.ofNullable(manifest);
    }

    void manifest(ManifestManager manifest) {
        this.manifest = manifest;
    }

    Optional<BatchOutcome> outcome() {
        return Optional.ofNullable(outcome);
    }

    void outcome(BatchOutcome outcome) {
        this.outcome = outcome;
    }
}
