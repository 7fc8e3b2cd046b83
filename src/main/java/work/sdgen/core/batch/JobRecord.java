package work.sdgen.core.batch;

import java.util.Objects;
import java.util.Optional;
import work.sdgen.core.prompt.ResolvedPrompt;

/**
 * Per-prompt submission record. Transitions return new instances; terminal records never change.
 */
public record JobRecord(
    ResolvedPrompt prompt,
    JobState state,
    Optional<String> handleId,
    Optional<String> error,
    boolean fatal,
    Optional<Long> backendSeed
) {
    public JobRecord {
        Objects.requireNonNull(prompt, "prompt");
        Objects.requireNonNull(state, "state");
        Objects.requireNonNull(handleId, "handleId");
        Objects.requireNonNull(error, "error");
        Objects.requireNonNull(backendSeed, "backendSeed");
    }

    public static JobRecord pending(ResolvedPrompt prompt) {
        return new JobRecord(prompt, JobState.PENDING, Optional.empty(), Optional.empty(), false, Optional.empty());
    }

    public int index() {
        return prompt.index();
    }

    public JobRecord submitted(String handleId) {
        requireState(JobState.PENDING);
        return new JobRecord(prompt, JobState.SUBMITTED, Optional.of(handleId), error, false, backendSeed);
    }

    public JobRecord succeeded(Optional<Long> reportedSeed) {
        requireState(JobState.SUBMITTED);
        return new JobRecord(prompt, JobState.SUCCEEDED, handleId, Optional.empty(), false, reportedSeed);
    }

    public JobRecord failed(String message, boolean fatalError) {
        if (state.isTerminal()) {
            throw new IllegalStateException("Job " + index() + " is already " + state.label());
        }
        return new JobRecord(prompt, JobState.FAILED, handleId, Optional.of(message), fatalError, backendSeed);
    }

    private void requireState(JobState expected) {
        if (state != expected) {
            throw new IllegalStateException("Job " + index() + " is " + state.label() + ", expected " + expected.label());
        }
    }
}
