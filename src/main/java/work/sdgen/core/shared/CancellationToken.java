package work.sdgen.core.shared;

import java.util.Optional;

/**
 * Cooperative cancellation flag shared between the caller and a running generation.
 */
public final class CancellationToken {
    private volatile boolean cancelled;
    private volatile String reason;

    public void cancel() {
        cancel("cancelled");
    }

    public void cancel(String why) {
        if (!cancelled) {
            reason = why;
            cancelled = true;
        }
    }

    public boolean isCancelled() {
        return cancelled;
    }

    public Optional<String> reason() {
        return Optional.ofNullable(reason);
    }
}
