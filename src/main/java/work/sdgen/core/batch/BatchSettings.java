package work.sdgen.core.batch;

import java.time.Duration;
import java.util.Objects;

/**
 * Concurrency bound and polling limits of the batch driver.
 */
public record BatchSettings(int workers, Duration pollInterval, Duration pollTimeout) {
    public BatchSettings {
        Objects.requireNonNull(pollInterval, "pollInterval");
        Objects.requireNonNull(pollTimeout, "pollTimeout");
        if (workers < 1) {
            throw new IllegalArgumentException("workers must be at least 1");
        }
    }
}
