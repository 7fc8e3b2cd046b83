package work.sdgen.core.batch;

import java.util.Locale;

/**
 * Submission state of one job record.
 */
public enum JobState {
    PENDING,
    SUBMITTED,
    SUCCEEDED,
    FAILED;

    public boolean isTerminal() {
        return this == SUCCEEDED || this == FAILED;
    }

    public String label() {
        return name().toLowerCase(Locale.ROOT);
    }
}
