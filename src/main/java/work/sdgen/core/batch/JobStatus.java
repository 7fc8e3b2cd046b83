package work.sdgen.core.batch;

/**
 * Status reported by the backend for a submitted job.
 */
public enum JobStatus {
    PENDING,
    SUCCEEDED,
    FAILED;

    public boolean isTerminal() {
        return this != PENDING;
    }
}
