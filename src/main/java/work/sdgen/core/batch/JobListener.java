package work.sdgen.core.batch;

/**
 * Receives every job record transition. Called from worker threads.
 */
@FunctionalInterface
public interface JobListener {
    void onUpdate(JobRecord record);
}
