package work.sdgen.core.batch;

import work.sdgen.core.error.ConnectivityException;
import work.sdgen.core.error.SubmissionException;

/**
 * External image generation capability.
 */
public interface ImageBackend {
    /**
     * Checks the backend is reachable before any job is submitted.
     */
    void probe() throws ConnectivityException;

    JobHandle submit(GenerationRequest request) throws SubmissionException;

    /**
     * Refreshes a non-terminal handle. Synchronous backends never see this call.
     */
    default JobHandle poll(JobHandle handle) {
        return handle;
    }
}
