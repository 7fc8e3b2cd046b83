package work.sdgen.core.batch;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Aggregate result of the batch driver.
 */
public record BatchOutcome(
    List<JobRecord> jobs,
    int succeeded,
    int failed,
    int pending,
    boolean cancelled,
    Optional<String> fatalError
) {
    public BatchOutcome {
        jobs = List.copyOf(jobs);
    }

    public static BatchOutcome of(List<JobRecord> jobs, boolean cancelled, Optional<String> fatalError) {
        int succeeded = 0;
        int failed = 0;
        int pending = 0;
        for (JobRecord job : jobs) {
            switch (job.state()) {
                case SUCCEEDED -> succeeded++;
                case FAILED -> failed++;
                default -> pending++;
            }
        }
        return new BatchOutcome(jobs, succeeded, failed, pending, cancelled, fatalError);
    }

    public boolean fatal() {
        return fatalError.isPresent();
    }

    public boolean allTerminal() {
        return pending == 0;
    }

    public Map<String, Object> toSerializableMap() {
        var map = new LinkedHashMap<String, Object>();
        map.put("total", jobs.size());
        map.put("succeeded", succeeded);
        map.put("failed", failed);
        map.put("pending", pending);
        map.put("cancelled", cancelled);
        fatalError.ifPresent(error -> map.put("fatal_error", error));
        return map;
    }
}
