package work.sdgen.core.events;

public enum EventType {
    RUN_STARTED,
    PHASE_STARTED,
    PHASE_COMPLETED,
    PHASE_FAILED,
    MANIFEST_CREATED,
    JOB_UPDATED,
    MANIFEST_FINALIZED,
    RUN_FINISHED
}
