package work.sdgen.core.error;

/**
 * Raised when a run is cancelled before any manifest exists.
 */
public final class RunCancelledException extends SdgenException {
    public RunCancelledException(String phase) {
        super("run.cancelled", "Run cancelled during " + phase, detailsOf("phase", phase));
    }
}
