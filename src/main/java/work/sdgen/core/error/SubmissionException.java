package work.sdgen.core.error;

/**
 * A single job was rejected by the backend. Recorded on the job; only aborts the batch when fatal.
 */
public final class SubmissionException extends SdgenException {
    private final boolean fatal;

    public SubmissionException(String message, boolean fatal) {
        this(message, fatal, null, null);
    }

    public SubmissionException(String message, boolean fatal, Integer httpStatus, Throwable cause) {
        super(
            fatal ? "submission.fatal" : "submission.failed",
            message,
            detailsOf("fatal", fatal, "http_status", httpStatus),
            cause
        );
        this.fatal = fatal;
    }

    public boolean fatal() {
        return fatal;
    }
}
