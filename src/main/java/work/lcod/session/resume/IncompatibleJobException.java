package work.lcod.session.resume;

/**
 * A job definition changed since the session was saved.
 */
public final class IncompatibleJobException extends SessionResumeException {
    private final String jobId;

    public IncompatibleJobException(String jobId) {
        super("Definition of job '" + jobId + "' has changed");
        this.jobId = jobId;
    }

    public String jobId() {
        return jobId;
    }
}
