package work.lcod.session.resume;

/**
 * Base class of everything that can go wrong while resuming a dormant session.
 */
public class SessionResumeException extends RuntimeException {
    public SessionResumeException(String message) {
        super(message);
    }

    public SessionResumeException(String message, Throwable cause) {
        super(message, cause);
    }
}
