package work.lcod.session.resume;

/**
 * The persisted session is malformed or inconsistent.
 */
public final class CorruptedSessionException extends SessionResumeException {
    public CorruptedSessionException(String message) {
        super(message);
    }

    public CorruptedSessionException(String message, Throwable cause) {
        super(message, cause);
    }
}
