package work.lcod.session.resume;

/**
 * The persisted session is well formed but uses a format version this engine cannot read.
 */
public final class IncompatibleSessionException extends SessionResumeException {
    public IncompatibleSessionException(String message) {
        super(message);
    }
}
