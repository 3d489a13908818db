package work.lcod.session.resume;

import java.nio.file.Path;

/**
 * A result refers to an IO log file that does not exist.
 */
public final class BrokenReferenceException extends SessionResumeException {
    private final Path path;

    public BrokenReferenceException(Path path) {
        super("Job log " + path + " does not exist");
        this.path = path;
    }

    public Path path() {
        return path;
    }
}
