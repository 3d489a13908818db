package work.lcod.session.resume;

import java.nio.file.Path;

/**
 * IO log paths may be relative to the session location, or {@code null} for a result without a log.
 */
public final class SessionDecoderV5 extends DelegatingSessionDecoder {
    public SessionDecoderV5(SessionDecoder previous) {
        super(previous);
    }

    @Override
    public int version() {
        return 5;
    }

    @Override
    public Path ioLogPath(Object filenameRepr, ResumeContext context) {
        if (filenameRepr == null) {
            return null;
        }
        if (filenameRepr instanceof String filename && !Path.of(filename).isAbsolute()) {
            var location = context.options().location();
            if (location == null) {
                throw new CorruptedSessionException("Relative 'io_log_filename' " + filename
                    + " cannot be resolved without a session location");
            }
            return location.resolve(filename).normalize();
        }
        return super.ioLogPath(filenameRepr, context);
    }
}
