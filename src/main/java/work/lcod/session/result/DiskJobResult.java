package work.lcod.session.result;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Objects;

/**
 * Result whose IO log lives in an external file written by the execution engine.
 */
public record DiskJobResult(
    Outcome outcome,
    String comments,
    Integer returnCode,
    Double executionDuration,
    Path ioLogPath
) implements JobResult {
    public DiskJobResult {
        outcome = outcome == null ? Outcome.NONE : outcome;
        Objects.requireNonNull(ioLogPath, "ioLogPath");
    }

    /**
     * @throws java.io.UncheckedIOException when the log file cannot be read
     */
    @Override
    public List<IoLogRecord> ioLog() {
        return IoLogFiles.read(ioLogPath);
    }

    @Override
    public boolean hasIoLog() {
        return Files.exists(ioLogPath);
    }
}
