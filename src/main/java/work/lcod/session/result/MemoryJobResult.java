package work.lcod.session.result;

import java.util.List;

/**
 * Result whose IO log is kept in memory (and embedded in persisted sessions).
 */
public record MemoryJobResult(
    Outcome outcome,
    String comments,
    Integer returnCode,
    Double executionDuration,
    List<IoLogRecord> ioLog
) implements JobResult {
    private static final MemoryJobResult HOLLOW = new MemoryJobResult(Outcome.NONE, null, null, null, List.of());

    public MemoryJobResult {
        outcome = outcome == null ? Outcome.NONE : outcome;
        ioLog = ioLog == null ? List.of() : List.copyOf(ioLog);
    }

    public static MemoryJobResult hollow() {
        return HOLLOW;
    }

    public static MemoryJobResult of(Outcome outcome) {
        return new MemoryJobResult(outcome, null, null, null, List.of());
    }

    /**
     * Result whose only output is {@code stdout} on the standard output stream.
     */
    public static MemoryJobResult withStdout(Outcome outcome, String stdout) {
        return new MemoryJobResult(outcome, null, 0, null, List.of(IoLogRecord.stdout(stdout)));
    }

    @Override
    public boolean hasIoLog() {
        return !ioLog.isEmpty();
    }
}
