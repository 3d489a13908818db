package work.lcod.session.result;

import java.io.ByteArrayOutputStream;
import java.nio.charset.StandardCharsets;
import java.util.List;

/**
 * Immutable result of running a job. Optional fields are {@code null} when unknown.
 */
public interface JobResult {
    Outcome outcome();

    String comments();

    Integer returnCode();

    Double executionDuration();

    /**
     * Output records of the run. Disk-backed results read their log file on every call.
     */
    List<IoLogRecord> ioLog();

    boolean hasIoLog();

    /**
     * A hollow result carries no information at all; it is what every job starts with.
     */
    default boolean isHollow() {
        return outcome() == Outcome.NONE
            && comments() == null
            && returnCode() == null
            && executionDuration() == null
            && !hasIoLog();
    }

    /**
     * Concatenated standard output of the run, decoded as UTF-8.
     */
    default String stdout() {
        var buffer = new ByteArrayOutputStream();
        for (var record : ioLog()) {
            if (IoLogRecord.STDOUT.equals(record.stream())) {
                buffer.writeBytes(record.data());
            }
        }
        return buffer.toString(StandardCharsets.UTF_8);
    }
}
