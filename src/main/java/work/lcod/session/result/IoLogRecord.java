package work.lcod.session.result;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.Objects;

/**
 * One chunk of job output: seconds since the previous chunk, the stream it came from and the raw bytes.
 */
public record IoLogRecord(double delay, String stream, byte[] data) {
    public static final String STDOUT = "stdout";
    public static final String STDERR = "stderr";

    public IoLogRecord {
        if (delay < 0) {
            throw new IllegalArgumentException("IO log delay cannot be negative: " + delay);
        }
        if (!STDOUT.equals(stream) && !STDERR.equals(stream)) {
            throw new IllegalArgumentException("Unsupported IO log stream: " + stream);
        }
        data = data == null ? new byte[0] : data.clone();
    }

    public static IoLogRecord stdout(String text) {
        return new IoLogRecord(0, STDOUT, text.getBytes(StandardCharsets.UTF_8));
    }

    public static IoLogRecord stderr(String text) {
        return new IoLogRecord(0, STDERR, text.getBytes(StandardCharsets.UTF_8));
    }

    @Override
    public byte[] data() {
        return data.clone();
    }

    @Override
    public boolean equals(Object other) {
        return other instanceof IoLogRecord record
            && Double.compare(record.delay, delay) == 0
            && record.stream.equals(stream)
            && Arrays.equals(record.data, data);
    }

    @Override
    public int hashCode() {
        return Objects.hash(delay, stream) * 31 + Arrays.hashCode(data);
    }

    @Override
    public String toString() {
        return "IoLogRecord[delay=" + delay + ", stream=" + stream + ", bytes=" + data.length + "]";
    }
}
