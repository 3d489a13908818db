package work.lcod.session.result;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.OutputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Base64;
import java.util.List;
import org.apache.commons.compress.compressors.gzip.GzipCompressorInputStream;
import org.apache.commons.compress.compressors.gzip.GzipCompressorOutputStream;

/**
 * Reads and writes disk IO logs: gzip-compressed JSON lines of {@code [delay, stream, base64-data]}.
 */
public final class IoLogFiles {
    private static final ObjectMapper JSON = new ObjectMapper();

    private IoLogFiles() {}

    public static List<IoLogRecord> read(Path path) {
        var records = new ArrayList<IoLogRecord>();
        try (
            InputStream raw = Files.newInputStream(path);
            GzipCompressorInputStream gzip = new GzipCompressorInputStream(raw);
            BufferedReader reader = new BufferedReader(new InputStreamReader(gzip, StandardCharsets.UTF_8))
        ) {
            String line;
            int lineNo = 0;
            while ((line = reader.readLine()) != null) {
                lineNo++;
                if (line.isBlank()) {
                    continue;
                }
                records.add(parseLine(path, lineNo, line));
            }
        } catch (IOException ex) {
            throw new UncheckedIOException("Unable to read IO log " + path + ": " + ex.getMessage(), ex);
        }
        return records;
    }

    public static void write(Path path, List<IoLogRecord> records) {
        try {
            if (path.getParent() != null) {
                Files.createDirectories(path.getParent());
            }
            try (
                OutputStream raw = Files.newOutputStream(path);
                GzipCompressorOutputStream gzip = new GzipCompressorOutputStream(raw)
            ) {
                for (var record : records) {
                    var line = List.of(record.delay(), record.stream(), Base64.getEncoder().encodeToString(record.data()));
                    gzip.write(JSON.writeValueAsBytes(line));
                    gzip.write('\n');
                }
            }
        } catch (IOException ex) {
            throw new UncheckedIOException("Unable to write IO log " + path + ": " + ex.getMessage(), ex);
        }
    }

    private static IoLogRecord parseLine(Path path, int lineNo, String line) throws IOException {
        JsonNode node;
        try {
            node = JSON.readTree(line);
        } catch (JsonProcessingException ex) {
            throw new IOException("line " + lineNo + " of " + path + " is not JSON", ex);
        }
        if (node == null || !node.isArray() || node.size() != 3
            || !node.get(0).isNumber() || !node.get(1).isTextual() || !node.get(2).isTextual()) {
            throw new IOException("line " + lineNo + " of " + path + " is not a [delay, stream, data] triple");
        }
        try {
            byte[] data = Base64.getDecoder().decode(node.get(2).asText());
            return new IoLogRecord(node.get(0).asDouble(), node.get(1).asText(), data);
        } catch (IllegalArgumentException ex) {
            throw new IOException("line " + lineNo + " of " + path + ": " + ex.getMessage(), ex);
        }
    }
}
