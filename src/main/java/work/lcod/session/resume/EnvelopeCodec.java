package work.lcod.session.resume;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectWriter;
import com.fasterxml.jackson.databind.SerializationFeature;
import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import org.apache.commons.compress.compressors.gzip.GzipCompressorInputStream;
import org.apache.commons.compress.compressors.gzip.GzipCompressorOutputStream;

/**
 * Outer container of a persisted session: gzip-compressed UTF-8 JSON.
 */
public final class EnvelopeCodec {
    private static final ObjectMapper JSON = new ObjectMapper();
    private static final ObjectWriter WRITER = JSON.writer().with(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS);

    private EnvelopeCodec() {}

    /**
     * @throws CorruptedSessionException if the data is not gzip, not UTF-8 or not JSON
     */
    public static Object decode(byte[] data) {
        byte[] raw;
        try (GzipCompressorInputStream gzip = new GzipCompressorInputStream(new ByteArrayInputStream(data))) {
            raw = gzip.readAllBytes();
        } catch (IOException ex) {
            throw new CorruptedSessionException("Cannot decompress session data", ex);
        }
        String text;
        try {
            text = StandardCharsets.UTF_8.newDecoder()
                .onMalformedInput(CodingErrorAction.REPORT)
                .onUnmappableCharacter(CodingErrorAction.REPORT)
                .decode(ByteBuffer.wrap(raw))
                .toString();
        } catch (CharacterCodingException ex) {
            throw new CorruptedSessionException("Cannot decode session text", ex);
        }
        try {
            return JSON.readValue(text, Object.class);
        } catch (JsonProcessingException ex) {
            throw new CorruptedSessionException("Cannot interpret session JSON", ex);
        }
    }

    /**
     * Serializes {@code document} with sorted keys and compresses it.
     */
    public static byte[] encode(Object document) {
        var buffer = new ByteArrayOutputStream();
        try (GzipCompressorOutputStream gzip = new GzipCompressorOutputStream(buffer)) {
            gzip.write(WRITER.writeValueAsBytes(document));
        } catch (IOException ex) {
            throw new UncheckedIOException("Unable to encode session: " + ex.getMessage(), ex);
        }
        return buffer.toByteArray();
    }
}
