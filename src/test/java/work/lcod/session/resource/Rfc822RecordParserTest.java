package work.lcod.session.resource;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class Rfc822RecordParserTest {
    private final Rfc822RecordParser parser = new Rfc822RecordParser();

    @Test
    void splitsRecordsOnBlankLines() {
        var result = parser.parse("name: bluez\nversion: 5.50\n\nname: pulseaudio\nversion: 13\n");
        assertFalse(result.hasProblems());
        assertEquals(List.of(
            Map.of("name", "bluez", "version", "5.50"),
            Map.of("name", "pulseaudio", "version", "13")
        ), result.records());
    }

    @Test
    void joinsContinuationLines() {
        var result = parser.parse("description: first line\n second line\n .\n third line\n");
        assertEquals("first line\nsecond line\n\nthird line", result.records().get(0).get("description"));
    }

    @Test
    void emptyInputHasNoRecords() {
        assertTrue(parser.parse("").records().isEmpty());
        assertTrue(parser.parse("\n\n\n").records().isEmpty());
    }

    @Test
    void skipsMalformedRecordAndKeepsTheRest() {
        var result = parser.parse("name: a\ngarbage\nother: x\n\nname: b\n");
        assertEquals(List.of(Map.of("name", "b")), result.records());
        assertEquals(1, result.problems().size());
        assertTrue(result.problems().get(0).startsWith("line 2:"));
    }

    @Test
    void rejectsDuplicateKeys() {
        var result = parser.parse("name: a\nname: b\n");
        assertTrue(result.records().isEmpty());
        assertTrue(result.problems().get(0).contains("duplicate key 'name'"));
    }

    @Test
    void rejectsLeadingContinuation() {
        var result = parser.parse(" dangling\n");
        assertTrue(result.records().isEmpty());
        assertTrue(result.problems().get(0).contains("unexpected multi-line value"));
    }
}
