package work.lcod.session.resource;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Parses RFC822-like records: {@code key: value} lines, blank-line separated, with continuation
 * lines starting with whitespace.
 */
public final class Rfc822RecordParser implements RecordParser {
    @Override
    public Result parse(String text) {
        if (text == null || text.isEmpty()) {
            return new Result(List.of(), List.of());
        }
        var records = new ArrayList<Map<String, String>>();
        var problems = new ArrayList<String>();
        var builder = new RecordBuilder();
        boolean skipping = false;
        int lineNo = 0;
        for (String line : text.split("\\r?\\n", -1)) {
            lineNo++;
            if (line.isBlank()) {
                if (!skipping) {
                    builder.finish().ifPresent(records::add);
                }
                builder = new RecordBuilder();
                skipping = false;
                continue;
            }
            if (skipping) {
                continue;
            }
            String error = builder.accept(line);
            if (error != null) {
                problems.add("line " + lineNo + ": " + error);
                skipping = true;
            }
        }
        if (!skipping) {
            builder.finish().ifPresent(records::add);
        }
        return new Result(records, problems);
    }

    private static final class RecordBuilder {
        private final Map<String, String> data = new LinkedHashMap<>();
        private String key;
        private List<String> values;

        String accept(String line) {
            char first = line.charAt(0);
            if (first == ' ' || first == '\t') {
                if (key == null) {
                    return "unexpected multi-line value";
                }
                String trimmed = line.strip();
                values.add(".".equals(trimmed) ? "" : trimmed);
                return null;
            }
            int colon = line.indexOf(':');
            if (colon < 0) {
                return "unexpected non-empty line";
            }
            commit();
            String newKey = line.substring(0, colon).strip();
            if (newKey.isEmpty()) {
                return "empty key";
            }
            if (data.containsKey(newKey)) {
                return "duplicate key '" + newKey + "'";
            }
            key = newKey;
            values = new ArrayList<>();
            values.add(line.substring(colon + 1).strip());
            return null;
        }

        Optional<Map<String, String>> finish() {
            commit();
            return data.isEmpty() ? Optional.empty() : Optional.of(Collections.unmodifiableMap(data));
        }

        private void commit() {
            if (key != null) {
                data.put(key, String.join("\n", values).strip());
                key = null;
                values = null;
            }
        }
    }
}
