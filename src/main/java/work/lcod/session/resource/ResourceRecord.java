package work.lcod.session.resource;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * One key/value record produced by a resource job.
 */
public record ResourceRecord(Map<String, String> attributes) {
    public ResourceRecord {
        attributes = attributes == null
            ? Map.of()
            : Collections.unmodifiableMap(new LinkedHashMap<>(attributes));
    }

    public static ResourceRecord of(String... keyValues) {
        if (keyValues.length % 2 != 0) {
            throw new IllegalArgumentException("keyValues must contain key/value pairs");
        }
        var map = new LinkedHashMap<String, String>();
        for (int i = 0; i < keyValues.length; i += 2) {
            map.put(keyValues[i], keyValues[i + 1]);
        }
        return new ResourceRecord(map);
    }

    public Optional<String> get(String key) {
        return Optional.ofNullable(attributes.get(key));
    }
}
