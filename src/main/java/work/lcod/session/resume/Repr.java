package work.lcod.session.resume;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Extraction helpers for the JSON representation of a session. Every violation is a
 * {@link CorruptedSessionException} naming the offending key.
 */
final class Repr {
    private Repr() {}

    /**
     * Copy of a JSON object with its keys checked to be strings.
     */
    static Map<String, Object> asMap(Object value, String what) {
        if (!(value instanceof Map<?, ?> map)) {
            throw new CorruptedSessionException("Value of " + what + " is of incorrect type " + typeName(value));
        }
        var copy = new LinkedHashMap<String, Object>();
        for (var entry : map.entrySet()) {
            if (!(entry.getKey() instanceof String key)) {
                throw new CorruptedSessionException("Keys of " + what + " must be strings, got " + typeName(entry.getKey()));
            }
            copy.put(key, entry.getValue());
        }
        return copy;
    }

    static Object require(Map<String, Object> repr, String key) {
        if (!repr.containsKey(key)) {
            throw new CorruptedSessionException("Missing value for key '" + key + "'");
        }
        return repr.get(key);
    }

    static Map<String, Object> map(Map<String, Object> repr, String key) {
        var value = require(repr, key);
        if (value == null) {
            throw nullValue(key);
        }
        return asMap(value, "key '" + key + "'");
    }

    static List<?> list(Map<String, Object> repr, String key) {
        var value = require(repr, key);
        if (value == null) {
            throw nullValue(key);
        }
        if (value instanceof List<?> list) {
            return list;
        }
        throw wrongType(key, value);
    }

    /**
     * List of strings; {@code itemName} is used in the message for a non-string element.
     */
    static List<String> stringList(Map<String, Object> repr, String key, String itemName) {
        var result = new ArrayList<String>();
        for (var item : list(repr, key)) {
            if (!(item instanceof String str)) {
                throw new CorruptedSessionException("Each " + itemName + " in '" + key + "' must be a string, got "
                    + typeName(item));
            }
            result.add(str);
        }
        return result;
    }

    static String string(Map<String, Object> repr, String key) {
        var value = optionalString(repr, key);
        if (value == null) {
            throw nullValue(key);
        }
        return value;
    }

    static String optionalString(Map<String, Object> repr, String key) {
        var value = require(repr, key);
        if (value == null || value instanceof String) {
            return (String) value;
        }
        throw wrongType(key, value);
    }

    static Integer optionalInteger(Map<String, Object> repr, String key) {
        var value = require(repr, key);
        if (value == null) {
            return null;
        }
        if (isIntegral(value)) {
            long number = ((Number) value).longValue();
            if (number < Integer.MIN_VALUE || number > Integer.MAX_VALUE) {
                throw new CorruptedSessionException("Value of key '" + key + "' is out of range: " + value);
            }
            return (int) number;
        }
        throw wrongType(key, value);
    }

    static Double optionalNumber(Map<String, Object> repr, String key) {
        var value = require(repr, key);
        if (value == null) {
            return null;
        }
        if (value instanceof Number number) {
            return number.doubleValue();
        }
        throw wrongType(key, value);
    }

    static boolean isIntegral(Object value) {
        return value instanceof Integer || value instanceof Long || value instanceof BigInteger;
    }

    static String typeName(Object value) {
        if (value == null) {
            return "null";
        }
        if (value instanceof String) {
            return "string";
        }
        if (isIntegral(value)) {
            return "integer";
        }
        if (value instanceof Number) {
            return "number";
        }
        if (value instanceof Boolean) {
            return "boolean";
        }
        if (value instanceof List<?>) {
            return "list";
        }
        if (value instanceof Map<?, ?>) {
            return "object";
        }
        return value.getClass().getSimpleName();
    }

    private static CorruptedSessionException nullValue(String key) {
        return new CorruptedSessionException("Value of key '" + key + "' cannot be null");
    }

    private static CorruptedSessionException wrongType(String key, Object value) {
        return new CorruptedSessionException("Value of key '" + key + "' is of incorrect type " + typeName(value));
    }
}
