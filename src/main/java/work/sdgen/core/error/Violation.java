package work.sdgen.core.error;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * One offending field reported by configuration or schema validation.
 */
public record Violation(String field, String message) {
    public Violation {
        Objects.requireNonNull(field, "field");
        Objects.requireNonNull(message, "message");
    }

    public Map<String, Object> toSerializableMap() {
        var map = new LinkedHashMap<String, Object>();
        map.put("field", field);
        map.put("message", message);
        return map;
    }

    @Override
    public String toString() {
        return field + ": " + message;
    }
}
