package work.sdgen.core.variation;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * One keyed entry of a variation file. Multi-field entries carry {@code category.field -> text} assignments.
 */
public record VariationEntry(String key, String value, Map<String, String> fields, double weight, int position) {
    public VariationEntry {
        Objects.requireNonNull(key, "key");
        value = value == null ? "" : value;
        fields = Collections.unmodifiableMap(new LinkedHashMap<>(fields));
        if (!(weight > 0)) {
            throw new IllegalArgumentException("weight must be positive: " + weight);
        }
    }

    public static VariationEntry single(String key, String value, int position) {
        return new VariationEntry(key, value, Map.of(), 1.0, position);
    }

    public boolean isMultiField() {
        return !fields.isEmpty();
    }

    /**
     * Text used when the entry fills a plain placeholder.
     */
    public String text() {
        if (!value.isEmpty() || fields.isEmpty()) {
            return value;
        }
        return String.join(", ", fields.values());
    }

    public VariationEntry withKey(String newKey, int newPosition) {
        return new VariationEntry(newKey, value, fields, weight, newPosition);
    }
}
