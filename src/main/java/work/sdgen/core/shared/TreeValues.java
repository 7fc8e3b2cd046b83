package work.sdgen.core.shared;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Typed accessors over the map/list trees produced by the YAML loader.
 */
public final class TreeValues {
    private TreeValues() {}

    @SuppressWarnings("unchecked")
    public static Map<String, Object> map(Object value) {
        if (value instanceof Map<?, ?> map) {
            return (Map<String, Object>) map;
        }
        return Map.of();
    }

    public static Map<String, Object> section(Map<String, Object> document, String key) {
        return map(document.get(key));
    }

    public static Optional<String> string(Map<String, Object> document, String key) {
        Object value = document.get(key);
        if (value == null) {
            return Optional.empty();
        }
        if (value instanceof Map<?, ?> || value instanceof List<?>) {
            return Optional.empty();
        }
        return Optional.of(String.valueOf(value));
    }

    public static boolean isIntegral(Object value) {
        return value instanceof Integer || value instanceof Long || value instanceof Short || value instanceof BigInteger;
    }

    public static Optional<Long> longValue(Object value) {
        if (value == null) {
            return Optional.empty();
        }
        if (isIntegral(value)) {
            return Optional.of(((Number) value).longValue());
        }
        if (value instanceof String text) {
            try {
                return Optional.of(Long.parseLong(text.trim()));
            } catch (NumberFormatException ex) {
                return Optional.empty();
            }
        }
        return Optional.empty();
    }

    public static Optional<Double> doubleValue(Object value) {
        if (value instanceof Number number) {
            return Optional.of(number.doubleValue());
        }
        if (value instanceof String text) {
            try {
                return Optional.of(new BigDecimal(text.trim()).doubleValue());
            } catch (NumberFormatException ex) {
                return Optional.empty();
            }
        }
        return Optional.empty();
    }

    public static Optional<Boolean> booleanValue(Object value) {
        if (value instanceof Boolean bool) {
            return Optional.of(bool);
        }
        if (value instanceof String text) {
            if ("true".equalsIgnoreCase(text.trim())) {
                return Optional.of(Boolean.TRUE);
            }
            if ("false".equalsIgnoreCase(text.trim())) {
                return Optional.of(Boolean.FALSE);
            }
        }
        return Optional.empty();
    }

    public static Optional<List<String>> stringList(Object value) {
        if (value instanceof String text) {
            var items = new ArrayList<String>();
            for (String part : text.split(",")) {
                if (!part.isBlank()) {
                    items.add(part.trim());
                }
            }
            return Optional.of(List.copyOf(items));
        }
        if (value instanceof List<?> list) {
            var items = new ArrayList<String>();
            for (Object item : list) {
                if (item == null || item instanceof Map<?, ?> || item instanceof List<?>) {
                    return Optional.empty();
                }
                items.add(String.valueOf(item));
            }
            return Optional.of(List.copyOf(items));
        }
        return Optional.empty();
    }

    /**
     * Shallow key-wise merge; entries of {@code override} replace those of {@code base}.
     */
    public static Map<String, Object> merge(Map<String, Object> base, Map<String, Object> override) {
        var merged = new LinkedHashMap<String, Object>(base);
        merged.putAll(override);
        return merged;
    }
}
