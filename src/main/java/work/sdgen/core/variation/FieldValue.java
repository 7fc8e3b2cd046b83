package work.sdgen.core.variation;

import java.util.Objects;

/**
 * A field value tagged with where it came from.
 */
public record FieldValue(String value, FieldSource source) {
    public FieldValue {
        Objects.requireNonNull(source, "source");
        value = value == null ? "" : value;
    }

    public static FieldValue defaultValue(String value) {
        return new FieldValue(value, FieldSource.TEMPLATE_DEFAULT);
    }

    public static FieldValue chunk(String value) {
        return new FieldValue(value, FieldSource.CHUNK);
    }

    public static FieldValue override(String value) {
        return new FieldValue(value, FieldSource.OVERRIDE);
    }
}
