package work.sdgen.core.variation;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import work.sdgen.core.error.StructuralException;
import work.sdgen.core.template.ChunkOverride;

/**
 * Expands chunk overrides into field assignments and merges them by precedence:
 * inline override &gt; chunk field &gt; template default. A higher source replaces a field's value entirely.
 */
public final class VariationExpander {
    private VariationExpander() {}

    /**
     * Field assignments produced by one override. {@code entry} is ignored for literal overrides.
     */
    public static Map<String, FieldValue> expand(String placeholder, ChunkOverride override, VariationEntry entry) {
        var assignments = new LinkedHashMap<String, FieldValue>();
        switch (override.kind()) {
            case LITERAL:
                assignments.put(override.fieldPath(), FieldValue.override(override.literal()));
                break;
            case FIELD:
                if (entry.isMultiField()) {
                    throw StructuralException.invalidOverride(placeholder, override.fieldPath(),
                        "entry '" + entry.key() + "' of " + override.source() + " sets several fields; use '"
                            + override.source() + "' without a field path");
                }
                assignments.put(override.fieldPath(), FieldValue.override(entry.value()));
                break;
            case MULTI_FIELD:
                if (!entry.isMultiField()) {
                    throw StructuralException.invalidOverride(placeholder, null,
                        override.source() + " is not a multi-field variation; use 'field.path=" + override.source() + "'");
                }
                entry.fields().forEach((field, value) -> assignments.put(field, FieldValue.override(value)));
                break;
            default:
                throw new IllegalStateException("Unsupported override kind: " + override.kind());
        }
        return assignments;
    }

    /**
     * Applies assignments on top of {@code base}; later assignments of equal rank win.
     */
    public static Map<String, FieldValue> merge(Map<String, FieldValue> base, List<Map<String, FieldValue>> assignments) {
        var merged = new LinkedHashMap<>(base);
        for (Map<String, FieldValue> assignment : assignments) {
            for (var field : assignment.entrySet()) {
                FieldValue current = merged.get(field.getKey());
                if (current == null || !current.source().outranks(field.getValue().source())) {
                    merged.put(field.getKey(), field.getValue());
                }
            }
        }
        return merged;
    }
}
