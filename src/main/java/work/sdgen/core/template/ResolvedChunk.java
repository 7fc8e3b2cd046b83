package work.sdgen.core.template;

import java.nio.file.Path;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import work.sdgen.core.variation.FieldValue;

/**
 * A chunk with its ancestors applied: one tagged value per {@code category.field}.
 */
public record ResolvedChunk(
    Path source,
    String name,
    Map<String, FieldValue> fields,
    Optional<String> output,
    List<Path> chain
) {
    public ResolvedChunk {
        Objects.requireNonNull(source, "source");
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(output, "output");
        fields = Collections.unmodifiableMap(new LinkedHashMap<>(fields));
        chain = List.copyOf(chain);
    }

    public boolean declares(String fieldPath) {
        return fields.containsKey(fieldPath);
    }
}
