package work.sdgen.core.template;

import java.nio.file.Path;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * A template with its whole {@code implements} chain merged in.
 */
public record ResolvedTemplate(
    Path source,
    String name,
    String version,
    String template,
    String negativePrompt,
    Map<String, ImportSpec> imports,
    Map<String, Object> generation,
    Map<String, Object> output,
    Map<String, Object> parameters,
    List<Path> chain
) {
    public ResolvedTemplate {
        Objects.requireNonNull(source, "source");
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(template, "template");
        negativePrompt = negativePrompt == null ? "" : negativePrompt;
        imports = Collections.unmodifiableMap(new LinkedHashMap<>(imports));
        generation = Collections.unmodifiableMap(new LinkedHashMap<>(generation));
        output = Collections.unmodifiableMap(new LinkedHashMap<>(output));
        parameters = Collections.unmodifiableMap(new LinkedHashMap<>(parameters));
        chain = List.copyOf(chain);
    }

    public String displayName() {
        return source.getFileName().toString();
    }
}
