package work.sdgen.core.template;

import java.nio.file.Path;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import work.sdgen.core.shared.TreeValues;

/**
 * One raw YAML document of an inheritance chain.
 */
public record TemplateDocument(Path path, DocumentKind kind, Map<String, Object> content) {
    public TemplateDocument {
        Objects.requireNonNull(path, "path");
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(content, "content");
    }

    public Optional<String> parentReference() {
        return TreeValues.string(content, "implements").filter(ref -> !ref.isBlank());
    }

    public Optional<String> string(String key) {
        return TreeValues.string(content, key);
    }

    public Map<String, Object> section(String key) {
        return TreeValues.section(content, key);
    }

    public Path directory() {
        Path parent = path.getParent();
        return parent != null ? parent : Path.of(".");
    }

    public String fileName() {
        return path.getFileName().toString();
    }

    /**
     * File name without the YAML extension and the {@code .template}/{@code .prompt}/{@code .chunk} suffix.
     */
    public String stem() {
        String name = fileName();
        for (String suffix : new String[] {".yaml", ".yml"}) {
            if (name.endsWith(suffix)) {
                name = name.substring(0, name.length() - suffix.length());
            }
        }
        for (String suffix : new String[] {".template", ".prompt", ".chunk"}) {
            if (name.endsWith(suffix)) {
                name = name.substring(0, name.length() - suffix.length());
            }
        }
        return name;
    }
}
