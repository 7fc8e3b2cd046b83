package work.sdgen.core.template;

import java.nio.file.Path;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Kind of a YAML document, from its declared {@code type} or its file naming convention.
 */
public enum DocumentKind {
    TEMPLATE,
    PROMPT,
    CHUNK_TEMPLATE,
    CHUNK,
    VARIATIONS;

    public boolean isChunk() {
        return this == CHUNK || this == CHUNK_TEMPLATE;
    }

    public boolean isTemplate() {
        return this == TEMPLATE || this == PROMPT;
    }

    public static Optional<DocumentKind> fromDeclared(String type) {
        if (type == null || type.isBlank()) {
            return Optional.empty();
        }
        return switch (type.trim().toLowerCase(Locale.ROOT)) {
            case "template" -> Optional.of(TEMPLATE);
            case "prompt" -> Optional.of(PROMPT);
            case "chunk_template", "character_template" -> Optional.of(CHUNK_TEMPLATE);
            case "chunk", "character" -> Optional.of(CHUNK);
            case "variations", "variation", "multi_field" -> Optional.of(VARIATIONS);
            default -> Optional.empty();
        };
    }

    public static DocumentKind detect(Path path, Map<String, Object> document) {
        Object declared = document.get("type");
        if (declared instanceof String type) {
            var kind = fromDeclared(type);
            if (kind.isPresent()) {
                return kind.get();
            }
        }
        return fromFileName(path).orElseGet(() -> {
            if (document.containsKey("variations")) {
                return VARIATIONS;
            }
            if (document.containsKey("fields")) {
                return CHUNK;
            }
            if (document.containsKey("template")) {
                return PROMPT;
            }
            return VARIATIONS;
        });
    }

    public static Optional<DocumentKind> fromFileName(Path path) {
        String name = path.getFileName().toString().toLowerCase(Locale.ROOT);
        if (name.endsWith(".chunk.yaml") || name.endsWith(".chunk.yml")) {
            return Optional.of(CHUNK);
        }
        if (name.endsWith(".template.yaml") || name.endsWith(".template.yml")) {
            return Optional.of(TEMPLATE);
        }
        if (name.endsWith(".prompt.yaml") || name.endsWith(".prompt.yml")) {
            return Optional.of(PROMPT);
        }
        return Optional.empty();
    }
}
