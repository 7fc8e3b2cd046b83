package work.sdgen.core.template;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;
import work.sdgen.core.error.SelectorException;
import work.sdgen.core.error.TemplateValidationException;
import work.sdgen.core.error.Violation;
import work.sdgen.core.prompt.GenerationMode;
import work.sdgen.core.prompt.SeedMode;
import work.sdgen.core.shared.SeedSpecParser;
import work.sdgen.core.shared.TreeValues;
import work.sdgen.core.variation.SelectorParser;

/**
 * Schema validation of template documents. Collects every violation before failing.
 */
public final class TemplateValidator {
    static final Set<String> ALLOWED_KEYS = Set.of(
        "version", "type", "name", "implements", "imports", "template",
        "negative_prompt", "generation", "parameters", "output"
    );
    private static final Set<String> GENERATION_KEYS = Set.of(
        "mode", "seed_mode", "seed", "seeds", "max_images", "max_attempts",
        "weighted_ordering", "draw_random_seeds", "sampling_seed"
    );
    private static final Set<String> OUTPUT_KEYS = Set.of("directory", "session_name", "filename_keys");

    private TemplateValidator() {}

    public static void validate(TemplateChain chain) {
        var violations = new ArrayList<Violation>();
        boolean hasBody = false;
        for (TemplateDocument document : chain.documents()) {
            String prefix = document == chain.leaf() ? "" : document.fileName() + ":";
            validateDocument(document, prefix, violations);
            hasBody |= document.content().get("template") instanceof String;
        }
        if (!chain.leaf().content().containsKey("version")) {
            violations.add(new Violation("version", "is required"));
        }
        if (!hasBody) {
            violations.add(new Violation("template", "is required somewhere in the inheritance chain"));
        }
        if (!violations.isEmpty()) {
            throw new TemplateValidationException(chain.leaf().fileName(), violations);
        }
    }

    private static void validateDocument(TemplateDocument document, String prefix, List<Violation> violations) {
        Map<String, Object> content = document.content();
        for (String key : content.keySet()) {
            if (!ALLOWED_KEYS.contains(key)) {
                violations.add(new Violation(prefix + key, "unknown key"));
            }
        }
        Object version = content.get("version");
        if (version != null && !(version instanceof String) && !(version instanceof Number)) {
            violations.add(new Violation(prefix + "version", "must be a string"));
        }
        Object type = content.get("type");
        if (type != null && !("template".equals(type) || "prompt".equals(type))) {
            violations.add(new Violation(prefix + "type", "must be 'template' or 'prompt'"));
        }
        requireStringOrAbsent(content, "name", prefix, violations);
        requireStringOrAbsent(content, "implements", prefix, violations);
        validateText(content, "template", prefix, violations);
        validateText(content, "negative_prompt", prefix, violations);
        validateImports(content.get("imports"), prefix, violations);
        validateGeneration(content.get("generation"), prefix, violations);
        validateOutput(content.get("output"), prefix, violations);
        Object parameters = content.get("parameters");
        if (parameters != null && !(parameters instanceof Map<?, ?>)) {
            violations.add(new Violation(prefix + "parameters", "must be a mapping"));
        }
    }

    private static void requireStringOrAbsent(Map<String, Object> content, String key, String prefix, List<Violation> violations) {
        Object value = content.get(key);
        if (value != null && !(value instanceof String)) {
            violations.add(new Violation(prefix + key, "must be a string"));
        }
    }

    private static void validateText(Map<String, Object> content, String key, String prefix, List<Violation> violations) {
        Object value = content.get(key);
        if (value == null) {
            return;
        }
        if (!(value instanceof String text)) {
            violations.add(new Violation(prefix + key, "must be a string"));
            return;
        }
        try {
            for (Placeholder placeholder : PlaceholderParser.parse(text)) {
                SelectorParser.parse(placeholder.name(), placeholder.selectorExpression().orElse(null));
                for (ChunkOverride override : placeholder.overrides()) {
                    SelectorParser.parse(override.axisName(placeholder.name()), override.selectorExpression().orElse(null));
                }
            }
        } catch (SelectorException ex) {
            violations.add(new Violation(prefix + key, ex.getMessage()));
        }
    }

    private static void validateImports(Object imports, String prefix, List<Violation> violations) {
        if (imports == null) {
            return;
        }
        if (!(imports instanceof Map<?, ?> map)) {
            violations.add(new Violation(prefix + "imports", "must be a mapping"));
            return;
        }
        for (var entry : map.entrySet()) {
            String field = prefix + "imports." + entry.getKey();
            Object value = entry.getValue();
            if (!String.valueOf(entry.getKey()).matches("[A-Za-z_][A-Za-z0-9_]*")) {
                violations.add(new Violation(field, "import names must be identifiers"));
            }
            if (value instanceof String || value instanceof List<?>) {
                continue;
            }
            if (value instanceof Map<?, ?> spec) {
                if (!(spec.get("source") instanceof String) && !(spec.get("source") instanceof List<?>)) {
                    violations.add(new Violation(field + ".source", "is required"));
                }
                if (spec.get("type") != null && DocumentKind.fromDeclared(String.valueOf(spec.get("type"))).isEmpty()) {
                    violations.add(new Violation(field + ".type", "unknown document type"));
                }
                continue;
            }
            violations.add(new Violation(field, "must be a path, a list of sources or a mapping with 'source'"));
        }
    }

    private static void validateGeneration(Object generation, String prefix, List<Violation> violations) {
        if (generation == null) {
            return;
        }
        if (!(generation instanceof Map<?, ?>)) {
            violations.add(new Violation(prefix + "generation", "must be a mapping"));
            return;
        }
        Map<String, Object> section = TreeValues.map(generation);
        String field = prefix + "generation.";
        for (String key : section.keySet()) {
            if (!GENERATION_KEYS.contains(key)) {
                violations.add(new Violation(field + key, "unknown key"));
            }
        }
        Object mode = section.get("mode");
        if (mode != null && GenerationMode.parse(String.valueOf(mode)).isEmpty()) {
            violations.add(new Violation(field + "mode", "must be 'combinatorial' or 'random'"));
        }
        Object seedMode = section.get("seed_mode");
        if (seedMode != null && SeedMode.parse(String.valueOf(seedMode)).isEmpty()) {
            violations.add(new Violation(field + "seed_mode", "must be one of fixed, progressive, random, sweep"));
        }
        for (String key : List.of("seed", "sampling_seed")) {
            Object value = section.get(key);
            if (value != null && !TreeValues.isIntegral(value)) {
                violations.add(new Violation(field + key, "must be an integer"));
            }
        }
        for (String key : List.of("max_images", "max_attempts")) {
            Object value = section.get(key);
            if (value != null && (!TreeValues.isIntegral(value) || ((Number) value).longValue() <= 0)) {
                violations.add(new Violation(field + key, "must be a positive integer"));
            }
        }
        for (String key : List.of("weighted_ordering", "draw_random_seeds")) {
            Object value = section.get(key);
            if (value != null && !(value instanceof Boolean)) {
                violations.add(new Violation(field + key, "must be a boolean"));
            }
        }
        Object seeds = section.get("seeds");
        if (seeds != null) {
            try {
                SeedSpecParser.parse(seeds instanceof List<?> list ? joinSeeds(list) : String.valueOf(seeds));
            } catch (IllegalArgumentException ex) {
                violations.add(new Violation(field + "seeds", ex.getMessage()));
            }
        }
    }

    static String joinSeeds(List<?> seeds) {
        var parts = new ArrayList<String>();
        seeds.forEach(seed -> parts.add(String.valueOf(seed)));
        return String.join(",", parts);
    }

    private static void validateOutput(Object output, String prefix, List<Violation> violations) {
        if (output == null) {
            return;
        }
        if (!(output instanceof Map<?, ?>)) {
            violations.add(new Violation(prefix + "output", "must be a mapping"));
            return;
        }
        Map<String, Object> section = TreeValues.map(output);
        for (String key : section.keySet()) {
            if (!OUTPUT_KEYS.contains(key)) {
                violations.add(new Violation(prefix + "output." + key, "unknown key"));
            }
        }
        requireStringOrAbsent(section, "directory", prefix + "output.", violations);
        requireStringOrAbsent(section, "session_name", prefix + "output.", violations);
        Object keys = section.get("filename_keys");
        if (keys != null && TreeValues.stringList(keys).isEmpty()) {
            violations.add(new Violation(prefix + "output.filename_keys", "must be a list of placeholder names"));
        }
    }
}
