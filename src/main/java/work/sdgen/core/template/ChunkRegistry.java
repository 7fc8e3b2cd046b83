package work.sdgen.core.template;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import work.sdgen.core.shared.TreeValues;
import work.sdgen.core.variation.FieldValue;

/**
 * Loads chunks and chunk templates, resolving their {@code implements} chains. One registry per run.
 */
public final class ChunkRegistry {
    private static final Logger log = LoggerFactory.getLogger(ChunkRegistry.class);
    private static final Set<String> DEFINITION_KEYS = Set.of("default", "description", "type", "required", "example", "examples");

    private final InheritanceResolver walker;
    private final Map<Path, ResolvedChunk> cache = new HashMap<>();

    public ChunkRegistry(DocumentLocator locator) {
        this.walker = new InheritanceResolver(locator);
    }

    public synchronized ResolvedChunk load(Path path) {
        Path key = path.toAbsolutePath().normalize();
        ResolvedChunk cached = cache.get(key);
        if (cached != null) {
            log.debug("Chunk {} served from cache", key.getFileName());
            return cached;
        }
        List<TemplateDocument> chain = walker.walk(key, DocumentKind::isChunk, "chunk");
        var fields = new LinkedHashMap<String, FieldValue>();
        var paths = new ArrayList<Path>();
        for (int i = chain.size() - 1; i >= 0; i--) {
            TemplateDocument document = chain.get(i);
            paths.add(document.path());
            var flattened = new LinkedHashMap<String, Object>();
            flatten(flattened, "", document.section("fields"), document.kind() == DocumentKind.CHUNK_TEMPLATE);
            for (var field : flattened.entrySet()) {
                String value = field.getValue() == null ? "" : String.valueOf(field.getValue());
                if (document.kind() == DocumentKind.CHUNK_TEMPLATE) {
                    if (!value.isEmpty() || !fields.containsKey(field.getKey())) {
                        fields.put(field.getKey(), FieldValue.defaultValue(value));
                    }
                } else if (!value.isEmpty()) {
                    fields.put(field.getKey(), FieldValue.chunk(value));
                }
            }
        }
        Optional<String> output = Optional.empty();
        for (TemplateDocument document : chain) {
            output = document.string("output");
            if (output.isPresent()) {
                break;
            }
        }
        TemplateDocument leaf = chain.get(0);
        var resolved = new ResolvedChunk(
            key,
            leaf.string("name").filter(name -> !name.isBlank()).orElseGet(leaf::stem),
            fields,
            output,
            paths
        );
        cache.put(key, resolved);
        return resolved;
    }

    private static void flatten(Map<String, Object> target, String prefix, Map<String, Object> source, boolean definitions) {
        for (var entry : source.entrySet()) {
            String path = prefix.isEmpty() ? entry.getKey() : prefix + "." + entry.getKey();
            Object value = entry.getValue();
            if (value instanceof Map<?, ?> map) {
                if (definitions && isDefinition(map)) {
                    target.put(path, map.get("default"));
                } else {
                    flatten(target, path, TreeValues.map(value), definitions);
                }
            } else if (value instanceof List<?> list) {
                var items = new ArrayList<String>();
                list.forEach(item -> items.add(String.valueOf(item)));
                target.put(path, String.join(", ", items));
            } else {
                target.put(path, value);
            }
        }
    }

    private static boolean isDefinition(Map<?, ?> map) {
        for (Object key : map.keySet()) {
            if (DEFINITION_KEYS.contains(String.valueOf(key))) {
                return true;
            }
        }
        return false;
    }
}
