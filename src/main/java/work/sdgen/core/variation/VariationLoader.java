package work.sdgen.core.variation;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import work.sdgen.core.error.StructuralException;
import work.sdgen.core.shared.TextNormalizer;
import work.sdgen.core.shared.TreeValues;
import work.sdgen.core.template.DocumentLoader;
import work.sdgen.core.template.DocumentLocator;
import work.sdgen.core.template.ImportSource;
import work.sdgen.core.template.ImportSpec;

/**
 * Parses variation files and merges multi-source imports into one variation set.
 */
public final class VariationLoader {
    private static final Logger log = LoggerFactory.getLogger(VariationLoader.class);
    private static final Set<String> METADATA_KEYS = Set.of("type", "name", "version", "description");

    private final Map<Path, VariationFile> cache = new LinkedHashMap<>();

    public synchronized VariationFile load(String name, Path path) {
        Path key = path.toAbsolutePath().normalize();
        VariationFile cached = cache.get(key);
        if (cached == null) {
            Object tree = DocumentLoader.loadTree(key);
            cached = new VariationFile(name, Optional.of(key), parseEntries(tree, key.getFileName().toString()));
            cache.put(key, cached);
        } else {
            log.debug("Variation file {} served from cache", key);
        }
        return new VariationFile(name, cached.source(), cached.entries());
    }

    /**
     * Merges every source of an import, in declaration order. Inline values get an MD5 short key; a key that
     * collides with an earlier source is prefixed with the normalized path of its file.
     */
    public VariationFile merge(ImportSpec spec, DocumentLocator locator) {
        if (spec.isSingleFile()) {
            Path path = locator.locate(spec.baseDir(), spec.sources().get(0).reference(), spec.declaredIn(), "imports." + spec.symbol());
            return load(spec.symbol(), path);
        }
        var entries = new ArrayList<VariationEntry>();
        var keys = new LinkedHashSet<String>();
        for (ImportSource source : spec.sources()) {
            if (source.inline()) {
                String key = TextNormalizer.md5Short(source.reference());
                if (!keys.add(key)) {
                    throw StructuralException.invalidDocument(
                        spec.declaredIn().getFileName().toString(),
                        "import '" + spec.symbol() + "' repeats inline value " + source.reference());
                }
                entries.add(VariationEntry.single(key, source.inlineValue(), entries.size()));
                continue;
            }
            Path path = locator.locate(spec.baseDir(), source.reference(), spec.declaredIn(), "imports." + spec.symbol());
            for (VariationEntry entry : load(spec.symbol(), path).entries()) {
                String key = entry.key();
                if (!keys.add(key)) {
                    key = pathPrefix(source.reference()) + "__" + entry.key();
                    if (!keys.add(key)) {
                        throw StructuralException.invalidDocument(
                            spec.declaredIn().getFileName().toString(),
                            "import '" + spec.symbol() + "' cannot disambiguate key '" + entry.key() + "'");
                    }
                    log.debug("Key {} of {} renamed to {}", entry.key(), source.reference(), key);
                }
                entries.add(entry.withKey(key, entries.size()));
            }
        }
        return new VariationFile(spec.symbol(), Optional.empty(), entries);
    }

    static String pathPrefix(String reference) {
        String normalized = reference.replace('\\', '/').replaceAll("^(\\.\\.?/)+", "");
        if (normalized.endsWith(".yaml")) {
            normalized = normalized.substring(0, normalized.length() - 5);
        } else if (normalized.endsWith(".yml")) {
            normalized = normalized.substring(0, normalized.length() - 4);
        }
        return normalized.replace("/", "__").replace(".", "_");
    }

    static List<VariationEntry> parseEntries(Object tree, String document) {
        Object body = tree;
        if (tree instanceof Map<?, ?> root) {
            if (root.containsKey("variations")) {
                body = root.get("variations");
            } else {
                var stripped = new LinkedHashMap<String, Object>(TreeValues.map(tree));
                METADATA_KEYS.forEach(stripped::remove);
                body = stripped;
            }
        }
        var entries = new ArrayList<VariationEntry>();
        var seen = new LinkedHashSet<String>();
        if (body instanceof List<?> list) {
            for (int i = 0; i < list.size(); i++) {
                Object item = list.get(i);
                VariationEntry entry;
                if (item instanceof Map<?, ?> map && map.containsKey("key")) {
                    entry = structured(String.valueOf(map.get("key")), TreeValues.map(item), entries.size(), document);
                } else if (item instanceof Map<?, ?> map && map.size() == 1) {
                    var only = TreeValues.map(item).entrySet().iterator().next();
                    entry = fromValue(only.getKey(), only.getValue(), entries.size(), document);
                } else if (item != null && !(item instanceof Map<?, ?>) && !(item instanceof List<?>)) {
                    entry = VariationEntry.single("_" + i, String.valueOf(item), entries.size());
                } else {
                    throw StructuralException.invalidDocument(document, "entry " + i + " has no key");
                }
                add(entries, seen, entry, document);
            }
        } else if (body instanceof Map<?, ?>) {
            for (var item : TreeValues.map(body).entrySet()) {
                add(entries, seen, fromValue(item.getKey(), item.getValue(), entries.size(), document), document);
            }
        } else {
            throw StructuralException.invalidDocument(document, "variations must be a list or a mapping");
        }
        if (entries.isEmpty()) {
            throw StructuralException.invalidDocument(document, "declares no variation entries");
        }
        return entries;
    }

    private static void add(List<VariationEntry> entries, Set<String> seen, VariationEntry entry, String document) {
        if (!seen.add(entry.key())) {
            throw StructuralException.invalidDocument(document, "duplicate variation key '" + entry.key() + "'");
        }
        entries.add(entry);
    }

    private static VariationEntry fromValue(String key, Object value, int position, String document) {
        if (value instanceof Map<?, ?> map) {
            if (map.containsKey("value") || map.containsKey("fields") || map.containsKey("weight")) {
                return structured(key, TreeValues.map(value), position, document);
            }
            return new VariationEntry(key, "", flattenFields(TreeValues.map(value), key, document), 1.0, position);
        }
        if (value instanceof List<?>) {
            throw StructuralException.invalidDocument(document, "entry '" + key + "' must not be a list");
        }
        return VariationEntry.single(key, value == null ? "" : String.valueOf(value), position);
    }

    private static VariationEntry structured(String key, Map<String, Object> item, int position, String document) {
        double weight = 1.0;
        if (item.containsKey("weight")) {
            weight = TreeValues.doubleValue(item.get("weight"))
                .orElseThrow(() -> StructuralException.invalidDocument(document, "entry '" + key + "' has a non-numeric weight"));
            if (!(weight > 0)) {
                throw StructuralException.invalidDocument(document, "entry '" + key + "' weight must be positive");
            }
        }
        Object value = item.get("value");
        Map<String, String> fields = Map.of();
        String text = "";
        if (value instanceof Map<?, ?>) {
            fields = flattenFields(TreeValues.map(value), key, document);
        } else if (value != null) {
            text = String.valueOf(value);
        }
        if (item.get("fields") instanceof Map<?, ?>) {
            fields = flattenFields(TreeValues.map(item.get("fields")), key, document);
        }
        return new VariationEntry(key, text, fields, weight, position);
    }

    private static Map<String, String> flattenFields(Map<String, Object> source, String key, String document) {
        var fields = new LinkedHashMap<String, String>();
        flattenInto(fields, "", source, key, document);
        if (fields.isEmpty()) {
            throw StructuralException.invalidDocument(document, "multi-field entry '" + key + "' assigns no field");
        }
        return fields;
    }

    private static void flattenInto(Map<String, String> target, String prefix, Map<String, Object> source, String key, String document) {
        for (var field : source.entrySet()) {
            String path = prefix.isEmpty() ? field.getKey() : prefix + "." + field.getKey();
            Object value = field.getValue();
            if (value instanceof Map<?, ?>) {
                flattenInto(target, path, TreeValues.map(value), key, document);
            } else if (value instanceof List<?>) {
                throw StructuralException.invalidDocument(document, "multi-field entry '" + key + "' has a list at " + path);
            } else {
                target.put(path, value == null ? "" : String.valueOf(value));
            }
        }
    }
}
