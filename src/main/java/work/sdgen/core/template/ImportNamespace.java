package work.sdgen.core.template;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import work.sdgen.core.variation.VariationFile;

/**
 * Symbols available to a template body: variation sets and resolved chunks.
 */
public final class ImportNamespace {
    private final Map<String, VariationFile> variations;
    private final Map<String, ResolvedChunk> chunks;

    public ImportNamespace(Map<String, VariationFile> variations, Map<String, ResolvedChunk> chunks) {
        this.variations = Collections.unmodifiableMap(new LinkedHashMap<>(variations));
        this.chunks = Collections.unmodifiableMap(new LinkedHashMap<>(chunks));
    }

    public Optional<VariationFile> variation(String symbol) {
        return Optional.ofNullable(variations.get(symbol));
    }

    public Optional<ResolvedChunk> chunk(String symbol) {
        return Optional.ofNullable(chunks.get(symbol));
    }

    public boolean contains(String symbol) {
        return variations.containsKey(symbol) || chunks.containsKey(symbol);
    }

    public Map<String, VariationFile> variations() {
        return variations;
    }

    public Map<String, ResolvedChunk> chunks() {
        return chunks;
    }
}
