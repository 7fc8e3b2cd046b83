package work.sdgen.core.variation;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Random;
import work.sdgen.core.error.SelectorException;

/**
 * Applies a selector to the ordered entries of a variation file.
 */
public final class SelectorEvaluator {
    private final Random random;

    public SelectorEvaluator(Random random) {
        this.random = random;
    }

    public List<VariationEntry> evaluate(String placeholder, VariationFile file, Selector selector) {
        List<VariationEntry> entries = file.entries();
        switch (selector.kind()) {
            case ALL:
                return entries;
            case LIMIT:
                requireAvailable(placeholder, selector.count(), entries.size());
                return List.copyOf(entries.subList(0, selector.count()));
            case RANDOM: {
                requireAvailable(placeholder, selector.count(), entries.size());
                var pool = new ArrayList<>(entries);
                Collections.shuffle(pool, random);
                return List.copyOf(pool.subList(0, selector.count()));
            }
            case INDEXES: {
                var selected = new ArrayList<VariationEntry>();
                for (int index : selector.indexes()) {
                    if (index >= entries.size()) {
                        throw SelectorException.indexOutOfRange(placeholder, index, entries.size());
                    }
                    selected.add(entries.get(index));
                }
                return List.copyOf(selected);
            }
            case RANGE:
                if (selector.end() >= entries.size()) {
                    throw SelectorException.indexOutOfRange(placeholder, selector.end(), entries.size());
                }
                return List.copyOf(entries.subList(selector.start(), selector.end() + 1));
            case KEYS: {
                var selected = new ArrayList<VariationEntry>();
                for (String key : selector.keys()) {
                    selected.add(file.find(key).orElseThrow(() -> SelectorException.unknownKey(placeholder, key)));
                }
                return List.copyOf(selected);
            }
            default:
                throw new IllegalStateException("Unsupported selector kind: " + selector.kind());
        }
    }

    private static void requireAvailable(String placeholder, int requested, int available) {
        if (requested > available) {
            throw SelectorException.insufficientEntries(placeholder, requested, available);
        }
    }
}
