package work.sdgen.core.variation;

import java.util.List;
import java.util.Objects;

/**
 * Parsed bracket selector of a placeholder.
 */
public record Selector(Kind kind, int count, int start, int end, List<Integer> indexes, List<String> keys) {
    public enum Kind {
        ALL,
        RANDOM,
        LIMIT,
        INDEXES,
        RANGE,
        KEYS
    }

    private static final Selector ALL_ENTRIES = new Selector(Kind.ALL, 0, 0, 0, List.of(), List.of());

    public Selector {
        Objects.requireNonNull(kind, "kind");
        indexes = List.copyOf(indexes);
        keys = List.copyOf(keys);
    }

    public static Selector all() {
        return ALL_ENTRIES;
    }

    public static Selector random(int count) {
        return new Selector(Kind.RANDOM, count, 0, 0, List.of(), List.of());
    }

    public static Selector limit(int count) {
        return new Selector(Kind.LIMIT, count, 0, 0, List.of(), List.of());
    }

    public static Selector indexes(List<Integer> indexes) {
        return new Selector(Kind.INDEXES, 0, 0, 0, indexes, List.of());
    }

    /**
     * Inclusive index bounds; entries are only materialized once the file length is known.
     */
    public static Selector range(int start, int end) {
        return new Selector(Kind.RANGE, 0, start, end, List.of(), List.of());
    }

    public static Selector keys(List<String> keys) {
        return new Selector(Kind.KEYS, 0, 0, 0, List.of(), keys);
    }

    public boolean isRandom() {
        return kind == Kind.RANDOM;
    }
}
