package work.sdgen.core.prompt;

import java.util.List;
import java.util.Objects;
import work.sdgen.core.variation.VariationEntry;
import work.sdgen.core.variation.VariationFile;

/**
 * One generation dimension: a named placeholder (or chunk override) and its candidate entries.
 */
public record Axis(String name, VariationFile file, List<VariationEntry> candidates, double weight, boolean pinned) {
    public Axis {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(file, "file");
        candidates = List.copyOf(candidates);
    }

    public int size() {
        return candidates.size();
    }

    /**
     * A {@code $0} axis is left out of the loops and drawn at random for every combination.
     */
    public boolean isFloating() {
        return weight == 0;
    }

    public Axis pin(VariationEntry entry) {
        return new Axis(name, file, List.of(entry), weight, true);
    }
}
