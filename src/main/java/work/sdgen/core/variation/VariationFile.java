package work.sdgen.core.variation;

import java.nio.file.Path;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Ordered variation entries bound to an import symbol.
 */
public record VariationFile(String name, Optional<Path> source, List<VariationEntry> entries) {
    public VariationFile {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(source, "source");
        entries = List.copyOf(entries);
    }

    public int size() {
        return entries.size();
    }

    public Optional<VariationEntry> find(String key) {
        return entries.stream().filter(entry -> entry.key().equals(key)).findFirst();
    }

    public boolean isMultiField() {
        return !entries.isEmpty() && entries.stream().allMatch(VariationEntry::isMultiField);
    }

    public double meanWeight() {
        return entries.stream().mapToDouble(VariationEntry::weight).average().orElse(1.0);
    }
}
