package work.sdgen.core.shared;

import java.util.ArrayList;
import java.util.List;

/**
 * Expands seed sweep specifications.
 *
 * <ul>
 *   <li>{@code 1000,1005,1008} explicit list</li>
 *   <li>{@code 1000-1019} inclusive range</li>
 *   <li>{@code 20#1000} twenty consecutive seeds starting at 1000</li>
 *   <li>{@code 42} a single seed</li>
 * </ul>
 */
public final class SeedSpecParser {
    private static final int MAX_SEEDS = 100_000;

    private SeedSpecParser() {}

    public static List<Long> parse(String spec) {
        if (spec == null || spec.isBlank()) {
            throw new IllegalArgumentException("Seed specification is empty");
        }
        String trimmed = spec.trim();
        try {
            if (trimmed.contains("#")) {
                String[] parts = trimmed.split("#", 2);
                int count = Integer.parseInt(parts[0].trim());
                long start = Long.parseLong(parts[1].trim());
                if (count <= 0) {
                    throw new IllegalArgumentException("Seed count must be positive: " + spec);
                }
                return consecutive(start, count, spec);
            }
            if (trimmed.contains(",")) {
                var seeds = new ArrayList<Long>();
                for (String part : trimmed.split(",")) {
                    if (!part.isBlank()) {
                        seeds.add(Long.parseLong(part.trim()));
                    }
                }
                if (seeds.isEmpty()) {
                    throw new IllegalArgumentException("Seed list is empty: " + spec);
                }
                return List.copyOf(seeds);
            }
            int dash = trimmed.indexOf('-', 1);
            if (dash > 0) {
                long start = Long.parseLong(trimmed.substring(0, dash).trim());
                long end = Long.parseLong(trimmed.substring(dash + 1).trim());
                if (end < start) {
                    throw new IllegalArgumentException("Seed range end is before its start: " + spec);
                }
                if (end - start >= MAX_SEEDS) {
                    throw new IllegalArgumentException("Seed range is too large: " + spec);
                }
                return consecutive(start, (int) (end - start + 1), spec);
            }
            return List.of(Long.parseLong(trimmed));
        } catch (NumberFormatException ex) {
            throw new IllegalArgumentException("Invalid seed specification: " + spec, ex);
        }
    }

    private static List<Long> consecutive(long start, int count, String spec) {
        if (count > MAX_SEEDS) {
            throw new IllegalArgumentException("Seed range is too large: " + spec);
        }
        var seeds = new ArrayList<Long>(count);
        for (int i = 0; i < count; i++) {
            seeds.add(start + i);
        }
        return List.copyOf(seeds);
    }
}
