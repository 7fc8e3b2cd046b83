package work.sdgen.core.prompt;

import java.util.Locale;
import java.util.Optional;

/**
 * Seed assignment strategy applied after combinations are selected.
 */
public enum SeedMode {
    FIXED,
    PROGRESSIVE,
    RANDOM,
    SWEEP;

    public static Optional<SeedMode> parse(String value) {
        if (value == null || value.isBlank()) {
            return Optional.empty();
        }
        try {
            return Optional.of(valueOf(value.trim().toUpperCase(Locale.ROOT)));
        } catch (IllegalArgumentException ex) {
            return Optional.empty();
        }
    }

    public boolean needsBaseSeed() {
        return this == FIXED || this == PROGRESSIVE;
    }

    public String label() {
        return name().toLowerCase(Locale.ROOT);
    }
}
