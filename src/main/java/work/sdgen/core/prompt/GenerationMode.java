package work.sdgen.core.prompt;

import java.util.Locale;
import java.util.Optional;

/**
 * How candidate sets become concrete combinations.
 */
public enum GenerationMode {
    COMBINATORIAL,
    RANDOM;

    public static Optional<GenerationMode> parse(String value) {
        if (value == null || value.isBlank()) {
            return Optional.empty();
        }
        try {
            return Optional.of(valueOf(value.trim().toUpperCase(Locale.ROOT)));
        } catch (IllegalArgumentException ex) {
            return Optional.empty();
        }
    }

    public String label() {
        return name().toLowerCase(Locale.ROOT);
    }
}
