package work.sdgen.core.template;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * A {@code {...}} occurrence in a template body, with its position in the text.
 */
public record Placeholder(
    String token,
    String name,
    Optional<String> selectorExpression,
    List<ChunkOverride> overrides,
    int start,
    int end
) {
    public static final String PROMPT = "prompt";
    public static final String NEGATIVE_PROMPT = "negprompt";

    public Placeholder {
        Objects.requireNonNull(token, "token");
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(selectorExpression, "selectorExpression");
        overrides = List.copyOf(overrides);
    }

    public boolean isReserved() {
        return (PROMPT.equals(name) || NEGATIVE_PROMPT.equals(name))
            && selectorExpression.isEmpty()
            && overrides.isEmpty();
    }

    public boolean hasOverrides() {
        return !overrides.isEmpty();
    }
}
