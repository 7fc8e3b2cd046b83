package work.sdgen.core.template;

import java.util.Objects;
import java.util.Optional;

/**
 * One inline override of a chunk placeholder ({@code {Hero with Ethnicity[limit:2], outfit.main="dress"}}).
 */
public record ChunkOverride(
    Kind kind,
    String fieldPath,
    String source,
    Optional<String> selectorExpression,
    String literal
) {
    public enum Kind {
        /** {@code Source[sel]}: each entry assigns several fields. */
        MULTI_FIELD,
        /** {@code field.path=Source[sel]}: each entry assigns one field. */
        FIELD,
        /** {@code field.path="text"}: fixed value. */
        LITERAL
    }

    public ChunkOverride {
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(selectorExpression, "selectorExpression");
    }

    public static ChunkOverride multiField(String source, Optional<String> selector) {
        return new ChunkOverride(Kind.MULTI_FIELD, null, source, selector, null);
    }

    public static ChunkOverride field(String fieldPath, String source, Optional<String> selector) {
        return new ChunkOverride(Kind.FIELD, fieldPath, source, selector, null);
    }

    public static ChunkOverride literal(String fieldPath, String literal) {
        return new ChunkOverride(Kind.LITERAL, fieldPath, null, Optional.empty(), literal);
    }

    public boolean isSourced() {
        return kind != Kind.LITERAL;
    }

    /**
     * Generation axis driven by this override, e.g. {@code Hero.Ethnicity} or {@code Hero.outfit.main}.
     */
    public String axisName(String chunkSymbol) {
        return chunkSymbol + "." + (kind == Kind.MULTI_FIELD ? source : fieldPath);
    }
}
