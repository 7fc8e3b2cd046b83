package work.sdgen.core.error;

import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Fatal failure of the structural resolution (inheritance graph, references, imports, document shape).
 */
public final class StructuralException extends SdgenException {
    public enum Kind {
        CYCLE,
        MISSING_REFERENCE,
        UNRESOLVED_IMPORT,
        INVALID_DOCUMENT,
        INVALID_OVERRIDE
    }

    private final Kind kind;

    private StructuralException(Kind kind, String message, Map<String, Object> details, Throwable cause) {
        super("structural." + kind.name().toLowerCase(Locale.ROOT), message, details, cause);
        this.kind = kind;
    }

    public Kind kind() {
        return kind;
    }

    public static StructuralException cycle(List<String> path) {
        return new StructuralException(
            Kind.CYCLE,
            "Inheritance cycle detected: " + String.join(" -> ", path),
            detailsOf("path", List.copyOf(path)),
            null
        );
    }

    public static StructuralException missingReference(String document, String field, String reference) {
        return new StructuralException(
            Kind.MISSING_REFERENCE,
            "Referenced document '" + reference + "' not found (" + field + " in " + document + ")",
            detailsOf("document", document, "field", field, "reference", reference),
            null
        );
    }

    public static StructuralException unresolvedImport(String document, String symbol) {
        return new StructuralException(
            Kind.UNRESOLVED_IMPORT,
            "Placeholder '" + symbol + "' is not declared in the imports of " + document,
            detailsOf("document", document, "symbol", symbol),
            null
        );
    }

    public static StructuralException invalidDocument(String document, String message) {
        return invalidDocument(document, message, null);
    }

    public static StructuralException invalidDocument(String document, String message, Throwable cause) {
        return new StructuralException(
            Kind.INVALID_DOCUMENT,
            "Invalid document " + document + ": " + message,
            detailsOf("document", document),
            cause
        );
    }

    public static StructuralException invalidOverride(String placeholder, String field, String message) {
        return new StructuralException(
            Kind.INVALID_OVERRIDE,
            "Invalid override in {" + placeholder + "}: " + message,
            detailsOf("placeholder", placeholder, "field", field),
            null
        );
    }
}
