package work.sdgen.core.error;

import java.util.Locale;
import java.util.Map;

/**
 * Selector evaluation failure; always names the offending placeholder.
 */
public final class SelectorException extends SdgenException {
    public enum Kind {
        INSUFFICIENT_ENTRIES,
        INDEX_OUT_OF_RANGE,
        UNKNOWN_KEY,
        INVALID_SYNTAX
    }

    private final Kind kind;
    private final String placeholder;

    private SelectorException(Kind kind, String placeholder, String message, Map<String, Object> details) {
        super("selector." + kind.name().toLowerCase(Locale.ROOT), message, details);
        this.kind = kind;
        this.placeholder = placeholder;
    }

    public Kind kind() {
        return kind;
    }

    public String placeholder() {
        return placeholder;
    }

    public static SelectorException insufficientEntries(String placeholder, int requested, int available) {
        return new SelectorException(
            Kind.INSUFFICIENT_ENTRIES,
            placeholder,
            "Placeholder '" + placeholder + "' requests " + requested + " entries but only " + available + " exist",
            detailsOf("placeholder", placeholder, "requested", requested, "available", available)
        );
    }

    public static SelectorException indexOutOfRange(String placeholder, int index, int available) {
        return new SelectorException(
            Kind.INDEX_OUT_OF_RANGE,
            placeholder,
            "Placeholder '" + placeholder + "' index " + index + " is out of range (size " + available + ")",
            detailsOf("placeholder", placeholder, "index", index, "available", available)
        );
    }

    public static SelectorException unknownKey(String placeholder, String key) {
        return new SelectorException(
            Kind.UNKNOWN_KEY,
            placeholder,
            "Placeholder '" + placeholder + "' has no entry with key '" + key + "'",
            detailsOf("placeholder", placeholder, "key", key)
        );
    }

    public static SelectorException invalidSyntax(String placeholder, String expression, String message) {
        return new SelectorException(
            Kind.INVALID_SYNTAX,
            placeholder,
            "Invalid selector '" + expression + "' on '" + placeholder + "': " + message,
            detailsOf("placeholder", placeholder, "expression", expression)
        );
    }
}
