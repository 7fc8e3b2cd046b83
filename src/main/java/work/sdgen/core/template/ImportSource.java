package work.sdgen.core.template;

/**
 * One source of an import: a document reference or an inline variation value.
 */
public record ImportSource(String reference, boolean inline) {
    public static ImportSource of(String raw) {
        String trimmed = raw.trim();
        return new ImportSource(trimmed, isInline(trimmed));
    }

    public static boolean isInline(String raw) {
        if (raw.startsWith("\"") || raw.startsWith("'")) {
            return true;
        }
        return !(raw.endsWith(".yaml") || raw.endsWith(".yml"));
    }

    /**
     * Inline value without surrounding quotes.
     */
    public String inlineValue() {
        String value = reference;
        if (value.length() >= 2
            && (value.startsWith("\"") && value.endsWith("\"") || value.startsWith("'") && value.endsWith("'"))) {
            value = value.substring(1, value.length() - 1);
        }
        return value;
    }
}
