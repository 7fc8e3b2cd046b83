package work.sdgen.core.shared;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.text.Normalizer;
import java.util.HexFormat;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * String helpers shared by filename generation, session naming and import key generation.
 */
public final class TextNormalizer {
    private static final Pattern DIACRITICS = Pattern.compile("\\p{M}+");
    private static final Pattern NON_ALNUM = Pattern.compile("[^A-Za-z0-9]+");
    private static final Pattern UNSAFE_NAME = Pattern.compile("[^A-Za-z0-9_-]+");
    private static final Pattern COMMA_RUNS = Pattern.compile(",\\s*(,\\s*)+");
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");
    private static final Pattern SPACE_BEFORE_COMMA = Pattern.compile(" +,");
    private static final Pattern EDGE_SEPARATORS = Pattern.compile("^[,\\s]+|[,\\s]+$");

    private TextNormalizer() {}

    /**
     * Turns arbitrary text into an ASCII UpperCamel token, e.g. {@code "très souriant!"} becomes
     * {@code "TresSouriant"}. The result is truncated to {@code maxLength} characters.
     */
    public static String upperCamel(String value, int maxLength) {
        if (value == null) {
            return "";
        }
        String ascii = DIACRITICS.matcher(Normalizer.normalize(value, Normalizer.Form.NFD)).replaceAll("");
        var builder = new StringBuilder();
        for (String word : NON_ALNUM.split(ascii)) {
            if (word.isEmpty()) {
                continue;
            }
            builder.append(Character.toUpperCase(word.charAt(0)));
            builder.append(word.substring(1).toLowerCase(Locale.ROOT));
        }
        return builder.length() > maxLength ? builder.substring(0, maxLength) : builder.toString();
    }

    /**
     * Keeps letters, digits, dashes and underscores; everything else collapses into a single underscore.
     */
    public static String safeName(String value) {
        if (value == null) {
            return "";
        }
        String ascii = DIACRITICS.matcher(Normalizer.normalize(value.trim(), Normalizer.Form.NFD)).replaceAll("");
        String cleaned = UNSAFE_NAME.matcher(ascii).replaceAll("_");
        return cleaned.replaceAll("^_+|_+$", "");
    }

    /**
     * Flattens rendered prompt text onto one line and removes empty comma-separated slots.
     */
    public static String cleanPrompt(String text) {
        if (text == null) {
            return "";
        }
        String result = WHITESPACE.matcher(text).replaceAll(" ");
        result = COMMA_RUNS.matcher(result).replaceAll(", ");
        result = SPACE_BEFORE_COMMA.matcher(result).replaceAll(",");
        return EDGE_SEPARATORS.matcher(result).replaceAll("");
    }

    public static String md5Short(String value) {
        try {
            var digest = MessageDigest.getInstance("MD5").digest(value.getBytes(StandardCharsets.UTF_8));
            return HexFormat.of().formatHex(digest).substring(0, 8);
        } catch (NoSuchAlgorithmException ex) {
            throw new IllegalStateException("MD5 digest unavailable", ex);
        }
    }
}
