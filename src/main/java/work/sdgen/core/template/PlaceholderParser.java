package work.sdgen.core.template;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import work.sdgen.core.error.SelectorException;

/**
 * Scans template text for placeholders. Brackets and quotes may contain commas and braces.
 */
public final class PlaceholderParser {
    private static final String NAME = "[A-Za-z_][A-Za-z0-9_]*";
    private static final String FIELD_PATH = NAME + "(?:\\." + NAME + ")*";
    private static final Pattern SIMPLE = Pattern.compile("(" + NAME + ")\\s*(?:\\[(.*)])?", Pattern.DOTALL);
    private static final Pattern WITH = Pattern.compile("(" + NAME + ")\\s+with\\s+(.+)", Pattern.DOTALL);
    private static final Pattern LITERAL = Pattern.compile("(" + FIELD_PATH + ")\\s*=\\s*(\"(.*)\"|'(.*)')", Pattern.DOTALL);
    private static final Pattern SOURCED = Pattern.compile("(" + FIELD_PATH + ")\\s*=\\s*(" + NAME + ")\\s*(?:\\[(.*)])?", Pattern.DOTALL);

    private PlaceholderParser() {}

    public static List<Placeholder> parse(String text) {
        var placeholders = new ArrayList<Placeholder>();
        if (text == null) {
            return placeholders;
        }
        int i = 0;
        while (i < text.length()) {
            char c = text.charAt(i);
            if (c == '}') {
                throw SelectorException.invalidSyntax(excerpt(text, i), excerpt(text, i), "unbalanced '}'");
            }
            if (c != '{') {
                i++;
                continue;
            }
            int close = findClose(text, i);
            String token = text.substring(i, close + 1);
            placeholders.add(parseToken(token, i, close + 1));
            i = close + 1;
        }
        return placeholders;
    }

    private static int findClose(String text, int open) {
        int brackets = 0;
        char quote = 0;
        for (int i = open + 1; i < text.length(); i++) {
            char c = text.charAt(i);
            if (quote != 0) {
                if (c == quote) {
                    quote = 0;
                }
                continue;
            }
            switch (c) {
                case '"', '\'' -> {
                    if (brackets == 0) {
                        quote = c;
                    }
                }
                case '[' -> brackets++;
                case ']' -> brackets--;
                case '{' -> {
                    if (brackets == 0) {
                        throw SelectorException.invalidSyntax(excerpt(text, open), excerpt(text, open), "nested '{'");
                    }
                }
                case '}' -> {
                    if (brackets == 0) {
                        return i;
                    }
                }
                default -> {
                }
            }
        }
        throw SelectorException.invalidSyntax(excerpt(text, open), excerpt(text, open), "unclosed '{'");
    }

    private static Placeholder parseToken(String token, int start, int end) {
        String inner = token.substring(1, token.length() - 1).trim();
        Matcher with = WITH.matcher(inner);
        if (with.matches()) {
            var overrides = new ArrayList<ChunkOverride>();
            for (String item : splitTopLevel(with.group(2))) {
                overrides.add(parseOverride(token, item.trim()));
            }
            if (overrides.isEmpty()) {
                throw SelectorException.invalidSyntax(token, token, "'with' requires at least one override");
            }
            return new Placeholder(token, with.group(1), Optional.empty(), overrides, start, end);
        }
        Matcher simple = SIMPLE.matcher(inner);
        if (simple.matches()) {
            return new Placeholder(token, simple.group(1), Optional.ofNullable(simple.group(2)).map(String::trim), List.of(), start, end);
        }
        throw SelectorException.invalidSyntax(token, token, "malformed placeholder");
    }

    private static ChunkOverride parseOverride(String token, String item) {
        Matcher literal = LITERAL.matcher(item);
        if (literal.matches()) {
            String value = literal.group(3) != null ? literal.group(3) : literal.group(4);
            return ChunkOverride.literal(literal.group(1), value);
        }
        Matcher sourced = SOURCED.matcher(item);
        if (sourced.matches()) {
            return ChunkOverride.field(sourced.group(1), sourced.group(2), Optional.ofNullable(sourced.group(3)).map(String::trim));
        }
        Matcher simple = SIMPLE.matcher(item);
        if (simple.matches()) {
            return ChunkOverride.multiField(simple.group(1), Optional.ofNullable(simple.group(2)).map(String::trim));
        }
        throw SelectorException.invalidSyntax(token, item, "malformed override");
    }

    static List<String> splitTopLevel(String text) {
        var parts = new ArrayList<String>();
        int brackets = 0;
        char quote = 0;
        int from = 0;
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (quote != 0) {
                if (c == quote) {
                    quote = 0;
                }
            } else if (c == '"' || c == '\'') {
                quote = c;
            } else if (c == '[') {
                brackets++;
            } else if (c == ']') {
                brackets--;
            } else if (c == ',' && brackets == 0) {
                parts.add(text.substring(from, i));
                from = i + 1;
            }
        }
        parts.add(text.substring(from));
        parts.removeIf(String::isBlank);
        return parts;
    }

    private static String excerpt(String text, int at) {
        int end = Math.min(text.length(), at + 30);
        return text.substring(at, end);
    }
}
