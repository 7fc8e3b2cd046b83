package work.sdgen.core.variation;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import work.sdgen.core.error.SelectorException;

/**
 * Parses selector expressions such as {@code limit:4}, {@code indexes:0,2;$5} or {@code happy,sad}.
 * Parts are separated by {@code ;}; a part starting with {@code $} is the loop weight, and {@code $0} takes the
 * placeholder out of the combinatorial loops. The short forms {@code 15} and {@code #1,3,5} stand for
 * {@code random:15} and {@code indexes:1,3,5}.
 */
public final class SelectorParser {
    private SelectorParser() {}

    public static ParsedSelector parse(String placeholder, String expression) {
        if (expression == null || expression.isBlank()) {
            return ParsedSelector.all();
        }
        Selector selector = null;
        Optional<Double> weight = Optional.empty();
        for (String rawPart : expression.split(";")) {
            String part = rawPart.trim();
            if (part.isEmpty()) {
                continue;
            }
            if (part.startsWith("$")) {
                if (weight.isPresent()) {
                    throw SelectorException.invalidSyntax(placeholder, expression, "weight declared twice");
                }
                weight = Optional.of(parseWeight(placeholder, expression, part.substring(1).trim()));
                continue;
            }
            if (selector != null) {
                throw SelectorException.invalidSyntax(placeholder, expression, "only one selector is allowed");
            }
            selector = parseSelector(placeholder, expression, part);
        }
        return new ParsedSelector(selector == null ? Selector.all() : selector, weight);
    }

    private static double parseWeight(String placeholder, String expression, String raw) {
        try {
            double weight = Double.parseDouble(raw);
            if (!(weight >= 0) || Double.isInfinite(weight)) {
                throw SelectorException.invalidSyntax(placeholder, expression, "weight must be zero or positive");
            }
            return weight;
        } catch (NumberFormatException ex) {
            throw SelectorException.invalidSyntax(placeholder, expression, "weight '" + raw + "' is not a number");
        }
    }

    private static Selector parseSelector(String placeholder, String expression, String part) {
        if (part.startsWith("#")) {
            return Selector.indexes(parseIndexes(placeholder, expression, part.substring(1)));
        }
        if (isDigits(part)) {
            return Selector.random(parseCount(placeholder, expression, part));
        }
        int colon = part.indexOf(':');
        String head = (colon < 0 ? part : part.substring(0, colon)).trim().toLowerCase(Locale.ROOT);
        String argument = colon < 0 ? "" : part.substring(colon + 1).trim();
        switch (head) {
            case "all":
                if (colon >= 0) {
                    throw SelectorException.invalidSyntax(placeholder, expression, "'all' takes no argument");
                }
                return Selector.all();
            case "random":
                return Selector.random(parseCount(placeholder, expression, argument));
            case "limit":
                return Selector.limit(parseCount(placeholder, expression, argument));
            case "indexes":
                return Selector.indexes(parseIndexes(placeholder, expression, argument));
            case "range":
                return parseRange(placeholder, expression, argument);
            default:
                if (colon >= 0) {
                    throw SelectorException.invalidSyntax(placeholder, expression, "unknown selector '" + head + "'");
                }
                return Selector.keys(parseKeys(placeholder, expression, part));
        }
    }

    private static int parseCount(String placeholder, String expression, String raw) {
        try {
            int count = Integer.parseInt(raw);
            if (count <= 0) {
                throw SelectorException.invalidSyntax(placeholder, expression, "count must be positive");
            }
            return count;
        } catch (NumberFormatException ex) {
            throw SelectorException.invalidSyntax(placeholder, expression, "count '" + raw + "' is not an integer");
        }
    }

    private static List<Integer> parseIndexes(String placeholder, String expression, String raw) {
        var indexes = new ArrayList<Integer>();
        for (String item : raw.split(",")) {
            if (item.isBlank()) {
                continue;
            }
            try {
                int index = Integer.parseInt(item.trim());
                if (index < 0) {
                    throw SelectorException.invalidSyntax(placeholder, expression, "index must not be negative");
                }
                indexes.add(index);
            } catch (NumberFormatException ex) {
                throw SelectorException.invalidSyntax(placeholder, expression, "index '" + item.trim() + "' is not an integer");
            }
        }
        if (indexes.isEmpty()) {
            throw SelectorException.invalidSyntax(placeholder, expression, "no index given");
        }
        return indexes;
    }

    private static Selector parseRange(String placeholder, String expression, String raw) {
        String[] bounds = raw.split("-");
        if (bounds.length != 2) {
            throw SelectorException.invalidSyntax(placeholder, expression, "range must look like a-b");
        }
        try {
            int start = Integer.parseInt(bounds[0].trim());
            int end = Integer.parseInt(bounds[1].trim());
            if (start < 0 || end < start) {
                throw SelectorException.invalidSyntax(placeholder, expression, "range bounds are invalid");
            }
            return Selector.range(start, end);
        } catch (NumberFormatException ex) {
            throw SelectorException.invalidSyntax(placeholder, expression, "range bounds must be integers");
        }
    }

    private static boolean isDigits(String part) {
        for (int i = 0; i < part.length(); i++) {
            if (!Character.isDigit(part.charAt(i))) {
                return false;
            }
        }
        return !part.isEmpty();
    }

    private static List<String> parseKeys(String placeholder, String expression, String raw) {
        var keys = new ArrayList<String>();
        for (String item : raw.split(",")) {
            if (!item.isBlank()) {
                keys.add(item.trim());
            }
        }
        if (keys.isEmpty()) {
            throw SelectorException.invalidSyntax(placeholder, expression, "no key given");
        }
        return keys;
    }
}
