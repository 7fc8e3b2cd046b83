package work.sdgen.core.template;

import java.util.ArrayList;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import work.sdgen.core.shared.TextNormalizer;
import work.sdgen.core.variation.FieldValue;

/**
 * Renders a chunk's {@code output} text from effective field values.
 */
public final class ChunkRenderer {
    private static final Pattern FIELD_REFERENCE = Pattern.compile("\\{([A-Za-z_][A-Za-z0-9_]*(?:\\.[A-Za-z_][A-Za-z0-9_]*)*)}");

    private ChunkRenderer() {}

    public static String render(ResolvedChunk chunk, Map<String, FieldValue> fields) {
        if (chunk.output().isEmpty()) {
            var values = new ArrayList<String>();
            for (FieldValue value : fields.values()) {
                if (!value.value().isBlank()) {
                    values.add(value.value().trim());
                }
            }
            return String.join(", ", values);
        }
        Matcher matcher = FIELD_REFERENCE.matcher(chunk.output().get());
        var rendered = new StringBuilder();
        while (matcher.find()) {
            FieldValue value = fields.get(matcher.group(1));
            matcher.appendReplacement(rendered, Matcher.quoteReplacement(value == null ? "" : value.value()));
        }
        matcher.appendTail(rendered);
        return TextNormalizer.cleanPrompt(rendered.toString());
    }
}
