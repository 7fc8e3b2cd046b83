package work.sdgen.core.prompt;

import java.util.List;
import java.util.Map;
import work.sdgen.core.shared.TextNormalizer;

/**
 * Deterministic image file names: {@code 003_Expression-Smiling.png}.
 */
public final class FilenameGenerator {
    private static final int MAX_COMPONENT = 50;

    private final List<String> filenameKeys;

    public FilenameGenerator(List<String> filenameKeys) {
        this.filenameKeys = List.copyOf(filenameKeys);
    }

    /**
     * @param index zero-based position in generation order
     * @param keys  chosen entry key per axis
     */
    public String filename(int index, Map<String, String> keys) {
        var name = new StringBuilder(String.format("%03d", index + 1));
        for (String axis : filenameKeys) {
            String key = keys.get(axis);
            if (key == null) {
                continue;
            }
            name.append('_')
                .append(TextNormalizer.upperCamel(axis, MAX_COMPONENT))
                .append('-')
                .append(TextNormalizer.upperCamel(key, MAX_COMPONENT));
        }
        return name.append(".png").toString();
    }
}
