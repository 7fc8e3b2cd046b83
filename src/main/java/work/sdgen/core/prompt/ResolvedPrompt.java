package work.sdgen.core.prompt;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Final prompt, negative prompt, chosen entries and seed of one image. {@code index} is zero-based.
 */
public record ResolvedPrompt(
    int index,
    String prompt,
    String negativePrompt,
    long seed,
    Map<String, String> keys,
    Map<String, String> values,
    String filename
) {
    public ResolvedPrompt {
        Objects.requireNonNull(prompt, "prompt");
        Objects.requireNonNull(negativePrompt, "negativePrompt");
        Objects.requireNonNull(filename, "filename");
        keys = Collections.unmodifiableMap(new LinkedHashMap<>(keys));
        values = Collections.unmodifiableMap(new LinkedHashMap<>(values));
    }

    public Map<String, Object> toSerializableMap() {
        var map = new LinkedHashMap<String, Object>();
        map.put("index", index);
        map.put("seed", seed);
        map.put("filename", filename);
        map.put("prompt", prompt);
        map.put("negative_prompt", negativePrompt);
        map.put("keys", keys);
        return map;
    }
}
