package work.sdgen.core.batch;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import work.sdgen.core.prompt.ResolvedPrompt;

/**
 * Payload for one image submission.
 */
public record GenerationRequest(
    int index,
    String prompt,
    String negativePrompt,
    long seed,
    String filename,
    Map<String, Object> parameters
) {
    public GenerationRequest {
        Objects.requireNonNull(prompt, "prompt");
        Objects.requireNonNull(negativePrompt, "negativePrompt");
        Objects.requireNonNull(filename, "filename");
        parameters = Collections.unmodifiableMap(new LinkedHashMap<>(parameters));
    }

    public static GenerationRequest of(ResolvedPrompt prompt, Map<String, Object> parameters) {
        return new GenerationRequest(
            prompt.index(),
            prompt.prompt(),
            prompt.negativePrompt(),
            prompt.seed(),
            prompt.filename(),
            parameters
        );
    }

    /**
     * Flat payload: generation parameters with prompt, negative prompt and seed on top.
     */
    public Map<String, Object> toPayload() {
        var payload = new LinkedHashMap<String, Object>(parameters);
        payload.put("prompt", prompt);
        payload.put("negative_prompt", negativePrompt);
        payload.put("seed", seed);
        return payload;
    }
}
