package work.sdgen.core.prompt;

import java.util.List;

public record GenerationResult(List<ResolvedPrompt> prompts, GenerationStatistics statistics) {
    public GenerationResult {
        prompts = List.copyOf(prompts);
    }
}
