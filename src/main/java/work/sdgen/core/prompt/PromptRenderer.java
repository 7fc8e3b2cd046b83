package work.sdgen.core.prompt;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import work.sdgen.core.shared.TextNormalizer;
import work.sdgen.core.template.ChunkRenderer;
import work.sdgen.core.template.Placeholder;
import work.sdgen.core.variation.FieldValue;
import work.sdgen.core.variation.VariationEntry;
import work.sdgen.core.variation.VariationExpander;

/**
 * Substitutes one combination of entries into the template texts.
 */
final class PromptRenderer {
    private final ResolutionPlan plan;

    PromptRenderer(ResolutionPlan plan) {
        this.plan = plan;
    }

    String prompt(Map<String, VariationEntry> selection) {
        return render(plan.template(), plan.placeholders(), selection);
    }

    String negativePrompt(Map<String, VariationEntry> selection) {
        return render(plan.negativePrompt(), plan.negativePlaceholders(), selection);
    }

    private String render(String text, List<Placeholder> placeholders, Map<String, VariationEntry> selection) {
        var builder = new StringBuilder();
        int position = 0;
        for (Placeholder placeholder : placeholders) {
            builder.append(text, position, placeholder.start());
            builder.append(valueOf(placeholder, selection));
            position = placeholder.end();
        }
        builder.append(text.substring(position));
        return TextNormalizer.cleanPrompt(builder.toString());
    }

    /**
     * Multi-field entries may carry fields the chunk does not declare; those are dropped.
     */
    private String valueOf(Placeholder placeholder, Map<String, VariationEntry> selection) {
        if (placeholder.isReserved()) {
            return "";
        }
        ChunkBinding binding = plan.chunkBindings().get(placeholder.token());
        if (binding == null) {
            return selection.get(placeholder.name()).text();
        }
        var assignments = new ArrayList<Map<String, FieldValue>>();
        for (ChunkBinding.BoundOverride bound : binding.overrides()) {
            VariationEntry entry = bound.axis().map(selection::get).orElse(null);
            var expanded = VariationExpander.expand(binding.symbol(), bound.override(), entry);
            expanded.keySet().removeIf(field -> !binding.chunk().declares(field));
            assignments.add(expanded);
        }
        return ChunkRenderer.render(binding.chunk(), VariationExpander.merge(binding.chunk().fields(), assignments));
    }
}
