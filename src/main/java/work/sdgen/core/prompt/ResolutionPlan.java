package work.sdgen.core.prompt;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import work.sdgen.core.template.Placeholder;

/**
 * Output of loading and resolution: template texts, their placeholders and the candidate set of every axis.
 */
public record ResolutionPlan(
    String template,
    String negativePrompt,
    List<Placeholder> placeholders,
    List<Placeholder> negativePlaceholders,
    List<Axis> axes,
    Map<String, ChunkBinding> chunkBindings
) {
    public ResolutionPlan {
        Objects.requireNonNull(template, "template");
        Objects.requireNonNull(negativePrompt, "negativePrompt");
        placeholders = List.copyOf(placeholders);
        negativePlaceholders = List.copyOf(negativePlaceholders);
        axes = List.copyOf(axes);
        chunkBindings = Collections.unmodifiableMap(new LinkedHashMap<>(chunkBindings));
    }

    public Optional<Axis> axis(String name) {
        return axes.stream().filter(axis -> axis.name().equals(name)).findFirst();
    }

    public List<Axis> loopedAxes() {
        return axes.stream().filter(axis -> !axis.isFloating()).toList();
    }

    public List<Axis> floatingAxes() {
        return axes.stream().filter(Axis::isFloating).toList();
    }

    /**
     * Size of the Cartesian product of the looped axes, saturating at {@link Long#MAX_VALUE}. Zero when any axis,
     * floating or not, has no candidate.
     */
    public long combinationSpace() {
        if (axes.stream().anyMatch(axis -> axis.size() == 0)) {
            return 0L;
        }
        long total = 1L;
        for (Axis axis : loopedAxes()) {
            if (axis.size() == 0) {
                return 0L;
            }
            if (total > Long.MAX_VALUE / axis.size()) {
                return Long.MAX_VALUE;
            }
            total *= axis.size();
        }
        return total;
    }
}
