package work.sdgen.core.prompt;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import work.sdgen.core.error.ConfigException;
import work.sdgen.core.error.SelectorException;
import work.sdgen.core.error.StructuralException;
import work.sdgen.core.template.ChunkOverride;
import work.sdgen.core.template.ImportNamespace;
import work.sdgen.core.template.Placeholder;
import work.sdgen.core.template.PlaceholderParser;
import work.sdgen.core.template.ResolvedChunk;
import work.sdgen.core.template.ResolvedTemplate;
import work.sdgen.core.variation.ParsedSelector;
import work.sdgen.core.variation.SelectorEvaluator;
import work.sdgen.core.variation.SelectorParser;
import work.sdgen.core.variation.VariationFile;

/**
 * Binds placeholders to imports, evaluates selectors and pins fixed placeholders.
 */
public final class PlanBuilder {
    private static final Logger log = LoggerFactory.getLogger(PlanBuilder.class);

    private final SelectorEvaluator evaluator;

    public PlanBuilder(SelectorEvaluator evaluator) {
        this.evaluator = evaluator;
    }

    public ResolutionPlan build(ResolvedTemplate template, ImportNamespace namespace, Map<String, String> fixed) {
        var state = new State(template, namespace);
        List<Placeholder> body = PlaceholderParser.parse(template.template());
        List<Placeholder> negative = PlaceholderParser.parse(template.negativePrompt());
        body.forEach(state::bind);
        negative.forEach(state::bind);

        for (var pin : fixed.entrySet()) {
            Axis axis = state.axes.get(pin.getKey());
            if (axis == null) {
                throw ConfigException.single("use_fixed." + pin.getKey(), "no placeholder named '" + pin.getKey() + "'");
            }
            var entry = axis.file().find(pin.getValue())
                .orElseThrow(() -> SelectorException.unknownKey(pin.getKey(), pin.getValue()));
            state.axes.put(pin.getKey(), axis.pin(entry));
            log.debug("Placeholder {} pinned to {}", pin.getKey(), pin.getValue());
        }
        return new ResolutionPlan(
            template.template(),
            template.negativePrompt(),
            body,
            negative,
            new ArrayList<>(state.axes.values()),
            state.bindings
        );
    }

    private final class State {
        private final ResolvedTemplate template;
        private final ImportNamespace namespace;
        private final Map<String, Axis> axes = new LinkedHashMap<>();
        private final Map<String, Optional<String>> selectors = new LinkedHashMap<>();
        private final Map<String, ChunkBinding> bindings = new LinkedHashMap<>();

        State(ResolvedTemplate template, ImportNamespace namespace) {
            this.template = template;
            this.namespace = namespace;
        }

        void bind(Placeholder placeholder) {
            if (placeholder.isReserved()) {
                return;
            }
            Optional<ResolvedChunk> chunk = namespace.chunk(placeholder.name());
            if (chunk.isPresent()) {
                bindChunk(placeholder, chunk.get());
                return;
            }
            VariationFile file = namespace.variation(placeholder.name())
                .orElseThrow(() -> StructuralException.unresolvedImport(template.displayName(), placeholder.name()));
            if (placeholder.hasOverrides()) {
                throw StructuralException.invalidOverride(placeholder.name(), null, "overrides apply to chunk placeholders only");
            }
            addAxis(placeholder.name(), file, placeholder.selectorExpression());
        }

        private void bindChunk(Placeholder placeholder, ResolvedChunk chunk) {
            if (placeholder.selectorExpression().isPresent()) {
                throw SelectorException.invalidSyntax(placeholder.name(), placeholder.selectorExpression().get(),
                    "chunk placeholders take overrides, not selectors");
            }
            var bound = new ArrayList<ChunkBinding.BoundOverride>();
            for (ChunkOverride override : placeholder.overrides()) {
                if (override.kind() != ChunkOverride.Kind.MULTI_FIELD && !chunk.declares(override.fieldPath())) {
                    throw StructuralException.invalidOverride(placeholder.name(), override.fieldPath(),
                        "chunk " + chunk.name() + " declares no field '" + override.fieldPath() + "'");
                }
                if (!override.isSourced()) {
                    bound.add(new ChunkBinding.BoundOverride(override, Optional.empty()));
                    continue;
                }
                VariationFile file = namespace.variation(override.source())
                    .orElseThrow(() -> StructuralException.unresolvedImport(template.displayName(), override.source()));
                String axisName = override.axisName(placeholder.name());
                addAxis(axisName, file, override.selectorExpression());
                bound.add(new ChunkBinding.BoundOverride(override, Optional.of(axisName)));
            }
            bindings.putIfAbsent(placeholder.token(), new ChunkBinding(placeholder.name(), chunk, bound));
        }

        private void addAxis(String name, VariationFile file, Optional<String> expression) {
            if (axes.containsKey(name)) {
                if (!Objects.equals(selectors.get(name), expression)) {
                    log.warn("Placeholder {} appears with selector {}; keeping the first one ({})",
                        name, expression.orElse("<all>"), selectors.get(name).orElse("<all>"));
                }
                return;
            }
            ParsedSelector parsed = SelectorParser.parse(name, expression.orElse(null));
            var candidates = evaluator.evaluate(name, file, parsed.selector());
            double weight = parsed.weight().orElseGet(() ->
                candidates.stream().mapToDouble(entry -> entry.weight()).average().orElse(1.0));
            axes.put(name, new Axis(name, file, candidates, weight, false));
            selectors.put(name, expression);
        }
    }
}
