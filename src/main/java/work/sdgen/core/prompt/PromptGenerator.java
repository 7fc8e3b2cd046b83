package work.sdgen.core.prompt;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Random;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import work.sdgen.core.error.ConfigException;
import work.sdgen.core.variation.VariationEntry;

/**
 * Expands a resolution plan into resolved prompts, combinatorially or by sampling without duplicates.
 * Floating ({@code $0}) axes do not take part in either; they are drawn once per combination.
 */
public final class PromptGenerator {
    private static final Logger log = LoggerFactory.getLogger(PromptGenerator.class);
    static final int ATTEMPT_MULTIPLIER = 10;
    static final long MAX_UNCAPPED_COMBINATIONS = 100_000L;

    private final Random random;

    public PromptGenerator(Random random) {
        this.random = random;
    }

    public GenerationResult generate(ResolutionPlan plan, GenerationSettings settings) {
        long started = System.nanoTime();
        var seeds = new SeedAssigner(settings, random);
        int perCombination = seeds.seedsPerCombination();
        int cap = settings.maxImages().orElse(Integer.MAX_VALUE);

        List<Axis> order = plan.loopedAxes();
        List<Axis> floating = plan.floatingAxes();
        List<int[]> combinations;
        int attempts;
        boolean exhausted = false;
        if (plan.combinationSpace() == 0) {
            combinations = List.of();
            attempts = 0;
        } else if (settings.mode() == GenerationMode.COMBINATORIAL) {
            if (settings.weightedOrdering()) {
                order = new ArrayList<>(order);
                order.sort(Comparator.comparingDouble(Axis::weight));
            }
            long space = plan.combinationSpace();
            if (settings.maxImages().isEmpty() && space > MAX_UNCAPPED_COMBINATIONS) {
                throw ConfigException.single("generation.max_images",
                    "combination space of " + space + " needs a max_images cap");
            }
            int wanted = ceilDiv(cap, perCombination);
            combinations = cartesian(order, wanted);
            attempts = combinations.size();
        } else {
            int target = ceilDiv(cap, perCombination);
            int budget = settings.maxAttempts().orElse((int) Math.min(Integer.MAX_VALUE, (long) target * ATTEMPT_MULTIPLIER));
            var sampled = sample(order, target, budget);
            combinations = sampled.combinations;
            attempts = sampled.attempts;
            exhausted = combinations.size() < target;
            if (exhausted) {
                log.warn("Random sampling produced {} of {} combinations after {} attempts",
                    combinations.size(), target, attempts);
            }
        }

        var renderer = new PromptRenderer(plan);
        var filenames = new FilenameGenerator(settings.filenameKeys());
        var prompts = new ArrayList<ResolvedPrompt>();
        var distribution = new LinkedHashMap<String, Map<String, Integer>>();
        plan.axes().forEach(axis -> distribution.put(axis.name(), new LinkedHashMap<>()));
        for (int[] combination : combinations) {
            var selection = new LinkedHashMap<String, VariationEntry>();
            for (int i = 0; i < order.size(); i++) {
                selection.put(order.get(i).name(), order.get(i).candidates().get(combination[i]));
            }
            for (Axis axis : floating) {
                selection.put(axis.name(), axis.candidates().get(random.nextInt(axis.size())));
            }
            var keys = new LinkedHashMap<String, String>();
            var values = new LinkedHashMap<String, String>();
            for (Axis axis : plan.axes()) {
                VariationEntry entry = selection.get(axis.name());
                keys.put(axis.name(), entry.key());
                values.put(axis.name(), entry.text());
            }
            String prompt = renderer.prompt(selection);
            String negative = renderer.negativePrompt(selection);
            for (int slot = 0; slot < perCombination && prompts.size() < cap; slot++) {
                int index = prompts.size();
                prompts.add(new ResolvedPrompt(
                    index,
                    prompt,
                    negative,
                    seeds.seedFor(index, slot),
                    keys,
                    values,
                    filenames.filename(index, keys)
                ));
                keys.forEach((axis, key) -> distribution.get(axis).merge(key, 1, Integer::sum));
            }
        }

        var candidates = new LinkedHashMap<String, Integer>();
        plan.axes().forEach(axis -> candidates.put(axis.name(), axis.size()));
        var statistics = new GenerationStatistics(
            settings.mode(),
            candidates,
            plan.combinationSpace(),
            distribution,
            prompts.size(),
            attempts,
            exhausted,
            Duration.ofNanos(System.nanoTime() - started)
        );
        log.info("Generated {} prompts ({} mode, {} possible combinations)",
            prompts.size(), settings.mode().label(), plan.combinationSpace());
        return new GenerationResult(prompts, statistics);
    }

    /**
     * Odometer over the axes; the last axis varies fastest. Stops after {@code limit} combinations.
     */
    static List<int[]> cartesian(List<Axis> axes, int limit) {
        var combinations = new ArrayList<int[]>();
        for (Axis axis : axes) {
            if (axis.size() == 0) {
                return combinations;
            }
        }
        int[] current = new int[axes.size()];
        while (combinations.size() < limit) {
            combinations.add(current.clone());
            int position = axes.size() - 1;
            while (position >= 0) {
                current[position]++;
                if (current[position] < axes.get(position).size()) {
                    break;
                }
                current[position] = 0;
                position--;
            }
            if (position < 0) {
                break;
            }
        }
        return combinations;
    }

    private Sampled sample(List<Axis> axes, int target, int budget) {
        var combinations = new ArrayList<int[]>();
        Set<List<Integer>> seen = new HashSet<>();
        int attempts = 0;
        while (combinations.size() < target && attempts < budget) {
            attempts++;
            int[] draw = new int[axes.size()];
            var key = new ArrayList<Integer>(axes.size());
            for (int i = 0; i < axes.size(); i++) {
                draw[i] = random.nextInt(axes.get(i).size());
                key.add(draw[i]);
            }
            if (seen.add(key)) {
                combinations.add(draw);
            }
        }
        return new Sampled(combinations, attempts);
    }

    private static int ceilDiv(int value, int divisor) {
        return (int) ((value + (long) divisor - 1) / divisor);
    }

    private record Sampled(List<int[]> combinations, int attempts) {}
}
