package work.sdgen.core.prompt;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.nio.file.Path;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Random;
import java.util.stream.Collectors;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import work.sdgen.core.error.ConfigException;
import work.sdgen.core.error.SelectorException;
import work.sdgen.core.support.SdgenTestSupport;
import work.sdgen.core.template.ChunkRegistry;
import work.sdgen.core.template.DocumentLocator;
import work.sdgen.core.template.ImportResolver;
import work.sdgen.core.template.InheritanceResolver;
import work.sdgen.core.variation.SelectorEvaluator;
import work.sdgen.core.variation.VariationLoader;

class PromptGeneratorTest {
    @TempDir
    Path workspace;

    private static ResolutionPlan plan(Path template, Map<String, String> fixed) {
        var locator = DocumentLocator.relativeOnly();
        var resolved = new InheritanceResolver(locator).resolve(template);
        var namespace = new ImportResolver(locator, new ChunkRegistry(locator), new VariationLoader()).resolve(resolved);
        return new PlanBuilder(new SelectorEvaluator(new Random(7))).build(resolved, namespace, fixed);
    }

    private static GenerationSettings settings(GenerationMode mode, SeedMode seedMode, Integer maxImages) {
        return new GenerationSettings(mode, seedMode, 1000L, List.of(), Optional.ofNullable(maxImages),
            Optional.empty(), false, false, List.of("Expression"));
    }

    private static List<ResolvedPrompt> portrait(GenerationSettings settings) {
        return new PromptGenerator(new Random(11))
            .generate(plan(SdgenTestSupport.portraitTemplate(), Map.of()), settings)
            .prompts();
    }

    @Test
    void combinatorialWalksEveryCombinationLastAxisFastest() {
        var prompts = portrait(settings(GenerationMode.COMBINATORIAL, SeedMode.PROGRESSIVE, null));

        assertEquals(8, prompts.size());
        assertEquals("portrait of a woman, neutral expression, soft light", prompts.get(0).prompt());
        assertEquals("portrait of a woman, neutral expression, backlit", prompts.get(1).prompt());
        assertEquals("portrait of a woman, smiling softly, soft light", prompts.get(2).prompt());
        assertEquals("blurry, lowres", prompts.get(2).negativePrompt());
        assertEquals("003_Expression-Smiling.png", prompts.get(2).filename());
        assertEquals(Map.of("Expression", "smiling", "Lighting", "soft"), prompts.get(2).keys());
        for (int i = 0; i < prompts.size(); i++) {
            assertEquals(i, prompts.get(i).index());
            assertEquals(1000L + i, prompts.get(i).seed());
        }
    }

    @Test
    void capStopsCombinatorialExpansion() {
        var result = new PromptGenerator(new Random(1)).generate(
            plan(SdgenTestSupport.portraitTemplate(), Map.of()),
            settings(GenerationMode.COMBINATORIAL, SeedMode.FIXED, 3));

        assertEquals(3, result.prompts().size());
        assertEquals(8, result.statistics().combinationSpace());
        assertEquals(3, result.statistics().imagesGenerated());
        assertTrue(result.prompts().stream().allMatch(prompt -> prompt.seed() == 1000L));
    }

    @Test
    void randomModeNeverRepeatsACombination() {
        var prompts = portrait(settings(GenerationMode.RANDOM, SeedMode.RANDOM, 6));

        assertEquals(6, prompts.size());
        var distinct = prompts.stream().map(ResolvedPrompt::keys).collect(Collectors.toSet());
        assertEquals(6, distinct.size());
        assertTrue(prompts.stream().allMatch(prompt -> prompt.seed() == -1L));
    }

    @Test
    void randomModeReportsExhaustedAttempts() {
        var result = new PromptGenerator(new Random(3)).generate(
            plan(SdgenTestSupport.portraitTemplate(), Map.of()),
            settings(GenerationMode.RANDOM, SeedMode.RANDOM, 20));

        assertEquals(8, result.prompts().size());
        assertTrue(result.statistics().attemptsExhausted());
        assertEquals(200, result.statistics().attempts());
    }

    @Test
    void drawnRandomSeedsAreUnsigned32Bit() {
        var settings = new GenerationSettings(GenerationMode.COMBINATORIAL, SeedMode.RANDOM, 0L, List.of(),
            Optional.empty(), Optional.empty(), false, true, List.of());
        var prompts = new PromptGenerator(new Random(5))
            .generate(plan(SdgenTestSupport.portraitTemplate(), Map.of()), settings)
            .prompts();

        assertTrue(prompts.stream().allMatch(prompt -> prompt.seed() >= 0 && prompt.seed() <= 0xFFFFFFFFL));
        assertEquals("001.png", prompts.get(0).filename());
    }

    @Test
    void sweepRepeatsEachCombinationPerSeed() {
        var settings = new GenerationSettings(GenerationMode.COMBINATORIAL, SeedMode.SWEEP, 0L, List.of(10L, 20L),
            Optional.empty(), Optional.empty(), false, false, List.of());
        var prompts = new PromptGenerator(new Random(5))
            .generate(plan(SdgenTestSupport.portraitTemplate(), Map.of()), settings)
            .prompts();

        assertEquals(16, prompts.size());
        assertEquals(prompts.get(0).prompt(), prompts.get(1).prompt());
        assertEquals(10L, prompts.get(0).seed());
        assertEquals(20L, prompts.get(1).seed());
        assertEquals(10L, prompts.get(2).seed());
    }

    @Test
    void weightedOrderingPutsHeavyAxesInTheInnerLoop() {
        Path template = SdgenTestSupport.write(workspace, "weighted.prompt.yaml",
            "version: '1'",
            "imports:",
            "  Expression: " + SdgenTestSupport.fixture("portrait", "expression.yaml"),
            "  Lighting: " + SdgenTestSupport.fixture("portrait", "lighting.yaml"),
            "template: '{Expression[limit:2;$5]}, {Lighting[indexes:0,2;$1]}'");
        var settings = new GenerationSettings(GenerationMode.COMBINATORIAL, SeedMode.FIXED, 1L, List.of(),
            Optional.empty(), Optional.empty(), true, false, List.of());

        var prompts = new PromptGenerator(new Random(5)).generate(plan(template, Map.of()), settings).prompts();

        assertEquals(4, prompts.size());
        assertEquals(Map.of("Expression", "neutral", "Lighting", "soft"), prompts.get(0).keys());
        assertEquals(Map.of("Expression", "smiling", "Lighting", "soft"), prompts.get(1).keys());
        assertEquals(Map.of("Expression", "neutral", "Lighting", "backlit"), prompts.get(2).keys());
    }

    @Test
    void zeroWeightAxisIsDrawnPerCombinationOutsideTheLoops() {
        Path template = SdgenTestSupport.write(workspace, "floating.prompt.yaml",
            "version: '1'",
            "imports:",
            "  Expression: " + SdgenTestSupport.fixture("portrait", "expression.yaml"),
            "  Lighting: " + SdgenTestSupport.fixture("portrait", "lighting.yaml"),
            "template: '{Expression[limit:2;$2]}, {Lighting[$0]}'");
        var plan = plan(template, Map.of());

        var result = new PromptGenerator(new Random(3)).generate(plan, settings(GenerationMode.COMBINATORIAL, SeedMode.FIXED, 10));

        assertEquals(2, result.prompts().size());
        assertEquals(2, result.statistics().combinationSpace());
        assertEquals(List.of("Expression"), plan.loopedAxes().stream().map(Axis::name).toList());
        assertEquals("neutral", result.prompts().get(0).keys().get("Expression"));
        assertEquals("smiling", result.prompts().get(1).keys().get("Expression"));
        var lighting = List.of("soft", "dramatic", "backlit", "neon", "golden");
        assertTrue(result.prompts().stream().allMatch(prompt -> lighting.contains(prompt.keys().get("Lighting"))));
    }

    @Test
    void generationIsIdempotentForAPlan() {
        var plan = plan(SdgenTestSupport.portraitTemplate(), Map.of());
        var settings = settings(GenerationMode.COMBINATORIAL, SeedMode.PROGRESSIVE, null);

        assertEquals(
            new PromptGenerator(new Random(1)).generate(plan, settings).prompts(),
            new PromptGenerator(new Random(2)).generate(plan, settings).prompts());
    }

    @Test
    void fixedPlaceholdersCollapseTheirAxis() {
        var plan = plan(SdgenTestSupport.portraitTemplate(), Map.of("Expression", "angry"));
        var prompts = new PromptGenerator(new Random(1))
            .generate(plan, settings(GenerationMode.COMBINATORIAL, SeedMode.FIXED, null))
            .prompts();

        assertEquals(2, prompts.size());
        assertTrue(prompts.stream().allMatch(prompt -> prompt.prompt().contains("angry glare")));
        assertTrue(plan.axis("Expression").orElseThrow().pinned());
    }

    @Test
    void fixingAnUnknownPlaceholderIsAConfigError() {
        var ex = assertThrows(ConfigException.class,
            () -> plan(SdgenTestSupport.portraitTemplate(), Map.of("Mood", "calm")));
        assertEquals("use_fixed.Mood", ex.violations().get(0).field());
    }

    @Test
    void fixingAnUnknownKeyIsASelectorError() {
        var ex = assertThrows(SelectorException.class,
            () -> plan(SdgenTestSupport.portraitTemplate(), Map.of("Expression", "ecstatic")));
        assertEquals(SelectorException.Kind.UNKNOWN_KEY, ex.kind());
    }

    @Test
    void chunkOverridesBecomeAxes() {
        var plan = plan(SdgenTestSupport.fixture("characters", "hero_outfits.prompt.yaml"), Map.of());
        var settings = new GenerationSettings(GenerationMode.COMBINATORIAL, SeedMode.FIXED, 42L, List.of(),
            Optional.empty(), Optional.empty(), false, false, List.of("Hero.outfit"));

        var prompts = new PromptGenerator(new Random(1)).generate(plan, settings).prompts();

        assertEquals(2, prompts.size());
        assertEquals("masterpiece, red hair, brown eyes, wearing shining armor, standing, detailed background",
            prompts.get(0).prompt());
        assertEquals("masterpiece, red hair, brown eyes, wearing a blue robe, standing, detailed background",
            prompts.get(1).prompt());
        assertEquals("lowres, watermark", prompts.get(0).negativePrompt());
        assertEquals("001_HeroOutfit-Armor.png", prompts.get(0).filename());
    }

    @Test
    void multiFieldEntriesOnlySetDeclaredChunkFields() {
        Path chunk = SdgenTestSupport.write(workspace, "plain.chunk.yaml",
            "name: Plain",
            "fields:",
            "  hair: red hair",
            "  eyes: green eyes");
        Path moods = SdgenTestSupport.write(workspace, "moods.yaml",
            "type: multi_field",
            "tired:",
            "  hair: messy hair",
            "  pose: slumped");
        Path template = SdgenTestSupport.write(workspace, "plain.prompt.yaml",
            "version: '1'",
            "imports:",
            "  Plain: " + chunk,
            "  Moods: " + moods,
            "template: '{Plain with Moods}'");

        var prompts = new PromptGenerator(new Random(1))
            .generate(plan(template, Map.of()), settings(GenerationMode.COMBINATORIAL, SeedMode.FIXED, null))
            .prompts();

        assertEquals(1, prompts.size());
        assertEquals("messy hair, green eyes", prompts.get(0).prompt());
    }

    @Test
    void multiFieldSourcesAssignSeveralChunkFields() {
        Path template = SdgenTestSupport.write(workspace, "looks.prompt.yaml",
            "version: '1'",
            "imports:",
            "  Hero: " + SdgenTestSupport.fixture("characters", "hero.chunk.yaml"),
            "  Looks: " + SdgenTestSupport.fixture("characters", "looks.yaml"),
            "template: '{Hero with Looks}'");
        var settings = new GenerationSettings(GenerationMode.COMBINATORIAL, SeedMode.FIXED, 1L, List.of(),
            Optional.empty(), Optional.empty(), false, false, List.of());

        var prompts = new PromptGenerator(new Random(1)).generate(plan(template, Map.of()), settings).prompts();

        var texts = new HashSet<String>();
        prompts.forEach(prompt -> texts.add(prompt.prompt()));
        assertEquals(2, prompts.size());
        assertTrue(texts.contains("black hair, grey eyes, wearing casual clothes"), texts.toString());
        assertTrue(texts.contains("blond hair, brown eyes, wearing casual clothes"), texts.toString());
        assertFalse(texts.stream().anyMatch(text -> text.contains("red hair")));
    }
}
