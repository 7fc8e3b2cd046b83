package work.sdgen.core.variation;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.junit.jupiter.api.Test;
import work.sdgen.core.error.StructuralException;
import work.sdgen.core.template.ChunkOverride;

class VariationExpanderTest {
    private static final VariationEntry GOTH = new VariationEntry(
        "goth", "", Map.of("appearance.hair", "black hair", "appearance.eyes", "grey eyes"), 1.0, 0);
    private static final VariationEntry ARMOR = VariationEntry.single("armor", "shining armor", 0);

    @Test
    void fieldOverrideAssignsOneField() {
        var assignments = VariationExpander.expand("Hero", ChunkOverride.field("outfit", "Outfits", Optional.empty()), ARMOR);
        assertEquals(Map.of("outfit", FieldValue.override("shining armor")), assignments);
    }

    @Test
    void multiFieldOverrideAssignsEveryField() {
        var assignments = VariationExpander.expand("Hero", ChunkOverride.multiField("Looks", Optional.empty()), GOTH);
        assertEquals(2, assignments.size());
        assertEquals(FieldSource.OVERRIDE, assignments.get("appearance.eyes").source());
    }

    @Test
    void literalOverrideIgnoresEntries() {
        var assignments = VariationExpander.expand("Hero", ChunkOverride.literal("mood", "calm"), null);
        assertEquals("calm", assignments.get("mood").value());
    }

    @Test
    void mismatchedOverrideShapesAreRejected() {
        assertThrows(StructuralException.class,
            () -> VariationExpander.expand("Hero", ChunkOverride.field("outfit", "Looks", Optional.empty()), GOTH));
        var ex = assertThrows(StructuralException.class,
            () -> VariationExpander.expand("Hero", ChunkOverride.multiField("Outfits", Optional.empty()), ARMOR));
        assertEquals(StructuralException.Kind.INVALID_OVERRIDE, ex.kind());
    }

    @Test
    void mergeFollowsProvenanceRanking() {
        var base = new LinkedHashMap<String, FieldValue>();
        base.put("hair", FieldValue.chunk("red hair"));
        base.put("eyes", FieldValue.defaultValue("brown eyes"));
        base.put("outfit", FieldValue.override("armor"));

        var merged = VariationExpander.merge(base, List.of(
            Map.of("hair", FieldValue.override("black hair")),
            Map.of("eyes", FieldValue.chunk("green eyes")),
            Map.of("outfit", FieldValue.chunk("robe"))
        ));

        assertEquals("black hair", merged.get("hair").value());
        assertEquals("green eyes", merged.get("eyes").value());
        assertEquals("armor", merged.get("outfit").value());
        assertEquals(List.of("hair", "eyes", "outfit"), List.copyOf(merged.keySet()));
    }

    @Test
    void laterOverrideOfEqualRankWins() {
        var merged = VariationExpander.merge(Map.of(), List.of(
            Map.of("mood", FieldValue.override("calm")),
            Map.of("mood", FieldValue.override("angry"))
        ));
        assertEquals("angry", merged.get("mood").value());
    }

    @Test
    void nonPositiveWeightsAreRejected() {
        assertThrows(IllegalArgumentException.class, () -> new VariationEntry("a", "b", Map.of(), 0, 0));
    }
}
