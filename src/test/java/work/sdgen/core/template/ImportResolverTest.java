package work.sdgen.core.template;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.nio.file.Path;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import work.sdgen.core.error.StructuralException;
import work.sdgen.core.support.SdgenTestSupport;
import work.sdgen.core.variation.VariationLoader;

class ImportResolverTest {
    @TempDir
    Path workspace;

    private final DocumentLocator locator = DocumentLocator.relativeOnly();

    private ImportNamespace resolve(Path template) {
        var resolved = new InheritanceResolver(locator).resolve(template);
        return new ImportResolver(locator, new ChunkRegistry(locator), new VariationLoader()).resolve(resolved);
    }

    @Test
    void separatesChunksFromVariationSets() {
        var namespace = resolve(SdgenTestSupport.fixture("characters", "hero_outfits.prompt.yaml"));

        assertTrue(namespace.chunk("Hero").isPresent());
        assertEquals(3, namespace.variation("Outfits").orElseThrow().size());
        assertTrue(namespace.variation("Looks").orElseThrow().isMultiField());
        assertTrue(namespace.variation("Hero").isEmpty());
    }

    @Test
    void detectsChunksByContentOrDeclaredType() {
        SdgenTestSupport.write(workspace, "cat.yaml", "fields:", "  fur: tabby fur");
        SdgenTestSupport.write(workspace, "dog.yaml", "fields:", "  fur: short fur");
        Path template = SdgenTestSupport.write(workspace, "pets.prompt.yaml",
            "version: '1'",
            "imports:",
            "  Cat: cat.yaml",
            "  Dog:",
            "    source: dog.yaml",
            "    type: chunk",
            "template: '{Cat} and {Dog}'");

        var namespace = resolve(template);
        assertTrue(namespace.chunk("Cat").isPresent());
        assertTrue(namespace.chunk("Dog").isPresent());
    }

    @Test
    void undeclaredPlaceholderIsAnUnresolvedImport() {
        SdgenTestSupport.write(workspace, "moods.yaml", "calm: calm");
        Path template = SdgenTestSupport.write(workspace, "t.prompt.yaml",
            "version: '1'", "imports:", "  Mood: moods.yaml", "template: '{Mood}, {Weather}'");

        var ex = assertThrows(StructuralException.class, () -> resolve(template));
        assertEquals(StructuralException.Kind.UNRESOLVED_IMPORT, ex.kind());
        assertEquals("Weather", ex.details().get("symbol"));
    }

    @Test
    void undeclaredOverrideSourceIsAnUnresolvedImport() {
        Path template = SdgenTestSupport.write(workspace, "t.prompt.yaml",
            "version: '1'",
            "imports:",
            "  Hero: " + SdgenTestSupport.fixture("characters", "hero.chunk.yaml"),
            "template: '{Hero with outfit=Outfits}'");

        var ex = assertThrows(StructuralException.class, () -> resolve(template));
        assertEquals("Outfits", ex.details().get("symbol"));
    }

    @Test
    void missingImportFileIsAMissingReference() {
        Path template = SdgenTestSupport.write(workspace, "t.prompt.yaml",
            "version: '1'", "imports:", "  Mood: nowhere.yaml", "template: '{Mood}'");

        var ex = assertThrows(StructuralException.class, () -> resolve(template));
        assertEquals(StructuralException.Kind.MISSING_REFERENCE, ex.kind());
        assertEquals("imports.Mood", ex.details().get("field"));
    }
}
