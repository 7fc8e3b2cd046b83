package work.sdgen.core.template;

import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.nio.file.Path;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import work.sdgen.core.error.TemplateValidationException;
import work.sdgen.core.error.Violation;
import work.sdgen.core.support.SdgenTestSupport;

class TemplateValidatorTest {
    @TempDir
    Path workspace;

    private TemplateChain chain(Path path) {
        return new InheritanceResolver(DocumentLocator.relativeOnly()).loadChain(path);
    }

    @Test
    void acceptsFixtureTemplates() {
        assertDoesNotThrow(() -> TemplateValidator.validate(chain(SdgenTestSupport.portraitTemplate())));
        assertDoesNotThrow(() -> TemplateValidator.validate(
            chain(SdgenTestSupport.fixture("characters", "hero_outfits.prompt.yaml"))));
    }

    @Test
    void enumeratesEveryViolation() {
        Path path = SdgenTestSupport.write(workspace, "broken.prompt.yaml",
            "template: '{Mood[limit:zero]}'",
            "colour: red",
            "generation:",
            "  mode: shuffled",
            "  max_images: -3",
            "  weighted_ordering: maybe",
            "  seeds: 'abc'",
            "output:",
            "  folder: out");

        var ex = assertThrows(TemplateValidationException.class, () -> TemplateValidator.validate(chain(path)));
        var fields = ex.violations().stream().map(Violation::field).toList();
        assertTrue(fields.contains("version"), fields.toString());
        assertTrue(fields.contains("colour"), fields.toString());
        assertTrue(fields.contains("template"), fields.toString());
        assertTrue(fields.contains("generation.mode"), fields.toString());
        assertTrue(fields.contains("generation.max_images"), fields.toString());
        assertTrue(fields.contains("generation.weighted_ordering"), fields.toString());
        assertTrue(fields.contains("generation.seeds"), fields.toString());
        assertTrue(fields.contains("output.folder"), fields.toString());
        assertEquals("broken.prompt.yaml", ex.document());
        assertEquals("template.invalid", ex.code());
    }

    @Test
    void prefixesViolationsOfAncestors() {
        SdgenTestSupport.write(workspace, "base.template.yaml", "template: '{prompt}'", "extra: 1");
        Path child = SdgenTestSupport.write(workspace, "child.prompt.yaml",
            "version: '1'", "implements: base.template.yaml", "template: 'x'");

        var ex = assertThrows(TemplateValidationException.class, () -> TemplateValidator.validate(chain(child)));
        assertEquals(1, ex.violations().size());
        assertEquals("base.template.yaml:extra", ex.violations().get(0).field());
    }

    @Test
    void requiresABodySomewhereInTheChain() {
        Path path = SdgenTestSupport.write(workspace, "empty.prompt.yaml", "version: '1'", "name: nothing");

        var ex = assertThrows(TemplateValidationException.class, () -> TemplateValidator.validate(chain(path)));
        assertEquals("template", ex.violations().get(0).field());
    }
}
