package work.sdgen.core.template;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.function.Predicate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import work.sdgen.core.error.StructuralException;

/**
 * Walks {@code implements} references iteratively and merges template chains.
 */
public final class InheritanceResolver {
    private static final Logger log = LoggerFactory.getLogger(InheritanceResolver.class);
    static final String PROMPT_SLOT = "{prompt}";
    static final String NEGATIVE_SLOT = "{negprompt}";

    private final DocumentLocator locator;

    public InheritanceResolver(DocumentLocator locator) {
        this.locator = locator;
    }

    public TemplateChain loadChain(Path path) {
        return new TemplateChain(walk(path, DocumentKind::isTemplate, "template"));
    }

    /**
     * Loads a document and its ancestors, leaf first. Every document must satisfy {@code expected}.
     */
    List<TemplateDocument> walk(Path path, Predicate<DocumentKind> expected, String expectedLabel) {
        var documents = new ArrayList<TemplateDocument>();
        var visited = new LinkedHashSet<Path>();
        Path current = path.toAbsolutePath().normalize();
        while (current != null) {
            if (!visited.add(current)) {
                var cycle = new ArrayList<String>();
                visited.forEach(p -> cycle.add(p.getFileName().toString()));
                cycle.add(current.getFileName().toString());
                throw StructuralException.cycle(cycle);
            }
            var content = DocumentLoader.loadMapping(current);
            var document = new TemplateDocument(current, DocumentKind.detect(current, content), content);
            if (!expected.test(document.kind())) {
                throw StructuralException.invalidDocument(
                    document.fileName(), "expected a " + expectedLabel + " document but found " + document.kind());
            }
            documents.add(document);
            Path next = null;
            var parent = document.parentReference();
            if (parent.isPresent()) {
                next = locator.locate(document.directory(), parent.get(), document.path(), "implements");
                log.debug("{} implements {}", document.fileName(), next);
            }
            current = next;
        }
        return documents;
    }

    public ResolvedTemplate merge(TemplateChain chain) {
        String template = null;
        String negative = null;
        var imports = new LinkedHashMap<String, ImportSpec>();
        var paths = new ArrayList<Path>();
        for (TemplateDocument document : chain.rootFirst()) {
            paths.add(document.path());
            for (Map.Entry<String, Object> entry : document.section("imports").entrySet()) {
                imports.put(entry.getKey(), ImportSpec.parse(entry.getKey(), entry.getValue(), document));
            }
            var own = document.string("template");
            if (own.isPresent()) {
                if (template == null) {
                    template = own.get();
                } else if (template.contains(PROMPT_SLOT)) {
                    template = template.replace(PROMPT_SLOT, own.get());
                } else {
                    log.warn("{} overrides its parent template because the parent declares no {} slot",
                        document.fileName(), PROMPT_SLOT);
                    template = own.get();
                }
            }
            var ownNegative = document.string("negative_prompt");
            if (ownNegative.isPresent()) {
                if (negative != null && negative.contains(NEGATIVE_SLOT)) {
                    negative = negative.replace(NEGATIVE_SLOT, ownNegative.get());
                } else {
                    negative = ownNegative.get();
                }
            }
        }
        if (template == null) {
            throw StructuralException.invalidDocument(chain.leaf().fileName(), "no template body in the inheritance chain");
        }
        return new ResolvedTemplate(
            chain.leaf().path(),
            chain.name(),
            chain.leaf().string("version").orElse(""),
            template,
            negative,
            imports,
            chain.mergedSection("generation"),
            chain.mergedSection("output"),
            chain.mergedSection("parameters"),
            paths
        );
    }

    public ResolvedTemplate resolve(Path path) {
        return merge(loadChain(path));
    }
}
