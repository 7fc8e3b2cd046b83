package work.sdgen.core.template;

import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import work.sdgen.core.error.StructuralException;
import work.sdgen.core.variation.VariationFile;
import work.sdgen.core.variation.VariationLoader;

/**
 * Turns a template's {@code imports:} into a namespace and checks every referenced symbol is declared.
 */
public final class ImportResolver {
    private static final Logger log = LoggerFactory.getLogger(ImportResolver.class);

    private final DocumentLocator locator;
    private final ChunkRegistry chunks;
    private final VariationLoader variations;

    public ImportResolver(DocumentLocator locator, ChunkRegistry chunks, VariationLoader variations) {
        this.locator = locator;
        this.chunks = chunks;
        this.variations = variations;
    }

    public ImportNamespace resolve(ResolvedTemplate template) {
        var variationSets = new LinkedHashMap<String, VariationFile>();
        var chunkSet = new LinkedHashMap<String, ResolvedChunk>();
        for (ImportSpec spec : template.imports().values()) {
            if (isChunk(spec)) {
                Path path = locator.locate(spec.baseDir(), spec.sources().get(0).reference(), spec.declaredIn(), "imports." + spec.symbol());
                chunkSet.put(spec.symbol(), chunks.load(path));
                log.debug("Import {} resolved to chunk {}", spec.symbol(), path.getFileName());
            } else {
                VariationFile file = variations.merge(spec, locator);
                variationSets.put(spec.symbol(), file);
                log.debug("Import {} resolved to {} variation entries", spec.symbol(), file.size());
            }
        }
        var namespace = new ImportNamespace(variationSets, chunkSet);
        requireDeclared(template, namespace);
        return namespace;
    }

    private boolean isChunk(ImportSpec spec) {
        if (spec.declaredKind().isPresent()) {
            boolean chunk = spec.declaredKind().get().isChunk();
            if (chunk && !spec.isSingleFile()) {
                throw StructuralException.invalidDocument(
                    spec.declaredIn().getFileName().toString(), "chunk import '" + spec.symbol() + "' must name exactly one file");
            }
            return chunk;
        }
        if (!spec.isSingleFile()) {
            return false;
        }
        return DocumentKind.fromFileName(Path.of(spec.sources().get(0).reference()))
            .map(DocumentKind::isChunk)
            .orElseGet(() -> {
                Path path = locator.locate(spec.baseDir(), spec.sources().get(0).reference(), spec.declaredIn(), "imports." + spec.symbol());
                Object tree = DocumentLoader.loadTree(path);
                return tree instanceof Map<?, ?> && DocumentKind.detect(path, castMap(tree)).isChunk();
            });
    }

    @SuppressWarnings("unchecked")
    private static Map<String, Object> castMap(Object tree) {
        return (Map<String, Object>) tree;
    }

    private static void requireDeclared(ResolvedTemplate template, ImportNamespace namespace) {
        for (String text : List.of(template.template(), template.negativePrompt())) {
            for (Placeholder placeholder : PlaceholderParser.parse(text)) {
                if (placeholder.isReserved()) {
                    continue;
                }
                if (!namespace.contains(placeholder.name())) {
                    throw StructuralException.unresolvedImport(template.displayName(), placeholder.name());
                }
                for (ChunkOverride override : placeholder.overrides()) {
                    if (override.isSourced() && namespace.variation(override.source()).isEmpty()) {
                        throw StructuralException.unresolvedImport(template.displayName(), override.source());
                    }
                }
            }
        }
    }
}
