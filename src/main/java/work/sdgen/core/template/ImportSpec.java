package work.sdgen.core.template;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import work.sdgen.core.error.StructuralException;

/**
 * An {@code imports:} entry, keeping the directory of the document that declared it.
 */
public record ImportSpec(
    String symbol,
    List<ImportSource> sources,
    Optional<DocumentKind> declaredKind,
    Path baseDir,
    Path declaredIn
) {
    public ImportSpec {
        Objects.requireNonNull(symbol, "symbol");
        Objects.requireNonNull(declaredKind, "declaredKind");
        Objects.requireNonNull(baseDir, "baseDir");
        Objects.requireNonNull(declaredIn, "declaredIn");
        sources = List.copyOf(sources);
    }

    public boolean isSingleFile() {
        return sources.size() == 1 && !sources.get(0).inline();
    }

    public static ImportSpec parse(String symbol, Object value, TemplateDocument document) {
        Optional<DocumentKind> declaredKind = Optional.empty();
        Object rawSources = value;
        if (value instanceof Map<?, ?> map) {
            rawSources = map.get("source");
            Object type = map.get("type");
            if (type != null) {
                declaredKind = DocumentKind.fromDeclared(String.valueOf(type));
                if (declaredKind.isEmpty()) {
                    throw StructuralException.invalidDocument(
                        document.fileName(), "import '" + symbol + "' declares unknown type '" + type + "'");
                }
            }
        }
        var sources = new ArrayList<ImportSource>();
        if (rawSources instanceof String text && !text.isBlank()) {
            sources.add(ImportSource.of(text));
        } else if (rawSources instanceof List<?> list) {
            for (Object item : list) {
                if (item == null || item instanceof Map<?, ?> || item instanceof List<?>) {
                    throw StructuralException.invalidDocument(
                        document.fileName(), "import '" + symbol + "' lists a non-scalar source");
                }
                sources.add(ImportSource.of(String.valueOf(item)));
            }
        }
        if (sources.isEmpty()) {
            throw StructuralException.invalidDocument(document.fileName(), "import '" + symbol + "' has no source");
        }
        return new ImportSpec(symbol, sources, declaredKind, document.directory(), document.path());
    }
}
