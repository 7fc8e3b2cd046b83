package work.sdgen.core.template;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import work.sdgen.core.error.StructuralException;

/**
 * Resolves document references relative to the referencing document, then against the configured roots.
 */
public final class DocumentLocator {
    private final List<Path> roots;

    public DocumentLocator(List<Path> roots) {
        this.roots = List.copyOf(roots);
    }

    public static DocumentLocator relativeOnly() {
        return new DocumentLocator(List.of());
    }

    public Path locate(Path baseDir, String reference, Path referencingDocument, String field) {
        if (reference == null || reference.isBlank()) {
            throw StructuralException.missingReference(String.valueOf(referencingDocument), field, String.valueOf(reference));
        }
        Path candidate = Path.of(reference.trim());
        if (candidate.isAbsolute()) {
            if (Files.isRegularFile(candidate)) {
                return candidate.normalize();
            }
        } else {
            Path relative = baseDir.resolve(candidate).normalize();
            if (Files.isRegularFile(relative)) {
                return relative.toAbsolutePath();
            }
            for (Path root : roots) {
                Path rooted = root.resolve(candidate).normalize();
                if (Files.isRegularFile(rooted)) {
                    return rooted.toAbsolutePath();
                }
            }
        }
        throw StructuralException.missingReference(String.valueOf(referencingDocument), field, reference);
    }
}
