package work.sdgen.core.error;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Schema violations of a template document, all reported at once.
 */
public final class TemplateValidationException extends SdgenException {
    private final String document;
    private final List<Violation> violations;

    public TemplateValidationException(String document, List<Violation> violations) {
        super(
            "template.invalid",
            "Template " + document + " is invalid: "
                + violations.stream().map(Violation::toString).collect(Collectors.joining("; ")),
            detailsOf(
                "document", document,
                "violations", violations.stream().map(Violation::toSerializableMap).toList()
            )
        );
        this.document = document;
        this.violations = List.copyOf(violations);
    }

    public String document() {
        return document;
    }

    public List<Violation> violations() {
        return violations;
    }
}
