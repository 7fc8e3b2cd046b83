package work.sdgen.core.error;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Invalid session configuration, listing every violation found.
 */
public final class ConfigException extends SdgenException {
    private final List<Violation> violations;

    public ConfigException(List<Violation> violations) {
        super(
            "config.invalid",
            "Invalid configuration: " + violations.stream().map(Violation::toString).collect(Collectors.joining("; ")),
            detailsOf("violations", violations.stream().map(Violation::toSerializableMap).toList())
        );
        this.violations = List.copyOf(violations);
    }

    public static ConfigException single(String field, String message) {
        return new ConfigException(List.of(new Violation(field, message)));
    }

    public List<Violation> violations() {
        return violations;
    }
}
