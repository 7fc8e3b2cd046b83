package work.sdgen.core.variation;

import java.util.Objects;
import java.util.Optional;

/**
 * A selector together with the optional {@code $W} loop weight declared next to it.
 */
public record ParsedSelector(Selector selector, Optional<Double> weight) {
    public ParsedSelector {
        Objects.requireNonNull(selector, "selector");
        Objects.requireNonNull(weight, "weight");
    }

    public static ParsedSelector all() {
        return new ParsedSelector(Selector.all(), Optional.empty());
    }
}
