package work.sdgen.core.prompt;

import java.util.List;
import java.util.Objects;
import java.util.Optional;
import work.sdgen.core.template.ChunkOverride;
import work.sdgen.core.template.ResolvedChunk;

/**
 * A chunk placeholder occurrence with its overrides bound to generation axes.
 */
public record ChunkBinding(String symbol, ResolvedChunk chunk, List<BoundOverride> overrides) {
    public record BoundOverride(ChunkOverride override, Optional<String> axis) {
        public BoundOverride {
            Objects.requireNonNull(override, "override");
            Objects.requireNonNull(axis, "axis");
        }
    }

    public ChunkBinding {
        Objects.requireNonNull(symbol, "symbol");
        Objects.requireNonNull(chunk, "chunk");
        overrides = List.copyOf(overrides);
    }
}
