package work.sdgen.core.events;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * One entry of the run event log. {@code sequence} starts at 1 and has no gaps.
 */
public record RunEvent(long sequence, EventType type, Optional<String> phase, Map<String, Object> payload, Instant timestamp) {
    public RunEvent {
        Objects.requireNonNull(type, "type");
        Objects.requireNonNull(phase, "phase");
        Objects.requireNonNull(timestamp, "timestamp");
        payload = Collections.unmodifiableMap(new LinkedHashMap<>(payload));
    }

    public Map<String, Object> toSerializableMap() {
        var map = new LinkedHashMap<String, Object>();
        map.put("sequence", sequence);
        map.put("type", type.name().toLowerCase(Locale.ROOT));
        phase.ifPresent(value -> map.put("phase", value));
        map.put("payload", payload);
        map.put("timestamp", timestamp.toString());
        return map;
    }
}
