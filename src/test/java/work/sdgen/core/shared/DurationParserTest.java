package work.sdgen.core.shared;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.Duration;
import java.util.Optional;
import org.junit.jupiter.api.Test;

class DurationParserTest {
    @Test
    void parsesSeconds() {
        Optional<Duration> duration = DurationParser.parse("30s");
        assertTrue(duration.isPresent());
        assertEquals(Duration.ofSeconds(30), duration.get());
    }

    @Test
    void parsesMinutesAndFractions() {
        assertEquals(Duration.ofMinutes(2), DurationParser.parse("2m").orElseThrow());
        assertEquals(Duration.ofMillis(1500), DurationParser.parse("1.5s").orElseThrow());
    }

    @Test
    void parsesMillisecondsByDefault() {
        assertEquals(Duration.ofMillis(250), DurationParser.parse("250").orElseThrow());
        assertEquals(Duration.ofMillis(250), DurationParser.parse("250ms").orElseThrow());
    }

    @Test
    void blankMeansAbsent() {
        assertTrue(DurationParser.parse(null).isEmpty());
        assertTrue(DurationParser.parse("  ").isEmpty());
    }

    @Test
    void rejectsUnknownUnits() {
        assertThrows(IllegalArgumentException.class, () -> DurationParser.parse("3 days"));
    }

    @Test
    void formatsWithTheLargestExactUnit() {
        assertEquals("1h", DurationParser.format(Duration.ofHours(1)));
        assertEquals("10m", DurationParser.format(Duration.ofMinutes(10)));
        assertEquals("90s", DurationParser.format(Duration.ofSeconds(90)));
        assertEquals("500ms", DurationParser.format(Duration.ofMillis(500)));
    }
}
