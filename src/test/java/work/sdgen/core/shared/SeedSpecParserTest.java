package work.sdgen.core.shared;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.util.List;
import org.junit.jupiter.api.Test;

class SeedSpecParserTest {
    @Test
    void parsesExplicitList() {
        assertEquals(List.of(1000L, 1005L, 1008L), SeedSpecParser.parse("1000, 1005,1008"));
    }

    @Test
    void parsesInclusiveRange() {
        assertEquals(List.of(10L, 11L, 12L, 13L), SeedSpecParser.parse("10-13"));
    }

    @Test
    void parsesCountFromStart() {
        assertEquals(List.of(1000L, 1001L, 1002L), SeedSpecParser.parse("3#1000"));
    }

    @Test
    void parsesSingleSeedIncludingNegative() {
        assertEquals(List.of(42L), SeedSpecParser.parse("42"));
        assertEquals(List.of(-1L), SeedSpecParser.parse("-1"));
    }

    @Test
    void rejectsMalformedSpecs() {
        assertThrows(IllegalArgumentException.class, () -> SeedSpecParser.parse(""));
        assertThrows(IllegalArgumentException.class, () -> SeedSpecParser.parse("abc"));
        assertThrows(IllegalArgumentException.class, () -> SeedSpecParser.parse("20-10"));
        assertThrows(IllegalArgumentException.class, () -> SeedSpecParser.parse("0#5"));
        assertThrows(IllegalArgumentException.class, () -> SeedSpecParser.parse("0-200000"));
    }
}
