package work.sdgen.core.variation;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Random;
import org.junit.jupiter.api.Test;
import work.sdgen.core.error.SelectorException;

class SelectorTest {
    private static VariationFile file(int size) {
        var entries = new ArrayList<VariationEntry>();
        for (int i = 0; i < size; i++) {
            entries.add(VariationEntry.single("k" + i, "value " + i, i));
        }
        return new VariationFile("Test", Optional.empty(), entries);
    }

    private static List<String> keys(List<VariationEntry> entries) {
        return entries.stream().map(VariationEntry::key).toList();
    }

    private static List<VariationEntry> select(VariationFile file, String expression) {
        var parsed = SelectorParser.parse("Test", expression);
        return new SelectorEvaluator(new Random(7)).evaluate("Test", file, parsed.selector());
    }

    @Test
    void emptyExpressionSelectsEverything() {
        var parsed = SelectorParser.parse("Test", null);
        assertEquals(Selector.Kind.ALL, parsed.selector().kind());
        assertTrue(parsed.weight().isEmpty());
        assertEquals(5, select(file(5), "").size());
    }

    @Test
    void limitKeepsFileOrder() {
        assertEquals(List.of("k0", "k1", "k2", "k3"), keys(select(file(12), "limit:4")));
        assertEquals(List.of("k0", "k1"), keys(select(file(2), "limit:2")));
    }

    @Test
    void limitBeyondFileLengthFails() {
        var ex = assertThrows(SelectorException.class, () -> select(file(3), "limit:4"));
        assertEquals(SelectorException.Kind.INSUFFICIENT_ENTRIES, ex.kind());
        assertEquals("Test", ex.placeholder());
    }

    @Test
    void randomDrawsDistinctEntries() {
        var selected = select(file(10), "random:6");
        assertEquals(6, selected.size());
        assertEquals(6, new HashSet<>(keys(selected)).size());
    }

    @Test
    void randomOnTooSmallFileFailsInsteadOfTruncating() {
        var ex = assertThrows(SelectorException.class, () -> select(file(2), "random:3"));
        assertEquals(SelectorException.Kind.INSUFFICIENT_ENTRIES, ex.kind());
        assertEquals(3, ex.details().get("requested"));
        assertEquals(2, ex.details().get("available"));
    }

    @Test
    void indexesAndRangesFollowTheirOwnOrder() {
        assertEquals(List.of("k2", "k0"), keys(select(file(5), "indexes:2,0")));
        assertEquals(List.of("k1", "k2", "k3"), keys(select(file(5), "range:1-3")));
    }

    @Test
    void rangeIsCheckedAgainstTheFileBeforeExpanding() {
        var parsed = SelectorParser.parse("Test", "range:0-2147483647");
        assertEquals(Selector.Kind.RANGE, parsed.selector().kind());
        assertEquals(Integer.MAX_VALUE, parsed.selector().end());

        var ex = assertThrows(SelectorException.class, () -> select(file(5), "range:0-2147483647"));
        assertEquals(SelectorException.Kind.INDEX_OUT_OF_RANGE, ex.kind());
        assertEquals(Integer.MAX_VALUE, ex.details().get("index"));
    }

    @Test
    void shortFormsStandForRandomAndIndexes() {
        var random = SelectorParser.parse("Test", "3;$2");
        assertEquals(Selector.Kind.RANDOM, random.selector().kind());
        assertEquals(3, random.selector().count());
        assertEquals(3, select(file(6), "3").size());

        assertEquals(List.of("k1", "k3", "k4"), keys(select(file(5), "#1,3,4")));
    }

    @Test
    void zeroWeightIsAccepted() {
        var parsed = SelectorParser.parse("Quality", "$0");
        assertEquals(Selector.Kind.ALL, parsed.selector().kind());
        assertEquals(Optional.of(0.0), parsed.weight());
    }

    @Test
    void outOfRangeIndexFails() {
        var ex = assertThrows(SelectorException.class, () -> select(file(5), "indexes:0,5"));
        assertEquals(SelectorException.Kind.INDEX_OUT_OF_RANGE, ex.kind());
        assertEquals(5, ex.details().get("index"));
    }

    @Test
    void keysSelectByName() {
        assertEquals(List.of("k3", "k1"), keys(select(file(5), "k3, k1")));
        var ex = assertThrows(SelectorException.class, () -> select(file(5), "k3,missing"));
        assertEquals(SelectorException.Kind.UNKNOWN_KEY, ex.kind());
    }

    @Test
    void weightPartIsSeparatedBySemicolon() {
        var parsed = SelectorParser.parse("Test", "limit:3;$2.5");
        assertEquals(Selector.Kind.LIMIT, parsed.selector().kind());
        assertEquals(3, parsed.selector().count());
        assertEquals(Optional.of(2.5), parsed.weight());

        var weightOnly = SelectorParser.parse("Test", "$4");
        assertEquals(Selector.Kind.ALL, weightOnly.selector().kind());
        assertEquals(Optional.of(4.0), weightOnly.weight());
    }

    @Test
    void malformedExpressionsAreSyntaxErrors() {
        for (String expression : List.of("limit:0", "limit:x", "random:", "range:5-1", "foo:1", "all:2", "$-1", "$1;$2",
            "limit:1;random:1", "0", "#", "#1,x", "99999999999")) {
            var ex = assertThrows(SelectorException.class, () -> SelectorParser.parse("Test", expression), expression);
            assertEquals(SelectorException.Kind.INVALID_SYNTAX, ex.kind(), expression);
        }
    }
}
