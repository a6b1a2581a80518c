package work.lcod.components.dedupe;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.IntStream;
import org.junit.jupiter.api.Test;

class DedupeEngineTest {
    @Test
    void uniqueKeepsTheHundredMostRecentIds() {
        var engine = new DedupeEngine(DedupeStrategy.UNIQUE);
        DedupeState state = DedupeState.empty(DedupeStrategy.UNIQUE);
        for (int id = 1; id <= 101; id++) {
            var admission = engine.admit(id, state);
            assertTrue(admission.accepted());
            state = admission.state();
        }
        var expected = IntStream.rangeClosed(2, 101).mapToObj(String::valueOf).collect(Collectors.toList());
        assertEquals(expected, ((UniqueCache) state).ids());
        assertTrue(engine.admit(1, state).accepted(), "evicted id is accepted again");
        assertFalse(engine.admit(50, state).accepted());
    }

    @Test
    void uniqueDropsRepeatsInsideOneBatch() {
        var engine = new DedupeEngine(DedupeStrategy.UNIQUE);
        var result = engine.admitBatch(List.of("a", "b", "a", 1, "1"), DedupeState.empty(DedupeStrategy.UNIQUE));
        assertEquals(List.of(true, true, false, true, false), result.accepted());
        assertEquals(3, result.acceptedCount());
    }

    @Test
    void greatestAcceptsOnlyIncreasingIds() {
        var engine = new DedupeEngine(DedupeStrategy.GREATEST);
        var result = engine.admitBatch(List.of(5, 3, 9, 7), DedupeState.empty(DedupeStrategy.GREATEST));
        assertEquals(List.of(true, false, true, false), result.accepted());
        assertEquals(0, new BigDecimal("9").compareTo(((GreatestCache) result.state()).maxId()));
    }

    @Test
    void greatestComparesNumericStringsAsNumbers() {
        var engine = new DedupeEngine(DedupeStrategy.GREATEST);
        var first = engine.admit("10", DedupeState.empty(DedupeStrategy.GREATEST));
        assertTrue(first.accepted());
        assertFalse(engine.admit(9, first.state()).accepted());
        assertTrue(engine.admit("10.5", first.state()).accepted());
    }

    @Test
    void greatestRejectsNonNumericIds() {
        var engine = new DedupeEngine(DedupeStrategy.GREATEST);
        var error = assertThrows(DedupeTypeException.class,
            () -> engine.admit("abc", DedupeState.empty(DedupeStrategy.GREATEST)));
        assertEquals("dedupe_type", error.code());
    }

    @Test
    void lastAcceptsEverythingAfterTheCachedId() {
        var engine = new DedupeEngine(DedupeStrategy.LAST);
        var first = engine.admitBatch(List.of("a", "b", "c"), DedupeState.empty(DedupeStrategy.LAST));
        assertEquals(List.of(true, true, true), first.accepted());
        assertEquals("c", ((LastCache) first.state()).lastId());

        var second = engine.admitBatch(List.of("b", "d"), first.state());
        assertEquals(List.of(false, true), second.accepted());
        assertEquals("d", ((LastCache) second.state()).lastId());
    }

    @Test
    void lastCutsAtTheFirstOccurrenceOfTheCachedId() {
        var engine = new DedupeEngine(DedupeStrategy.LAST);
        var state = engine.admitBatch(List.of("c"), DedupeState.empty(DedupeStrategy.LAST)).state();

        var result = engine.admitBatch(List.of("c", "d", "c", "e"), state);
        assertEquals(List.of(false, true, true, true), result.accepted());
        assertEquals("e", ((LastCache) result.state()).lastId());

        var later = engine.admitBatch(List.of("v", "w", "x"), engine.admitBatch(List.of("w"), DedupeState.empty(DedupeStrategy.LAST)).state());
        assertEquals(List.of(false, false, true), later.accepted());
    }

    @Test
    void lastWithoutTheCachedIdDropsOnlyRememberedIds() {
        var engine = new DedupeEngine(DedupeStrategy.LAST);
        var state = engine.admitBatch(List.of("a", "b", "c"), DedupeState.empty(DedupeStrategy.LAST)).state();

        var result = engine.admitBatch(List.of("x", "a", "y"), state);
        assertEquals(List.of(true, false, true), result.accepted());
        assertEquals("y", ((LastCache) result.state()).lastId());
        assertEquals(List.of("a", "b", "c", "x", "y"), ((LastCache) result.state()).recent());
    }

    @Test
    void lastAcceptsTheWholeBatchWhenNothingMatches() {
        var engine = new DedupeEngine(DedupeStrategy.LAST);
        var state = engine.admitBatch(List.of("a"), DedupeState.empty(DedupeStrategy.LAST)).state();
        var result = engine.admitBatch(List.of("p", "q"), state);
        assertEquals(List.of(true, true), result.accepted());
        assertEquals("q", ((LastCache) result.state()).lastId());
    }

    @Test
    void lastKeepsStateWhenTheBatchIsFullyDropped() {
        var engine = new DedupeEngine(DedupeStrategy.LAST);
        var state = engine.admitBatch(List.of("a", "b"), DedupeState.empty(DedupeStrategy.LAST)).state();
        var result = engine.admitBatch(List.of("a", "b"), state);
        assertEquals(0, result.acceptedCount());
        assertSame(state, result.state());
    }

    @Test
    void noneAcceptsEverythingWithoutIds() {
        var engine = new DedupeEngine(DedupeStrategy.NONE);
        var ids = new ArrayList<Object>(Arrays.asList(null, null, "a", "a"));
        var result = engine.admitBatch(ids, DedupeState.empty(DedupeStrategy.NONE));
        assertEquals(4, result.acceptedCount());
    }

    @Test
    void strategiesWithCachesRequireIds() {
        for (DedupeStrategy strategy : List.of(DedupeStrategy.UNIQUE, DedupeStrategy.GREATEST, DedupeStrategy.LAST)) {
            var engine = new DedupeEngine(strategy);
            var error = assertThrows(MissingIdForDedupeException.class, () -> engine.admit(null, DedupeState.empty(strategy)));
            assertEquals("missing_id_for_dedupe", error.code());
        }
    }

    @Test
    void stateSurvivesMapRoundTrip() {
        var engine = new DedupeEngine(DedupeStrategy.LAST);
        var state = engine.admitBatch(List.of("a", "b"), DedupeState.empty(DedupeStrategy.LAST)).state();
        var restored = DedupeState.fromMap(DedupeStrategy.LAST, state.toMap());
        assertEquals(state, restored);
        assertEquals(DedupeState.empty(DedupeStrategy.UNIQUE), DedupeState.fromMap(DedupeStrategy.UNIQUE, state.toMap()));
    }
}
