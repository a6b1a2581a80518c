package work.lcod.components.shared;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.Duration;
import java.util.Optional;
import org.junit.jupiter.api.Test;

class DurationsTest {
    @Test
    void parsesUnits() {
        assertEquals(Optional.of(Duration.ofMillis(250)), Durations.parse("250ms"));
        assertEquals(Optional.of(Duration.ofSeconds(30)), Durations.parse("30s"));
        assertEquals(Optional.of(Duration.ofMinutes(2)), Durations.parse("2m"));
        assertEquals(Optional.of(Duration.ofHours(1)), Durations.parse("1H"));
        assertEquals(Optional.of(Duration.ofDays(1)), Durations.parse(" 1d "));
    }

    @Test
    void bareNumbersAreMilliseconds() {
        assertEquals(Optional.of(Duration.ofMillis(1500)), Durations.parse("1500"));
        assertEquals(Optional.of(Duration.ZERO), Durations.parse("0"));
    }

    @Test
    void blankMeansUnset() {
        assertTrue(Durations.parse(null).isEmpty());
        assertTrue(Durations.parse("  ").isEmpty());
    }

    @Test
    void rejectsGarbageAndNegatives() {
        assertThrows(IllegalArgumentException.class, () -> Durations.parse("soon"));
        assertThrows(IllegalArgumentException.class, () -> Durations.parse("-5s"));
    }
}
