package work.lcod.taskgen.shared;

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
    void parsesCompoundDurations() {
        assertEquals(Duration.ofSeconds(90), DurationParser.parse("1m30s").orElseThrow());
        assertEquals(Duration.ofMillis(3_600_500), DurationParser.parse("1h500ms").orElseThrow());
    }

    @Test
    void readsBareNumbersAsSeconds() {
        assertEquals(Duration.ofSeconds(45), DurationParser.parse("45").orElseThrow());
    }

    @Test
    void blankInputIsEmpty() {
        assertTrue(DurationParser.parse("  ").isEmpty());
        assertTrue(DurationParser.parse(null).isEmpty());
    }

    @Test
    void rejectsUnknownUnits() {
        assertThrows(IllegalArgumentException.class, () -> DurationParser.parse("10d"));
        assertThrows(IllegalArgumentException.class, () -> DurationParser.parse("s30"));
    }
}
