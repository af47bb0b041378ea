package dev.ebullient.gamemaster.state;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;

import org.junit.jupiter.api.Test;

class WorldClockTest {

    StateStore store = new StateStore("clock", PathSchema.fromClasspath(), 5);

    @Test
    void now_defaultsToStartOfYearOne() {
        assertEquals(Instant.parse("0001-01-01T00:00:00Z"), WorldClock.now(store.snapshot()));
    }

    @Test
    void advance_rollsOverDaysAndRecomputesTimeOfDay() {
        store.apply(Patch.against(store.snapshot())
                .addAll(WorldClock.setTo(Instant.parse("1492-03-31T23:59:57Z")))
                .build());
        store.apply(Patch.against(store.snapshot())
                .addAll(WorldClock.advance(store.snapshot(), Duration.ofSeconds(6)))
                .build());

        Map<String, Object> time = store.snapshot().getMap(WorldClock.PATH);
        assertEquals(1492, time.get("year"));
        assertEquals(4, time.get("month"));
        assertEquals(1, time.get("day"));
        assertEquals(0, time.get("hour"));
        assertEquals(3, time.get("second"));
        assertEquals("Deep Night", time.get("time_of_day"));
    }

    @Test
    void advance_rejectsNegativeDurations() {
        assertThrows(IllegalArgumentException.class,
                () -> WorldClock.advance(store.snapshot(), Duration.ofMinutes(-1)));
    }

    @Test
    void timeOfDay_bands() {
        assertEquals("Deep Night", WorldClock.timeOfDay(4));
        assertEquals("Dawn", WorldClock.timeOfDay(5));
        assertEquals("Morning", WorldClock.timeOfDay(11));
        assertEquals("Midday", WorldClock.timeOfDay(13));
        assertEquals("Afternoon", WorldClock.timeOfDay(17));
        assertEquals("Evening", WorldClock.timeOfDay(19));
        assertEquals("Night", WorldClock.timeOfDay(23));
    }

    @Test
    void now_invalidDateIsSchemaViolation() {
        store.apply(Patch.against(store.snapshot())
                .set("world_data.world_time.month", 2)
                .set("world_data.world_time.day", 30)
                .build());
        assertThrows(SchemaViolationException.class, () -> WorldClock.now(store.snapshot()));
    }
}
