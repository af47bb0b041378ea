package dev.ebullient.gamemaster.state;

import java.time.DateTimeException;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * In-game time, stored under {@code world_data.world_time}. All cooldowns and decay
 * are computed against this clock, never against wall-clock time.
 */
public final class WorldClock {

    public static final String PATH = "world_data.world_time";

    private WorldClock() {
    }

    public static Instant now(WorldState state) {
        Map<String, Object> time = state.getMap(PATH);
        try {
            return LocalDateTime.of(
                    intValue(time, "year", 1),
                    intValue(time, "month", 1),
                    intValue(time, "day", 1),
                    intValue(time, "hour", 0),
                    intValue(time, "minute", 0),
                    intValue(time, "second", 0))
                    .toInstant(ZoneOffset.UTC);
        } catch (DateTimeException e) {
            throw new SchemaViolationException(PATH, "valid calendar date", e.getMessage());
        }
    }

    public static List<PatchOp> advance(WorldState state, Duration by) {
        if (by.isNegative()) {
            throw new IllegalArgumentException("World time cannot move backwards: " + by);
        }
        return setTo(now(state).plus(by));
    }

    public static List<PatchOp> setTo(Instant instant) {
        LocalDateTime t = LocalDateTime.ofInstant(instant, ZoneOffset.UTC);
        Map<String, Object> time = new LinkedHashMap<>();
        time.put("year", t.getYear());
        time.put("month", t.getMonthValue());
        time.put("day", t.getDayOfMonth());
        time.put("hour", t.getHour());
        time.put("minute", t.getMinute());
        time.put("second", t.getSecond());
        time.put("time_of_day", timeOfDay(t.getHour()));
        return List.of(new PatchOp.Assign(PATH, time));
    }

    public static String timeOfDay(int hour) {
        if (hour < 5) {
            return "Deep Night";
        } else if (hour < 7) {
            return "Dawn";
        } else if (hour < 12) {
            return "Morning";
        } else if (hour < 14) {
            return "Midday";
        } else if (hour < 18) {
            return "Afternoon";
        } else if (hour < 20) {
            return "Evening";
        }
        return "Night";
    }

    private static int intValue(Map<String, Object> time, String key, int defaultValue) {
        return time.get(key) instanceof Number n ? n.intValue() : defaultValue;
    }
}
