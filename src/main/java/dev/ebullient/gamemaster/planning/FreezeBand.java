package dev.ebullient.gamemaster.planning;

import java.time.Duration;

/**
 * Difficulty class to freeze duration. Harder checks freeze longer.
 */
public enum FreezeBand {
    TRIVIAL(Integer.MIN_VALUE, 10, 1),
    EASY(11, 12, 2),
    MODERATE(13, 14, 4),
    HARD(15, 16, 8),
    VERY_HARD(17, 18, 12),
    NEARLY_IMPOSSIBLE(19, Integer.MAX_VALUE, 24);

    private final int low;
    private final int high;
    private final int hours;

    FreezeBand(int low, int high, int hours) {
        this.low = low;
        this.high = high;
        this.hours = hours;
    }

    public int hours() {
        return hours;
    }

    public Duration duration() {
        return Duration.ofHours(hours);
    }

    public static FreezeBand forDifficulty(int difficulty) {
        for (FreezeBand band : values()) {
            if (difficulty >= band.low && difficulty <= band.high) {
                return band;
            }
        }
        throw new IllegalStateException("No freeze band for difficulty " + difficulty);
    }
}
