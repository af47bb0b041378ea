package dev.ebullient.gamemaster.reputation;

/**
 * Public score (-100..100) to notoriety tier and the disposition it implies.
 */
public enum Notoriety {
    INFAMOUS("Infamous", -100, -75, -8),
    NOTORIOUS("Notorious", -74, -40, -5),
    DISREPUTABLE("Disreputable", -39, -10, -2),
    UNKNOWN("Unknown", -9, 9, 0),
    KNOWN("Known", 10, 39, 1),
    RESPECTED("Respected", 40, 74, 3),
    FAMOUS("Famous", 75, 94, 5),
    LEGENDARY("Legendary", 95, 100, 7);

    public static final int MIN_SCORE = -100;
    public static final int MAX_SCORE = 100;

    private final String label;
    private final int low;
    private final int high;
    private final int disposition;

    Notoriety(String label, int low, int high, int disposition) {
        this.label = label;
        this.low = low;
        this.high = high;
        this.disposition = disposition;
    }

    public String label() {
        return label;
    }

    public int disposition() {
        return disposition;
    }

    public static Notoriety of(int score) {
        int clamped = clamp(score);
        for (Notoriety tier : values()) {
            if (clamped >= tier.low && clamped <= tier.high) {
                return tier;
            }
        }
        return UNKNOWN;
    }

    public static int clamp(int score) {
        return Math.max(MIN_SCORE, Math.min(MAX_SCORE, score));
    }
}
