package dev.ebullient.gamemaster.reputation;

/**
 * Private faction score (-10..10) to standing tier and the disposition it implies.
 */
public enum FactionStanding {
    ENEMY("Enemy", -10, -8, -10),
    HOSTILE("Hostile", -7, -5, -6),
    UNFRIENDLY("Unfriendly", -4, -2, -3),
    NEUTRAL("Neutral", -1, 1, 0),
    FRIENDLY("Friendly", 2, 3, 3),
    TRUSTED("Trusted", 4, 6, 5),
    ALLY("Ally", 7, 8, 8),
    CHAMPION("Champion", 9, 10, 10);

    public static final int MIN_SCORE = -10;
    public static final int MAX_SCORE = 10;

    private final String label;
    private final int low;
    private final int high;
    private final int disposition;

    FactionStanding(String label, int low, int high, int disposition) {
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

    public static FactionStanding of(int score) {
        int clamped = clamp(score);
        for (FactionStanding standing : values()) {
            if (clamped >= standing.low && clamped <= standing.high) {
                return standing;
            }
        }
        return NEUTRAL;
    }

    public static int clamp(int score) {
        return Math.max(MIN_SCORE, Math.min(MAX_SCORE, score));
    }
}
