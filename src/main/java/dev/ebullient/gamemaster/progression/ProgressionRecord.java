package dev.ebullient.gamemaster.progression;

import dev.ebullient.gamemaster.state.WorldState;

/**
 * Player progression as stored in {@code player_character_data}. {@code level} is never
 * derived from {@code xpCurrent}.
 */
public record ProgressionRecord(int level, int xpCurrent) {

    public static final String LEVEL = "player_character_data.level";
    public static final String XP_CURRENT = "player_character_data.experience.current";
    public static final String LEVEL_UP_PENDING = "player_character_data.level_up_pending";

    public static ProgressionRecord from(WorldState state) {
        return new ProgressionRecord(state.getInt(LEVEL, 1), state.getInt(XP_CURRENT, 0));
    }

    public ProgressionRecord withXp(int xp) {
        return new ProgressionRecord(level, xp);
    }
}
