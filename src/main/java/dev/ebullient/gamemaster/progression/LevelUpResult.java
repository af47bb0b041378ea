package dev.ebullient.gamemaster.progression;

import java.util.List;

public record LevelUpResult(
        boolean applied,
        int fromLevel,
        int toLevel,
        int hpGain,
        int proficiencyBonus,
        List<String> grants) {

    public LevelUpResult {
        grants = grants == null ? List.of() : List.copyOf(grants);
    }

    static LevelUpResult unchanged(ProgressionRecord record) {
        return new LevelUpResult(false, record.level(), record.level(), 0,
                ProgressionEngine.proficiencyBonus(record.level()), List.of());
    }
}
