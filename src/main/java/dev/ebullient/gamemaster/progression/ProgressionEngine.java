package dev.ebullient.gamemaster.progression;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import jakarta.inject.Singleton;

import org.jboss.logging.Logger;

import dev.ebullient.gamemaster.state.Patch;
import dev.ebullient.gamemaster.state.PatchOp;
import dev.ebullient.gamemaster.state.StateStore;
import dev.ebullient.gamemaster.state.WorldState;

/**
 * XP and level authority. XP only moves through {@link #awardXp} (or an explicit
 * administrative {@link #correctXp}); level only moves through {@link #applyLevelUp}.
 */
@Singleton
public class ProgressionEngine {
    private static final Logger log = Logger.getLogger(ProgressionEngine.class);

    public static final int MAX_LEVEL = 20;
    public static final String ABILITY_SCORE_IMPROVEMENT = "ability_score_improvement";

    static final String HP_MAX = "player_character_data.hp_max";
    static final String HP_CURRENT = "player_character_data.hp_current";
    static final String HIT_DIE = "player_character_data.hit_die";
    static final String CONSTITUTION = "player_character_data.abilities.constitution";
    static final String PROFICIENCY_BONUS = "player_character_data.proficiency_bonus";
    static final String FEATURE_GRANTS = "player_character_data.pending_feature_grants";

    private static final int[] XP_THRESHOLDS = {
            0, 300, 900, 2700, 6500, 14000, 23000, 34000, 48000, 64000,
            85000, 100000, 120000, 140000, 165000, 195000, 225000, 265000, 305000, 355000
    };

    private static final Set<Integer> ASI_LEVELS = Set.of(4, 8, 12, 16, 19);

    public static int xpThresholdFor(int level) {
        if (level < 1 || level > MAX_LEVEL) {
            throw new IllegalArgumentException("Level must be between 1 and %d, got %d".formatted(MAX_LEVEL, level));
        }
        return XP_THRESHOLDS[level - 1];
    }

    public static int proficiencyBonus(int level) {
        return 2 + (Math.max(1, Math.min(level, MAX_LEVEL)) - 1) / 4;
    }

    public boolean checkLevelUp(ProgressionRecord record) {
        if (record.level() >= MAX_LEVEL) {
            return false;
        }
        return record.xpCurrent() >= xpThresholdFor(record.level() + 1);
    }

    public int xpToNextLevel(ProgressionRecord record) {
        if (record.level() >= MAX_LEVEL) {
            return 0;
        }
        return Math.max(0, xpThresholdFor(record.level() + 1) - record.xpCurrent());
    }

    /**
     * Operations that add {@code amount} XP, for callers that commit them with other changes.
     */
    public List<PatchOp> xpAwardOps(WorldState state, int amount) {
        if (amount < 0) {
            throw new IllegalArgumentException("XP awards must not be negative: " + amount);
        }
        ProgressionRecord record = ProgressionRecord.from(state);
        return xpOps(record.withXp(record.xpCurrent() + amount));
    }

    public ProgressionRecord awardXp(StateStore store, int amount, String reason) {
        synchronized (store) {
            WorldState state = store.snapshot();
            List<PatchOp> ops = xpAwardOps(state, amount);
            store.apply(Patch.against(state).addAll(ops).build());
            ProgressionRecord after = ProgressionRecord.from(store.snapshot());
            log.infof("[%s] Awarded %d XP (%s): %d total", store.campaignId(), amount, reason, after.xpCurrent());
            return after;
        }
    }

    /**
     * Administrative override. The only way XP may decrease.
     */
    public ProgressionRecord correctXp(StateStore store, int newValue, String reason) {
        if (newValue < 0) {
            throw new IllegalArgumentException("XP must not be negative: " + newValue);
        }
        synchronized (store) {
            WorldState state = store.snapshot();
            ProgressionRecord before = ProgressionRecord.from(state);
            store.apply(Patch.against(state).addAll(xpOps(before.withXp(newValue))).build());
            log.warnf("[%s] XP corrected from %d to %d: %s", store.campaignId(), before.xpCurrent(), newValue, reason);
            return ProgressionRecord.from(store.snapshot());
        }
    }

    /**
     * Compute (without committing) the level up to {@code targetLevel}.
     * Reapplying a level that was already reached is a no-op.
     */
    public LevelUpResult levelUp(ProgressionRecord record, int targetLevel, int hitDie, int constitution) {
        if (record.level() >= targetLevel) {
            return LevelUpResult.unchanged(record);
        }
        if (targetLevel != record.level() + 1) {
            throw new IllegalArgumentException("Level ups advance one level at a time: %d -> %d"
                    .formatted(record.level(), targetLevel));
        }
        if (!checkLevelUp(record)) {
            throw new IllegalStateException("Not eligible for level %d: %d of %d XP"
                    .formatted(targetLevel, record.xpCurrent(), xpThresholdFor(targetLevel)));
        }
        int conModifier = Math.floorDiv(constitution - 10, 2);
        int hpGain = Math.max(1, hitDie / 2 + 1 + conModifier);
        List<String> grants = new ArrayList<>();
        if (ASI_LEVELS.contains(targetLevel)) {
            grants.add(ABILITY_SCORE_IMPROVEMENT);
        }
        return new LevelUpResult(true, record.level(), targetLevel, hpGain, proficiencyBonus(targetLevel), grants);
    }

    public LevelUpResult applyLevelUp(StateStore store, int targetLevel) {
        synchronized (store) {
            WorldState state = store.snapshot();
            ProgressionRecord record = ProgressionRecord.from(state);
            LevelUpResult result = levelUp(record, targetLevel,
                    state.getInt(HIT_DIE, 8), state.getInt(CONSTITUTION, 10));
            if (!result.applied()) {
                log.debugf("[%s] Level %d already reached", store.campaignId(), targetLevel);
                return result;
            }

            Patch.Builder patch = Patch.against(state)
                    .set(ProgressionRecord.LEVEL, result.toLevel())
                    .set(PROFICIENCY_BONUS, result.proficiencyBonus())
                    .set(ProgressionRecord.LEVEL_UP_PENDING,
                            checkLevelUp(new ProgressionRecord(result.toLevel(), record.xpCurrent())));
            state.getInt(HP_MAX).ifPresent(hp -> patch.set(HP_MAX, hp + result.hpGain()));
            state.getInt(HP_CURRENT).ifPresent(hp -> patch.set(HP_CURRENT, hp + result.hpGain()));
            for (String grant : result.grants()) {
                Map<String, Object> item = new LinkedHashMap<>();
                item.put("feature", grant);
                item.put("level", result.toLevel());
                patch.append(FEATURE_GRANTS, item);
            }
            store.apply(patch.build());
            log.infof("[%s] Level up %d -> %d (+%d HP, proficiency +%d)", store.campaignId(),
                    result.fromLevel(), result.toLevel(), result.hpGain(), result.proficiencyBonus());
            return result;
        }
    }

    private List<PatchOp> xpOps(ProgressionRecord record) {
        return List.of(
                new PatchOp.Assign(ProgressionRecord.XP_CURRENT, record.xpCurrent()),
                new PatchOp.Assign(ProgressionRecord.LEVEL_UP_PENDING, checkLevelUp(record)));
    }
}
