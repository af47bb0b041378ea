package dev.ebullient.gamemaster.combat;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import dev.ebullient.gamemaster.progression.ProgressionEngine;
import dev.ebullient.gamemaster.progression.ProgressionRecord;
import dev.ebullient.gamemaster.state.Patch;
import dev.ebullient.gamemaster.state.PathSchema;
import dev.ebullient.gamemaster.state.StateStore;
import dev.ebullient.gamemaster.state.WorldClock;
import dev.ebullient.gamemaster.state.WorldState;

class CombatEngineTest {

    static final PathSchema SCHEMA = PathSchema.fromClasspath();
    static final Instant WALL_CLOCK = Instant.parse("2024-05-01T12:00:00Z");

    StateStore store;
    CombatEngine combat;

    @BeforeEach
    void setUp() {
        store = new StateStore("combat", SCHEMA, 20);
        combat = new CombatEngine();
        combat.progression = new ProgressionEngine();
        combat.clock = Clock.fixed(WALL_CLOCK, ZoneOffset.UTC);
    }

    String startGoblinAmbush() {
        return combat.startCombat(store, "Triboar Trail", List.of(
                CombatantSetup.pc("pc_kira_001", 20, 15, 12),
                CombatantSetup.enemy("goblin_1", 7, 15, "1/4", 15),
                CombatantSetup.enemy("bugbear", 27, 16, "1", 12),
                new CombatantSetup("npc_sildar_001", ActorType.ALLY, 18, 18, 16, null, 12, null)));
    }

    List<String> order() {
        return combat.session(store.snapshot()).initiativeOrder().stream().map(InitiativeEntry::actorId).toList();
    }

    @Test
    void startCombat_sessionIdEncodesTimeAndLocation() {
        String sessionId = startGoblinAmbush();

        assertEquals("combat_" + WALL_CLOCK.getEpochSecond() + "_" + CombatEngine.locationHash("Triboar Trail"),
                sessionId);
        assertTrue(sessionId.matches("combat_\\d+_[0-9a-f]{4}"), sessionId);
        assertEquals(CombatEngine.locationHash("triboar trail"), CombatEngine.locationHash("Triboar  Trail!"));
    }

    @Test
    void startCombat_allInitiativeKnownGoesActive() {
        startGoblinAmbush();
        CombatSession session = combat.session(store.snapshot());

        assertEquals(CombatPhase.ACTIVE, session.phase());
        assertTrue(session.inCombat());
        assertEquals(1, session.round());
        // ties at 12: pc, then ally, then enemy
        assertEquals(List.of("goblin_1", "pc_kira_001", "npc_sildar_001", "bugbear"), order());
        assertEquals("goblin_1", session.currentActor().orElseThrow());
    }

    @Test
    void setInitiative_activatesOnceEveryScoreIsKnown() {
        combat.startCombat(store, "cave", List.of(
                CombatantSetup.pc("pc_kira_001", 20, 15, null),
                CombatantSetup.enemy("wolf_b", 11, 13, "1/4", null),
                CombatantSetup.enemy("wolf_a", 11, 13, "1/4", null)));
        assertEquals(CombatPhase.INITIATING, combat.session(store.snapshot()).phase());

        combat.setInitiative(store, "wolf_b", 9);
        combat.setInitiative(store, "wolf_a", 9);
        assertEquals(CombatPhase.INITIATING, combat.session(store.snapshot()).phase());

        CombatSession session = combat.setInitiative(store, "pc_kira_001", 9);
        assertEquals(CombatPhase.ACTIVE, session.phase());
        assertEquals(List.of("pc_kira_001", "wolf_a", "wolf_b"), order());
        assertThrows(InvalidCombatStateException.class, () -> combat.setInitiative(store, "wolf_a", 3));
    }

    @Test
    void startCombat_rejectsBadRosters() {
        assertThrows(InvalidCombatStateException.class, () -> combat.startCombat(store, "road", List.of(
                CombatantSetup.enemy("orc", 15, 13, null, 10))));
        assertThrows(InvalidCombatStateException.class, () -> combat.startCombat(store, "road", List.of(
                CombatantSetup.pc("pc_kira_001", 20, 15, 10),
                CombatantSetup.pc("pc_kira_001", 20, 15, 10))));
        assertThrows(InvalidCombatStateException.class, () -> combat.startCombat(store, "road", List.of()));
        assertEquals(WorldState.INITIAL_VERSION, store.version());

        startGoblinAmbush();
        assertThrows(InvalidCombatStateException.class, this::startGoblinAmbush);
    }

    @Test
    void applyDamage_honoursDamageTable() {
        combat.startCombat(store, "crypt", List.of(
                CombatantSetup.pc("pc_kira_001", 20, 15, 10),
                CombatantSetup.enemy("skeleton", 30, 13, "1/4", 8).withDamageModifiers(Map.of(
                        DamageType.BLUDGEONING, DamageResponse.VULNERABLE,
                        DamageType.PIERCING, DamageResponse.RESISTANT,
                        DamageType.POISON, DamageResponse.IMMUNE))));

        assertEquals(27, combat.applyDamage(store, "skeleton", 7, DamageType.PIERCING).hpCurrent());
        assertEquals(27, combat.applyDamage(store, "skeleton", 12, DamageType.POISON).hpCurrent());
        assertEquals(19, combat.applyDamage(store, "skeleton", 4, DamageType.BLUDGEONING).hpCurrent());
        assertEquals(14, combat.applyDamage(store, "skeleton", 5, DamageType.FIRE).hpCurrent());

        Combatant dead = combat.applyDamage(store, "skeleton", 50, DamageType.SLASHING);
        assertEquals(0, dead.hpCurrent());
        assertTrue(dead.isDefeated());
        assertTrue(combat.session(store.snapshot()).combatant("skeleton").isPresent());

        assertThrows(IllegalArgumentException.class,
                () -> combat.applyDamage(store, "pc_kira_001", -3, DamageType.FIRE));
        assertThrows(InvalidCombatStateException.class,
                () -> combat.applyDamage(store, "nobody", 3, DamageType.FIRE));
    }

    @Test
    void applyDamage_hugeVulnerableHitSaturates() {
        combat.startCombat(store, "bridge", List.of(
                CombatantSetup.pc("pc_kira_001", 20, 15, 10),
                CombatantSetup.enemy("troll", 30, 15, "5", 8).withDamageModifiers(Map.of(
                        DamageType.FIRE, DamageResponse.VULNERABLE))));

        assertEquals(Integer.MAX_VALUE, DamageResponse.VULNERABLE.apply(Integer.MAX_VALUE));
        Combatant troll = combat.applyDamage(store, "troll", Integer.MAX_VALUE, DamageType.FIRE);
        assertEquals(0, troll.hpCurrent());
        assertTrue(troll.isDefeated());

        Combatant kira = combat.applyDamage(store, "pc_kira_001", Integer.MAX_VALUE, null);
        assertEquals(0, kira.hpCurrent());
    }

    @Test
    void heal_clearsDefeatAndClampsToMax() {
        startGoblinAmbush();
        combat.applyDamage(store, "pc_kira_001", 25, null);
        Combatant healed = combat.heal(store, "pc_kira_001", 40);
        assertEquals(20, healed.hpCurrent());
        assertTrue(healed.canAct());
    }

    @Test
    void advanceTurn_skipsDefeatedAndSurrendered() {
        startGoblinAmbush();
        combat.applyDamage(store, "pc_kira_001", 20, DamageType.SLASHING);
        combat.markSurrendered(store, "npc_sildar_001");

        CombatSession session = combat.advanceTurn(store);
        assertEquals("bugbear", session.currentActor().orElseThrow());
        assertEquals(1, session.round());
    }

    @Test
    void advanceTurn_wrapCompletesRoundAndAdvancesWorldClock() {
        store.apply(Patch.against(store.snapshot())
                .addAll(WorldClock.setTo(Instant.parse("1492-06-01T11:59:58Z")))
                .build());
        startGoblinAmbush();

        combat.advanceTurn(store);
        combat.advanceTurn(store);
        combat.advanceTurn(store);
        assertEquals(1, combat.session(store.snapshot()).round());

        CombatSession session = combat.advanceTurn(store);
        assertEquals(2, session.round());
        assertEquals("goblin_1", session.currentActor().orElseThrow());
        WorldState state = store.snapshot();
        assertEquals(Instant.parse("1492-06-01T12:00:04Z"), WorldClock.now(state));
        assertEquals("Midday", state.getString(WorldClock.PATH + ".time_of_day").orElseThrow());
    }

    @Test
    void advanceTurn_failsWhenNobodyCanAct() {
        combat.startCombat(store, "pit", List.of(
                CombatantSetup.pc("pc_kira_001", 5, 12, 10),
                CombatantSetup.enemy("ooze", 10, 8, "1/2", 5)));
        combat.applyDamage(store, "pc_kira_001", 5, null);
        combat.markSurrendered(store, "ooze");
        assertThrows(InvalidCombatStateException.class, () -> combat.advanceTurn(store));
    }

    @Test
    void endCombat_awardsXpForDefeatedAndSurrenderedEnemiesExactlyOnce() {
        String sessionId = startGoblinAmbush();
        combat.applyDamage(store, "bugbear", 27, DamageType.SLASHING);
        combat.markSurrendered(store, "goblin_1");

        CombatResolution first = combat.endCombat(store, CombatOutcome.ENDED);
        assertEquals(sessionId, first.sessionId());
        assertEquals(250, first.xpAwarded());
        assertEquals(RewardStatus.APPLIED, first.rewardStatus());
        assertEquals(250, ProgressionRecord.from(store.snapshot()).xpCurrent());

        long version = store.version();
        CombatResolution second = combat.endCombat(store, CombatOutcome.ENDED);
        assertEquals(RewardStatus.DUPLICATE, second.rewardStatus());
        assertEquals(250, second.xpAwarded());
        assertEquals(version, store.version());
        assertEquals(250, ProgressionRecord.from(store.snapshot()).xpCurrent());

        WorldState state = store.snapshot();
        assertEquals("ended", state.getString("combat_state.phase").orElseThrow());
        assertFalse(state.getBoolean("combat_state.in_combat"));
        assertEquals(List.of("goblin_1", "bugbear"), state.getList("combat_state.summary.enemies_defeated"));
    }

    @Test
    void endCombat_fledAwardsNothing() {
        startGoblinAmbush();
        combat.applyDamage(store, "goblin_1", 7, null);

        CombatResolution resolution = combat.endCombat(store, CombatOutcome.FLED);
        assertEquals(CombatOutcome.FLED, resolution.outcome());
        assertEquals(0, resolution.xpAwarded());
        assertEquals(RewardStatus.NONE, resolution.rewardStatus());
        assertEquals(0, ProgressionRecord.from(store.snapshot()).xpCurrent());
        assertEquals(CombatPhase.FLED, combat.session(store.snapshot()).phase());
    }

    @Test
    void endCombat_rejectsDanglingInitiativeEntry() {
        startGoblinAmbush();
        store.apply(Patch.against(store.snapshot()).delete("combat_state.combatants.bugbear").build());

        assertThrows(InvalidCombatStateException.class, () -> combat.endCombat(store, CombatOutcome.ENDED));
        assertFalse(store.snapshot().getBoolean("combat_state.rewards_processed"));
    }

    @Test
    void endCombat_withoutSessionFails() {
        assertThrows(InvalidCombatStateException.class, () -> combat.endCombat(store, CombatOutcome.ENDED));
    }

    @Test
    void archive_movesSummaryToHistory() {
        String sessionId = startGoblinAmbush();
        combat.applyDamage(store, "goblin_1", 7, null);
        assertThrows(InvalidCombatStateException.class, () -> combat.archive(store));
        combat.endCombat(store, CombatOutcome.ENDED);

        Map<String, Object> entry = combat.archive(store);
        assertEquals(sessionId, entry.get("session_id"));
        assertEquals(50, entry.get("xp_awarded"));

        WorldState state = store.snapshot();
        CombatSession session = combat.session(state);
        assertEquals(CombatPhase.IDLE, session.phase());
        assertTrue(session.combatants().isEmpty());
        assertEquals(sessionId, state.getString("combat_state.last_session_id").orElseThrow());
        assertEquals(1, state.getList("combat_state.history").size());

        // a retried end after archiving is still a duplicate, not a second award
        CombatResolution retry = combat.endCombat(store, CombatOutcome.ENDED);
        assertEquals(RewardStatus.DUPLICATE, retry.rewardStatus());
        assertEquals(50, ProgressionRecord.from(store.snapshot()).xpCurrent());
    }

    @Test
    void startCombat_archivesProcessedSessionFirst() {
        String first = startGoblinAmbush();
        combat.endCombat(store, CombatOutcome.FLED);

        combat.clock = Clock.fixed(WALL_CLOCK.plusSeconds(60), ZoneOffset.UTC);
        String second = startGoblinAmbush();

        WorldState state = store.snapshot();
        assertEquals(first, state.getString("combat_state.last_session_id").orElseThrow());
        assertEquals(second, state.getString("combat_state.session_id").orElseThrow());
        assertEquals(1, state.getList("combat_state.history").size());
    }
}
