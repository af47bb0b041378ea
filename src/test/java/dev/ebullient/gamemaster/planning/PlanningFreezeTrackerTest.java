package dev.ebullient.gamemaster.planning;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import dev.ebullient.gamemaster.state.PathSchema;
import dev.ebullient.gamemaster.state.StateStore;
import dev.ebullient.gamemaster.state.WorldState;

class PlanningFreezeTrackerTest {

    static final Instant NOW = Instant.parse("1492-03-10T09:00:00Z");

    StateStore store;
    PlanningFreezeTracker freezes;

    @BeforeEach
    void setUp() {
        store = new StateStore("planning", PathSchema.fromClasspath(), 10);
        freezes = new PlanningFreezeTracker();
    }

    @Test
    void freezeDuration_bandsIncreaseWithDifficulty() {
        assertEquals(Duration.ofHours(1), PlanningFreezeTracker.freezeDuration(5));
        assertEquals(Duration.ofHours(1), PlanningFreezeTracker.freezeDuration(10));
        assertEquals(Duration.ofHours(2), PlanningFreezeTracker.freezeDuration(12));
        assertEquals(Duration.ofHours(4), PlanningFreezeTracker.freezeDuration(13));
        assertEquals(Duration.ofHours(8), PlanningFreezeTracker.freezeDuration(16));
        assertEquals(Duration.ofHours(12), PlanningFreezeTracker.freezeDuration(17));
        assertEquals(Duration.ofHours(24), PlanningFreezeTracker.freezeDuration(25));
    }

    @Test
    void registerFailure_freezesOnlyThatTopic() {
        FrozenPlan plan = freezes.registerFailure(store, "bribe_the_guard", 15, NOW, "guard refused");

        assertEquals(NOW.plus(Duration.ofHours(8)), plan.freezeUntil());
        WorldState state = store.snapshot();
        assertTrue(freezes.isFrozen(state, "bribe_the_guard", NOW.plus(Duration.ofHours(7))));
        assertFalse(freezes.isFrozen(state, "bribe_the_guard", NOW.plus(Duration.ofHours(8))));
        assertFalse(freezes.isFrozen(state, "sneak_past_the_guard", NOW));
        assertEquals(List.of(plan), freezes.active(state, NOW));
    }

    @Test
    void registerFailure_replacesExistingFreeze() {
        freezes.registerFailure(store, "bribe_the_guard", 20, NOW, "first try");
        FrozenPlan second = freezes.registerFailure(store, "bribe_the_guard", 8, NOW.plus(Duration.ofHours(1)), null);

        FrozenPlan stored = freezes.lookup(store.snapshot(), "bribe_the_guard").orElseThrow();
        assertEquals(second, stored);
        assertEquals(1, stored.freezeHours());
        assertEquals(8, stored.originalDifficulty());
    }

    @Test
    void registerFailure_validatesInput() {
        assertThrows(IllegalArgumentException.class,
                () -> freezes.registerFailure(store, "Bribe The Guard", 12, NOW, null));
        assertThrows(IllegalArgumentException.class,
                () -> freezes.registerFailure(store, "bribe_the_guard", -1, NOW, null));
    }

    @Test
    void breakEarly_removesFreeze() {
        freezes.registerFailure(store, "forge_the_seal", 18, NOW, null);

        assertTrue(freezes.breakEarly(store, "forge_the_seal", BreakReason.QUALIFIED_ASSISTANCE));
        assertFalse(freezes.isFrozen(store.snapshot(), "forge_the_seal", NOW));
        assertFalse(freezes.breakEarly(store, "forge_the_seal", BreakReason.ADMIN_OVERRIDE));
    }

    @Test
    void pruneExpired_deletesOnlyExpiredEntries() {
        freezes.registerFailure(store, "quick", 10, NOW, null);
        freezes.registerFailure(store, "slow", 19, NOW, null);

        List<String> pruned = freezes.pruneExpired(store, NOW.plus(Duration.ofHours(2)));

        assertEquals(List.of("quick"), pruned);
        WorldState state = store.snapshot();
        assertFalse(state.contains("frozen_plans.quick"));
        assertTrue(state.contains("frozen_plans.slow"));

        long version = store.version();
        assertTrue(freezes.pruneExpired(store, NOW.plus(Duration.ofHours(3))).isEmpty());
        assertEquals(version, store.version());
    }
}
