package dev.ebullient.gamemaster;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import org.jboss.logging.Logger;

import com.fasterxml.jackson.databind.ObjectMapper;

import dev.ebullient.gamemaster.combat.CombatEngine;
import dev.ebullient.gamemaster.combat.CombatOutcome;
import dev.ebullient.gamemaster.combat.CombatResolution;
import dev.ebullient.gamemaster.combat.CombatSession;
import dev.ebullient.gamemaster.entity.EntityRegistry;
import dev.ebullient.gamemaster.model.Decision;
import dev.ebullient.gamemaster.model.PlanningCheck;
import dev.ebullient.gamemaster.model.TurnRequest;
import dev.ebullient.gamemaster.model.TurnResult;
import dev.ebullient.gamemaster.planning.FrozenPlan;
import dev.ebullient.gamemaster.planning.PlanningFreezeTracker;
import dev.ebullient.gamemaster.progression.LevelUpResult;
import dev.ebullient.gamemaster.progression.ProgressionEngine;
import dev.ebullient.gamemaster.progression.ProgressionRecord;
import dev.ebullient.gamemaster.reputation.DecayResult;
import dev.ebullient.gamemaster.reputation.ReputationResolver;
import dev.ebullient.gamemaster.state.GodModeParser;
import dev.ebullient.gamemaster.state.Patch;
import dev.ebullient.gamemaster.state.PatchOp;
import dev.ebullient.gamemaster.state.PatchParser;
import dev.ebullient.gamemaster.state.PatchSource;
import dev.ebullient.gamemaster.state.StaleVersionException;
import dev.ebullient.gamemaster.state.StateStore;
import dev.ebullient.gamemaster.state.WorldClock;
import dev.ebullient.gamemaster.state.WorldState;

/**
 * Runs one author turn against a campaign: housekeeping, entity registration, the author's
 * patch, then the consequences of the turn's decisions. The whole turn commits as one
 * version, or not at all.
 */
@ApplicationScoped
public class TurnProcessor {
    private static final Logger log = Logger.getLogger(TurnProcessor.class);

    @Inject
    CampaignSessions sessions;

    @Inject
    EntityRegistry registry;

    @Inject
    CombatEngine combat;

    @Inject
    ProgressionEngine progression;

    @Inject
    ReputationResolver reputation;

    @Inject
    PlanningFreezeTracker freezes;

    @Inject
    ObjectMapper objectMapper;

    public TurnResult processTurn(String campaignId, TurnRequest request) {
        StateStore store = sessions.store(campaignId);
        synchronized (store) {
            if (request.baseVersion() != store.version()) {
                log.warnf("[%s] Stale turn: computed against version %d, current is %d",
                        campaignId, request.baseVersion(), store.version());
                throw new StaleVersionException(request.baseVersion(), store.version());
            }
            PatchParser parser = new PatchParser(objectMapper);
            Patch patch = parser.parse(request.baseVersion(), request.patch());

            List<String> notices = new ArrayList<>();
            List<String> assigned = new ArrayList<>();
            CombatResolution resolution = store.inTransaction("turn", staged -> {
                // lazy expiry and decay against the world clock
                Instant now = WorldClock.now(staged.snapshot());
                List<String> expired = freezes.pruneExpired(staged, now);
                if (!expired.isEmpty()) {
                    notices.add("Planning freezes expired: " + String.join(", ", expired));
                }
                DecayResult decay = reputation.applyDecay(staged, now);
                if (decay.changed()) {
                    notices.add("Reputation decay: %d rumor(s) forgotten, %d point(s) of drift"
                            .formatted(decay.rumorsDropped(), decay.driftPoints()));
                }

                if (!request.entities().isEmpty()) {
                    assigned.addAll(registry.registerAll(staged, request.entities()));
                }

                if (!patch.isEmpty()) {
                    registry.validatePatch(staged.snapshot(), patch, staged.schema());
                    staged.apply(patch);
                }
                return applyDecision(staged, request.decision(), notices);
            });
            return new TurnResult(store.version(), assigned, notices, resolution);
        }
    }

    /**
     * Consequences in a fixed order: combat start, combat end, narrative XP, level up, planning.
     */
    CombatResolution applyDecision(StateStore store, Decision decision, List<String> notices) {
        CombatResolution resolution = null;

        if (decision.startsCombat()) {
            CombatSession session = combat.session(store.snapshot());
            if (session.phase().isLive()) {
                notices.add("Combat %s is already in progress".formatted(session.sessionId()));
            } else {
                String sessionId = combat.startCombat(store, decision.combatLocation(), decision.combatants());
                notices.add("Combat %s started".formatted(sessionId));
            }
        }

        CombatOutcome outcome = decision.combatOutcome();
        if (outcome == null && decision.leftCombat() && combat.session(store.snapshot()).phase().isLive()) {
            outcome = CombatOutcome.ENDED;
        }
        if (outcome != null) {
            resolution = combat.endCombat(store, outcome);
            notices.add("Combat %s %s: %d XP (%s)".formatted(resolution.sessionId(), resolution.outcome().value(),
                    resolution.xpAwarded(), resolution.rewardStatus()));
        }

        if (decision.xpAward() != null && decision.xpAward() > 0) {
            ProgressionRecord record = progression.awardXp(store, decision.xpAward(),
                    StringUtils.firstNonBlank(decision.xpReason(), "narrative award"));
            notices.add("Awarded %d XP (%d total)".formatted(decision.xpAward(), record.xpCurrent()));
        }

        if (decision.levelUp()) {
            ProgressionRecord record = ProgressionRecord.from(store.snapshot());
            if (progression.checkLevelUp(record)) {
                LevelUpResult result = progression.applyLevelUp(store, record.level() + 1);
                notices.add("Reached level %d (+%d HP)".formatted(result.toLevel(), result.hpGain()));
            } else {
                notices.add("Level up declined: %d XP still needed".formatted(progression.xpToNextLevel(record)));
            }
        }

        if (decision.planningCheck() != null) {
            applyPlanningCheck(store, decision.planningCheck(), notices);
        }
        return resolution;
    }

    private void applyPlanningCheck(StateStore store, PlanningCheck check, List<String> notices) {
        Instant now = WorldClock.now(store.snapshot());
        if (freezes.isFrozen(store.snapshot(), check.topicKey(), now)) {
            if (check.breakReason() == null) {
                FrozenPlan plan = freezes.lookup(store.snapshot(), check.topicKey()).orElseThrow();
                notices.add("Planning on %s is frozen until %s; check ignored".formatted(check.topicKey(),
                        plan.freezeUntil()));
                return;
            }
            freezes.breakEarly(store, check.topicKey(), check.breakReason());
            notices.add("Freeze on %s lifted: %s".formatted(check.topicKey(), check.breakReason().value()));
        }
        if (!check.passed()) {
            FrozenPlan plan = freezes.registerFailure(store, check.topicKey(), check.difficulty(), now,
                    check.description());
            notices.add("Planning on %s frozen until %s".formatted(check.topicKey(), plan.freezeUntil()));
        }
    }

    /**
     * Apply a {@code GOD_MODE_SET:} correction. Entity edges are still validated.
     */
    public WorldState applyRecovery(String campaignId, String text) {
        StateStore store = sessions.store(campaignId);
        List<PatchOp> ops = GodModeParser.parse(text);
        synchronized (store) {
            WorldState state = store.snapshot();
            registry.validatePatch(state, new Patch(state.version(), ops, PatchSource.RECOVERY), store.schema());
            return store.applyCorrection(ops);
        }
    }
}
