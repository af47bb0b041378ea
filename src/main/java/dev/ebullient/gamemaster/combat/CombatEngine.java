package dev.ebullient.gamemaster.combat;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.HexFormat;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import jakarta.inject.Inject;
import jakarta.inject.Singleton;

import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;

import dev.ebullient.gamemaster.StringUtils;
import dev.ebullient.gamemaster.progression.ProgressionEngine;
import dev.ebullient.gamemaster.state.Patch;
import dev.ebullient.gamemaster.state.PatchOp;
import dev.ebullient.gamemaster.state.StateStore;
import dev.ebullient.gamemaster.state.WorldClock;
import dev.ebullient.gamemaster.state.WorldState;

/**
 * Turn-based state machine over {@code combat_state}:
 * {@code idle -> initiating -> active -> ended | fled -> (archive) idle}.
 * <p>
 * Every transition reads the current snapshot and commits one patch. The author decides
 * when combat starts and ends; this engine keeps the consequences consistent.
 */
@Singleton
public class CombatEngine {
    private static final Logger log = Logger.getLogger(CombatEngine.class);

    public static final String DOMAIN = "combat_state";

    static final String IN_COMBAT = DOMAIN + ".in_combat";
    static final String SESSION_ID = DOMAIN + ".session_id";
    static final String PHASE = DOMAIN + ".phase";
    static final String ROUND = DOMAIN + ".round";
    static final String TURN_CURSOR = DOMAIN + ".turn_cursor";
    static final String INITIATIVE_ORDER = DOMAIN + ".initiative_order";
    static final String COMBATANTS = DOMAIN + ".combatants";
    static final String REWARDS_PROCESSED = DOMAIN + ".rewards_processed";
    static final String LOCATION = DOMAIN + ".location";
    static final String SUMMARY = DOMAIN + ".summary";
    static final String HISTORY = DOMAIN + ".history";
    static final String LAST_SESSION_ID = DOMAIN + ".last_session_id";

    @Inject
    ProgressionEngine progression;

    @ConfigProperty(name = "gamemaster.combat.seconds-per-round", defaultValue = "6")
    int secondsPerRound = 6;

    Clock clock = Clock.systemUTC();

    public CombatSession session(WorldState state) {
        return CombatSession.from(state);
    }

    /**
     * Open a new session. A finished session whose rewards were applied is archived first.
     *
     * @return the new session id
     */
    public String startCombat(StateStore store, String location, List<CombatantSetup> setups) {
        synchronized (store) {
            WorldState state = store.snapshot();
            CombatSession current = CombatSession.from(state);
            if (current.phase().isLive() || current.inCombat()) {
                throw new InvalidCombatStateException(current.sessionId(), "Combat is already in progress");
            }

            Patch.Builder patch = Patch.against(state);
            if (current.phase().isTerminal()) {
                if (!current.rewardsProcessed()) {
                    throw new InvalidCombatStateException(current.sessionId(),
                            "Previous session has not processed its rewards");
                }
                patch.addAll(archiveOps(archivedEntry(state, current)));
            }

            String place = StringUtils.firstNonBlank(location, "unknown");
            String sessionId = newSessionId(place);
            List<InitiativeEntry> order = new ArrayList<>();
            Map<String, Combatant> combatants = new LinkedHashMap<>();
            for (Combatant c : validate(sessionId, setups)) {
                combatants.put(c.actorId(), c);
            }
            for (CombatantSetup setup : setups) {
                order.add(new InitiativeEntry(setup.actorId(), setup.initiative(), setup.type()));
            }

            Map<String, Object> combatantTree = new LinkedHashMap<>();
            combatants.forEach((id, c) -> combatantTree.put(id, c.toMap()));

            patch.set(IN_COMBAT, true)
                    .set(SESSION_ID, sessionId)
                    .set(LOCATION, place)
                    .set(REWARDS_PROCESSED, false)
                    .delete(SUMMARY)
                    .delete(COMBATANTS)
                    .set(COMBATANTS, combatantTree);

            boolean ready = order.stream().allMatch(e -> e.initiativeScore() != null);
            patch.addAll(ready
                    ? activationOps(sessionId, order, combatants)
                    : initiatingOps(order));

            store.apply(patch.build());
            log.infof("[%s] Combat %s started at %s with %d combatants (%s)", store.campaignId(), sessionId,
                    place, setups.size(), ready ? CombatPhase.ACTIVE.value() : CombatPhase.INITIATING.value());
            return sessionId;
        }
    }

    /**
     * Record an initiative score. The session becomes active once every actor has one.
     */
    public CombatSession setInitiative(StateStore store, String actorId, int score) {
        synchronized (store) {
            WorldState state = store.snapshot();
            CombatSession session = CombatSession.from(state);
            if (session.phase() != CombatPhase.INITIATING) {
                throw new InvalidCombatStateException(session.sessionId(),
                        "Initiative can only be set while initiating, not " + session.phase().value());
            }
            List<InitiativeEntry> order = new ArrayList<>();
            boolean found = false;
            for (InitiativeEntry entry : session.initiativeOrder()) {
                if (entry.actorId().equals(actorId)) {
                    entry = entry.withScore(score);
                    found = true;
                }
                order.add(entry);
            }
            if (!found) {
                throw new InvalidCombatStateException(session.sessionId(), actorId + " is not in the initiative order");
            }

            boolean ready = order.stream().allMatch(e -> e.initiativeScore() != null);
            store.apply(Patch.against(state)
                    .addAll(ready
                            ? activationOps(session.sessionId(), order, session.combatants())
                            : initiatingOps(order))
                    .build());
            if (ready) {
                log.infof("[%s] Combat %s is active", store.campaignId(), session.sessionId());
            }
            return CombatSession.from(store.snapshot());
        }
    }

    /**
     * Apply damage after resistance (half, rounded down), vulnerability (double) or immunity (zero).
     * A combatant reduced to 0 HP is marked defeated and stays listed for audit.
     */
    public Combatant applyDamage(StateStore store, String actorId, int amount, DamageType type) {
        if (amount < 0) {
            throw new IllegalArgumentException("Damage must not be negative: " + amount);
        }
        synchronized (store) {
            WorldState state = store.snapshot();
            CombatSession session = requirePhase(state, CombatPhase.ACTIVE);
            Combatant target = requireCombatant(session, actorId);

            int effective = type == null ? amount : target.effectiveDamage(amount, type);
            int hp = (int) Math.max(0L, (long) target.hpCurrent() - effective);
            List<String> status = hp == 0 ? target.statusWith(Combatant.DEFEATED) : target.status();

            store.apply(Patch.against(state)
                    .set(combatantPath(actorId, "hp_current"), hp)
                    .set(combatantPath(actorId, "status"), new ArrayList<>(status))
                    .build());
            log.debugf("[%s] %s takes %d %s damage (%d effective), %d/%d HP", store.campaignId(), actorId,
                    amount, type == null ? "untyped" : type.value(), effective, hp, target.hpMax());
            return CombatSession.from(store.snapshot()).combatant(actorId).orElseThrow();
        }
    }

    public Combatant heal(StateStore store, String actorId, int amount) {
        if (amount < 0) {
            throw new IllegalArgumentException("Healing must not be negative: " + amount);
        }
        synchronized (store) {
            WorldState state = store.snapshot();
            CombatSession session = requireLive(state);
            Combatant target = requireCombatant(session, actorId);

            int hp = Math.min(target.hpMax(), target.hpCurrent() + amount);
            List<String> status = hp > 0 ? target.statusWithout(Combatant.DEFEATED) : target.status();
            store.apply(Patch.against(state)
                    .set(combatantPath(actorId, "hp_current"), hp)
                    .set(combatantPath(actorId, "status"), new ArrayList<>(status))
                    .build());
            return CombatSession.from(store.snapshot()).combatant(actorId).orElseThrow();
        }
    }

    /**
     * A surrendered enemy stops taking turns and is worth the same XP as a defeated one.
     */
    public Combatant markSurrendered(StateStore store, String actorId) {
        synchronized (store) {
            WorldState state = store.snapshot();
            CombatSession session = requireLive(state);
            Combatant target = requireCombatant(session, actorId);
            if (target.isSurrendered()) {
                return target;
            }
            store.apply(Patch.against(state)
                    .set(combatantPath(actorId, "status"), new ArrayList<>(target.statusWith(Combatant.SURRENDERED)))
                    .build());
            log.infof("[%s] %s surrendered", store.campaignId(), actorId);
            return CombatSession.from(store.snapshot()).combatant(actorId).orElseThrow();
        }
    }

    /**
     * Move the cursor to the next combatant that can still act. Wrapping past the end of
     * the initiative order completes a round and advances the world clock.
     */
    public CombatSession advanceTurn(StateStore store) {
        synchronized (store) {
            WorldState state = store.snapshot();
            CombatSession session = requirePhase(state, CombatPhase.ACTIVE);
            List<InitiativeEntry> order = session.initiativeOrder();
            int size = order.size();

            for (int step = 1; step <= size; step++) {
                int index = (session.turnCursor() + step) % size;
                Combatant next = session.combatants().get(order.get(index).actorId());
                if (next == null || !next.canAct()) {
                    continue;
                }
                Patch.Builder patch = Patch.against(state).set(TURN_CURSOR, index);
                if (session.turnCursor() + step >= size) {
                    patch.set(ROUND, session.round() + 1)
                            .addAll(WorldClock.advance(state, Duration.ofSeconds(secondsPerRound)));
                    log.debugf("[%s] Combat %s round %d", store.campaignId(), session.sessionId(), session.round() + 1);
                }
                store.apply(patch.build());
                return CombatSession.from(store.snapshot());
            }
            throw new InvalidCombatStateException(session.sessionId(), "No combatant is able to act");
        }
    }

    /**
     * Enter a terminal phase. On {@code ENDED}, XP for every defeated or surrendered enemy is
     * awarded in the same commit that sets {@code rewards_processed}; repeating the call is a no-op.
     */
    public CombatResolution endCombat(StateStore store, CombatOutcome outcome) {
        synchronized (store) {
            WorldState state = store.snapshot();
            CombatSession session = CombatSession.from(state);

            if (session.phase().isTerminal() && session.rewardsProcessed()) {
                return duplicate(store, session.sessionId(), CombatOutcome.of(session.phase()),
                        state.getInt(SUMMARY + ".xp_awarded", 0), outcome);
            }
            if (session.phase() == CombatPhase.IDLE) {
                List<Object> history = state.getList(HISTORY);
                if (!history.isEmpty() && history.get(history.size() - 1) instanceof Map<?, ?> last) {
                    return duplicate(store, String.valueOf(last.get("session_id")),
                            CombatOutcome.fromValue(String.valueOf(last.get("outcome"))),
                            last.get("xp_awarded") instanceof Number n ? n.intValue() : 0, outcome);
                }
                throw new InvalidCombatStateException(null, "No combat session to end");
            }
            if (session.phase().isTerminal()) {
                // the author wrote the terminal phase directly; settle rewards for what was recorded
                outcome = CombatOutcome.of(session.phase());
            }
            requireConsistent(session);

            List<String> neutralized = new ArrayList<>();
            int xp = 0;
            for (Combatant c : session.combatants().values()) {
                if (c.type() == ActorType.ENEMY && (c.isDefeated() || c.isSurrendered())) {
                    neutralized.add(c.actorId());
                    if (outcome == CombatOutcome.ENDED) {
                        xp += ChallengeRating.xpFor(c.cr());
                    }
                }
            }

            Map<String, Object> summary = new LinkedHashMap<>();
            summary.put("session_id", session.sessionId());
            summary.put("outcome", outcome.value());
            summary.put("xp_awarded", xp);
            summary.put("rounds", session.round());
            summary.put("enemies_defeated", neutralized);
            summary.put("location", session.location());

            Patch.Builder patch = Patch.against(state)
                    .set(PHASE, outcome.phase().value())
                    .set(IN_COMBAT, false)
                    .set(REWARDS_PROCESSED, true)
                    .delete(SUMMARY)
                    .set(SUMMARY, summary);
            if (xp > 0) {
                patch.addAll(progression.xpAwardOps(state, xp));
            }
            store.apply(patch.build());

            RewardStatus status = outcome == CombatOutcome.ENDED ? RewardStatus.APPLIED : RewardStatus.NONE;
            log.infof("[%s] Combat %s %s after %d rounds: %d XP", store.campaignId(), session.sessionId(),
                    outcome.value(), session.round(), xp);
            return new CombatResolution(session.sessionId(), outcome, xp, status);
        }
    }

    /**
     * Move a finished, processed session onto {@code history} and clear the live fields.
     *
     * @return the archived summary
     */
    public Map<String, Object> archive(StateStore store) {
        synchronized (store) {
            WorldState state = store.snapshot();
            CombatSession session = CombatSession.from(state);
            if (!session.phase().isTerminal() || !session.rewardsProcessed()) {
                throw new InvalidCombatStateException(session.sessionId(),
                        "Only a finished session with processed rewards can be archived");
            }
            Map<String, Object> entry = archivedEntry(state, session);
            store.apply(Patch.against(state).addAll(archiveOps(entry)).build());
            log.infof("[%s] Archived combat %s", store.campaignId(), session.sessionId());
            return entry;
        }
    }

    private static Map<String, Object> archivedEntry(WorldState state, CombatSession session) {
        Map<String, Object> entry = new LinkedHashMap<>(state.getMap(SUMMARY));
        entry.put("session_id", session.sessionId());
        entry.put("archived_at", WorldClock.now(state).toString());
        return entry;
    }

    List<PatchOp> archiveOps(Map<String, Object> entry) {
        return List.of(
                new PatchOp.Append(HISTORY, List.of(entry)),
                new PatchOp.Assign(LAST_SESSION_ID, entry.get("session_id")),
                new PatchOp.Assign(IN_COMBAT, false),
                new PatchOp.Assign(PHASE, CombatPhase.IDLE.value()),
                new PatchOp.Assign(ROUND, 0),
                new PatchOp.Assign(TURN_CURSOR, 0),
                new PatchOp.Assign(INITIATIVE_ORDER, List.of()),
                new PatchOp.Assign(REWARDS_PROCESSED, false),
                new PatchOp.Delete(COMBATANTS),
                new PatchOp.Delete(SESSION_ID),
                new PatchOp.Delete(LOCATION),
                new PatchOp.Delete(SUMMARY));
    }

    private CombatResolution duplicate(StateStore store, String sessionId, CombatOutcome recorded, int xp,
            CombatOutcome requested) {
        log.warnf("[%s] Duplicate reward attempt for combat %s (requested %s, recorded %s); ignored",
                store.campaignId(), sessionId, requested.value(), recorded.value());
        return new CombatResolution(sessionId, recorded, xp, RewardStatus.DUPLICATE);
    }

    private List<PatchOp> initiatingOps(List<InitiativeEntry> order) {
        return List.of(
                new PatchOp.Assign(INITIATIVE_ORDER, toList(order)),
                new PatchOp.Assign(PHASE, CombatPhase.INITIATING.value()),
                new PatchOp.Assign(ROUND, 0),
                new PatchOp.Assign(TURN_CURSOR, 0));
    }

    private List<PatchOp> activationOps(String sessionId, List<InitiativeEntry> order,
            Map<String, Combatant> combatants) {
        for (InitiativeEntry entry : order) {
            if (!combatants.containsKey(entry.actorId())) {
                throw new InvalidCombatStateException(sessionId,
                        "Initiative order references %s, which is not a combatant".formatted(entry.actorId()));
            }
        }
        List<InitiativeEntry> sorted = new ArrayList<>(order);
        sorted.sort(InitiativeEntry.TURN_ORDER);
        int cursor = 0;
        while (cursor < sorted.size() - 1 && !combatants.get(sorted.get(cursor).actorId()).canAct()) {
            cursor++;
        }
        return List.of(
                new PatchOp.Assign(INITIATIVE_ORDER, toList(sorted)),
                new PatchOp.Assign(PHASE, CombatPhase.ACTIVE.value()),
                new PatchOp.Assign(ROUND, 1),
                new PatchOp.Assign(TURN_CURSOR, cursor));
    }

    private List<Combatant> validate(String sessionId, List<CombatantSetup> setups) {
        if (setups == null || setups.isEmpty()) {
            throw new InvalidCombatStateException(sessionId, "Combat needs at least one combatant");
        }
        Set<String> seen = new HashSet<>();
        List<Combatant> result = new ArrayList<>();
        for (CombatantSetup setup : setups) {
            String id = setup.actorId();
            if (id == null || id.isBlank() || id.contains(".")) {
                throw new InvalidCombatStateException(sessionId, "Invalid actor id: " + id);
            }
            if (!seen.add(id)) {
                throw new InvalidCombatStateException(sessionId, "Duplicate combatant " + id);
            }
            if (setup.hpMax() < 1 || (setup.hpCurrent() != null
                    && (setup.hpCurrent() < 0 || setup.hpCurrent() > setup.hpMax()))) {
                throw new InvalidCombatStateException(sessionId,
                        "%s: hp_current must be within [0, hp_max] and hp_max at least 1".formatted(id));
            }
            if (setup.type() == ActorType.ENEMY && !ChallengeRating.isValid(setup.cr())) {
                throw new InvalidCombatStateException(sessionId,
                        "Enemy %s needs a valid challenge rating, got %s".formatted(id, setup.cr()));
            }
            result.add(Combatant.fromSetup(setup));
        }
        return result;
    }

    private void requireConsistent(CombatSession session) {
        for (InitiativeEntry entry : session.initiativeOrder()) {
            if (!session.combatants().containsKey(entry.actorId())) {
                throw new InvalidCombatStateException(session.sessionId(),
                        "Initiative order references %s, which is not a combatant".formatted(entry.actorId()));
            }
        }
        for (Combatant c : session.combatants().values()) {
            if (c.type() == ActorType.ENEMY && (c.isDefeated() || c.isSurrendered()) && !ChallengeRating.isValid(c.cr())) {
                throw new InvalidCombatStateException(session.sessionId(),
                        "Enemy %s has no valid challenge rating".formatted(c.actorId()));
            }
        }
    }

    private CombatSession requirePhase(WorldState state, CombatPhase phase) {
        CombatSession session = CombatSession.from(state);
        if (session.phase() != phase) {
            throw new InvalidCombatStateException(session.sessionId(),
                    "Expected combat phase %s, but it is %s".formatted(phase.value(), session.phase().value()));
        }
        return session;
    }

    private CombatSession requireLive(WorldState state) {
        CombatSession session = CombatSession.from(state);
        if (!session.phase().isLive()) {
            throw new InvalidCombatStateException(session.sessionId(),
                    "No combat in progress (phase %s)".formatted(session.phase().value()));
        }
        return session;
    }

    private Combatant requireCombatant(CombatSession session, String actorId) {
        return session.combatant(actorId)
                .orElseThrow(() -> new InvalidCombatStateException(session.sessionId(),
                        actorId + " is not a combatant"));
    }

    private static String combatantPath(String actorId, String field) {
        return COMBATANTS + "." + actorId + "." + field;
    }

    private static List<Object> toList(List<InitiativeEntry> order) {
        List<Object> list = new ArrayList<>(order.size());
        order.forEach(e -> list.add(e.toMap()));
        return list;
    }

    String newSessionId(String location) {
        return "combat_%d_%s".formatted(clock.instant().getEpochSecond(), locationHash(location));
    }

    static String locationHash(String location) {
        try {
            byte[] digest = MessageDigest.getInstance("SHA-1")
                    .digest(StringUtils.slugify(location).getBytes(StandardCharsets.UTF_8));
            return HexFormat.of().formatHex(digest).substring(0, 4);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-1 is not available", e);
        }
    }
}
