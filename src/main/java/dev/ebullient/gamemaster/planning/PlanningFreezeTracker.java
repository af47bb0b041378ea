package dev.ebullient.gamemaster.planning;

import java.time.Duration;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Pattern;

import jakarta.inject.Singleton;

import org.jboss.logging.Logger;

import dev.ebullient.gamemaster.state.Patch;
import dev.ebullient.gamemaster.state.SchemaViolationException;
import dev.ebullient.gamemaster.state.StateStore;
import dev.ebullient.gamemaster.state.WorldState;

/**
 * Cooldowns on re-attempting a planning topic after a failed quality check.
 * <p>
 * A freeze is scoped to its topic key only: a different key is never blocked, even if it
 * serves the same goal. Expiry is evaluated against the world clock, lazily.
 */
@Singleton
public class PlanningFreezeTracker {
    private static final Logger log = Logger.getLogger(PlanningFreezeTracker.class);

    public static final String DOMAIN = "frozen_plans";
    public static final Pattern TOPIC_KEY = Pattern.compile("[a-z0-9_]+");

    public static Duration freezeDuration(int difficulty) {
        return FreezeBand.forDifficulty(difficulty).duration();
    }

    /**
     * Freeze {@code topicKey} from {@code now}. A new failure on a frozen topic replaces the old freeze.
     */
    public FrozenPlan registerFailure(StateStore store, String topicKey, int difficulty, Instant now,
            String description) {
        requireTopicKey(topicKey);
        if (difficulty < 0) {
            throw new IllegalArgumentException("Difficulty must not be negative: " + difficulty);
        }
        FreezeBand band = FreezeBand.forDifficulty(difficulty);
        FrozenPlan plan = new FrozenPlan(topicKey, now, now.plus(band.duration()), difficulty, band.hours(),
                description);
        synchronized (store) {
            WorldState state = store.snapshot();
            store.apply(Patch.against(state)
                    .delete(path(topicKey))
                    .set(path(topicKey), plan.toMap())
                    .build());
        }
        log.infof("[%s] Planning on %s frozen for %dh (difficulty %d)", store.campaignId(), topicKey,
                band.hours(), difficulty);
        return plan;
    }

    public boolean isFrozen(WorldState state, String topicKey, Instant now) {
        return lookup(state, topicKey).map(p -> p.isFrozenAt(now)).orElse(false);
    }

    public Optional<FrozenPlan> lookup(WorldState state, String topicKey) {
        Object entry = state.getMap(DOMAIN).get(topicKey);
        if (!(entry instanceof Map<?, ?> map)) {
            return Optional.empty();
        }
        try {
            return Optional.of(FrozenPlan.fromMap(topicKey, map));
        } catch (DateTimeParseException e) {
            throw new SchemaViolationException(path(topicKey), "ISO-8601 failed_at and freeze_until",
                    e.getParsedString());
        }
    }

    public List<FrozenPlan> active(WorldState state, Instant now) {
        List<FrozenPlan> plans = new ArrayList<>();
        for (String topic : state.getMap(DOMAIN).keySet()) {
            lookup(state, topic).filter(p -> p.isFrozenAt(now)).ifPresent(plans::add);
        }
        return plans;
    }

    /**
     * Lift a freeze before it expires.
     *
     * @return false if the topic was not frozen
     */
    public boolean breakEarly(StateStore store, String topicKey, BreakReason reason) {
        synchronized (store) {
            WorldState state = store.snapshot();
            if (!state.getMap(DOMAIN).containsKey(topicKey)) {
                return false;
            }
            store.apply(Patch.against(state).delete(path(topicKey)).build());
        }
        log.infof("[%s] Freeze on %s lifted early: %s", store.campaignId(), topicKey, reason.value());
        return true;
    }

    /**
     * Delete every freeze whose {@code freeze_until} has passed.
     *
     * @return the pruned topic keys
     */
    public List<String> pruneExpired(StateStore store, Instant now) {
        synchronized (store) {
            WorldState state = store.snapshot();
            Patch.Builder patch = Patch.against(state);
            List<String> expired = new ArrayList<>();
            for (String topic : state.getMap(DOMAIN).keySet()) {
                Optional<FrozenPlan> plan = lookup(state, topic);
                if (plan.isPresent() && !plan.get().isFrozenAt(now)) {
                    expired.add(topic);
                    patch.delete(path(topic));
                }
            }
            if (!expired.isEmpty()) {
                store.apply(patch.build());
                log.infof("[%s] Expired planning freezes: %s", store.campaignId(), expired);
            }
            return expired;
        }
    }

    private static void requireTopicKey(String topicKey) {
        if (topicKey == null || !TOPIC_KEY.matcher(topicKey).matches()) {
            throw new IllegalArgumentException("Topic keys must match [a-z0-9_]+: " + topicKey);
        }
    }

    private static String path(String topicKey) {
        return DOMAIN + "." + topicKey;
    }
}
