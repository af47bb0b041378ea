package dev.ebullient.gamemaster.reputation;

import java.time.Duration;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeParseException;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import jakarta.inject.Singleton;

import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;

import dev.ebullient.gamemaster.state.Patch;
import dev.ebullient.gamemaster.state.StateStore;
import dev.ebullient.gamemaster.state.WorldState;

/**
 * Resolves how an NPC (or faction) regards an actor, and maintains reputation records.
 * <p>
 * Precedence, first match wins: faction trust override, direct relationship, faction
 * standing, public notoriety, neutral.
 */
@Singleton
public class ReputationResolver {
    private static final Logger log = Logger.getLogger(ReputationResolver.class);

    public static final String PLAYER_RECORD = "custom_campaign_state.reputation";
    static final String NPC_DATA = "npc_data";

    @ConfigProperty(name = "gamemaster.reputation.rumor-horizon-days", defaultValue = "28")
    int rumorHorizonDays = 28;

    @ConfigProperty(name = "gamemaster.reputation.max-rumors", defaultValue = "20")
    int maxRumors = 20;

    @ConfigProperty(name = "gamemaster.reputation.drift-threshold", defaultValue = "50")
    int driftThreshold = 50;

    public Disposition resolve(WorldState state, String actorId, String factionId) {
        return resolve(state, actorId, factionId, null);
    }

    /**
     * Resolve using the NPC's own faction membership ({@code npc_data.<npc>.faction}).
     */
    public Disposition resolveForNpc(WorldState state, String actorId, String npcId) {
        String factionId = npcEntryPath(state, npcId)
                .flatMap(path -> state.getString(path + ".faction"))
                .orElse(null);
        return resolve(state, actorId, factionId, npcId);
    }

    public Disposition resolve(WorldState state, String actorId, String factionId, String npcId) {
        String record = recordPath(actorId);

        if (factionId != null) {
            Optional<Integer> override = state.getInt(privatePath(record, factionId) + ".trust_override");
            if (override.isPresent()) {
                int value = FactionStanding.clamp(override.get());
                return new Disposition(value, DispositionSource.TRUST_OVERRIDE, FactionStanding.of(value).label());
            }
        }

        if (npcId != null && actorId != null) {
            Optional<Integer> trust = npcEntryPath(state, npcId)
                    .flatMap(path -> state.getInt(path + ".relationships." + actorId + ".trust_level"));
            if (trust.isPresent()) {
                int value = FactionStanding.clamp(trust.get());
                return new Disposition(value, DispositionSource.RELATIONSHIP, FactionStanding.of(value).label());
            }
        }

        if (factionId != null) {
            Optional<Integer> score = state.getInt(privatePath(record, factionId) + ".score");
            if (score.isPresent()) {
                FactionStanding standing = FactionStanding.of(score.get());
                return new Disposition(standing.disposition(), DispositionSource.FACTION_STANDING, standing.label());
            }
        }

        Optional<Integer> publicScore = state.getInt(record + ".public.score");
        if (publicScore.isPresent()) {
            Notoriety notoriety = Notoriety.of(publicScore.get());
            return new Disposition(notoriety.disposition(), DispositionSource.PUBLIC_NOTORIETY, notoriety.label());
        }

        return Disposition.NEUTRAL;
    }

    public int adjustPublic(StateStore store, String actorId, int delta) {
        synchronized (store) {
            WorldState state = store.snapshot();
            String base = recordPath(actorId) + ".public";
            int score = Notoriety.clamp(state.getInt(base + ".score", 0) + delta);
            store.apply(Patch.against(state)
                    .set(base + ".score", score)
                    .set(base + ".notoriety_level", Notoriety.of(score).label())
                    .build());
            return score;
        }
    }

    public int adjustFaction(StateStore store, String actorId, String factionId, int delta) {
        synchronized (store) {
            WorldState state = store.snapshot();
            String base = privatePath(recordPath(actorId), factionId);
            int score = FactionStanding.clamp(state.getInt(base + ".score", 0) + delta);
            store.apply(Patch.against(state)
                    .set(base + ".score", score)
                    .set(base + ".standing", FactionStanding.of(score).label())
                    .build());
            return score;
        }
    }

    /**
     * Set (or, with {@code null}, clear) the faction-wide trust override.
     */
    public void setTrustOverride(StateStore store, String actorId, String factionId, Integer value) {
        synchronized (store) {
            WorldState state = store.snapshot();
            String path = privatePath(recordPath(actorId), factionId) + ".trust_override";
            Patch.Builder patch = Patch.against(state);
            if (value == null) {
                patch.delete(path);
            } else {
                patch.set(path, FactionStanding.clamp(value));
            }
            store.apply(patch.build());
            log.infof("[%s] Trust override for %s toward %s: %s", store.campaignId(), factionId, actorId, value);
        }
    }

    /**
     * Deeds are permanent: they never decay.
     */
    public void recordDeed(StateStore store, String actorId, String deed, String factionId) {
        synchronized (store) {
            WorldState state = store.snapshot();
            String record = recordPath(actorId);
            String path = factionId == null
                    ? record + ".public.known_deeds"
                    : privatePath(record, factionId) + ".known_deeds";
            store.apply(Patch.against(state).append(path, deed).build());
        }
    }

    public void addTitle(StateStore store, String actorId, String title) {
        synchronized (store) {
            WorldState state = store.snapshot();
            String path = recordPath(actorId) + ".public.titles";
            if (state.getList(path).contains(title)) {
                return;
            }
            store.apply(Patch.against(state).append(path, title).build());
        }
    }

    /**
     * Append a rumor stamped with world time, dropping the oldest beyond the cap.
     */
    public void addRumor(StateStore store, String actorId, String text, Instant now) {
        synchronized (store) {
            WorldState state = store.snapshot();
            String path = recordPath(actorId) + ".public.rumors";
            Map<String, Object> rumor = new LinkedHashMap<>();
            rumor.put("text", text);
            rumor.put("recorded_at", now.toString());

            List<Object> rumors = new ArrayList<>(state.getList(path));
            rumors.add(rumor);
            Patch.Builder patch = Patch.against(state);
            if (rumors.size() > maxRumors) {
                int dropped = rumors.size() - maxRumors;
                patch.set(path, new ArrayList<>(rumors.subList(dropped, rumors.size())));
                log.infof("[%s] Dropped %d oldest rumor(s) about %s", store.campaignId(), dropped,
                        actorId == null ? "the player" : actorId);
            } else {
                patch.append(path, rumor);
            }
            store.apply(patch.build());
        }
    }

    /**
     * Age every reputation record to {@code now}: rumors past the horizon are dropped at each
     * elapsed week, and public scores beyond the drift threshold move toward neutral by one
     * point per elapsed month.
     */
    public DecayResult applyDecay(StateStore store, Instant now) {
        synchronized (store) {
            WorldState state = store.snapshot();
            Patch.Builder patch = Patch.against(state);
            DecayResult total = DecayResult.NONE;
            for (String record : recordPaths(state)) {
                total = total.plus(decay(state, record, now, patch));
            }
            if (!patch.isEmpty()) {
                store.apply(patch.build());
            }
            if (total.changed()) {
                log.infof("[%s] Reputation decay: %d rumor(s) dropped, %d drift point(s)",
                        store.campaignId(), total.rumorsDropped(), total.driftPoints());
            }
            return total;
        }
    }

    private DecayResult decay(WorldState state, String record, Instant now, Patch.Builder patch) {
        int dropped = 0;
        int drift = 0;

        Instant lastSweep = parseInstant(state.get(record + ".last_rumor_sweep_at").orElse(null));
        if (lastSweep == null) {
            patch.set(record + ".last_rumor_sweep_at", now.toString());
        } else {
            long weeks = Duration.between(lastSweep, now).toDays() / 7;
            if (weeks > 0) {
                Instant horizon = now.minus(Duration.ofDays(rumorHorizonDays));
                List<Object> rumors = state.getList(record + ".public.rumors");
                List<Object> kept = new ArrayList<>();
                for (Object rumor : rumors) {
                    Instant at = rumor instanceof Map<?, ?> map ? parseInstant(map.get("recorded_at")) : null;
                    if (at != null && at.isBefore(horizon)) {
                        dropped++;
                    } else {
                        kept.add(rumor);
                    }
                }
                if (dropped > 0) {
                    patch.set(record + ".public.rumors", kept);
                }
                patch.set(record + ".last_rumor_sweep_at", lastSweep.plus(Duration.ofDays(weeks * 7)).toString());
            }
        }

        Instant lastDrift = parseInstant(state.get(record + ".last_drift_at").orElse(null));
        if (lastDrift == null) {
            patch.set(record + ".last_drift_at", now.toString());
        } else {
            LocalDateTime from = LocalDateTime.ofInstant(lastDrift, ZoneOffset.UTC);
            long months = ChronoUnit.MONTHS.between(from, LocalDateTime.ofInstant(now, ZoneOffset.UTC));
            if (months > 0) {
                Optional<Integer> score = state.getInt(record + ".public.score");
                if (score.isPresent() && Math.abs(score.get()) > driftThreshold) {
                    int s = score.get();
                    drift = (int) Math.min(months, Math.abs(s) - driftThreshold);
                    int next = s > 0 ? s - drift : s + drift;
                    patch.set(record + ".public.score", next)
                            .set(record + ".public.notoriety_level", Notoriety.of(next).label());
                }
                patch.set(record + ".last_drift_at", from.plusMonths(months).toInstant(ZoneOffset.UTC).toString());
            }
        }
        return new DecayResult(dropped, drift);
    }

    /** Existing reputation records: the player's, then each NPC's. */
    List<String> recordPaths(WorldState state) {
        List<String> paths = new ArrayList<>();
        if (!state.getMap(PLAYER_RECORD).isEmpty()) {
            paths.add(PLAYER_RECORD);
        }
        state.getMap(NPC_DATA).forEach((id, entry) -> {
            if (entry instanceof Map<?, ?> npc && npc.get("reputation") instanceof Map<?, ?> rep && !rep.isEmpty()) {
                paths.add(NPC_DATA + "." + id + ".reputation");
            }
        });
        return paths;
    }

    /**
     * The player's record lives under {@code custom_campaign_state}; anyone else's under their NPC entry.
     */
    public static String recordPath(String actorId) {
        if (actorId == null || actorId.isBlank() || actorId.startsWith("pc_")) {
            return PLAYER_RECORD;
        }
        return NPC_DATA + "." + actorId + ".reputation";
    }

    private static String privatePath(String record, String factionId) {
        return record + ".private." + factionId;
    }

    /**
     * NPC entries are keyed by string id; fall back to the entry whose {@code string_id} matches.
     */
    static Optional<String> npcEntryPath(WorldState state, String npcId) {
        if (npcId == null) {
            return Optional.empty();
        }
        Map<String, Object> npcs = state.getMap(NPC_DATA);
        if (npcs.get(npcId) instanceof Map) {
            return Optional.of(NPC_DATA + "." + npcId);
        }
        for (Map.Entry<String, Object> entry : npcs.entrySet()) {
            if (entry.getValue() instanceof Map<?, ?> npc && npcId.equals(npc.get("string_id"))) {
                return Optional.of(NPC_DATA + "." + entry.getKey());
            }
        }
        return Optional.empty();
    }

    private static Instant parseInstant(Object value) {
        if (!(value instanceof String text)) {
            return null;
        }
        try {
            return Instant.parse(text);
        } catch (DateTimeParseException e) {
            log.debugf("Ignoring unparseable timestamp %s", text);
            return null;
        }
    }
}
