package dev.ebullient.gamemaster.reputation;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import dev.ebullient.gamemaster.state.Patch;
import dev.ebullient.gamemaster.state.PathSchema;
import dev.ebullient.gamemaster.state.StateStore;
import dev.ebullient.gamemaster.state.WorldState;

class ReputationResolverTest {

    static final String KIRA = "pc_kira_001";
    static final String MARA = "npc_mara_001";
    static final String ZHENT = "faction_zhentarim_001";
    static final Instant T0 = Instant.parse("1492-01-01T00:00:00Z");

    StateStore store;
    ReputationResolver reputation;

    @BeforeEach
    void setUp() {
        store = new StateStore("reputation", PathSchema.fromClasspath(), 10);
        reputation = new ReputationResolver();
        store.apply(Patch.against(store.snapshot())
                .merge("npc_data." + MARA, Map.of(
                        "name", "Mara",
                        "faction", ZHENT,
                        "relationships", Map.of(KIRA, Map.of("trust_level", 5))))
                .build());
    }

    @Test
    void resolve_trustOverrideBeatsRelationship() {
        reputation.setTrustOverride(store, KIRA, ZHENT, -10);

        Disposition disposition = reputation.resolveForNpc(store.snapshot(), KIRA, MARA);

        assertEquals(-10, disposition.value());
        assertEquals(DispositionSource.TRUST_OVERRIDE, disposition.source());
        assertEquals("Enemy", disposition.tier());
    }

    @Test
    void resolve_fallsThroughInPrecedenceOrder() {
        reputation.adjustFaction(store, KIRA, ZHENT, 7);
        reputation.adjustPublic(store, KIRA, 80);

        Disposition relationship = reputation.resolveForNpc(store.snapshot(), KIRA, MARA);
        assertEquals(5, relationship.value());
        assertEquals(DispositionSource.RELATIONSHIP, relationship.source());

        Disposition standing = reputation.resolve(store.snapshot(), KIRA, ZHENT);
        assertEquals(8, standing.value());
        assertEquals(DispositionSource.FACTION_STANDING, standing.source());
        assertEquals("Ally", standing.tier());

        Disposition notoriety = reputation.resolve(store.snapshot(), KIRA, "faction_harpers_001");
        assertEquals(5, notoriety.value());
        assertEquals(DispositionSource.PUBLIC_NOTORIETY, notoriety.source());
        assertEquals("Famous", notoriety.tier());
    }

    @Test
    void resolve_defaultsToNeutral() {
        assertEquals(Disposition.NEUTRAL, reputation.resolve(store.snapshot(), KIRA, ZHENT));
    }

    @Test
    void resolve_findsNpcByStringId() {
        store.apply(Patch.against(store.snapshot())
                .merge("npc_data.tom", Map.of("string_id", "npc_tom_001",
                        "relationships", Map.of(KIRA, Map.of("trust_level", -3))))
                .build());

        Disposition disposition = reputation.resolveForNpc(store.snapshot(), KIRA, "npc_tom_001");
        assertEquals(-3, disposition.value());
        assertEquals(DispositionSource.RELATIONSHIP, disposition.source());
    }

    @Test
    void setTrustOverride_nullClears() {
        reputation.setTrustOverride(store, KIRA, ZHENT, 9);
        reputation.setTrustOverride(store, KIRA, ZHENT, null);
        assertEquals(DispositionSource.RELATIONSHIP,
                reputation.resolveForNpc(store.snapshot(), KIRA, MARA).source());
    }

    @Test
    void adjustPublic_clampsAndLabels() {
        assertEquals(100, reputation.adjustPublic(store, KIRA, 150));
        assertEquals("Legendary",
                store.snapshot().getString(ReputationResolver.PLAYER_RECORD + ".public.notoriety_level").orElseThrow());
        assertEquals(-10, reputation.adjustFaction(store, KIRA, ZHENT, -40));
    }

    @Test
    void addTitle_isSetLike() {
        reputation.addTitle(store, KIRA, "Dragonfriend");
        long version = store.version();
        reputation.addTitle(store, KIRA, "Dragonfriend");
        assertEquals(version, store.version());
        assertEquals(List.of("Dragonfriend"), store.snapshot().getList(ReputationResolver.PLAYER_RECORD + ".public.titles"));
    }

    @Test
    void addRumor_dropsOldestBeyondCap() {
        reputation.maxRumors = 3;
        for (int i = 1; i <= 4; i++) {
            reputation.addRumor(store, KIRA, "rumor " + i, T0.plus(Duration.ofDays(i)));
        }
        List<Object> rumors = store.snapshot().getList(ReputationResolver.PLAYER_RECORD + ".public.rumors");
        assertEquals(3, rumors.size());
        assertEquals("rumor 2", ((Map<?, ?>) rumors.get(0)).get("text"));
    }

    @Test
    void applyDecay_dropsOldRumorsKeepsDeedsAndDrifts() {
        reputation.adjustPublic(store, KIRA, 60);
        reputation.recordDeed(store, KIRA, "slew the young dragon", null);
        assertFalse(reputation.applyDecay(store, T0).changed());

        reputation.addRumor(store, KIRA, "old gossip", T0);
        reputation.addRumor(store, KIRA, "fresh gossip", T0.plus(Duration.ofDays(20)));

        DecayResult result = reputation.applyDecay(store, T0.plus(Duration.ofDays(35)));

        assertEquals(1, result.rumorsDropped());
        assertEquals(1, result.driftPoints());
        WorldState state = store.snapshot();
        List<Object> rumors = state.getList(ReputationResolver.PLAYER_RECORD + ".public.rumors");
        assertEquals(1, rumors.size());
        assertEquals("fresh gossip", ((Map<?, ?>) rumors.get(0)).get("text"));
        assertEquals(59, state.getInt(ReputationResolver.PLAYER_RECORD + ".public.score", 0));
        assertEquals(List.of("slew the young dragon"),
                state.getList(ReputationResolver.PLAYER_RECORD + ".public.known_deeds"));
    }

    @Test
    void applyDecay_driftStopsAtThreshold() {
        reputation.adjustPublic(store, KIRA, -52);
        reputation.applyDecay(store, T0);

        DecayResult result = reputation.applyDecay(store, Instant.parse("1492-07-01T00:00:00Z"));

        assertEquals(2, result.driftPoints());
        assertEquals(-50, store.snapshot().getInt(ReputationResolver.PLAYER_RECORD + ".public.score", 0));
        assertFalse(reputation.applyDecay(store, Instant.parse("1492-12-01T00:00:00Z")).changed());
    }

    @Test
    void recordPath_playerOrNpc() {
        assertEquals(ReputationResolver.PLAYER_RECORD, ReputationResolver.recordPath(null));
        assertEquals(ReputationResolver.PLAYER_RECORD, ReputationResolver.recordPath(KIRA));
        assertEquals("npc_data." + MARA + ".reputation", ReputationResolver.recordPath(MARA));
        assertEquals(FactionStanding.NEUTRAL, FactionStanding.of(0));
    }
}
