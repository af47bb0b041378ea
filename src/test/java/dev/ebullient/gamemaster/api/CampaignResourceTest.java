package dev.ebullient.gamemaster.api;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.util.List;
import java.util.Map;

import jakarta.inject.Inject;
import jakarta.ws.rs.core.Response;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import com.fasterxml.jackson.databind.ObjectMapper;

import dev.ebullient.gamemaster.CampaignNotFoundException;
import dev.ebullient.gamemaster.combat.CombatOutcome;
import dev.ebullient.gamemaster.combat.CombatPhase;
import dev.ebullient.gamemaster.combat.CombatantSetup;
import dev.ebullient.gamemaster.combat.DamageType;
import dev.ebullient.gamemaster.combat.InvalidCombatStateException;
import dev.ebullient.gamemaster.entity.EntityKind;
import dev.ebullient.gamemaster.entity.EntityRegistration;
import dev.ebullient.gamemaster.model.Campaign;
import dev.ebullient.gamemaster.model.Decision;
import dev.ebullient.gamemaster.model.TurnRequest;
import dev.ebullient.gamemaster.reputation.DispositionSource;
import dev.ebullient.gamemaster.state.SchemaViolationException;
import dev.ebullient.gamemaster.state.StaleVersionException;
import io.quarkus.test.junit.QuarkusTest;

@QuarkusTest
class CampaignResourceTest {

    @Inject
    CampaignResource campaigns;

    @Inject
    CombatResource combat;

    @Inject
    ObjectMapper objectMapper;

    String campaignId;

    @BeforeEach
    void setUp() {
        Response created = campaigns.createCampaign(
                objectMapper.createObjectNode().put("name", "Resource " + System.nanoTime()));
        assertEquals(201, created.getStatus());
        campaignId = ((Campaign) created.getEntity()).id();
    }

    @AfterEach
    void tearDown() {
        campaigns.deleteCampaign(campaignId);
    }

    @Test
    void createCampaign_blankNameRejected() {
        Response response = campaigns.createCampaign(objectMapper.createObjectNode().put("name", " "));
        assertEquals(400, response.getStatus());
        assertEquals("bad_request", ((ErrorResponse) response.getEntity()).error());
    }

    @Test
    void getStatePath_foundAndMissing() {
        Response found = campaigns.getStatePath(campaignId, "combat_state.phase");
        assertEquals(200, found.getStatus());
        assertEquals("idle", ((Map<?, ?>) found.getEntity()).get("value"));

        Response missing = campaigns.getStatePath(campaignId, "world_data.weather");
        assertEquals(404, missing.getStatus());
        assertEquals("not_found", ((ErrorResponse) missing.getEntity()).error());
    }

    @Test
    void getDisposition_relationshipThenFaction() throws Exception {
        Map<String, Object> state = campaigns.getState(campaignId);
        long version = ((Number) state.get("game_state_version")).longValue();
        campaigns.processTurn(campaignId, new TurnRequest(version, objectMapper.readTree("""
                {"npc_data": {"npc_mara_001": {"faction": "faction_zhentarim_001",
                  "relationships": {"pc_kira_001": {"trust_level": 4}}}},
                 "custom_campaign_state": {"reputation": {"private": {"faction_zhentarim_001": {"score": -6}}}}}
                """), List.of(
                new EntityRegistration(EntityKind.PC, "Kira"),
                new EntityRegistration(EntityKind.NPC, "Mara"),
                new EntityRegistration(EntityKind.FACTION, "Zhentarim")), Decision.NONE));

        assertEquals(DispositionSource.RELATIONSHIP,
                campaigns.getDisposition(campaignId, "pc_kira_001", "npc_mara_001", null).source());
        assertEquals(DispositionSource.FACTION_STANDING,
                campaigns.getDisposition(campaignId, "pc_kira_001", null, "faction_zhentarim_001").source());
        assertEquals(DispositionSource.DEFAULT,
                campaigns.getDisposition(campaignId, "pc_kira_001", null, null).source());
    }

    @Test
    void combatEndpoints_runSessionToArchive() {
        long version = ((Number) campaigns.getState(campaignId).get("game_state_version")).longValue();
        campaigns.processTurn(campaignId, new TurnRequest(version, null,
                List.of(new EntityRegistration(EntityKind.PC, "Kira")),
                Decision.startCombat("Triboar Trail", List.of(
                        CombatantSetup.pc("pc_kira_001", 12, 15, null),
                        CombatantSetup.enemy("goblin", 7, 15, "1/4", 14)))));
        assertEquals(CombatPhase.INITIATING, combat.getSession(campaignId).phase());

        assertEquals(CombatPhase.ACTIVE,
                combat.setInitiative(campaignId, new CombatResource.InitiativeRoll("pc_kira_001", 17)).phase());
        assertEquals(0, combat.applyDamage(campaignId,
                new CombatResource.DamageRoll("goblin", 9, DamageType.SLASHING)).hpCurrent());

        version = ((Number) campaigns.getState(campaignId).get("game_state_version")).longValue();
        campaigns.processTurn(campaignId, new TurnRequest(version, null, List.of(),
                Decision.endCombat(CombatOutcome.ENDED)));
        Map<String, Object> archived = combat.archive(campaignId);
        assertEquals(50, archived.get("xp_awarded"));
        assertEquals(CombatPhase.IDLE, combat.getSession(campaignId).phase());
    }

    @Test
    void exceptionMappers_statusAndBody() {
        EngineExceptionMappers mappers = new EngineExceptionMappers();

        assertEquals(409, mappers.staleVersion(new StaleVersionException(3, 4)).getStatus());
        assertEquals(409, mappers.invalidCombatState(new InvalidCombatStateException("s1", "over")).getStatus());
        assertEquals(404, mappers.campaignNotFound(new CampaignNotFoundException("nowhere")).getStatus());
        assertEquals(400, mappers.illegalArgument(new IllegalArgumentException("nope")).getStatus());

        Response violation = mappers.schemaViolation(
                new SchemaViolationException("player_character_data.level", "integer 1..20", "25"));
        assertEquals(422, violation.getStatus());
        ErrorResponse body = (ErrorResponse) violation.getEntity();
        assertEquals("schema_violation", body.error());
        assertEquals("player_character_data.level", body.path());
        assertEquals("integer 1..20", body.expected());

        assertThrows(CampaignNotFoundException.class, () -> campaigns.getState("nowhere"));
    }
}
