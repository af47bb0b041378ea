package dev.ebullient.gamemaster;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;

import jakarta.inject.Inject;

import org.junit.jupiter.api.Test;

import com.fasterxml.jackson.databind.ObjectMapper;

import dev.ebullient.gamemaster.entity.EntityKind;
import dev.ebullient.gamemaster.entity.EntityRegistration;
import dev.ebullient.gamemaster.model.Campaign;
import dev.ebullient.gamemaster.model.Decision;
import dev.ebullient.gamemaster.model.TurnRequest;
import dev.ebullient.gamemaster.model.TurnResult;
import io.quarkus.test.junit.QuarkusTest;

@QuarkusTest
class GameMasterWiringTest {

    @Inject
    CampaignSessions sessions;

    @Inject
    TurnProcessor turns;

    @Inject
    ObjectMapper objectMapper;

    @Test
    void processTurn_throughInjectedBeans() throws Exception {
        Campaign campaign = sessions.createCampaign("Wiring " + System.nanoTime());
        try {
            TurnResult result = turns.processTurn(campaign.id(), new TurnRequest(campaign.version(),
                    objectMapper.readTree("{\"world_data\": {\"weather\": \"fog\"}}"),
                    List.of(new EntityRegistration(EntityKind.LOCATION, "Phandalin")),
                    Decision.awardXp(25, "found the town")));

            assertEquals(List.of("loc_phandalin_001"), result.assignedIds());
            assertTrue(sessions.listCampaigns().stream().anyMatch(c -> c.id().equals(campaign.id())));
            assertEquals(result.version(), sessions.getCampaign(campaign.id()).version());
            assertEquals(25, sessions.store(campaign.id()).snapshot()
                    .getInt("player_character_data.experience.current", 0));
        } finally {
            sessions.deleteCampaign(campaign.id());
        }
    }
}
