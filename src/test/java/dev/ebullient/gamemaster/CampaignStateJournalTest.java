package dev.ebullient.gamemaster;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import com.fasterxml.jackson.databind.ObjectMapper;

import dev.ebullient.gamemaster.model.Campaign;
import dev.ebullient.gamemaster.state.ChangelogEntry;
import dev.ebullient.gamemaster.state.Patch;
import dev.ebullient.gamemaster.state.PatchOp;
import dev.ebullient.gamemaster.state.PatchSource;
import dev.ebullient.gamemaster.state.PathSchema;
import dev.ebullient.gamemaster.state.StateStore;
import dev.ebullient.gamemaster.state.WorldState;

class CampaignStateJournalTest {

    static final PathSchema SCHEMA = PathSchema.fromClasspath();

    @TempDir
    Path tempDir;

    CampaignStateJournal journal;

    @BeforeEach
    void setUp() throws Exception {
        journal = new CampaignStateJournal();
        // Set the state directory via reflection (it's a config property)
        var field = CampaignStateJournal.class.getDeclaredField("stateDir");
        field.setAccessible(true);
        field.set(journal, tempDir.toString());
        journal.objectMapper = new ObjectMapper();
    }

    @Test
    void createCampaign_writesVersionedSnapshot() throws IOException {
        Campaign campaign = journal.createCampaign("lost_mines", WorldState.initial(SCHEMA));

        assertEquals("lost_mines", campaign.id());
        assertEquals(1, campaign.version());
        String content = Files.readString(journal.snapshotPath("lost_mines"), StandardCharsets.UTF_8);
        assertTrue(content.contains("\"game_state_version\" : 1"), content);
        assertTrue(content.contains("\"combat_state\""), content);
    }

    @Test
    void createCampaign_refusesExistingId() {
        journal.createCampaign("lost_mines", WorldState.initial(SCHEMA));
        assertThrows(UncheckedIOException.class,
                () -> journal.createCampaign("lost_mines", WorldState.initial(SCHEMA)));
    }

    @Test
    void committed_persistsSnapshotAndChangelog() {
        journal.createCampaign("lost_mines", WorldState.initial(SCHEMA));
        StateStore store = new StateStore("lost_mines", SCHEMA, 5, journal.load("lost_mines").orElseThrow());
        store.addListener(journal);

        store.apply(Patch.against(store.snapshot())
                .set("world_data.campaign_name", "Lost Mine of Phandelver")
                .append("custom_campaign_state.core_memories", "arrived in Phandalin")
                .build());
        store.apply(Patch.against(store.snapshot()).delete("world_data.campaign_name").build());

        WorldState loaded = journal.load("lost_mines").orElseThrow();
        assertEquals(3, loaded.version());
        assertEquals(store.snapshot().tree(), loaded.tree());

        List<ChangelogEntry> changelog = journal.readChangelog("lost_mines");
        assertEquals(2, changelog.size());
        assertEquals(2, changelog.get(0).version());
        assertEquals(PatchSource.ENGINE, changelog.get(0).source());
        assertEquals(new PatchOp.Append("custom_campaign_state.core_memories", List.of("arrived in Phandalin")),
                changelog.get(0).ops().get(1));
        assertEquals(new PatchOp.Delete("world_data.campaign_name"), changelog.get(1).ops().get(0));
    }

    @Test
    void listCampaigns_usesCampaignName() {
        WorldState initial = WorldState.initial(SCHEMA);
        StateStore store = new StateStore("b_side", SCHEMA, 5, initial);
        store.apply(Patch.against(initial).set("world_data.campaign_name", "The B Side").build());
        journal.createCampaign("b_side", store.snapshot());
        journal.createCampaign("a_side", initial);

        List<Campaign> campaigns = journal.listCampaigns();

        assertEquals(List.of("a_side", "b_side"), campaigns.stream().map(Campaign::id).toList());
        assertEquals("a_side", campaigns.get(0).name());
        assertEquals("The B Side", campaigns.get(1).name());
        assertEquals(2, campaigns.get(1).version());
    }

    @Test
    void deleteCampaign_removesBothFiles() {
        journal.createCampaign("lost_mines", WorldState.initial(SCHEMA));
        journal.appendChangelog("lost_mines",
                new ChangelogEntry(2, PatchSource.AUTHOR, List.of(), "2024-01-01T00:00:00Z", null));

        assertTrue(journal.deleteCampaign("lost_mines"));
        assertFalse(Files.exists(journal.snapshotPath("lost_mines")));
        assertFalse(Files.exists(journal.changelogPath("lost_mines")));
        assertFalse(journal.deleteCampaign("lost_mines"));
        assertNull(journal.getCampaign("lost_mines"));
        assertTrue(journal.load("lost_mines").isEmpty());
    }
}
