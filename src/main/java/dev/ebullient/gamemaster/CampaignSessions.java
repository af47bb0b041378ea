package dev.ebullient.gamemaster;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

import jakarta.inject.Inject;
import jakarta.inject.Singleton;

import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;

import dev.ebullient.gamemaster.model.Campaign;
import dev.ebullient.gamemaster.state.StateStore;
import dev.ebullient.gamemaster.state.StateTrees;
import dev.ebullient.gamemaster.state.WorldState;

/**
 * One {@link StateStore} per campaign, loaded on first use and persisted after every commit.
 */
@Singleton
public class CampaignSessions {
    private static final Logger log = Logger.getLogger(CampaignSessions.class);

    private final Map<String, StateStore> stores = new ConcurrentHashMap<>();

    @Inject
    CampaignStateJournal journal;

    @Inject
    WorldSchemaService schemaService;

    @ConfigProperty(name = "gamemaster.state.history-limit", defaultValue = "50")
    int historyLimit = 50;

    public List<Campaign> listCampaigns() {
        return journal.listCampaigns();
    }

    public Campaign createCampaign(String name) {
        String id = StringUtils.slugify(name);
        if (journal.exists(id)) {
            throw new IllegalArgumentException("Campaign already exists: " + id);
        }
        WorldState initial = WorldState.initial(schemaService.schema());
        Map<String, Object> tree = StateTrees.mutableCopyOf(initial.tree());
        Map<String, Object> world = new LinkedHashMap<>();
        world.put("campaign_name", StringUtils.firstNonBlank(name, id));
        tree.put("world_data", world);

        Campaign campaign = journal.createCampaign(id, new WorldState(WorldState.INITIAL_VERSION, tree));
        log.infof("Created campaign %s (%s)", campaign.id(), campaign.name());
        return campaign;
    }

    public Campaign getCampaign(String campaignId) {
        Campaign campaign = journal.getCampaign(campaignId);
        if (campaign == null) {
            throw new CampaignNotFoundException(campaignId);
        }
        return campaign;
    }

    /**
     * The live store for a campaign.
     *
     * @throws CampaignNotFoundException if the campaign has never been created
     */
    public StateStore store(String campaignId) {
        return stores.computeIfAbsent(campaignId, id -> {
            WorldState state = journal.load(id).orElseThrow(() -> new CampaignNotFoundException(id));
            StateStore store = new StateStore(id, schemaService.schema(), historyLimit, state);
            store.addListener(journal);
            log.debugf("Opened campaign %s at version %d", id, state.version());
            return store;
        });
    }

    public boolean deleteCampaign(String campaignId) {
        StateStore store = stores.remove(campaignId);
        if (store != null) {
            synchronized (store) {
                return journal.deleteCampaign(campaignId);
            }
        }
        return journal.deleteCampaign(campaignId);
    }
}
