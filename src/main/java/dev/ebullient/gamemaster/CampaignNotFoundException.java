package dev.ebullient.gamemaster;

import dev.ebullient.gamemaster.state.WorldStateException;

public class CampaignNotFoundException extends WorldStateException {

    public CampaignNotFoundException(String campaignId) {
        super(null, "No such campaign: " + campaignId);
    }
}
