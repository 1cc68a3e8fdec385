package io.github.hotbrkm.campaignengine.server.campaign;

public class CampaignNotFoundException extends RuntimeException {
    public CampaignNotFoundException(long campaignId) {
        super("Campaign not found: " + campaignId);
    }
}
