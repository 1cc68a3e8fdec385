package io.github.hotbrkm.campaignengine.agent.email.send.result;

/**
 * Send-side campaign and subscriber counters. Increments are atomic in the store and rates are recomputed with them.
 */
public interface CampaignStatsRecorder {

    void recordSent(long campaignId, Long subscriberId);

    void recordFailed(long campaignId);
}
