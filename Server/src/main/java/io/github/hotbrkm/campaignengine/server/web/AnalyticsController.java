package io.github.hotbrkm.campaignengine.server.web;

import io.github.hotbrkm.campaignengine.server.campaign.CampaignAnalytics;
import io.github.hotbrkm.campaignengine.server.campaign.CampaignAnalyticsService;
import io.github.hotbrkm.campaignengine.server.campaign.RealtimeActivity;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/campaigns")
@RequiredArgsConstructor
public class AnalyticsController {

    private final CampaignAnalyticsService campaignAnalyticsService;

    @GetMapping("/{campaignId}/analytics")
    public CampaignAnalytics analytics(@PathVariable("campaignId") long campaignId) {
        return campaignAnalyticsService.analyze(campaignId);
    }

    @GetMapping("/{campaignId}/realtime")
    public RealtimeActivity realtime(@PathVariable("campaignId") long campaignId) {
        return campaignAnalyticsService.realtime(campaignId);
    }
}
