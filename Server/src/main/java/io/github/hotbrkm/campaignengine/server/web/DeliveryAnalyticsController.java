package io.github.hotbrkm.campaignengine.server.web;

import io.github.hotbrkm.campaignengine.server.campaign.DeliveryAnalytics;
import io.github.hotbrkm.campaignengine.server.campaign.DeliveryAnalyticsService;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/delivery")
@RequiredArgsConstructor
public class DeliveryAnalyticsController {

    private final DeliveryAnalyticsService deliveryAnalyticsService;

    @GetMapping("/analytics")
    public DeliveryAnalytics analytics() {
        return deliveryAnalyticsService.analyze();
    }
}
