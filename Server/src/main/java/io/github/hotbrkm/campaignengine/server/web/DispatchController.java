package io.github.hotbrkm.campaignengine.server.web;

import io.github.hotbrkm.campaignengine.server.campaign.CampaignDispatchService;
import io.github.hotbrkm.campaignengine.server.web.dto.DispatchRequestBody;
import io.github.hotbrkm.campaignengine.server.web.dto.DispatchResultResponse;
import io.github.hotbrkm.campaignengine.server.web.dto.RecipientPayload;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

/**
 * Synchronous dispatch: the response arrives once every recipient of the batch has an outcome.
 */
@RestController
@RequestMapping("/api/campaigns")
@RequiredArgsConstructor
public class DispatchController {

    private final CampaignDispatchService campaignDispatchService;

    @PostMapping("/{campaignId}/dispatch")
    public List<DispatchResultResponse> dispatch(@PathVariable("campaignId") long campaignId,
                                                 @Valid @RequestBody DispatchRequestBody body) {
        return campaignDispatchService.dispatch(campaignId,
                        body.recipients().stream().map(RecipientPayload::toProfile).toList())
                .stream()
                .map(DispatchResultResponse::from)
                .toList();
    }
}
