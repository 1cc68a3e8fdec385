package io.github.hotbrkm.campaignengine.server.campaign;

import io.github.hotbrkm.campaignengine.agent.email.content.MessageTemplate;
import io.github.hotbrkm.campaignengine.agent.email.content.RecipientProfile;
import io.github.hotbrkm.campaignengine.agent.email.mime.AttachmentMedia;
import io.github.hotbrkm.campaignengine.agent.email.send.engine.DispatchEngine;
import io.github.hotbrkm.campaignengine.agent.email.send.engine.DispatchRequest;
import io.github.hotbrkm.campaignengine.agent.email.send.engine.DispatchResult;
import io.github.hotbrkm.campaignengine.server.persistence.entity.CampaignEntity;
import io.github.hotbrkm.campaignengine.server.persistence.repository.CampaignRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Loads a campaign's template and hands one recipient batch to the {@link DispatchEngine}.
 * <p>
 * Not transactional: the engine writes each send record in its own transaction while it paces the batch.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class CampaignDispatchService {

    private final CampaignRepository campaignRepository;
    private final DispatchEngine dispatchEngine;

    public List<DispatchResult> dispatch(long campaignId, List<RecipientProfile> recipients) {
        CampaignEntity campaign = campaignRepository.findById(campaignId)
                .orElseThrow(() -> new CampaignNotFoundException(campaignId));
        MessageTemplate template = new MessageTemplate(campaign.getSubject(), campaign.getHtmlContent(),
                campaign.getTextContent(), campaign.isWeightedSpintax());

        List<AttachmentMedia> attachments = campaign.getAttachments().stream()
                .map(attachment -> new AttachmentMedia(attachment.getFileName(), attachment.getFilePath()))
                .toList();

        List<DispatchResult> results = dispatchEngine.dispatch(new DispatchRequest(campaignId, template,
                campaign.getFromName(), campaign.getFromEmail(), recipients, attachments));

        log.info("campaignId={}, recipients={}, event=campaign_dispatched", campaignId, results.size());
        return results;
    }
}
