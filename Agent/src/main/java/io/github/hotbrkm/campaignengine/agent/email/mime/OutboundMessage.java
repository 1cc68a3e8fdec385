package io.github.hotbrkm.campaignengine.agent.email.mime;

import lombok.Builder;

import java.util.List;

@Builder(toBuilder = true)
public record OutboundMessage(String fromName,
                              String fromEmail,
                              String recipientName,
                              String recipientEmail,
                              String subject,
                              String html,
                              String text,
                              IdentityHeaders identity,
                              List<AttachmentMedia> attachments) {

    public OutboundMessage {
        attachments = attachments == null ? List.of() : List.copyOf(attachments);
    }
}
