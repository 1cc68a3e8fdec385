package io.github.hotbrkm.campaignengine.agent.email.send.engine;

import io.github.hotbrkm.campaignengine.agent.email.content.MessageTemplate;
import io.github.hotbrkm.campaignengine.agent.email.content.RecipientProfile;
import io.github.hotbrkm.campaignengine.agent.email.mime.AttachmentMedia;

import java.util.List;
import java.util.Objects;

/**
 * One campaign batch. {@code fromName} and {@code fromEmail} fall back to the configured sender when null.
 * Every recipient gets the same {@code attachments}.
 */
public record DispatchRequest(long campaignId,
                              MessageTemplate template,
                              String fromName,
                              String fromEmail,
                              List<RecipientProfile> recipients,
                              List<AttachmentMedia> attachments) {

    public DispatchRequest {
        Objects.requireNonNull(template, "template must not be null");
        recipients = recipients == null ? List.of() : List.copyOf(recipients);
        attachments = attachments == null ? List.of() : List.copyOf(attachments);
    }

    public DispatchRequest(long campaignId, MessageTemplate template, String fromName, String fromEmail,
                           List<RecipientProfile> recipients) {
        this(campaignId, template, fromName, fromEmail, recipients, List.of());
    }
}
