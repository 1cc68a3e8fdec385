package io.github.hotbrkm.campaignengine.agent.email.mime;

import jakarta.mail.MessagingException;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.time.Clock;
import java.time.ZonedDateTime;
import java.util.Objects;
import java.util.Optional;

/**
 * Builds the MIME text of one message and prepends the DKIM-Signature when signing is enabled.
 * Attachments are read from disk on every compose, so a file replaced mid-campaign is picked up.
 */
@Slf4j
public class EmailMimeComposer {

    private final DeliveryAuthenticator authenticator;
    private final Clock clock;
    private final AttachmentLoader attachmentLoader;

    public EmailMimeComposer(DeliveryAuthenticator authenticator, Clock clock) {
        this.authenticator = Objects.requireNonNull(authenticator, "authenticator must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
        this.attachmentLoader = new AttachmentLoader();
    }

    public ComposedMessage compose(OutboundMessage message) throws MessagingException {
        IdentityHeaders identity = message.identity();

        MimeMessageBuilder messageBuilder = new MimeMessageBuilder();
        messageBuilder.setFrom(message.fromName(), message.fromEmail());
        messageBuilder.setTo(message.recipientName(), message.recipientEmail());
        messageBuilder.setSubject(message.subject());
        messageBuilder.addAlterContent("text/plain", message.text());
        messageBuilder.addAlterContent("text/html", message.html());
        try {
            messageBuilder.addAttachments(attachmentLoader.getAttachmentFiles(message.attachments()));
        } catch (IOException e) {
            throw new MessagingException("Cannot read attachment: " + e.getMessage(), e);
        }
        messageBuilder.makeHeader(identity.messageId(), ZonedDateTime.now(clock), identity.asHeaders());
        messageBuilder.makeBody();

        Optional<String> signature = authenticator.sign(messageBuilder.toString());
        signature.ifPresent(value -> messageBuilder.setExtension("DKIM-Signature: " + value));

        String envelopeFrom = identity.returnPath() != null ? identity.returnPath() : message.fromEmail();
        return new ComposedMessage(identity.messageId(), envelopeFrom, message.recipientEmail(), messageBuilder.toString());
    }
}
