package io.github.hotbrkm.campaignengine.agent.email.mime;

/**
 * A fully built message ready for the transport: envelope addresses plus the signed RFC 5322 text.
 */
public record ComposedMessage(String messageId, String envelopeFrom, String recipient, String rawMime) {
}
