package io.github.hotbrkm.campaignengine.agent.email.send.transport;

import io.github.hotbrkm.campaignengine.agent.email.mime.ComposedMessage;
import io.github.hotbrkm.campaignengine.agent.email.send.server.SmtpServer;

/**
 * Hands a composed message to one relay. Implementations bound every call with a timeout.
 */
public interface MailTransport {

    /**
     * @throws TransportException when the relay could not be reached or refused the message
     */
    void send(SmtpServer server, ComposedMessage message);
}
