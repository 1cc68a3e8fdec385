package io.github.hotbrkm.campaignengine.agent.email.send.transport;

import io.github.hotbrkm.campaignengine.agent.email.config.EmailConfig;
import io.github.hotbrkm.campaignengine.agent.email.mime.ComposedMessage;
import io.github.hotbrkm.campaignengine.agent.email.send.server.SmtpSecurity;
import io.github.hotbrkm.campaignengine.agent.email.send.server.SmtpServer;
import jakarta.mail.Address;
import jakarta.mail.MessagingException;
import jakarta.mail.Session;
import jakarta.mail.Transport;
import jakarta.mail.internet.InternetAddress;
import jakarta.mail.internet.MimeMessage;
import lombok.extern.slf4j.Slf4j;
import org.eclipse.angus.mail.smtp.SMTPSendFailedException;

import java.io.ByteArrayInputStream;
import java.nio.charset.StandardCharsets;
import java.util.Properties;

/**
 * SMTP transport on Jakarta Mail. One connection per message, bounded by connect, read and write timeouts.
 * The composed text is relayed as is so the DKIM signature stays valid.
 */
@Slf4j
public class JakartaMailTransport implements MailTransport {

    private final int connectTimeoutMs;
    private final int sendTimeoutMs;

    public JakartaMailTransport(EmailConfig.Send send) {
        this.connectTimeoutMs = send.resolveConnectTimeoutMs();
        this.sendTimeoutMs = send.resolveSendTimeoutMs();
    }

    @Override
    public void send(SmtpServer server, ComposedMessage message) {
        String protocol = server.security() == SmtpSecurity.SSL ? "smtps" : "smtp";
        Session session = Session.getInstance(sessionProperties(server, protocol, message.envelopeFrom()));

        try (Transport transport = session.getTransport(protocol)) {
            MimeMessage mimeMessage = new MimeMessage(session,
                    new ByteArrayInputStream(message.rawMime().getBytes(StandardCharsets.UTF_8)));
            transport.connect(server.host(), server.port(), server.username(), server.password());
            transport.sendMessage(mimeMessage, new Address[]{new InternetAddress(message.recipient())});
            log.debug("server={}, messageId={}, event=smtp_accepted", server.name(), message.messageId());
        } catch (SMTPSendFailedException e) {
            throw new TransportException(server.name(), e.getReturnCode(), e.getMessage(), e);
        } catch (MessagingException e) {
            throw new TransportException(server.name(), -1, e.getMessage(), e);
        }
    }

    private Properties sessionProperties(SmtpServer server, String protocol, String envelopeFrom) {
        String prefix = "mail." + protocol + ".";
        Properties props = new Properties();
        props.put(prefix + "host", server.host());
        props.put(prefix + "port", String.valueOf(server.port()));
        props.put(prefix + "connectiontimeout", String.valueOf(connectTimeoutMs));
        props.put(prefix + "timeout", String.valueOf(sendTimeoutMs));
        props.put(prefix + "writetimeout", String.valueOf(sendTimeoutMs));
        props.put(prefix + "auth", String.valueOf(server.hasCredentials()));
        if (envelopeFrom != null) {
            props.put(prefix + "from", envelopeFrom);
        }
        if (server.security() == SmtpSecurity.STARTTLS) {
            props.put(prefix + "starttls.enable", "true");
            props.put(prefix + "starttls.required", "true");
        }
        if (server.security() == SmtpSecurity.SSL) {
            props.put(prefix + "ssl.enable", "true");
        }
        return props;
    }
}
