package io.github.hotbrkm.campaignengine.agent.email.send.server;

import io.github.hotbrkm.campaignengine.agent.email.config.EmailConfig;

import java.util.Objects;

/**
 * One outbound relay of the sending pool. {@code name} identifies it in health tracking and send records.
 */
public record SmtpServer(String name, String host, int port, String username, String password,
                         SmtpSecurity security, int priority, boolean enabled) {

    public SmtpServer {
        Objects.requireNonNull(name, "name must not be null");
        Objects.requireNonNull(host, "host must not be null");
        security = security == null ? SmtpSecurity.NONE : security;
    }

    public static SmtpServer from(EmailConfig.Server server) {
        String name = server.getName() != null && !server.getName().isBlank()
                ? server.getName()
                : server.getHost() + ":" + server.getPort();
        return new SmtpServer(name, server.getHost(), server.getPort(), server.getUsername(), server.getPassword(),
                SmtpSecurity.from(server.getSecurity()), server.getPriority(), server.isEnabled());
    }

    public boolean hasCredentials() {
        return username != null && !username.isBlank();
    }

    @Override
    public String toString() {
        // keep the password out of logs
        return "SmtpServer[" + name + " " + host + ":" + port + ", priority=" + priority + ", enabled=" + enabled + "]";
    }
}
