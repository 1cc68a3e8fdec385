package io.github.hotbrkm.campaignengine.agent.email.send.transport;

import lombok.Getter;

/**
 * A single transport attempt failed. Keeps the SMTP reply code when the server sent one, otherwise -1.
 */
@Getter
public class TransportException extends RuntimeException {
    private final String serverName;
    private final int statusCode;

    public TransportException(String serverName, int statusCode, String message, Throwable cause) {
        super(message, cause);
        this.serverName = serverName;
        this.statusCode = statusCode;
    }

    public TransportException(String serverName, String message) {
        this(serverName, -1, message, null);
    }
}
