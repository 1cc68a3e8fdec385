package io.github.hotbrkm.campaignengine.agent.email.send.server;

/**
 * The pool is empty or every server in it is disabled.
 */
public class NoServerAvailableException extends RuntimeException {
    public NoServerAvailableException(String message) {
        super(message);
    }
}
