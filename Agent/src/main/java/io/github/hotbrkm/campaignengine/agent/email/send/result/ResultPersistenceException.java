package io.github.hotbrkm.campaignengine.agent.email.send.result;

/**
 * Exception indicating failure to persist a send record.
 * <p>
 * This exception is considered a fatal error and stops the dispatch run; the caller decides whether to requeue.
 */
public class ResultPersistenceException extends RuntimeException {
    public ResultPersistenceException(String message) {
        super(message);
    }

    public ResultPersistenceException(String message, Throwable cause) {
        super(message, cause);
    }
}
