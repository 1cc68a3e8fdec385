package io.github.hotbrkm.campaignengine.agent.email.config;

/**
 * Missing or unusable delivery configuration. Raised while wiring the engine and never retried.
 */
public class EngineConfigurationException extends RuntimeException {
    public EngineConfigurationException(String message) {
        super(message);
    }

    public EngineConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
