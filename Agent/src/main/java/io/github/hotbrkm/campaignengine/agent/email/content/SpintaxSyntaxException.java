package io.github.hotbrkm.campaignengine.agent.email.content;

import lombok.Getter;

import java.util.List;

/**
 * Thrown when spintax text is malformed or nested deeper than allowed.
 * Carries every validation error found, not just the first.
 */
@Getter
public class SpintaxSyntaxException extends RuntimeException {
    private final List<String> errors;

    public SpintaxSyntaxException(List<String> errors) {
        super(String.join("; ", errors));
        this.errors = List.copyOf(errors);
    }

    public SpintaxSyntaxException(String error) {
        this(List.of(error));
    }
}
