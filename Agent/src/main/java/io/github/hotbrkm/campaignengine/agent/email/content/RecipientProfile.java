package io.github.hotbrkm.campaignengine.agent.email.content;

import lombok.Builder;

/**
 * Read-only personalization fields of one recipient. Every field except {@code email} may be null.
 */
@Builder(toBuilder = true)
public record RecipientProfile(Long subscriberId,
                               String email,
                               String firstName,
                               String lastName,
                               String company,
                               String city,
                               String country,
                               String timezone,
                               String industry) {
}
