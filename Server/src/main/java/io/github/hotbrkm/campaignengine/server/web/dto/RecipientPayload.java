package io.github.hotbrkm.campaignengine.server.web.dto;

import io.github.hotbrkm.campaignengine.agent.email.content.RecipientProfile;
import jakarta.validation.constraints.NotBlank;

/**
 * Address syntax is checked by the dispatch engine, which reports bad addresses as REJECTED.
 */
public record RecipientPayload(Long subscriberId,
                               @NotBlank String email,
                               String firstName,
                               String lastName,
                               String company,
                               String city,
                               String country,
                               String timezone,
                               String industry) {

    public RecipientProfile toProfile() {
        return RecipientProfile.builder()
                .subscriberId(subscriberId)
                .email(email)
                .firstName(firstName)
                .lastName(lastName)
                .company(company)
                .city(city)
                .country(country)
                .timezone(timezone)
                .industry(industry)
                .build();
    }
}
