package io.github.hotbrkm.campaignengine.server.web.dto;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotEmpty;

import java.util.List;

public record DispatchRequestBody(@NotEmpty List<@Valid RecipientPayload> recipients) {
}
