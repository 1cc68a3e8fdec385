package io.github.hotbrkm.campaignengine.server.web.dto;

import io.github.hotbrkm.campaignengine.agent.email.send.engine.DispatchResult;
import io.github.hotbrkm.campaignengine.agent.email.send.engine.DispatchStatus;

public record DispatchResultResponse(Long recipientId,
                                     String email,
                                     DispatchStatus status,
                                     String trackingId,
                                     String error) {

    public static DispatchResultResponse from(DispatchResult result) {
        return new DispatchResultResponse(result.recipientId(), result.email(), result.status(),
                result.trackingId(), result.error());
    }
}
