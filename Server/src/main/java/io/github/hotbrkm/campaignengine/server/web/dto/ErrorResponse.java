package io.github.hotbrkm.campaignengine.server.web.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;

import java.time.Instant;
import java.util.List;

/**
 * {@code results} is only present when a dispatch stopped partway and some recipients already have outcomes.
 */
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ErrorResponse(int status,
                            String error,
                            String message,
                            List<String> details,
                            List<DispatchResultResponse> results,
                            String path,
                            Instant timestamp) {
}
