package io.github.hotbrkm.campaignengine.server.web;

import io.github.hotbrkm.campaignengine.agent.email.content.SpintaxSyntaxException;
import io.github.hotbrkm.campaignengine.agent.email.send.engine.DispatchAbortedException;
import io.github.hotbrkm.campaignengine.agent.email.send.result.ResultPersistenceException;
import io.github.hotbrkm.campaignengine.agent.email.send.server.NoServerAvailableException;
import io.github.hotbrkm.campaignengine.server.campaign.CampaignNotFoundException;
import io.github.hotbrkm.campaignengine.server.web.dto.DispatchResultResponse;
import io.github.hotbrkm.campaignengine.server.web.dto.ErrorResponse;
import jakarta.servlet.http.HttpServletRequest;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.time.Instant;
import java.util.List;

/**
 * Error mapping for the campaign API. Tracking endpoints handle their own failures.
 */
@Slf4j
@RestControllerAdvice
public class ApiExceptionHandler {

    @ExceptionHandler(CampaignNotFoundException.class)
    public ResponseEntity<ErrorResponse> handleCampaignNotFound(CampaignNotFoundException ex, HttpServletRequest request) {
        log.warn("event=campaign_not_found, reason={}", ex.getMessage());
        return build(HttpStatus.NOT_FOUND, ex.getMessage(), List.of(), request);
    }

    @ExceptionHandler(SpintaxSyntaxException.class)
    public ResponseEntity<ErrorResponse> handleSpintax(SpintaxSyntaxException ex, HttpServletRequest request) {
        log.warn("event=template_rejected, errors={}", ex.getErrors().size());
        return build(HttpStatus.BAD_REQUEST, "Campaign template has malformed spintax", ex.getErrors(), request);
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ErrorResponse> handleValidation(MethodArgumentNotValidException ex, HttpServletRequest request) {
        List<String> details = ex.getBindingResult().getFieldErrors().stream()
                .map(error -> error.getField() + ": " + error.getDefaultMessage())
                .toList();
        return build(HttpStatus.BAD_REQUEST, "Validation failed", details, request);
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ErrorResponse> handleUnreadable(HttpMessageNotReadableException ex, HttpServletRequest request) {
        return build(HttpStatus.BAD_REQUEST, "Malformed request body", List.of(), request);
    }

    @ExceptionHandler(NoServerAvailableException.class)
    public ResponseEntity<ErrorResponse> handleNoServer(NoServerAvailableException ex, HttpServletRequest request) {
        log.error("event=dispatch_unavailable, reason={}", ex.getMessage());
        List<DispatchResultResponse> results = null;
        if (ex instanceof DispatchAbortedException aborted) {
            results = aborted.getResults().stream().map(DispatchResultResponse::from).toList();
        }
        return build(HttpStatus.SERVICE_UNAVAILABLE, ex.getMessage(), List.of(), results, request);
    }

    @ExceptionHandler(ResultPersistenceException.class)
    public ResponseEntity<ErrorResponse> handlePersistence(ResultPersistenceException ex, HttpServletRequest request) {
        log.error("event=dispatch_aborted, reason={}", ex.getMessage(), ex);
        return build(HttpStatus.INTERNAL_SERVER_ERROR, "Dispatch aborted: send records could not be written",
                List.of(), request);
    }

    private static ResponseEntity<ErrorResponse> build(HttpStatus status, String message, List<String> details,
                                                       HttpServletRequest request) {
        return build(status, message, details, null, request);
    }

    private static ResponseEntity<ErrorResponse> build(HttpStatus status, String message, List<String> details,
                                                       List<DispatchResultResponse> results,
                                                       HttpServletRequest request) {
        ErrorResponse error = ErrorResponse.builder()
                .status(status.value())
                .error(status.getReasonPhrase())
                .message(message)
                .details(details)
                .results(results)
                .path(request.getRequestURI())
                .timestamp(Instant.now())
                .build();
        return ResponseEntity.status(status).body(error);
    }
}
