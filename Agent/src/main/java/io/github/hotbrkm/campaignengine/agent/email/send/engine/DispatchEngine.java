package io.github.hotbrkm.campaignengine.agent.email.send.engine;

import io.github.hotbrkm.campaignengine.agent.email.content.MessageTemplate;
import io.github.hotbrkm.campaignengine.agent.email.content.PersonalizedContent;
import io.github.hotbrkm.campaignengine.agent.email.content.RecipientProfile;
import io.github.hotbrkm.campaignengine.agent.email.content.SendContext;
import io.github.hotbrkm.campaignengine.agent.email.content.SpintaxSyntaxException;
import io.github.hotbrkm.campaignengine.agent.email.domain.EmailAddressUtil;
import io.github.hotbrkm.campaignengine.agent.email.mime.ComposedMessage;
import io.github.hotbrkm.campaignengine.agent.email.mime.IdentityHeaders;
import io.github.hotbrkm.campaignengine.agent.email.mime.OutboundMessage;
import io.github.hotbrkm.campaignengine.agent.email.send.result.PendingSend;
import io.github.hotbrkm.campaignengine.agent.email.send.result.ResultPersistenceException;
import io.github.hotbrkm.campaignengine.agent.email.send.server.NoServerAvailableException;
import io.github.hotbrkm.campaignengine.agent.email.send.server.SmtpServer;
import io.github.hotbrkm.campaignengine.agent.email.send.transport.TransportException;
import io.github.hotbrkm.campaignengine.agent.email.tracking.TrackedHtml;
import jakarta.mail.MessagingException;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Sends one campaign batch, recipient by recipient.
 * <p>
 * Per recipient the flow is:
 * <ol>
 *   <li>COMPOSING: personalize the template and inject tracking (link mappings are persisted here)</li>
 *   <li>AUTHENTICATING: identity headers, MIME build and DKIM signature</li>
 *   <li>a PENDING send record is written before any transport attempt</li>
 *   <li>SENDING: up to {@code maxAttempts} attempts, each on the server the selector currently ranks first,
 *       with exponential backoff between attempts</li>
 *   <li>SENT or FAILED is written to the send record, then send-side counters are updated</li>
 * </ol>
 * Counter failures are logged for reconciliation and never change a delivery outcome. A send record write
 * failure aborts the run with {@link ResultPersistenceException}.
 * <p>
 * Between recipients the run waits for the per-domain inter-send delay, and after every {@code batchSize}
 * recipients for the batch delay instead. Interrupting the dispatching thread stops the run; recipients not
 * reached are reported as SKIPPED. The same happens when the server pool runs dry, except that the run then
 * ends with {@link DispatchAbortedException}.
 */
@Slf4j
public class DispatchEngine {

    private final DispatchRuntimeContext context;

    public DispatchEngine(DispatchRuntimeContext context) {
        this.context = Objects.requireNonNull(context, "context must not be null");
    }

    /**
     * @throws SpintaxSyntaxException     when the template is malformed; nothing is sent
     * @throws DispatchAbortedException   when the pool has no enabled server; carries every recipient's outcome
     * @throws ResultPersistenceException when a send record cannot be written
     */
    public List<DispatchResult> dispatch(DispatchRequest request) {
        Objects.requireNonNull(request, "request must not be null");
        validateTemplate(request.template());

        long campaignId = request.campaignId();
        List<RecipientProfile> recipients = request.recipients();
        SendContext sendContext = new SendContext(context.clock(), context.random());
        List<DispatchResult> results = new ArrayList<>(recipients.size());

        log.info("campaignId={}, recipients={}, event=dispatch_start", campaignId, recipients.size());

        int attempted = 0;
        for (int i = 0; i < recipients.size(); i++) {
            RecipientProfile recipient = recipients.get(i);
            if (!EmailAddressUtil.isValid(recipient.email())) {
                log.warn("campaignId={}, subscriberId={}, event=recipient_rejected, reason=invalid_email",
                        campaignId, recipient.subscriberId());
                context.metricsRecorder().recordResult(DispatchStatus.REJECTED.name());
                results.add(DispatchResult.rejected(recipient, "Invalid email address"));
                continue;
            }

            if (attempted > 0 && !pauseBeforeNext(attempted, recipient)) {
                skipRemaining(recipients, i, results, campaignId);
                break;
            }
            attempted++;

            DispatchResult result;
            try {
                result = deliver(request, recipient, sendContext);
            } catch (DispatchAbortedException e) {
                results.addAll(e.getResults());
                e.getResults().forEach(r -> context.metricsRecorder().recordResult(r.status().name()));
                skipRemaining(recipients, i + 1, results, campaignId);
                logSummary(campaignId, results);
                throw new DispatchAbortedException(e.getMessage(), results, e.getCause());
            }
            context.metricsRecorder().recordResult(result.status().name());
            results.add(result);

            if (Thread.currentThread().isInterrupted()) {
                skipRemaining(recipients, i + 1, results, campaignId);
                break;
            }
        }

        logSummary(campaignId, results);
        return results;
    }

    private void validateTemplate(MessageTemplate template) {
        List<String> errors = new ArrayList<>();
        errors.addAll(context.spintaxExpander().validate(template.subject()));
        errors.addAll(context.spintaxExpander().validate(template.html()));
        errors.addAll(context.spintaxExpander().validate(template.text()));
        if (!errors.isEmpty()) {
            throw new SpintaxSyntaxException(errors);
        }
    }

    private DispatchResult deliver(DispatchRequest request, RecipientProfile recipient, SendContext sendContext) {
        long campaignId = request.campaignId();
        String trackingId = context.tokenGenerator().newTrackingId();
        RecipientDelivery delivery = new RecipientDelivery(trackingId);

        delivery.transitionTo(DeliveryState.COMPOSING);
        PersonalizedContent content = context.personalizer().personalize(request.template(), recipient, sendContext);
        TrackedHtml trackedHtml = context.trackingInjector().inject(content.html(), trackingId, campaignId);

        delivery.transitionTo(DeliveryState.AUTHENTICATING);
        ComposedMessage composed;
        try {
            composed = compose(request, recipient, content, trackedHtml.html());
        } catch (MessagingException | IllegalStateException e) {
            log.error("campaignId={}, trackingId={}, event=compose_failed", campaignId, trackingId, e);
            delivery.transitionTo(DeliveryState.FAILED);
            persistPending(campaignId, recipient, trackingId, null, content, trackedHtml.html());
            context.sendRecordStore().markFailed(trackingId, null, 0, "Composition failed: " + e.getMessage());
            updateCounters(campaignId, trackingId, "emails_failed", () -> context.statsRecorder().recordFailed(campaignId));
            return DispatchResult.failed(recipient, trackingId, e.getMessage());
        }

        persistPending(campaignId, recipient, trackingId, composed.messageId(), content, trackedHtml.html());
        return send(campaignId, recipient, delivery, composed);
    }

    private ComposedMessage compose(DispatchRequest request, RecipientProfile recipient, PersonalizedContent content,
                                    String trackedHtml) throws MessagingException {
        IdentityHeaders identity = context.authenticator()
                .identityHeaders(request.campaignId(), recipient.subscriberId(), recipient.email());
        OutboundMessage message = OutboundMessage.builder()
                .fromName(request.fromName() != null ? request.fromName() : context.smtpConfig().getFromName())
                .fromEmail(request.fromEmail() != null ? request.fromEmail() : context.smtpConfig().getFrom())
                .recipientName(displayName(recipient))
                .recipientEmail(recipient.email().trim())
                .subject(content.subject())
                .html(trackedHtml)
                .text(content.text())
                .identity(identity)
                .attachments(request.attachments())
                .build();
        return context.mimeComposer().compose(message);
    }

    private DispatchResult send(long campaignId, RecipientProfile recipient, RecipientDelivery delivery,
                                ComposedMessage composed) {
        String trackingId = delivery.getTrackingId();
        RetryPolicy retryPolicy = context.retryPolicy();

        while (true) {
            SmtpServer server;
            try {
                server = context.serverSelector().next();
            } catch (NoServerAvailableException e) {
                delivery.recordError(e.getMessage());
                DispatchResult failed = fail(campaignId, recipient, delivery);
                throw new DispatchAbortedException(e.getMessage(), List.of(failed), e);
            }
            delivery.beginAttempt(server);

            long startedAt = System.nanoTime();
            try {
                context.transport().send(server, composed);
            } catch (TransportException e) {
                Duration elapsed = Duration.ofNanos(System.nanoTime() - startedAt);
                context.serverSelector().recordOutcome(server, false, elapsed);
                context.metricsRecorder().recordAttempt(server.name(), false, elapsed);
                delivery.recordError(e.getMessage());
                log.warn("campaignId={}, trackingId={}, server={}, attempt={}, code={}, event=transport_failed, error={}",
                        campaignId, trackingId, server.name(), delivery.getAttempts(), e.getStatusCode(), e.getMessage());

                if (!retryPolicy.canRetry(delivery.getAttempts())) {
                    return fail(campaignId, recipient, delivery);
                }
                long backoff = retryPolicy.computeRetryDelayMillis(delivery.getAttempts());
                try {
                    context.sleeper().sleep(backoff);
                } catch (InterruptedException ie) {
                    Thread.currentThread().interrupt();
                    delivery.recordError("Interrupted during retry backoff after: " + delivery.getLastError());
                    return fail(campaignId, recipient, delivery);
                }
                continue;
            }

            Duration elapsed = Duration.ofNanos(System.nanoTime() - startedAt);
            context.serverSelector().recordOutcome(server, true, elapsed);
            context.metricsRecorder().recordAttempt(server.name(), true, elapsed);
            delivery.transitionTo(DeliveryState.SENT);
            context.sendRecordStore().markSent(trackingId, server.name(), delivery.retryCount(), context.clock().instant());
            log.info("campaignId={}, trackingId={}, server={}, attempts={}, event=sent",
                    campaignId, trackingId, server.name(), delivery.getAttempts());
            updateCounters(campaignId, trackingId, "emails_sent",
                    () -> context.statsRecorder().recordSent(campaignId, recipient.subscriberId()));
            return DispatchResult.sent(recipient, trackingId);
        }
    }

    private DispatchResult fail(long campaignId, RecipientProfile recipient, RecipientDelivery delivery) {
        String trackingId = delivery.getTrackingId();
        delivery.transitionTo(DeliveryState.FAILED);
        context.sendRecordStore().markFailed(trackingId, delivery.lastServerName(), delivery.retryCount(),
                delivery.getLastError());
        log.error("campaignId={}, trackingId={}, attempts={}, event=send_failed, error={}",
                campaignId, trackingId, delivery.getAttempts(), delivery.getLastError());
        updateCounters(campaignId, trackingId, "emails_failed", () -> context.statsRecorder().recordFailed(campaignId));
        return DispatchResult.failed(recipient, trackingId, delivery.getLastError());
    }

    private void persistPending(long campaignId, RecipientProfile recipient, String trackingId, String messageId,
                                PersonalizedContent content, String trackedHtml) {
        context.sendRecordStore().createPending(PendingSend.builder()
                .trackingId(trackingId)
                .campaignId(campaignId)
                .subscriberId(recipient.subscriberId())
                .recipientEmail(recipient.email().trim())
                .messageId(messageId)
                .subject(content.subject())
                .html(trackedHtml)
                .text(content.text())
                .createdAt(context.clock().instant())
                .build());
    }

    private void updateCounters(long campaignId, String trackingId, String counter, Runnable update) {
        try {
            update.run();
        } catch (RuntimeException e) {
            context.metricsRecorder().recordCounterFailure(counter);
            log.error("campaignId={}, trackingId={}, counter={}, reconcile=true, event=counter_update_failed",
                    campaignId, trackingId, counter, e);
        }
    }

    /**
     * @return false when the wait was interrupted
     */
    private boolean pauseBeforeNext(int attempted, RecipientProfile next) {
        long delay = attempted % context.batchSize() == 0
                ? context.delayPolicy().batchDelayMillis(context.batchSize())
                : context.delayPolicy().interSendDelayMillis(next.email(), context.random());
        try {
            context.sleeper().sleep(delay);
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    private void skipRemaining(List<RecipientProfile> recipients, int from, List<DispatchResult> results, long campaignId) {
        log.warn("campaignId={}, skipped={}, event=dispatch_interrupted", campaignId, recipients.size() - from);
        for (int i = from; i < recipients.size(); i++) {
            results.add(DispatchResult.skipped(recipients.get(i)));
            context.metricsRecorder().recordResult(DispatchStatus.SKIPPED.name());
        }
    }

    private void logSummary(long campaignId, List<DispatchResult> results) {
        long sent = results.stream().filter(r -> r.status() == DispatchStatus.SENT).count();
        long failed = results.stream().filter(r -> r.status() == DispatchStatus.FAILED).count();
        long rejected = results.stream().filter(r -> r.status() == DispatchStatus.REJECTED).count();
        long skipped = results.stream().filter(r -> r.status() == DispatchStatus.SKIPPED).count();
        log.info("campaignId={}, sent={}, failed={}, rejected={}, skipped={}, event=dispatch_complete",
                campaignId, sent, failed, rejected, skipped);
    }

    private static String displayName(RecipientProfile recipient) {
        String first = recipient.firstName() == null ? "" : recipient.firstName().trim();
        String last = recipient.lastName() == null ? "" : recipient.lastName().trim();
        String name = (first + " " + last).trim();
        return name.isEmpty() ? null : name;
    }
}
