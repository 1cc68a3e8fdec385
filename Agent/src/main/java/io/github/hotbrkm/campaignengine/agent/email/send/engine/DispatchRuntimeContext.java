package io.github.hotbrkm.campaignengine.agent.email.send.engine;

import io.github.hotbrkm.campaignengine.agent.email.config.EmailConfig;
import io.github.hotbrkm.campaignengine.agent.email.content.ContentPersonalizer;
import io.github.hotbrkm.campaignengine.agent.email.content.SpintaxExpander;
import io.github.hotbrkm.campaignengine.agent.email.mime.DeliveryAuthenticator;
import io.github.hotbrkm.campaignengine.agent.email.mime.EmailMimeComposer;
import io.github.hotbrkm.campaignengine.agent.email.send.engine.metrics.DeliveryMetricsRecorder;
import io.github.hotbrkm.campaignengine.agent.email.send.result.CampaignStatsRecorder;
import io.github.hotbrkm.campaignengine.agent.email.send.result.SendRecordStore;
import io.github.hotbrkm.campaignengine.agent.email.send.server.ServerSelector;
import io.github.hotbrkm.campaignengine.agent.email.send.transport.MailTransport;
import io.github.hotbrkm.campaignengine.agent.email.tracking.TrackingInjector;
import io.github.hotbrkm.campaignengine.agent.email.tracking.TrackingTokenGenerator;
import lombok.Builder;

import java.time.Clock;
import java.util.Objects;
import java.util.random.RandomGenerator;

/**
 * Collaborators of {@link DispatchEngine}.
 */
@Builder
public record DispatchRuntimeContext(EmailConfig.Smtp smtpConfig,
                                     SpintaxExpander spintaxExpander,
                                     ContentPersonalizer personalizer,
                                     TrackingTokenGenerator tokenGenerator,
                                     TrackingInjector trackingInjector,
                                     DeliveryAuthenticator authenticator,
                                     EmailMimeComposer mimeComposer,
                                     ServerSelector serverSelector,
                                     MailTransport transport,
                                     SendRecordStore sendRecordStore,
                                     CampaignStatsRecorder statsRecorder,
                                     RetryPolicy retryPolicy,
                                     SendDelayPolicy delayPolicy,
                                     int batchSize,
                                     Sleeper sleeper,
                                     DeliveryMetricsRecorder metricsRecorder,
                                     Clock clock,
                                     RandomGenerator random) {

    public DispatchRuntimeContext {
        Objects.requireNonNull(smtpConfig, "smtpConfig must not be null");
        Objects.requireNonNull(spintaxExpander, "spintaxExpander must not be null");
        Objects.requireNonNull(personalizer, "personalizer must not be null");
        Objects.requireNonNull(tokenGenerator, "tokenGenerator must not be null");
        Objects.requireNonNull(trackingInjector, "trackingInjector must not be null");
        Objects.requireNonNull(authenticator, "authenticator must not be null");
        Objects.requireNonNull(mimeComposer, "mimeComposer must not be null");
        Objects.requireNonNull(serverSelector, "serverSelector must not be null");
        Objects.requireNonNull(transport, "transport must not be null");
        Objects.requireNonNull(sendRecordStore, "sendRecordStore must not be null");
        Objects.requireNonNull(statsRecorder, "statsRecorder must not be null");
        Objects.requireNonNull(retryPolicy, "retryPolicy must not be null");
        Objects.requireNonNull(delayPolicy, "delayPolicy must not be null");
        Objects.requireNonNull(sleeper, "sleeper must not be null");
        Objects.requireNonNull(metricsRecorder, "metricsRecorder must not be null");
        Objects.requireNonNull(clock, "clock must not be null");
        Objects.requireNonNull(random, "random must not be null");
        batchSize = batchSize > 0 ? batchSize : EmailConfig.Send.DEFAULT_BATCH_SIZE;
    }
}
