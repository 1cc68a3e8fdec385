package io.github.hotbrkm.campaignengine.agent.email.config;

import io.github.hotbrkm.campaignengine.agent.email.content.ContentPersonalizer;
import io.github.hotbrkm.campaignengine.agent.email.content.SpintaxExpander;
import io.github.hotbrkm.campaignengine.agent.email.domain.EmailDomainManager;
import io.github.hotbrkm.campaignengine.agent.email.mime.DeliveryAuthenticator;
import io.github.hotbrkm.campaignengine.agent.email.mime.DkimSigner;
import io.github.hotbrkm.campaignengine.agent.email.mime.EmailMimeComposer;
import io.github.hotbrkm.campaignengine.agent.email.send.engine.DispatchEngine;
import io.github.hotbrkm.campaignengine.agent.email.send.engine.DispatchRuntimeContext;
import io.github.hotbrkm.campaignengine.agent.email.send.engine.RetryPolicy;
import io.github.hotbrkm.campaignengine.agent.email.send.engine.SendDelayPolicy;
import io.github.hotbrkm.campaignengine.agent.email.send.engine.Sleeper;
import io.github.hotbrkm.campaignengine.agent.email.send.engine.metrics.DeliveryMetricsRecorder;
import io.github.hotbrkm.campaignengine.agent.email.send.result.CampaignStatsRecorder;
import io.github.hotbrkm.campaignengine.agent.email.send.result.SendRecordStore;
import io.github.hotbrkm.campaignengine.agent.email.send.server.ScoringServerSelector;
import io.github.hotbrkm.campaignengine.agent.email.send.server.ServerSelector;
import io.github.hotbrkm.campaignengine.agent.email.send.server.SmtpServer;
import io.github.hotbrkm.campaignengine.agent.email.send.transport.JakartaMailTransport;
import io.github.hotbrkm.campaignengine.agent.email.send.transport.MailTransport;
import io.github.hotbrkm.campaignengine.agent.email.tracking.LinkMappingStore;
import io.github.hotbrkm.campaignengine.agent.email.tracking.LinkVariationRegistry;
import io.github.hotbrkm.campaignengine.agent.email.tracking.TrackingInjector;
import io.github.hotbrkm.campaignengine.agent.email.tracking.TrackingTokenGenerator;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.security.SecureRandom;
import java.time.Clock;
import java.util.List;

@Slf4j
@Configuration
public class EmailSendConfig {

    @Bean
    @ConditionalOnMissingBean
    public Clock clock() {
        return Clock.systemDefaultZone();
    }

    @Bean
    public SpintaxExpander spintaxExpander() {
        return new SpintaxExpander();
    }

    @Bean
    public ContentPersonalizer contentPersonalizer(SpintaxExpander spintaxExpander) {
        return new ContentPersonalizer(spintaxExpander);
    }

    @Bean
    public EmailDomainManager emailDomainManager(EmailConfig emailConfig) {
        EmailConfig.Send send = emailConfig.getSend();
        return EmailDomainManager.fromDelays(send.getDomainDelayMs(), send.getDefaultDomainDelayMs());
    }

    /**
     * Fails startup when no SMTP server is configured.
     */
    @Bean
    public ServerSelector serverSelector(EmailConfig emailConfig) {
        List<SmtpServer> pool = emailConfig.getServers().stream().map(SmtpServer::from).toList();
        if (pool.isEmpty()) {
            throw new EngineConfigurationException("No SMTP servers configured under email.servers");
        }
        log.info("servers={}, enabled={}, event=server_pool_loaded", pool.size(),
                pool.stream().filter(SmtpServer::enabled).count());
        return new ScoringServerSelector(pool);
    }

    @Bean
    public DeliveryAuthenticator deliveryAuthenticator(EmailConfig emailConfig, Clock clock) {
        EmailConfig.Dkim dkim = emailConfig.getDkim();
        DkimSigner dkimSigner = dkim.isEnabled() ? new DkimSigner(dkim, clock) : null;
        if (dkimSigner == null) {
            log.warn("event=dkim_disabled, messages will be sent unsigned");
        }
        return new DeliveryAuthenticator(emailConfig, dkimSigner);
    }

    @Bean
    public EmailMimeComposer emailMimeComposer(DeliveryAuthenticator deliveryAuthenticator, Clock clock) {
        return new EmailMimeComposer(deliveryAuthenticator, clock);
    }

    @Bean
    public TrackingTokenGenerator trackingTokenGenerator() {
        return new TrackingTokenGenerator();
    }

    @Bean
    public TrackingInjector trackingInjector(EmailConfig emailConfig, TrackingTokenGenerator trackingTokenGenerator,
                                             LinkMappingStore linkMappingStore, Clock clock) {
        EmailConfig.Tracking tracking = emailConfig.getTracking();
        return new TrackingInjector(tracking, trackingTokenGenerator,
                new LinkVariationRegistry(tracking.getLinkVariations()), linkMappingStore, clock);
    }

    @Bean
    @ConditionalOnMissingBean
    public MailTransport mailTransport(EmailConfig emailConfig) {
        return new JakartaMailTransport(emailConfig.getSend());
    }

    @Bean
    @ConditionalOnMissingBean
    public Sleeper sleeper() {
        return Sleeper.threadSleep();
    }

    @Bean
    public DeliveryMetricsRecorder deliveryMetricsRecorder(ObjectProvider<MeterRegistry> meterRegistry) {
        return new DeliveryMetricsRecorder(meterRegistry.getIfAvailable());
    }

    @Bean
    public DispatchEngine dispatchEngine(EmailConfig emailConfig, SpintaxExpander spintaxExpander,
                                         ContentPersonalizer contentPersonalizer, TrackingTokenGenerator trackingTokenGenerator,
                                         TrackingInjector trackingInjector, DeliveryAuthenticator deliveryAuthenticator,
                                         EmailMimeComposer emailMimeComposer, ServerSelector serverSelector,
                                         MailTransport mailTransport, SendRecordStore sendRecordStore,
                                         CampaignStatsRecorder campaignStatsRecorder, EmailDomainManager emailDomainManager,
                                         Sleeper sleeper, DeliveryMetricsRecorder deliveryMetricsRecorder, Clock clock) {
        EmailConfig.Send send = emailConfig.getSend();
        DispatchRuntimeContext context = DispatchRuntimeContext.builder()
                .smtpConfig(emailConfig.getSmtp())
                .spintaxExpander(spintaxExpander)
                .personalizer(contentPersonalizer)
                .tokenGenerator(trackingTokenGenerator)
                .trackingInjector(trackingInjector)
                .authenticator(deliveryAuthenticator)
                .mimeComposer(emailMimeComposer)
                .serverSelector(serverSelector)
                .transport(mailTransport)
                .sendRecordStore(sendRecordStore)
                .statsRecorder(campaignStatsRecorder)
                .retryPolicy(new RetryPolicy(send))
                .delayPolicy(new SendDelayPolicy(send, emailDomainManager))
                .batchSize(send.resolveBatchSize())
                .sleeper(sleeper)
                .metricsRecorder(deliveryMetricsRecorder)
                .clock(clock)
                .random(new SecureRandom())
                .build();
        return new DispatchEngine(context);
    }
}
