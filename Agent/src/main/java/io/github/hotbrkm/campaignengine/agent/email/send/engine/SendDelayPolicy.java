package io.github.hotbrkm.campaignengine.agent.email.send.engine;

import io.github.hotbrkm.campaignengine.agent.email.config.EmailConfig;
import io.github.hotbrkm.campaignengine.agent.email.domain.EmailAddressUtil;
import io.github.hotbrkm.campaignengine.agent.email.domain.EmailDomainManager;

import java.util.random.RandomGenerator;

/**
 * Rate shaping between sends. Large webmail providers get a longer per-domain delay, and random jitter keeps the
 * sending pattern from looking mechanical.
 */
public class SendDelayPolicy {

    private final long baseDelayMillis;
    private final long maxJitterMillis;
    private final long batchDelayPerRecipientMillis;
    private final EmailDomainManager emailDomainManager;

    public SendDelayPolicy(EmailConfig.Send send, EmailDomainManager emailDomainManager) {
        this.baseDelayMillis = Math.max(0L, send.getBaseDelayMs());
        this.maxJitterMillis = Math.max(0L, send.getMaxJitterMs());
        this.batchDelayPerRecipientMillis = Math.max(0L, send.getBatchDelayPerRecipientMs());
        this.emailDomainManager = emailDomainManager;
    }

    /**
     * base + domain delay + jitter in {@code [0, maxJitter]}.
     */
    public long interSendDelayMillis(String recipientEmail, RandomGenerator random) {
        String domain = EmailAddressUtil.extractDomain(recipientEmail);
        long domainDelay = emailDomainManager.getEmailDomain(domain).getSendDelayMs();
        long jitter = maxJitterMillis == 0 ? 0 : random.nextLong(maxJitterMillis + 1);
        return baseDelayMillis + domainDelay + jitter;
    }

    public long batchDelayMillis(int batchSize) {
        return batchDelayPerRecipientMillis * Math.max(0, batchSize);
    }
}
