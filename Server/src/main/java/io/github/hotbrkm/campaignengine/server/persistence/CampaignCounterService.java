package io.github.hotbrkm.campaignengine.server.persistence;

import io.github.hotbrkm.campaignengine.agent.email.send.result.CampaignStatsRecorder;
import io.github.hotbrkm.campaignengine.server.persistence.entity.SubscriberEngagementEntity;
import io.github.hotbrkm.campaignengine.server.persistence.repository.CampaignRepository;
import io.github.hotbrkm.campaignengine.server.persistence.repository.SubscriberEngagementRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.ConcurrencyFailureException;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionDefinition;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Clock;
import java.time.Instant;

/**
 * Campaign and subscriber counters.
 * <p>
 * Each method runs in its own transaction so that a counter failure rolls back only the counters, never the
 * send record or tracking event written by the caller. Increments and the rate recompute that follows them
 * commit together. Callers must not hold a transaction of their own: every method needs exactly one
 * connection, and a caller holding another would need two.
 * <p>
 * The subscriber engagement row is created in a separate transaction before the counters run. When two
 * first hits for one subscriber race, the losing insert rolls back alone and the counters still apply.
 */
@Slf4j
@Service
public class CampaignCounterService implements CampaignStatsRecorder {

    static final int OPEN_ENGAGEMENT_POINTS = 2;
    static final int CLICK_ENGAGEMENT_POINTS = 5;

    private final CampaignRepository campaignRepository;
    private final SubscriberEngagementRepository subscriberEngagementRepository;
    private final Clock clock;
    private final TransactionTemplate requiresNew;

    public CampaignCounterService(CampaignRepository campaignRepository,
                                  SubscriberEngagementRepository subscriberEngagementRepository,
                                  Clock clock,
                                  PlatformTransactionManager transactionManager) {
        this.campaignRepository = campaignRepository;
        this.subscriberEngagementRepository = subscriberEngagementRepository;
        this.clock = clock;
        this.requiresNew = new TransactionTemplate(transactionManager);
        this.requiresNew.setPropagationBehavior(TransactionDefinition.PROPAGATION_REQUIRES_NEW);
    }

    @Override
    public void recordSent(long campaignId, Long subscriberId) {
        ensureEngagementRow(subscriberId);
        requiresNew.executeWithoutResult(status -> {
            if (campaignRepository.incrementSent(campaignId) > 0) {
                campaignRepository.recomputeRates(campaignId);
            } else {
                log.warn("campaignId={}, event=counter_skipped, reason=unknown_campaign", campaignId);
            }
            if (subscriberId != null) {
                subscriberEngagementRepository.incrementSent(subscriberId, clock.instant());
                subscriberEngagementRepository.recomputeRates(subscriberId);
            }
        });
    }

    @Override
    public void recordFailed(long campaignId) {
        requiresNew.executeWithoutResult(status -> {
            if (campaignRepository.incrementFailed(campaignId) > 0) {
                campaignRepository.recomputeRates(campaignId);
            }
        });
    }

    public void recordOpen(long campaignId, Long subscriberId, boolean unique, Instant openedAt) {
        ensureEngagementRow(subscriberId);
        requiresNew.executeWithoutResult(status -> {
            campaignRepository.incrementOpens(campaignId, unique ? 1L : 0L);
            campaignRepository.recomputeRates(campaignId);
            if (subscriberId != null) {
                subscriberEngagementRepository.incrementOpens(subscriberId, openedAt, OPEN_ENGAGEMENT_POINTS);
                subscriberEngagementRepository.recomputeRates(subscriberId);
            }
        });
    }

    public void recordClick(long campaignId, Long subscriberId, boolean unique, Instant clickedAt) {
        ensureEngagementRow(subscriberId);
        requiresNew.executeWithoutResult(status -> {
            campaignRepository.incrementClicks(campaignId, unique ? 1L : 0L);
            campaignRepository.recomputeRates(campaignId);
            if (subscriberId != null) {
                subscriberEngagementRepository.incrementClicks(subscriberId, clickedAt, CLICK_ENGAGEMENT_POINTS);
                subscriberEngagementRepository.recomputeRates(subscriberId);
            }
        });
    }

    public void recordConversion(long campaignId) {
        requiresNew.executeWithoutResult(status -> {
            campaignRepository.incrementConversions(campaignId);
            campaignRepository.recomputeRates(campaignId);
        });
    }

    private void ensureEngagementRow(Long subscriberId) {
        if (subscriberId == null || subscriberEngagementRepository.existsById(subscriberId)) {
            return;
        }
        try {
            requiresNew.executeWithoutResult(status -> subscriberEngagementRepository.saveAndFlush(
                    SubscriberEngagementEntity.builder().subscriberId(subscriberId).build()));
        } catch (DataIntegrityViolationException | ConcurrencyFailureException e) {
            // a concurrent hit created the row first
            log.debug("subscriberId={}, event=engagement_row_exists", subscriberId);
        }
    }
}
