package io.github.hotbrkm.campaignengine.server.attribution;

import io.github.hotbrkm.campaignengine.server.persistence.CampaignCounterService;
import io.github.hotbrkm.campaignengine.server.persistence.entity.ClickEventEntity;
import io.github.hotbrkm.campaignengine.server.persistence.entity.ConversionEventEntity;
import io.github.hotbrkm.campaignengine.server.persistence.entity.ConversionType;
import io.github.hotbrkm.campaignengine.server.persistence.entity.LinkMappingEntity;
import io.github.hotbrkm.campaignengine.server.persistence.entity.OpenEventEntity;
import io.github.hotbrkm.campaignengine.server.persistence.entity.SendRecordEntity;
import io.github.hotbrkm.campaignengine.server.persistence.repository.ClickEventRepository;
import io.github.hotbrkm.campaignengine.server.persistence.repository.ConversionEventRepository;
import io.github.hotbrkm.campaignengine.server.persistence.repository.LinkMappingRepository;
import io.github.hotbrkm.campaignengine.server.persistence.repository.OpenEventRepository;
import io.github.hotbrkm.campaignengine.server.persistence.repository.SendRecordRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.jspecify.annotations.Nullable;
import org.springframework.stereotype.Service;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;

/**
 * Turns pixel and redirect hits into open, click and conversion events.
 * <p>
 * The send record is locked while an event is written, so the "first hit from this IP" check and the event
 * insert cannot interleave with a concurrent hit on the same send. Telemetry is resolved before the lock is
 * taken. Counters are updated after the event transaction commits, once its lock and connection are released;
 * when they fail the event is kept and the failure is logged for reconciliation.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class AttributionIngestor {

    private final SendRecordRepository sendRecordRepository;
    private final LinkMappingRepository linkMappingRepository;
    private final OpenEventRepository openEventRepository;
    private final ClickEventRepository clickEventRepository;
    private final ConversionEventRepository conversionEventRepository;
    private final CampaignCounterService campaignCounterService;
    private final UserAgentParser userAgentParser;
    private final GeoLocationResolver geoLocationResolver;
    private final ConversionClassifier conversionClassifier;
    private final TransactionTemplate transactionTemplate;
    private final Clock clock;

    /**
     * @throws TrackingResolutionException when the tracking id belongs to no send
     */
    public OpenEventEntity handleOpen(String trackingId, RequestMeta meta) {
        if (trackingId == null || !sendRecordRepository.existsByTrackingId(trackingId)) {
            throw new TrackingResolutionException("Unknown tracking id: " + trackingId);
        }
        Telemetry telemetry = resolveTelemetry(meta);
        Instant now = clock.instant();

        OpenEventEntity event = transactionTemplate.execute(status -> insertOpen(trackingId, meta, telemetry, now));

        updateCounters("open", event.getCampaignId(), event.getSendRecordId(), () -> campaignCounterService.recordOpen(
                event.getCampaignId(), event.getSubscriberId(), event.isUniqueEvent(), now));

        log.info("campaignId={}, sendId={}, unique={}, device={}, event=email_opened",
                event.getCampaignId(), event.getSendRecordId(), event.isUniqueEvent(), event.getDeviceType());
        return event;
    }

    private OpenEventEntity insertOpen(String trackingId, RequestMeta meta, Telemetry telemetry, Instant now) {
        SendRecordEntity send = lockSend(trackingId);
        boolean unique = !openEventRepository.existsBySendRecordIdAndIpAddress(send.getId(), meta.ipAddress());

        OpenEventEntity event = OpenEventEntity.builder()
                .sendRecordId(send.getId())
                .campaignId(send.getCampaignId())
                .subscriberId(send.getSubscriberId())
                .trackingId(trackingId)
                .ipAddress(meta.ipAddress())
                .userAgent(meta.userAgent())
                .referer(meta.referer())
                .deviceType(telemetry.device().deviceType())
                .deviceOs(telemetry.device().os())
                .deviceBrand(telemetry.device().brand())
                .deviceModel(telemetry.device().model())
                .browserName(telemetry.device().browserName())
                .browserVersion(telemetry.device().browserVersion())
                .browserEngine(telemetry.device().browserEngine())
                .country(telemetry.geo().country())
                .countryCode(telemetry.geo().countryCode())
                .region(telemetry.geo().region())
                .city(telemetry.geo().city())
                .timezone(telemetry.geo().timezone())
                .latitude(telemetry.geo().latitude())
                .longitude(telemetry.geo().longitude())
                .isp(telemetry.geo().isp())
                .uniqueEvent(unique)
                .mobile(telemetry.device().isMobile())
                .openedAt(now)
                .timeToOpenSeconds(secondsBetween(send.getSentAt(), now))
                .build();
        return openEventRepository.saveAndFlush(event);
    }

    /**
     * @return the destination to redirect to
     * @throws TrackingResolutionException when the link is unknown, expired or its send no longer exists
     */
    public String handleClick(String linkId, RequestMeta meta) {
        LinkMappingEntity link = (linkId == null ? null : linkMappingRepository.findByLinkId(linkId).orElse(null));
        if (link == null) {
            throw new TrackingResolutionException("Unknown link id: " + linkId);
        }
        Instant now = clock.instant();
        if (link.getExpiresAt() != null && !now.isBefore(link.getExpiresAt())) {
            throw new TrackingResolutionException("Expired link id: " + linkId);
        }
        Telemetry telemetry = resolveTelemetry(meta);

        ClickOutcome outcome = transactionTemplate.execute(status -> insertClick(link, meta, telemetry, now));
        ClickEventEntity click = outcome.click();

        updateCounters("click", click.getCampaignId(), click.getSendRecordId(), () -> campaignCounterService.recordClick(
                click.getCampaignId(), click.getSubscriberId(), click.isUniqueEvent(), now));
        outcome.conversion().ifPresent(type -> {
            updateCounters("conversion", click.getCampaignId(), click.getSendRecordId(),
                    () -> campaignCounterService.recordConversion(click.getCampaignId()));
            log.info("campaignId={}, sendId={}, type={}, event=conversion_recorded",
                    click.getCampaignId(), click.getSendRecordId(), type);
        });

        log.info("campaignId={}, sendId={}, linkPosition={}, unique={}, event=link_clicked",
                click.getCampaignId(), click.getSendRecordId(), click.getLinkPosition(), click.isUniqueEvent());
        return link.getOriginalUrl();
    }

    private ClickOutcome insertClick(LinkMappingEntity link, RequestMeta meta, Telemetry telemetry, Instant now) {
        SendRecordEntity send = lockSend(link.getTrackingId());
        boolean unique = !clickEventRepository.existsBySendRecordIdAndIpAddress(send.getId(), meta.ipAddress());
        Instant firstOpen = openEventRepository.findFirstOpenedAt(send.getId());

        ClickEventEntity click = ClickEventEntity.builder()
                .sendRecordId(send.getId())
                .campaignId(send.getCampaignId())
                .subscriberId(send.getSubscriberId())
                .trackingId(send.getTrackingId())
                .linkId(link.getLinkId())
                .linkUrl(link.getOriginalUrl())
                .linkPosition(link.getPosition())
                .variant(link.getVariant())
                .ipAddress(meta.ipAddress())
                .userAgent(meta.userAgent())
                .referer(meta.referer())
                .deviceType(telemetry.device().deviceType())
                .deviceOs(telemetry.device().os())
                .deviceBrand(telemetry.device().brand())
                .deviceModel(telemetry.device().model())
                .browserName(telemetry.device().browserName())
                .browserVersion(telemetry.device().browserVersion())
                .browserEngine(telemetry.device().browserEngine())
                .country(telemetry.geo().country())
                .countryCode(telemetry.geo().countryCode())
                .region(telemetry.geo().region())
                .city(telemetry.geo().city())
                .timezone(telemetry.geo().timezone())
                .latitude(telemetry.geo().latitude())
                .longitude(telemetry.geo().longitude())
                .isp(telemetry.geo().isp())
                .uniqueEvent(unique)
                .mobile(telemetry.device().isMobile())
                .clickedAt(now)
                .timeToClickSeconds(secondsBetween(firstOpen, now))
                .build();
        clickEventRepository.saveAndFlush(click);

        Optional<ConversionType> conversion = conversionClassifier.classify(link.getOriginalUrl());
        if (conversion.isPresent() && !insertConversion(send, click, conversion.get(), now)) {
            conversion = Optional.empty();
        }
        return new ClickOutcome(click, conversion);
    }

    private boolean insertConversion(SendRecordEntity send, ClickEventEntity click, ConversionType type, Instant now) {
        if (conversionEventRepository.existsBySendRecordIdAndConversionType(send.getId(), type)) {
            log.debug("sendId={}, type={}, event=conversion_already_recorded", send.getId(), type);
            return false;
        }
        conversionEventRepository.saveAndFlush(ConversionEventEntity.builder()
                .sendRecordId(send.getId())
                .campaignId(send.getCampaignId())
                .subscriberId(send.getSubscriberId())
                .clickEventId(click.getId())
                .conversionType(type)
                .conversionUrl(click.getLinkUrl())
                .convertedAt(now)
                .build());
        return true;
    }

    private SendRecordEntity lockSend(String trackingId) {
        return sendRecordRepository.findByTrackingIdWithLock(trackingId)
                .orElseThrow(() -> new TrackingResolutionException("Unknown tracking id: " + trackingId));
    }

    private Telemetry resolveTelemetry(RequestMeta meta) {
        DeviceInfo device;
        try {
            device = userAgentParser.parse(meta.userAgent());
        } catch (RuntimeException e) {
            log.warn("event=user_agent_parse_failed, reason={}", e.getMessage());
            device = DeviceInfo.UNKNOWN_DEVICE;
        }
        GeoLocation geo;
        try {
            geo = geoLocationResolver.resolve(meta.ipAddress());
        } catch (RuntimeException e) {
            log.warn("ip={}, event=geo_resolve_failed, reason={}", meta.ipAddress(), e.getMessage());
            geo = GeoLocation.UNKNOWN;
        }
        return new Telemetry(device, geo != null ? geo : GeoLocation.UNKNOWN);
    }

    private void updateCounters(String kind, Long campaignId, Long sendId, Runnable update) {
        try {
            update.run();
        } catch (RuntimeException e) {
            log.error("campaignId={}, sendId={}, kind={}, event=counter_update_failed, reconcile=true",
                    campaignId, sendId, kind, e);
        }
    }

    private static @Nullable Long secondsBetween(@Nullable Instant from, Instant to) {
        if (from == null) {
            return null;
        }
        return Math.max(0L, Duration.between(from, to).getSeconds());
    }

    private record Telemetry(DeviceInfo device, GeoLocation geo) {
    }

    private record ClickOutcome(ClickEventEntity click, Optional<ConversionType> conversion) {
    }
}
