package io.github.hotbrkm.campaignengine.server.persistence;

import io.github.hotbrkm.campaignengine.agent.email.send.result.ResultPersistenceException;
import io.github.hotbrkm.campaignengine.agent.email.tracking.LinkMapping;
import io.github.hotbrkm.campaignengine.agent.email.tracking.LinkMappingStore;
import io.github.hotbrkm.campaignengine.server.persistence.entity.LinkMappingEntity;
import io.github.hotbrkm.campaignengine.server.persistence.repository.LinkMappingRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.Optional;

@Component
@RequiredArgsConstructor
public class JpaLinkMappingStore implements LinkMappingStore {

    private final LinkMappingRepository linkMappingRepository;

    @Override
    @Transactional
    public void saveAll(List<LinkMapping> mappings) {
        if (mappings.isEmpty()) {
            return;
        }
        try {
            linkMappingRepository.saveAllAndFlush(mappings.stream().map(JpaLinkMappingStore::toEntity).toList());
        } catch (DataAccessException e) {
            throw new ResultPersistenceException("Failed to save link mappings: trackingId="
                    + mappings.get(0).trackingId(), e);
        }
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<LinkMapping> findByLinkId(String linkId) {
        return linkMappingRepository.findByLinkId(linkId).map(JpaLinkMappingStore::toMapping);
    }

    private static LinkMappingEntity toEntity(LinkMapping mapping) {
        return LinkMappingEntity.builder()
                .linkId(mapping.linkId())
                .originalUrl(mapping.originalUrl())
                .trackingId(mapping.trackingId())
                .campaignId(mapping.campaignId())
                .position(mapping.position())
                .variant(mapping.variant())
                .createdAt(mapping.createdAt())
                .expiresAt(mapping.expiresAt())
                .build();
    }

    static LinkMapping toMapping(LinkMappingEntity entity) {
        return new LinkMapping(entity.getLinkId(), entity.getOriginalUrl(), entity.getTrackingId(),
                entity.getCampaignId(), entity.getPosition(), entity.getVariant(), entity.getCreatedAt(),
                entity.getExpiresAt());
    }
}
