package io.github.hotbrkm.campaignengine.server.persistence.repository;

import io.github.hotbrkm.campaignengine.server.persistence.entity.LinkMappingEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

@Repository
public interface LinkMappingRepository extends JpaRepository<LinkMappingEntity, Long> {

    Optional<LinkMappingEntity> findByLinkId(String linkId);

    List<LinkMappingEntity> findByTrackingIdOrderByPositionAsc(String trackingId);
}
