package io.github.hotbrkm.campaignengine.server.persistence.repository;

import io.github.hotbrkm.campaignengine.server.persistence.entity.ConversionEventEntity;
import io.github.hotbrkm.campaignengine.server.persistence.entity.ConversionType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface ConversionEventRepository extends JpaRepository<ConversionEventEntity, Long> {

    boolean existsBySendRecordIdAndConversionType(Long sendRecordId, ConversionType conversionType);

    List<ConversionEventEntity> findBySendRecordId(Long sendRecordId);

    long countByCampaignId(Long campaignId);
}
