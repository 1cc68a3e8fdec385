package io.github.hotbrkm.campaignengine.agent.email.tracking;

import java.util.List;
import java.util.Optional;

/**
 * Durable storage for link mappings.
 */
public interface LinkMappingStore {

    void saveAll(List<LinkMapping> mappings);

    Optional<LinkMapping> findByLinkId(String linkId);
}
