package io.github.hotbrkm.campaignengine.agent.email.tracking;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("LinkVariationRegistry test")
class LinkVariationRegistryTest {

    private static final String ORIGINAL = "https://shop.example.com/";

    @Test
    @DisplayName("Unconfigured URLs have no variant")
    void variantFor_unknownUrl() {
        assertThat(LinkVariationRegistry.empty().variantFor(ORIGINAL, "t1")).isEmpty();
        assertThat(new LinkVariationRegistry(Map.of(ORIGINAL, List.of())).variantFor(ORIGINAL, "t1")).isEmpty();
    }

    @Test
    @DisplayName("Tracking ids spread over the original and every alternative")
    void variantFor_spreadsAcrossCandidates() {
        LinkVariationRegistry registry = new LinkVariationRegistry(Map.of(ORIGINAL, List.of(ORIGINAL + "b")));
        TrackingTokenGenerator tokens = new TrackingTokenGenerator();
        Set<String> tags = new HashSet<>();

        for (int i = 0; i < 100; i++) {
            LinkVariationRegistry.Variant variant = registry.variantFor(ORIGINAL, tokens.newTrackingId()).orElseThrow();
            tags.add(variant.tag());
            assertThat(variant.url()).isEqualTo(variant.tag().equals("A") ? ORIGINAL : ORIGINAL + "b");
        }

        assertThat(tags).containsExactlyInAnyOrder("A", "B");
    }

    @Test
    @DisplayName("Mapping expiry is inclusive of the expiry instant")
    void linkMapping_isExpired() {
        Instant expiresAt = Instant.parse("2026-06-01T00:00:00Z");
        LinkMapping mapping = new LinkMapping("l", ORIGINAL, "t", 1L, 1, null, expiresAt.minusSeconds(60), expiresAt);

        assertThat(mapping.isExpired(expiresAt.minusSeconds(1))).isFalse();
        assertThat(mapping.isExpired(expiresAt)).isTrue();
    }
}
