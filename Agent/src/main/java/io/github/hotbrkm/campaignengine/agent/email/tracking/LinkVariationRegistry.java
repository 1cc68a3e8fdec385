package io.github.hotbrkm.campaignengine.agent.email.tracking;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HexFormat;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * A/B destinations for links. The original URL is variant A, configured alternatives follow as B, C and so on.
 * <p>
 * The variant is derived from the tracking id, so a recipient always lands on the same variant.
 */
public class LinkVariationRegistry {

    private final Map<String, List<String>> candidatesByUrl = new HashMap<>();

    public LinkVariationRegistry(Map<String, List<String>> variations) {
        if (variations == null) {
            return;
        }
        variations.forEach((originalUrl, alternatives) -> {
            if (alternatives == null || alternatives.isEmpty()) {
                return;
            }
            List<String> candidates = new ArrayList<>(alternatives.size() + 1);
            candidates.add(originalUrl);
            candidates.addAll(alternatives);
            candidatesByUrl.put(originalUrl, List.copyOf(candidates));
        });
    }

    public static LinkVariationRegistry empty() {
        return new LinkVariationRegistry(Map.of());
    }

    public Optional<Variant> variantFor(String originalUrl, String trackingId) {
        List<String> candidates = candidatesByUrl.get(originalUrl);
        if (candidates == null) {
            return Optional.empty();
        }
        int index = (int) (bucketOf(trackingId) % candidates.size());
        return Optional.of(new Variant(candidates.get(index), String.valueOf((char) ('A' + index))));
    }

    private static long bucketOf(String trackingId) {
        try {
            byte[] digest = MessageDigest.getInstance("SHA-256").digest(trackingId.getBytes(StandardCharsets.UTF_8));
            return Long.parseLong(HexFormat.of().formatHex(digest, 0, 4), 16);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 unavailable", e);
        }
    }

    public record Variant(String url, String tag) {
    }
}
