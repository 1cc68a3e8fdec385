package io.github.hotbrkm.campaignengine.agent.email.tracking;

import java.security.SecureRandom;
import java.util.HexFormat;

/**
 * Issues opaque identifiers for sends and links: 256 random bits, hex encoded.
 */
public class TrackingTokenGenerator {

    private static final int TOKEN_BYTES = 32;

    private final SecureRandom random = new SecureRandom();

    public String newTrackingId() {
        return nextToken();
    }

    public String newLinkId() {
        return nextToken();
    }

    private String nextToken() {
        byte[] bytes = new byte[TOKEN_BYTES];
        random.nextBytes(bytes);
        return HexFormat.of().formatHex(bytes);
    }
}
