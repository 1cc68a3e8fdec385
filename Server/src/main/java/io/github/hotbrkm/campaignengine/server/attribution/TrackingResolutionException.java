package io.github.hotbrkm.campaignengine.server.attribution;

/**
 * A tracking token or link id that does not resolve to a live send.
 */
public class TrackingResolutionException extends RuntimeException {
    public TrackingResolutionException(String message) {
        super(message);
    }
}
