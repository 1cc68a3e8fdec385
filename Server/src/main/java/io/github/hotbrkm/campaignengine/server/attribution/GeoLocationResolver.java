package io.github.hotbrkm.campaignengine.server.attribution;

/**
 * Resolves a client IP to a location. Implementations never throw; they answer {@link GeoLocation#UNKNOWN}.
 */
@FunctionalInterface
public interface GeoLocationResolver {

    GeoLocation resolve(String ipAddress);

    static GeoLocationResolver unknown() {
        return ipAddress -> GeoLocation.UNKNOWN;
    }
}
