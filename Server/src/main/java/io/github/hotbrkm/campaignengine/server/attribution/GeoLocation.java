package io.github.hotbrkm.campaignengine.server.attribution;

/**
 * Location of a client IP. Unresolved text fields are {@code "unknown"}; coordinates are then null.
 */
public record GeoLocation(String country,
                          String countryCode,
                          String region,
                          String city,
                          String timezone,
                          Double latitude,
                          Double longitude,
                          String isp) {

    public static final String UNKNOWN_VALUE = "unknown";
    public static final String DEFAULT_TIMEZONE = "UTC";

    public static final GeoLocation UNKNOWN = new GeoLocation(UNKNOWN_VALUE, UNKNOWN_VALUE, UNKNOWN_VALUE,
            UNKNOWN_VALUE, DEFAULT_TIMEZONE, null, null, UNKNOWN_VALUE);
}
