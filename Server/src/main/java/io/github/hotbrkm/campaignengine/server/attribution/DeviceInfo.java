package io.github.hotbrkm.campaignengine.server.attribution;

public record DeviceInfo(String deviceType,
                         String os,
                         String brand,
                         String model,
                         String browserName,
                         String browserVersion,
                         String browserEngine) {

    public static final String UNKNOWN = "unknown";
    public static final String MOBILE = "mobile";
    public static final String TABLET = "tablet";
    public static final String DESKTOP = "desktop";

    public static final DeviceInfo UNKNOWN_DEVICE =
            new DeviceInfo(DESKTOP, UNKNOWN, UNKNOWN, UNKNOWN, UNKNOWN, UNKNOWN, UNKNOWN);

    public boolean isMobile() {
        return MOBILE.equals(deviceType);
    }
}
