package io.github.hotbrkm.campaignengine.server.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

@Data
@ConfigurationProperties(prefix = "tracking")
@Component
public class TrackingProperties {

    public static final String DEFAULT_FALLBACK_URL = "/";

    /**
     * Redirect target when a click cannot be resolved.
     */
    private String fallbackUrl = DEFAULT_FALLBACK_URL;
    private Geo geo = new Geo();

    public String resolveFallbackUrl() {
        return fallbackUrl != null && !fallbackUrl.isBlank() ? fallbackUrl : DEFAULT_FALLBACK_URL;
    }

    @Data
    public static class Geo {
        public static final String DEFAULT_URL = "http://ip-api.com/json/{ip}";
        public static final int DEFAULT_CONNECT_TIMEOUT_MS = 1_000;
        public static final int DEFAULT_READ_TIMEOUT_MS = 2_000;

        private boolean enabled = true;
        private String url = DEFAULT_URL;
        private int connectTimeoutMs = DEFAULT_CONNECT_TIMEOUT_MS;
        private int readTimeoutMs = DEFAULT_READ_TIMEOUT_MS;

        public String resolveUrl() {
            return url != null && !url.isBlank() ? url : DEFAULT_URL;
        }

        public int resolveConnectTimeoutMs() {
            return connectTimeoutMs > 0 ? connectTimeoutMs : DEFAULT_CONNECT_TIMEOUT_MS;
        }

        public int resolveReadTimeoutMs() {
            return readTimeoutMs > 0 ? readTimeoutMs : DEFAULT_READ_TIMEOUT_MS;
        }
    }
}
