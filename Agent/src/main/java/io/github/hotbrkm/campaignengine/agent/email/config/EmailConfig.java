package io.github.hotbrkm.campaignengine.agent.email.config;

import lombok.Data;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

@Data
@ConfigurationProperties(prefix = "email")
@Component
public class EmailConfig {

    private Smtp smtp = new Smtp();
    private Dkim dkim = new Dkim();
    private Send send = new Send();
    private Tracking tracking = new Tracking();
    private List<Server> servers = new ArrayList<>();

    @Data
    public static class Smtp {
        private String from;
        private String fromName;
        /**
         * Bounce address. Falls back to {@link #from} when empty.
         */
        private String returnPath;

        public String resolveReturnPath() {
            return returnPath != null && !returnPath.isBlank() ? returnPath : from;
        }
    }

    @Data
    public static class Dkim {
        public static final String DEFAULT_CANONICALIZATION = "relaxed/simple";

        private boolean enabled;

        private String domain;
        private String selector;

        /**
         * PKCS#8 PEM file. Ignored when {@link #privateKey} is set.
         */
        private String keyPath;
        private String privateKey;

        private String canonicalization = DEFAULT_CANONICALIZATION;

        public String resolveCanonicalization() {
            return canonicalization != null && !canonicalization.isBlank() ? canonicalization : DEFAULT_CANONICALIZATION;
        }
    }

    @Data
    public static class Send {
        public static final int DEFAULT_MAX_ATTEMPTS = 3;
        public static final long DEFAULT_RETRY_BASE_DELAY_MS = 1_000L;
        public static final long DEFAULT_MAX_RETRY_DELAY_MS = 60_000L;
        public static final double DEFAULT_RETRY_BACKOFF_MULTIPLIER = 2.0d;
        public static final int DEFAULT_BATCH_SIZE = 100;
        public static final int DEFAULT_TIMEOUT_MS = 30_000;

        private int maxAttempts = DEFAULT_MAX_ATTEMPTS;
        private long retryBaseDelayMs = DEFAULT_RETRY_BASE_DELAY_MS;
        private long maxRetryDelayMs = DEFAULT_MAX_RETRY_DELAY_MS;
        private double retryBackoffMultiplier = DEFAULT_RETRY_BACKOFF_MULTIPLIER;

        private int connectTimeoutMs = DEFAULT_TIMEOUT_MS;
        private int sendTimeoutMs = DEFAULT_TIMEOUT_MS;

        private int batchSize = DEFAULT_BATCH_SIZE;
        private long batchDelayPerRecipientMs = 500L;

        // Inter-send delay: base + per-domain + random jitter in [0, maxJitterMs]
        private long baseDelayMs = 1_000L;
        private long defaultDomainDelayMs = 1_000L;
        private long maxJitterMs = 2_000L;
        private Map<String, Long> domainDelayMs = new HashMap<>(Map.of(
                "gmail.com", 2_000L,
                "yahoo.com", 3_000L,
                "outlook.com", 2_000L,
                "hotmail.com", 3_000L));

        public int resolveMaxAttempts() {
            return maxAttempts > 0 ? maxAttempts : DEFAULT_MAX_ATTEMPTS;
        }

        public long resolveRetryBaseDelayMs() {
            return retryBaseDelayMs >= 0 ? retryBaseDelayMs : DEFAULT_RETRY_BASE_DELAY_MS;
        }

        public long resolveMaxRetryDelayMs() {
            return maxRetryDelayMs >= 0 ? maxRetryDelayMs : DEFAULT_MAX_RETRY_DELAY_MS;
        }

        public double resolveRetryBackoffMultiplier() {
            return retryBackoffMultiplier > 0 ? retryBackoffMultiplier : DEFAULT_RETRY_BACKOFF_MULTIPLIER;
        }

        public int resolveBatchSize() {
            return batchSize > 0 ? batchSize : DEFAULT_BATCH_SIZE;
        }

        public int resolveConnectTimeoutMs() {
            return connectTimeoutMs > 0 ? connectTimeoutMs : DEFAULT_TIMEOUT_MS;
        }

        public int resolveSendTimeoutMs() {
            return sendTimeoutMs > 0 ? sendTimeoutMs : DEFAULT_TIMEOUT_MS;
        }
    }

    @Data
    public static class Tracking {
        public static final int DEFAULT_LINK_TTL_DAYS = 90;

        /**
         * Public base URL of the tracking endpoints, without trailing slash.
         */
        private String baseUrl = "http://localhost:8080";
        private String unsubscribeBaseUrl;
        private String unsubscribeSecret;
        private int linkTtlDays = DEFAULT_LINK_TTL_DAYS;

        /**
         * Original URL to A/B variant URLs.
         */
        private Map<String, List<String>> linkVariations = new HashMap<>();

        public String resolveUnsubscribeBaseUrl() {
            String base = unsubscribeBaseUrl != null && !unsubscribeBaseUrl.isBlank() ? unsubscribeBaseUrl : baseUrl;
            return stripTrailingSlash(base);
        }

        public String resolveBaseUrl() {
            return stripTrailingSlash(baseUrl);
        }

        public int resolveLinkTtlDays() {
            return linkTtlDays > 0 ? linkTtlDays : DEFAULT_LINK_TTL_DAYS;
        }

        private static String stripTrailingSlash(String url) {
            if (url == null) {
                return "";
            }
            return url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
        }
    }

    @Data
    public static class Server {
        private String name;
        private String host;
        private int port = 587;
        private String username;
        private String password;
        private String security = "STARTTLS";
        private int priority;
        private boolean enabled = true;
    }

}
