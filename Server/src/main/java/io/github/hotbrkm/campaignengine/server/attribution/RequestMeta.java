package io.github.hotbrkm.campaignengine.server.attribution;

import org.jspecify.annotations.Nullable;

/**
 * What a tracking hit tells us about its client.
 */
public record RequestMeta(String ipAddress, @Nullable String userAgent, @Nullable String referer) {
}
