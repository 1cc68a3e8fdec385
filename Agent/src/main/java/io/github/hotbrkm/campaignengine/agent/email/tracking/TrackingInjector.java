package io.github.hotbrkm.campaignengine.agent.email.tracking;

import io.github.hotbrkm.campaignengine.agent.email.config.EmailConfig;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Adds the open-tracking pixel and swaps hrefs for click-tracking redirects.
 * <p>
 * Only href values change; every other byte of the markup, quoting included, is kept, so an unquoted href
 * stays unquoted. Links that must keep working without the redirect (mail, phone, in-page anchors, script
 * and data URIs, file transfer and any unsubscribe link) are left alone.
 */
@Slf4j
public class TrackingInjector {

    // href, not data-href; double-quoted, single-quoted or bare value
    private static final Pattern HREF = Pattern.compile(
            "((?<![\\w-])href\\s*=\\s*)(?:\"([^\"]*)\"|'([^']*)'|([^\\s\"'>]+))", Pattern.CASE_INSENSITIVE);
    private static final Pattern BODY_CLOSE = Pattern.compile("</body\\s*>", Pattern.CASE_INSENSITIVE);
    private static final List<String> UNTRACKED_PREFIXES = List.of(
            "mailto:", "tel:", "sms:", "#", "javascript:", "data:", "ftp:", "file:");
    private static final String PIXEL_TEMPLATE =
            "<img src=\"%s\" width=\"1\" height=\"1\" style=\"display:none;border:0;outline:none;\" alt=\"\" />";

    private final String baseUrl;
    private final Duration linkTtl;
    private final TrackingTokenGenerator tokenGenerator;
    private final LinkVariationRegistry variationRegistry;
    private final LinkMappingStore linkMappingStore;
    private final Clock clock;

    public TrackingInjector(EmailConfig.Tracking tracking, TrackingTokenGenerator tokenGenerator,
                            LinkVariationRegistry variationRegistry, LinkMappingStore linkMappingStore, Clock clock) {
        this.baseUrl = tracking.resolveBaseUrl();
        this.linkTtl = Duration.ofDays(tracking.resolveLinkTtlDays());
        this.tokenGenerator = Objects.requireNonNull(tokenGenerator, "tokenGenerator must not be null");
        this.variationRegistry = Objects.requireNonNull(variationRegistry, "variationRegistry must not be null");
        this.linkMappingStore = Objects.requireNonNull(linkMappingStore, "linkMappingStore must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }

    /**
     * Rewrites the html for one send and persists a mapping per rewritten link.
     */
    public TrackedHtml inject(String html, String trackingId, long campaignId) {
        if (html == null || html.isEmpty()) {
            return new TrackedHtml(html, List.of());
        }
        Instant now = clock.instant();
        Instant expiresAt = now.plus(linkTtl);
        List<LinkMapping> mappings = new ArrayList<>();

        Matcher matcher = HREF.matcher(html);
        StringBuilder sb = new StringBuilder(html.length() + 256);
        while (matcher.find()) {
            String quote = quoteOf(matcher);
            String href = matcher.group(2) != null ? matcher.group(2)
                    : matcher.group(3) != null ? matcher.group(3) : matcher.group(4);
            if (!isTrackable(href)) {
                matcher.appendReplacement(sb, Matcher.quoteReplacement(matcher.group()));
                continue;
            }

            String destination = unescapeAmpersands(href.trim());
            String variant = null;
            Optional<LinkVariationRegistry.Variant> chosen = variationRegistry.variantFor(destination, trackingId);
            if (chosen.isPresent()) {
                destination = chosen.get().url();
                variant = chosen.get().tag();
            }

            String linkId = tokenGenerator.newLinkId();
            mappings.add(new LinkMapping(linkId, destination, trackingId, campaignId, mappings.size() + 1, variant,
                    now, expiresAt));

            String rewritten = matcher.group(1) + quote + clickUrl(linkId) + quote;
            matcher.appendReplacement(sb, Matcher.quoteReplacement(rewritten));
        }
        matcher.appendTail(sb);

        if (!mappings.isEmpty()) {
            linkMappingStore.saveAll(mappings);
        }
        String tracked = appendPixel(sb.toString(), trackingId);
        log.debug("trackingId={}, links={}, event=tracking_injected", abbreviate(trackingId), mappings.size());
        return new TrackedHtml(tracked, List.copyOf(mappings));
    }

    public String pixelUrl(String trackingId) {
        return baseUrl + "/track/pixel/" + trackingId;
    }

    public String clickUrl(String linkId) {
        return baseUrl + "/track/click/" + linkId;
    }

    static boolean isTrackable(String href) {
        if (href == null) {
            return false;
        }
        String value = href.trim().toLowerCase(Locale.ROOT);
        if (value.isEmpty() || value.contains("unsubscribe")) {
            return false;
        }
        for (String prefix : UNTRACKED_PREFIXES) {
            if (value.startsWith(prefix)) {
                return false;
            }
        }
        return true;
    }

    private String appendPixel(String html, String trackingId) {
        String pixel = String.format(PIXEL_TEMPLATE, pixelUrl(trackingId));
        Matcher matcher = BODY_CLOSE.matcher(html);
        int insertAt = -1;
        while (matcher.find()) {
            insertAt = matcher.start();
        }
        if (insertAt < 0) {
            return html + pixel;
        }
        return html.substring(0, insertAt) + pixel + html.substring(insertAt);
    }

    private static String quoteOf(Matcher matcher) {
        if (matcher.group(2) != null) {
            return "\"";
        }
        return matcher.group(3) != null ? "'" : "";
    }

    private static String unescapeAmpersands(String url) {
        return url.replace("&amp;", "&");
    }

    private static String abbreviate(String token) {
        return token.length() <= 8 ? token : token.substring(0, 8);
    }
}
