package io.github.hotbrkm.campaignengine.server.web;

import io.github.hotbrkm.campaignengine.server.attribution.AttributionIngestor;
import io.github.hotbrkm.campaignengine.server.attribution.ClientIpResolver;
import io.github.hotbrkm.campaignengine.server.attribution.RequestMeta;
import io.github.hotbrkm.campaignengine.server.attribution.TrackingResolutionException;
import io.github.hotbrkm.campaignengine.server.config.TrackingProperties;
import jakarta.servlet.http.HttpServletRequest;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Base64;

/**
 * Pixel and redirect endpoints. Attribution failures never reach the client: the pixel is always served and
 * clicks always redirect somewhere.
 */
@Slf4j
@RestController
@RequestMapping("/track")
@RequiredArgsConstructor
public class TrackingController {

    static final byte[] PIXEL_GIF = Base64.getDecoder()
            .decode("R0lGODlhAQABAIAAAAAAAP///yH5BAEAAAAALAAAAAABAAEAAAIBRAA7");

    private final AttributionIngestor attributionIngestor;
    private final ClientIpResolver clientIpResolver;
    private final TrackingProperties trackingProperties;

    @GetMapping("/pixel/{token}")
    public ResponseEntity<byte[]> pixel(@PathVariable("token") String token, HttpServletRequest request) {
        try {
            attributionIngestor.handleOpen(token, requestMeta(request));
        } catch (TrackingResolutionException e) {
            log.info("event=open_unresolved, reason={}", e.getMessage());
        } catch (RuntimeException e) {
            log.error("event=open_ingest_failed", e);
        }
        return ResponseEntity.ok()
                .contentType(MediaType.IMAGE_GIF)
                .contentLength(PIXEL_GIF.length)
                .header(HttpHeaders.CACHE_CONTROL, "no-cache, no-store, must-revalidate")
                .header(HttpHeaders.PRAGMA, "no-cache")
                .header(HttpHeaders.EXPIRES, "0")
                .body(PIXEL_GIF);
    }

    @GetMapping("/click/{linkId}")
    public ResponseEntity<Void> click(@PathVariable("linkId") String linkId, HttpServletRequest request) {
        String target;
        try {
            target = attributionIngestor.handleClick(linkId, requestMeta(request));
        } catch (TrackingResolutionException e) {
            log.info("event=click_unresolved, reason={}", e.getMessage());
            target = trackingProperties.resolveFallbackUrl();
        } catch (RuntimeException e) {
            log.error("linkId={}, event=click_ingest_failed", linkId, e);
            target = trackingProperties.resolveFallbackUrl();
        }
        return ResponseEntity.status(HttpStatus.FOUND)
                .header(HttpHeaders.LOCATION, target)
                .header(HttpHeaders.CACHE_CONTROL, "no-cache, no-store, must-revalidate")
                .build();
    }

    private RequestMeta requestMeta(HttpServletRequest request) {
        return new RequestMeta(clientIpResolver.resolve(request), request.getHeader(HttpHeaders.USER_AGENT),
                request.getHeader(HttpHeaders.REFERER));
    }
}
