package io.github.hotbrkm.campaignengine.server.attribution;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

/**
 * ip-api.com JSON lookup. Private and malformed addresses are not looked up.
 */
@Slf4j
public class IpApiGeoLocationResolver implements GeoLocationResolver {

    private static final String SUCCESS = "success";

    private final RestTemplate restTemplate;
    private final String urlTemplate;

    /**
     * @param urlTemplate lookup URL with an {@code {ip}} variable, e.g. {@code http://ip-api.com/json/{ip}}
     */
    public IpApiGeoLocationResolver(RestTemplate restTemplate, String urlTemplate) {
        this.restTemplate = restTemplate;
        this.urlTemplate = urlTemplate;
    }

    @Override
    public GeoLocation resolve(String ipAddress) {
        if (ipAddress == null || !ClientIpResolver.isPublicAddress(ipAddress)) {
            return GeoLocation.UNKNOWN;
        }
        IpApiResponse response;
        try {
            response = restTemplate.getForObject(urlTemplate, IpApiResponse.class, ipAddress);
        } catch (RestClientException e) {
            log.warn("ip={}, event=geo_lookup_failed, reason={}", ipAddress, e.getMessage());
            return GeoLocation.UNKNOWN;
        }
        if (response == null || !SUCCESS.equals(response.status())) {
            log.debug("ip={}, event=geo_lookup_unresolved", ipAddress);
            return GeoLocation.UNKNOWN;
        }
        return new GeoLocation(
                orUnknown(response.country()),
                orUnknown(response.countryCode()),
                orUnknown(response.regionName()),
                orUnknown(response.city()),
                response.timezone() != null ? response.timezone() : GeoLocation.DEFAULT_TIMEZONE,
                response.lat(),
                response.lon(),
                orUnknown(response.isp()));
    }

    private static String orUnknown(String value) {
        return value != null && !value.isBlank() ? value : GeoLocation.UNKNOWN_VALUE;
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record IpApiResponse(String status,
                         String country,
                         String countryCode,
                         String regionName,
                         String city,
                         String timezone,
                         Double lat,
                         Double lon,
                         String isp) {
    }
}
