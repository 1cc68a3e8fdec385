package io.github.hotbrkm.campaignengine.server.attribution;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.RestTemplate;

import static org.assertj.core.api.Assertions.assertThat;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withStatus;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

@DisplayName("IpApiGeoLocationResolver test")
class IpApiGeoLocationResolverTest {

    private static final String URL = "http://geo.test/json/{ip}";

    private MockRestServiceServer server;
    private IpApiGeoLocationResolver resolver;

    @BeforeEach
    void setUp() {
        RestTemplate restTemplate = new RestTemplate();
        server = MockRestServiceServer.bindTo(restTemplate).build();
        resolver = new IpApiGeoLocationResolver(restTemplate, URL);
    }

    @Test
    @DisplayName("Successful lookup maps every field")
    void resolve_success() {
        server.expect(requestTo("http://geo.test/json/8.8.8.8"))
                .andRespond(withSuccess("""
                        {"status":"success","country":"United States","countryCode":"US",
                         "region":"CA","regionName":"California","city":"Mountain View",
                         "timezone":"America/Los_Angeles","lat":37.4056,"lon":-122.0775,
                         "isp":"Google LLC","query":"8.8.8.8"}
                        """, MediaType.APPLICATION_JSON));

        GeoLocation location = resolver.resolve("8.8.8.8");

        assertThat(location.country()).isEqualTo("United States");
        assertThat(location.countryCode()).isEqualTo("US");
        assertThat(location.region()).isEqualTo("California");
        assertThat(location.city()).isEqualTo("Mountain View");
        assertThat(location.timezone()).isEqualTo("America/Los_Angeles");
        assertThat(location.latitude()).isEqualTo(37.4056);
        assertThat(location.longitude()).isEqualTo(-122.0775);
        assertThat(location.isp()).isEqualTo("Google LLC");
        server.verify();
    }

    @Test
    @DisplayName("Failed status, missing fields and HTTP errors degrade to unknown")
    void resolve_failuresAreUnknown() {
        server.expect(requestTo("http://geo.test/json/1.1.1.1"))
                .andRespond(withSuccess("{\"status\":\"fail\",\"message\":\"reserved range\"}",
                        MediaType.APPLICATION_JSON));
        server.expect(requestTo("http://geo.test/json/9.9.9.9"))
                .andRespond(withStatus(HttpStatus.TOO_MANY_REQUESTS));

        assertThat(resolver.resolve("1.1.1.1")).isEqualTo(GeoLocation.UNKNOWN);
        assertThat(resolver.resolve("9.9.9.9")).isEqualTo(GeoLocation.UNKNOWN);
        server.verify();
    }

    @Test
    @DisplayName("Partial answer keeps resolved fields and defaults the rest")
    void resolve_partial() {
        server.expect(requestTo("http://geo.test/json/8.8.4.4"))
                .andRespond(withSuccess("{\"status\":\"success\",\"country\":\"Germany\",\"countryCode\":\"DE\"}",
                        MediaType.APPLICATION_JSON));

        GeoLocation location = resolver.resolve("8.8.4.4");

        assertThat(location.country()).isEqualTo("Germany");
        assertThat(location.city()).isEqualTo(GeoLocation.UNKNOWN_VALUE);
        assertThat(location.timezone()).isEqualTo(GeoLocation.DEFAULT_TIMEZONE);
        assertThat(location.latitude()).isNull();
    }

    @Test
    @DisplayName("Private addresses are not looked up")
    void resolve_privateAddressSkipsLookup() {
        assertThat(resolver.resolve("192.168.0.10")).isEqualTo(GeoLocation.UNKNOWN);
        assertThat(resolver.resolve(null)).isEqualTo(GeoLocation.UNKNOWN);
        server.verify();
    }
}
