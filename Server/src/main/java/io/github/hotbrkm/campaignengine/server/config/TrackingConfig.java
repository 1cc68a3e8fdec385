package io.github.hotbrkm.campaignengine.server.config;

import io.github.hotbrkm.campaignengine.server.attribution.GeoLocationResolver;
import io.github.hotbrkm.campaignengine.server.attribution.IpApiGeoLocationResolver;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.client.RestTemplate;

import java.time.Duration;

@Slf4j
@Configuration
public class TrackingConfig {

    @Bean
    public RestTemplate geoRestTemplate(RestTemplateBuilder builder, TrackingProperties trackingProperties) {
        TrackingProperties.Geo geo = trackingProperties.getGeo();
        return builder
                .setConnectTimeout(Duration.ofMillis(geo.resolveConnectTimeoutMs()))
                .setReadTimeout(Duration.ofMillis(geo.resolveReadTimeoutMs()))
                .build();
    }

    @Bean
    public GeoLocationResolver geoLocationResolver(TrackingProperties trackingProperties, RestTemplate geoRestTemplate) {
        TrackingProperties.Geo geo = trackingProperties.getGeo();
        if (!geo.isEnabled()) {
            log.info("event=geo_lookup_disabled");
            return GeoLocationResolver.unknown();
        }
        return new IpApiGeoLocationResolver(geoRestTemplate, geo.resolveUrl());
    }
}
