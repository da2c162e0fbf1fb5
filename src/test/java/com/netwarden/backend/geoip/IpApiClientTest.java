package com.netwarden.backend.geoip;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.github.tomakehurst.wiremock.WireMockServer;
import com.netwarden.backend.config.RestClientConfig;
import com.netwarden.backend.geoip.config.GeoIpProperties;
import com.netwarden.backend.geoip.provider.GeoIpHttpException;
import com.netwarden.backend.geoip.provider.GeoIpParseException;
import com.netwarden.backend.geoip.provider.IpApiClient;
import com.netwarden.backend.geoip.provider.IpApiResult;
import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.web.client.RestClient;

import java.time.Duration;
import java.util.Optional;

import static com.github.tomakehurst.wiremock.client.WireMock.*;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class IpApiClientTest {

    static WireMockServer wm;

    IpApiClient client;

    @BeforeAll
    static void startWireMock() {
        wm = new WireMockServer(0);
        wm.start();
    }

    @AfterAll
    static void stopWireMock() {
        if (wm != null) wm.stop();
    }

    @BeforeEach
    void setUp() {
        wm.resetAll();
        RestClient http = new RestClientConfig().geoIpRestClient(
                "http://localhost:" + wm.port(), Duration.ofSeconds(2), Duration.ofSeconds(5), "NetWarden-Test");
        client = new IpApiClient(http, new ObjectMapper(), new GeoIpProperties());
    }

    @Test
    void success_maps_fields_and_parses_asn() {
        wm.stubFor(get(urlPathEqualTo("/json/8.8.8.8"))
                .withQueryParam("fields", matching(".*countryCode.*"))
                .willReturn(okJson("""
                        {"status":"success","country":"United States","countryCode":"us",
                         "regionName":"California","city":"Mountain View","lat":37.4,"lon":-122.1,
                         "timezone":"America/Los_Angeles","isp":"Google LLC","org":"Google Public DNS",
                         "as":"AS15169 Google LLC","asname":"GOOGLE","mobile":false,"proxy":false,"hosting":true}
                        """)));

        IpApiResult r = client.lookup("8.8.8.8").orElseThrow();

        assertThat(r.countryCode()).isEqualTo("US");
        assertThat(r.city()).isEqualTo("Mountain View");
        assertThat(r.asn()).isEqualTo(15169L);
        assertThat(r.asnOrg()).isEqualTo("GOOGLE");
        assertThat(r.hosting()).isTrue();
        assertThat(r.lat()).isEqualTo(37.4);
    }

    @Test
    void fail_status_is_empty_not_error() {
        wm.stubFor(get(urlPathEqualTo("/json/203.0.113.1"))
                .willReturn(okJson("{\"status\":\"fail\",\"message\":\"reserved range\"}")));

        Optional<IpApiResult> r = client.lookup("203.0.113.1");

        assertThat(r).isEmpty();
    }

    @Test
    void http_429_surfaces_status_and_body() {
        wm.stubFor(get(urlPathEqualTo("/json/1.1.1.1"))
                .willReturn(aResponse().withStatus(429).withBody("slow down")));

        assertThatThrownBy(() -> client.lookup("1.1.1.1"))
                .isInstanceOf(GeoIpHttpException.class)
                .satisfies(ex -> {
                    GeoIpHttpException e = (GeoIpHttpException) ex;
                    assertThat(e.getStatus()).isEqualTo(429);
                    assertThat(e.getMessage()).isEqualTo("GEOIP_HTTP_429");
                    assertThat(e.getBodySnippet()).contains("slow down");
                });
    }

    @Test
    void broken_body_is_parse_error() {
        wm.stubFor(get(urlPathEqualTo("/json/1.0.0.1"))
                .willReturn(aResponse().withStatus(200).withHeader("Content-Type", "application/json")
                        .withBody("{not json")));

        assertThatThrownBy(() -> client.lookup("1.0.0.1"))
                .isInstanceOf(GeoIpParseException.class)
                .satisfies(ex -> assertThat(((GeoIpParseException) ex).getCode()).isEqualTo("GEOIP_JSON_PARSE_FAILED"));
    }

    @Test
    void array_body_is_unexpected_json() {
        wm.stubFor(get(urlPathEqualTo("/json/9.9.9.9")).willReturn(okJson("[1,2,3]")));

        assertThatThrownBy(() -> client.lookup("9.9.9.9"))
                .isInstanceOf(GeoIpParseException.class)
                .satisfies(ex -> assertThat(((GeoIpParseException) ex).getCode()).isEqualTo("GEOIP_UNEXPECTED_JSON"));
    }
}
