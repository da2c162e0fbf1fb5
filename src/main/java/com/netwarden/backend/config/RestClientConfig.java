package com.netwarden.backend.config;

import com.netwarden.backend.report.notify.TelegramProperties;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpHeaders;
import org.springframework.http.client.JdkClientHttpRequestFactory;
import org.springframework.web.client.RestClient;

import java.net.http.HttpClient;
import java.time.Duration;

@Configuration
public class RestClientConfig {

    /** ip-api.com 相容的 GeoIP 遠端 provider（免費版只有 http） */
    @Bean("geoIpRestClient")
    public RestClient geoIpRestClient(
            @Value("${app.geoip.remote.base-url:http://ip-api.com}") String baseUrl,
            @Value("${app.geoip.remote.connect-timeout:PT3S}") Duration connectTimeout,
            @Value("${app.geoip.remote.read-timeout:PT10S}") Duration readTimeout,
            @Value("${app.geoip.remote.user-agent:NetWarden/1.0}") String userAgent
    ) {
        return build(baseUrl, connectTimeout, readTimeout, userAgent);
    }

    @Bean("telegramRestClient")
    public RestClient telegramRestClient(TelegramProperties props) {
        return build(props.getBaseUrl(), props.getConnectTimeout(), props.getReadTimeout(), "NetWarden/1.0");
    }

    private static RestClient build(String baseUrl, Duration connectTimeout, Duration readTimeout, String userAgent) {
        // ✅ 固定 HTTP/1.1：部分 provider / proxy 對 h2c upgrade 支援不穩
        HttpClient hc = HttpClient.newBuilder()
                .version(HttpClient.Version.HTTP_1_1)
                .connectTimeout(connectTimeout)
                .build();

        JdkClientHttpRequestFactory rf = new JdkClientHttpRequestFactory(hc);
        rf.setReadTimeout(readTimeout);

        return RestClient.builder()
                .baseUrl(baseUrl)
                .requestFactory(rf)
                .defaultHeader(HttpHeaders.USER_AGENT, userAgent)
                .build();
    }
}
