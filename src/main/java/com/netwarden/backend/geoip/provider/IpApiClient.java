package com.netwarden.backend.geoip.provider;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.netwarden.backend.geoip.config.GeoIpProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.client.ClientHttpResponse;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClient;

import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.Locale;
import java.util.Optional;

/**
 * ip-api.com 相容 JSON provider：GET /json/{ip}?fields=...
 * - 4xx/5xx → GeoIpHttpException
 * - 2xx 但 body 壞 → GeoIpParseException
 * - status != success（reserved range / invalid query）→ empty
 * 速率限制不在這裡做，由呼叫端先過 RemoteLookupGate。
 */
@Slf4j
@Component
public class IpApiClient {

    private static final int MAX_ERROR_SNIPPET_BYTES = 1024;

    private final RestClient http;
    private final ObjectMapper om;
    private final GeoIpProperties props;

    public IpApiClient(
            @Qualifier("geoIpRestClient") RestClient http,
            ObjectMapper om,
            GeoIpProperties props
    ) {
        this.http = http;
        this.om = om;
        this.props = props;
    }

    public Optional<IpApiResult> lookup(String ip) {
        String body = http.get()
                .uri(uriBuilder -> uriBuilder
                        .path("/json/{ip}")
                        .queryParam("fields", props.getRemote().getFields())
                        .build(ip))
                .retrieve()
                // ✅ 關鍵：把 4xx/5xx 拉出來（含 429 rate limited），不要混成 JSON parse fail
                .onStatus(HttpStatusCode::isError, (req, res) -> {
                    int status = res.getStatusCode().value();
                    String snippet = readBodySnippetQuietly(res, MAX_ERROR_SNIPPET_BYTES);
                    throw new GeoIpHttpException(status, "GEOIP_HTTP_" + status, snippet);
                })
                .body(String.class);

        if (body == null || body.isBlank()) {
            throw new GeoIpParseException(
                    "GEOIP_EMPTY_BODY",
                    "provider returned empty body (2xx) for ip=" + ip,
                    null,
                    null
            );
        }

        JsonNode root;
        try {
            root = om.readTree(body);
        } catch (Exception e) {
            String snippet = shrink(body, 300);
            throw new GeoIpParseException(
                    "GEOIP_JSON_PARSE_FAILED",
                    "provider JSON parse failed (2xx). ip=" + ip + ", snippet=" + snippet,
                    snippet,
                    e
            );
        }

        if (!root.isObject()) {
            throw new GeoIpParseException("GEOIP_UNEXPECTED_JSON", "provider JSON is not an object. ip=" + ip,
                    shrink(body, 300), null);
        }

        if (!"success".equalsIgnoreCase(root.path("status").asText(""))) {
            log.debug("provider has no data. ip={} message={}", ip, root.path("message").asText(""));
            return Optional.empty();
        }

        String asField = text(root, "as");

        return Optional.of(new IpApiResult(
                upper(text(root, "countryCode")),
                text(root, "country"),
                text(root, "regionName"),
                text(root, "city"),
                number(root, "lat"),
                number(root, "lon"),
                text(root, "timezone"),
                AsnStrings.parseAsn(asField),
                text(root, "asname"),
                text(root, "isp"),
                text(root, "org"),
                root.path("mobile").asBoolean(false),
                root.path("proxy").asBoolean(false),
                root.path("hosting").asBoolean(false)
        ));
    }

    private static String text(JsonNode root, String field) {
        JsonNode n = root.get(field);
        if (n == null || n.isNull()) return null;
        String t = n.asText("").trim();
        return t.isEmpty() ? null : t;
    }

    private static Double number(JsonNode root, String field) {
        JsonNode n = root.get(field);
        return (n != null && n.isNumber()) ? n.asDouble() : null;
    }

    private static String upper(String s) {
        return s == null ? null : s.toUpperCase(Locale.ROOT);
    }

    private static String readBodySnippetQuietly(ClientHttpResponse res, int maxBytes) {
        try (InputStream in = res.getBody()) {
            byte[] bytes = in.readNBytes(Math.max(0, maxBytes));
            if (bytes.length == 0) return "";
            return new String(bytes, StandardCharsets.UTF_8);
        } catch (Exception ignore) {
            return null;
        }
    }

    private static String shrink(String s, int maxChars) {
        if (s == null) return null;
        String t = s.replaceAll("\\s+", " ").trim();
        if (t.length() <= maxChars) return t;
        return t.substring(0, maxChars) + "...";
    }
}
