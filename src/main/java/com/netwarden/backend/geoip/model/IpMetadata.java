package com.netwarden.backend.geoip.model;

import lombok.Builder;

import java.time.Instant;

/**
 * 一個 IP 的地理 / 網路業者資訊（不可變）。
 * source：private / memory / database / maxmind / ip-api
 */
@Builder(toBuilder = true)
public record IpMetadata(
        String ipAddress,
        String countryCode,
        String countryName,
        String region,
        String city,
        Double latitude,
        Double longitude,
        String timezone,
        Long asn,
        String asnOrg,
        String connectionType,
        boolean proxy,
        boolean vpn,
        boolean tor,
        boolean hosting,
        boolean mobile,
        Instant lastCheckedAt,
        String source
) {
    public static final String PRIVATE_COUNTRY_CODE = "PRIVATE";
    public static final String PRIVATE_COUNTRY_NAME = "Private Network";

    public static IpMetadata privateNetwork(String ip) {
        return IpMetadata.builder()
                .ipAddress(ip)
                .countryCode(PRIVATE_COUNTRY_CODE)
                .countryName(PRIVATE_COUNTRY_NAME)
                .connectionType(ConnectionTypes.UNKNOWN)
                .source("private")
                .build();
    }

    public boolean isPrivateNetwork() {
        return PRIVATE_COUNTRY_CODE.equals(countryCode);
    }

    public IpMetadata withSource(String s) {
        return toBuilder().source(s).build();
    }
}
