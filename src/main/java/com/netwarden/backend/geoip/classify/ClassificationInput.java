package com.netwarden.backend.geoip.classify;

/**
 * @param providerMobile  provider 回報的 mobile flag（ip-api 有，MaxMind 沒有）
 * @param providerHosting provider 回報的 hosting flag
 */
public record ClassificationInput(
        Long asn,
        String asnOrg,
        String countryCode,
        boolean providerMobile,
        boolean providerHosting
) {}
