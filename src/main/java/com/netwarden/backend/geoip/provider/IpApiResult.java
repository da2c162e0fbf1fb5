package com.netwarden.backend.geoip.provider;

/** ip-api.com 成功回應裡我們用得到的欄位 */
public record IpApiResult(
        String countryCode,
        String country,
        String regionName,
        String city,
        Double lat,
        Double lon,
        String timezone,
        Long asn,
        String asName,
        String isp,
        String org,
        boolean mobile,
        boolean proxy,
        boolean hosting
) {
    /** asn_org 優先序：asname > org > isp */
    public String asnOrg() {
        if (asName != null && !asName.isBlank()) return asName;
        if (org != null && !org.isBlank()) return org;
        if (isp != null && !isp.isBlank()) return isp;
        return null;
    }
}
