package com.netwarden.backend.geoip.model;

/**
 * connection_type 常用值。asn_registry 的 provider_type 可能帶其他值（mobile_isp / hosting / isp ...），
 * 會原樣寫進 connection_type。
 */
public final class ConnectionTypes {

    public static final String RESIDENTIAL = "residential";
    public static final String MOBILE = "mobile";
    public static final String DATACENTER = "datacenter";
    public static final String VPN = "vpn";
    public static final String UNKNOWN = "unknown";

    private ConnectionTypes() {}
}
