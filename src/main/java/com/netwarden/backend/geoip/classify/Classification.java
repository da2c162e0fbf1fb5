package com.netwarden.backend.geoip.classify;

import com.netwarden.backend.geoip.model.ConnectionTypes;

/**
 * 分類結果。region / city 只有 registry 命中時才會有值（覆蓋 provider 給的）。
 */
public record Classification(
        String connectionType,
        boolean mobile,
        boolean datacenter,
        boolean vpn,
        String region,
        String city,
        Source source
) {
    public enum Source { REGISTRY, KEYWORD, PROVIDER_FLAG, FALLBACK }

    public static Classification unknown() {
        return new Classification(ConnectionTypes.UNKNOWN, false, false, false, null, null, Source.FALLBACK);
    }

    public static Classification residential() {
        return new Classification(ConnectionTypes.RESIDENTIAL, false, false, false, null, null, Source.FALLBACK);
    }

    public static Classification of(String category, Source source) {
        return new Classification(
                category,
                ConnectionTypes.MOBILE.equals(category),
                ConnectionTypes.DATACENTER.equals(category),
                ConnectionTypes.VPN.equals(category),
                null,
                null,
                source
        );
    }
}
