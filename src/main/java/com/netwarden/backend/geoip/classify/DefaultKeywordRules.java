package com.netwarden.backend.geoip.classify;

import com.netwarden.backend.geoip.config.GeoIpProperties.Rule;
import com.netwarden.backend.geoip.model.ConnectionTypes;

import java.util.ArrayList;
import java.util.List;

/** config 沒給 app.geoip.classification.rules 時用的內建清單（VPN → 行動電信 → 機房） */
final class DefaultKeywordRules {

    private static final List<String> VPN = List.of(
            "nordvpn", "expressvpn", "surfshark", "cyberghost", "private internet access",
            "mullvad", "protonvpn", "windscribe", "tunnelbear", "vyprvpn", "hotspot shield",
            "hide.me", "vpn", "proxy", "anonymizer"
    );

    private static final List<String> MOBILE = List.of(
            "mts", "beeline", "megafon", "tele2", "yota", "rostelecom mobile",
            "vodafone", "orange", "t-mobile", "verizon", "at&t", "sprint",
            "china mobile", "china unicom", "china telecom"
    );

    private static final List<String> DATACENTER = List.of(
            "digitalocean", "amazon", "hetzner", "ovh", "linode", "vultr", "google cloud",
            "azure", "microsoft", "rackspace", "ibm cloud", "oracle cloud", "alibaba cloud",
            "tencent cloud", "huawei cloud"
    );

    // 太短的縮寫用 whole word，避免 "ee" 命中 "Freenet" 這類
    private static final List<String> VPN_WORDS = List.of("pia");
    private static final List<String> MOBILE_WORDS = List.of("ee", "three", "o2");
    private static final List<String> DATACENTER_WORDS = List.of("aws");

    private DefaultKeywordRules() {}

    static List<Rule> rules() {
        List<Rule> out = new ArrayList<>();
        add(out, VPN, ConnectionTypes.VPN, false);
        add(out, VPN_WORDS, ConnectionTypes.VPN, true);
        add(out, MOBILE, ConnectionTypes.MOBILE, false);
        add(out, MOBILE_WORDS, ConnectionTypes.MOBILE, true);
        add(out, DATACENTER, ConnectionTypes.DATACENTER, false);
        add(out, DATACENTER_WORDS, ConnectionTypes.DATACENTER, true);
        return out;
    }

    private static void add(List<Rule> out, List<String> words, String category, boolean wholeWord) {
        for (String w : words) out.add(new Rule(w, category, wholeWord));
    }
}
