package com.netwarden.backend.geoip.classify;

import com.netwarden.backend.geoip.config.GeoIpProperties;
import com.netwarden.backend.geoip.entity.AsnRegistryEntity;
import com.netwarden.backend.geoip.repo.AsnRegistryRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.annotation.Order;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Component;

import java.util.Locale;
import java.util.Optional;
import java.util.Set;

/**
 * 第一階段：人工維護的 asn_registry。只對 registry 國家（預設 RU）的 IP 生效，
 * 命中時 provider_type 原樣當 connection_type，region / city 也用 registry 的。
 */
@Slf4j
@Order(1)
@Component
@RequiredArgsConstructor
public class AsnRegistryStage implements ClassificationStage {

    private static final Set<String> MOBILE_TYPES = Set.of("mobile", "mobile_isp");
    private static final Set<String> DATACENTER_TYPES = Set.of("hosting", "datacenter");
    private static final Set<String> VPN_TYPES = Set.of("vpn");

    private final AsnRegistryRepository repo;
    private final GeoIpProperties props;

    @Override
    public Optional<Classification> classify(ClassificationInput in) {
        if (in.asn() == null) return Optional.empty();

        String scope = props.getClassification().getRegistryCountry();
        if (scope == null || in.countryCode() == null || !scope.equalsIgnoreCase(in.countryCode())) {
            return Optional.empty();
        }

        AsnRegistryEntity row;
        try {
            row = repo.findByAsnAndActiveTrue(in.asn()).orElse(null);
        } catch (DataAccessException ex) {
            log.warn("asn registry lookup failed, falling back to keywords. asn={} err={}", in.asn(), ex.toString());
            return Optional.empty();
        }
        if (row == null || row.getProviderType() == null || row.getProviderType().isBlank()) {
            return Optional.empty();
        }

        String type = row.getProviderType().trim().toLowerCase(Locale.ROOT);
        return Optional.of(new Classification(
                type,
                MOBILE_TYPES.contains(type),
                DATACENTER_TYPES.contains(type),
                VPN_TYPES.contains(type),
                row.getRegion(),
                row.getCity(),
                Classification.Source.REGISTRY
        ));
    }
}
