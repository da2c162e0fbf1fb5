package com.netwarden.backend.geoip.service;

import com.netwarden.backend.geoip.entity.AsnRegistryEntity;
import com.netwarden.backend.geoip.repo.AsnRegistryRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Locale;
import java.util.Optional;

/** asn_registry 唯讀查詢（營運查表用） */
@Slf4j
@Service
@RequiredArgsConstructor
public class AsnRegistryService {

    private final AsnRegistryRepository repo;

    public Optional<AsnRegistryEntity> get(Long asn) {
        if (asn == null) return Optional.empty();
        try {
            return repo.findByAsnAndActiveTrue(asn);
        } catch (DataAccessException ex) {
            log.warn("asn registry get failed. asn={} err={}", asn, ex.toString());
            return Optional.empty();
        }
    }

    public List<AsnRegistryEntity> searchByOrgName(String query, int limit) {
        if (query == null || query.isBlank()) return List.of();
        try {
            return repo.searchByOrgName(query.trim(), PageRequest.of(0, Math.max(1, Math.min(limit, 200))));
        } catch (DataAccessException ex) {
            log.warn("asn registry search failed. q={} err={}", query, ex.toString());
            return List.of();
        }
    }

    public List<AsnRegistryEntity> listByProviderType(String providerType) {
        if (providerType == null || providerType.isBlank()) return List.of();
        try {
            return repo.findByProviderTypeAndActiveTrueOrderByAsnAsc(providerType.trim().toLowerCase(Locale.ROOT));
        } catch (DataAccessException ex) {
            log.warn("asn registry list failed. type={} err={}", providerType, ex.toString());
            return List.of();
        }
    }
}
