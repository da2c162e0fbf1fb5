package com.netwarden.backend.geoip.controller;

import com.netwarden.backend.geoip.entity.AsnRegistryEntity;
import com.netwarden.backend.geoip.model.IpMetadata;
import com.netwarden.backend.geoip.service.AsnRegistryService;
import com.netwarden.backend.geoip.service.GeoIpService;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;

@Validated
@RestController
@RequiredArgsConstructor
@RequestMapping("/api/v1/geoip")
public class GeoIpController {

    private final GeoIpService geoIp;
    private final AsnRegistryService asnRegistry;

    public record GeoIpStatus(boolean localDatabase) {}

    @GetMapping("/{ip:.+}")
    public IpMetadata lookup(@PathVariable String ip, @RequestParam(defaultValue = "true") boolean useCache) {
        return geoIp.lookup(ip, useCache)
                .orElseThrow(() -> new NoSuchElementException("GEOIP_NOT_FOUND"));
    }

    @PostMapping("/batch")
    public Map<String, IpMetadata> batch(@RequestBody @NotNull @Size(max = 1000) List<String> ips) {
        return geoIp.lookupBatch(ips);
    }

    @DeleteMapping("/cache")
    public ResponseEntity<Void> clearCache() {
        geoIp.clearCache();
        return ResponseEntity.noContent().build();
    }

    @GetMapping("/status")
    public GeoIpStatus status() {
        return new GeoIpStatus(geoIp.hasLocalDatabase());
    }

    @GetMapping("/asn/{asn}")
    public AsnRegistryEntity asn(@PathVariable Long asn) {
        return asnRegistry.get(asn).orElseThrow(() -> new NoSuchElementException("ASN_NOT_FOUND"));
    }

    @GetMapping("/asn")
    public List<AsnRegistryEntity> searchAsn(
            @RequestParam(required = false) String q,
            @RequestParam(required = false) String type,
            @RequestParam(defaultValue = "50") @Min(1) @Max(200) int limit
    ) {
        if (type != null && !type.isBlank()) return asnRegistry.listByProviderType(type);
        return asnRegistry.searchByOrgName(q, limit);
    }
}
