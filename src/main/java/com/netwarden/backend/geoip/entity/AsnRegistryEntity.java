package com.netwarden.backend.geoip.entity;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.PrePersist;
import jakarta.persistence.PreUpdate;
import jakarta.persistence.Table;
import lombok.Getter;
import lombok.Setter;

import java.time.Instant;

/**
 * 人工維護的 ASN 對照表（分類時優先於關鍵字規則）。這邊只讀。
 */
@Getter
@Setter
@Entity
@Table(
        name = "asn_registry",
        indexes = {
                @Index(name = "idx_asn_registry_type", columnList = "provider_type"),
                @Index(name = "idx_asn_registry_active", columnList = "is_active")
        }
)
public class AsnRegistryEntity {

    @Id
    @Column(nullable = false)
    private Long asn;

    @Column(name = "org_name", length = 255, nullable = false)
    private String orgName;

    @Column(name = "org_name_en", length = 255)
    private String orgNameEn;

    /** mobile / mobile_isp / hosting / datacenter / vpn / isp / regional_isp / business / infrastructure */
    @Column(name = "provider_type", length = 32)
    private String providerType;

    @Column(length = 100)
    private String region;

    @Column(length = 100)
    private String city;

    @Column(name = "country_code", length = 8, nullable = false)
    private String countryCode = "RU";

    @Column(columnDefinition = "TEXT")
    private String description;

    @Column(name = "is_active", nullable = false)
    private boolean active = true;

    @Column(name = "created_at", nullable = false)
    private Instant createdAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    @PrePersist
    void prePersist() {
        Instant now = Instant.now();
        if (createdAt == null) createdAt = now;
        if (updatedAt == null) updatedAt = now;
    }

    @PreUpdate
    void preUpdate() {
        updatedAt = Instant.now();
    }
}
