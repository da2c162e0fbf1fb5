package com.netwarden.backend.geoip.entity;

import com.netwarden.backend.geoip.model.IpMetadata;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.PrePersist;
import jakarta.persistence.PreUpdate;
import jakarta.persistence.Table;
import lombok.Getter;
import lombok.Setter;

import java.time.Duration;
import java.time.Instant;

@Getter
@Setter
@Entity
@Table(
        name = "ip_metadata",
        indexes = {
                @Index(name = "idx_ip_metadata_checked", columnList = "last_checked_at"),
                @Index(name = "idx_ip_metadata_asn", columnList = "asn")
        }
)
public class IpMetadataEntity {

    @Id
    @Column(name = "ip_address", length = 45, nullable = false)
    private String ipAddress;

    @Column(name = "country_code", length = 8)
    private String countryCode;

    @Column(name = "country_name", length = 100)
    private String countryName;

    @Column(length = 100)
    private String region;

    @Column(length = 100)
    private String city;

    private Double latitude;

    private Double longitude;

    @Column(length = 64)
    private String timezone;

    private Long asn;

    @Column(name = "asn_org", length = 255)
    private String asnOrg;

    @Column(name = "connection_type", length = 32)
    private String connectionType;

    @Column(name = "is_proxy", nullable = false)
    private boolean proxy;

    @Column(name = "is_vpn", nullable = false)
    private boolean vpn;

    @Column(name = "is_tor", nullable = false)
    private boolean tor;

    @Column(name = "is_hosting", nullable = false)
    private boolean hosting;

    @Column(name = "is_mobile", nullable = false)
    private boolean mobile;

    @Column(name = "created_at", nullable = false)
    private Instant createdAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    @Column(name = "last_checked_at", nullable = false)
    private Instant lastCheckedAt;

    @PrePersist
    void prePersist() {
        Instant now = Instant.now();
        if (createdAt == null) createdAt = now;
        if (updatedAt == null) updatedAt = now;
        if (lastCheckedAt == null) lastCheckedAt = now;
    }

    @PreUpdate
    void preUpdate() {
        updatedAt = Instant.now();
    }

    public boolean isFresh(Instant now, Duration freshness) {
        return lastCheckedAt != null && lastCheckedAt.isAfter(now.minus(freshness));
    }

    /** 查到新資料時覆蓋整列（last_checked_at 一起往前推） */
    public void apply(IpMetadata m, Instant checkedAt) {
        this.countryCode = m.countryCode();
        this.countryName = m.countryName();
        this.region = m.region();
        this.city = m.city();
        this.latitude = m.latitude();
        this.longitude = m.longitude();
        this.timezone = m.timezone();
        this.asn = m.asn();
        this.asnOrg = m.asnOrg();
        this.connectionType = m.connectionType();
        this.proxy = m.proxy();
        this.vpn = m.vpn();
        this.tor = m.tor();
        this.hosting = m.hosting();
        this.mobile = m.mobile();
        this.lastCheckedAt = checkedAt;
    }

    public IpMetadata toModel() {
        return IpMetadata.builder()
                .ipAddress(ipAddress)
                .countryCode(countryCode)
                .countryName(countryName)
                .region(region)
                .city(city)
                .latitude(latitude)
                .longitude(longitude)
                .timezone(timezone)
                .asn(asn)
                .asnOrg(asnOrg)
                .connectionType(connectionType)
                .proxy(proxy)
                .vpn(vpn)
                .tor(tor)
                .hosting(hosting)
                .mobile(mobile)
                .lastCheckedAt(lastCheckedAt)
                .source("database")
                .build();
    }
}
