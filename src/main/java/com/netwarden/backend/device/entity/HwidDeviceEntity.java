package com.netwarden.backend.device.entity;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.Table;
import jakarta.persistence.UniqueConstraint;
import lombok.Getter;
import lombok.Setter;

import java.time.Instant;

@Getter
@Setter
@Entity
@Table(
        name = "user_hwid_devices",
        uniqueConstraints = @UniqueConstraint(name = "uk_hwid_devices_user_hwid", columnNames = {"user_uuid", "hwid"}),
        indexes = {
                @Index(name = "idx_hwid_devices_user_uuid", columnList = "user_uuid"),
                @Index(name = "idx_hwid_devices_platform", columnList = "platform")
        }
)
public class HwidDeviceEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "user_uuid", length = 64, nullable = false)
    private String userUuid;

    @Column(length = 255, nullable = false)
    private String hwid;

    @Column(length = 50)
    private String platform;

    @Column(name = "os_version", length = 100)
    private String osVersion;

    @Column(name = "device_model", length = 255)
    private String deviceModel;

    @Column(name = "app_version", length = 50)
    private String appVersion;

    @Column(name = "user_agent", columnDefinition = "TEXT")
    private String userAgent;

    @Column(name = "created_at", nullable = false)
    private Instant createdAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    @Column(name = "synced_at", nullable = false)
    private Instant syncedAt;
}
