package com.netwarden.backend.violation.entity;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.Table;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

import java.time.Instant;
import java.util.List;

/**
 * 一次偵測到的違規（append-only）。
 * 評分相關欄位 updatable = false，建立後只允許兩種後續更新：
 * - 已通知（notified_at）
 * - 管理員處置（action_taken / action_taken_by / action_taken_at）
 */
@Getter
@Builder
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor(access = AccessLevel.PRIVATE)
@Entity
@Table(
        name = "violations",
        indexes = {
                @Index(name = "idx_violations_user_detected", columnList = "user_uuid,detected_at"),
                @Index(name = "idx_violations_detected_score", columnList = "detected_at,score"),
                @Index(name = "idx_violations_action", columnList = "recommended_action")
        }
)
public class ViolationEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "user_uuid", length = 64, nullable = false, updatable = false)
    private String userUuid;

    @Column(length = 255, updatable = false)
    private String username;

    @Column(length = 255, updatable = false)
    private String email;

    @Column(name = "telegram_id", updatable = false)
    private Long telegramId;

    // ===== score =====

    @Column(nullable = false, updatable = false)
    private double score;

    @Column(name = "recommended_action", length = 32, nullable = false, updatable = false)
    private String recommendedAction;

    /** 評分器沒給就是 null，跟 0.0 不同 */
    @Column(updatable = false)
    private Double confidence;

    @Column(name = "temporal_score", nullable = false, updatable = false)
    private double temporalScore;

    @Column(name = "geo_score", nullable = false, updatable = false)
    private double geoScore;

    @Column(name = "asn_score", nullable = false, updatable = false)
    private double asnScore;

    @Column(name = "profile_score", nullable = false, updatable = false)
    private double profileScore;

    @Column(name = "device_score", nullable = false, updatable = false)
    private double deviceScore;

    // ===== evidence =====

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "ip_addresses", updatable = false)
    private List<String> ipAddresses;

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(updatable = false)
    private List<String> countries;

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(updatable = false)
    private List<String> cities;

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "asn_types", updatable = false)
    private List<String> asnTypes;

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "os_list", updatable = false)
    private List<String> osList;

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "client_list", updatable = false)
    private List<String> clientList;

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(updatable = false)
    private List<String> reasons;

    @Column(name = "simultaneous_connections", nullable = false, updatable = false)
    private int simultaneousConnections;

    @Column(name = "unique_ips_count", nullable = false, updatable = false)
    private int uniqueIpsCount;

    @Column(name = "device_limit", updatable = false)
    private Integer deviceLimit;

    @Column(name = "impossible_travel", nullable = false, updatable = false)
    private boolean impossibleTravel;

    @Column(name = "is_mobile", nullable = false, updatable = false)
    private boolean mobile;

    @Column(name = "is_datacenter", nullable = false, updatable = false)
    private boolean datacenter;

    @Column(name = "is_vpn", nullable = false, updatable = false)
    private boolean vpn;

    /** scorer 給的完整 breakdown（JSON 原文） */
    @Column(name = "raw_breakdown", columnDefinition = "TEXT", updatable = false)
    private String rawBreakdown;

    @Column(name = "detected_at", nullable = false, updatable = false)
    private Instant detectedAt;

    // ===== follow-up（唯一可變的部分） =====

    @Column(name = "notified_at")
    private Instant notifiedAt;

    @Column(name = "action_taken", length = 32)
    private String actionTaken;

    @Column(name = "action_taken_by")
    private Long actionTakenBy;

    @Column(name = "action_taken_at")
    private Instant actionTakenAt;
}
