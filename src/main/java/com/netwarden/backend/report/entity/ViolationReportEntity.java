package com.netwarden.backend.report.entity;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.Table;
import lombok.Getter;
import lombok.Setter;

import java.time.Instant;

/**
 * 產生過的報表（daily / weekly / monthly / custom）。
 * 聚合結果用 JSON 文字存，讀回來再轉。
 */
@Getter
@Setter
@Entity
@Table(
        name = "violation_reports",
        indexes = {
                @Index(name = "idx_reports_type_end", columnList = "report_type,period_end"),
                @Index(name = "idx_reports_generated", columnList = "generated_at")
        }
)
public class ViolationReportEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "report_type", length = 16, nullable = false)
    private String reportType;

    @Column(name = "period_start", nullable = false)
    private Instant periodStart;

    @Column(name = "period_end", nullable = false)
    private Instant periodEnd;

    @Column(name = "total_violations", nullable = false)
    private long totalViolations;

    @Column(name = "critical_count", nullable = false)
    private long criticalCount;

    @Column(name = "warning_count", nullable = false)
    private long warningCount;

    @Column(name = "monitor_count", nullable = false)
    private long monitorCount;

    @Column(name = "unique_users", nullable = false)
    private long uniqueUsers;

    @Column(name = "prev_total_violations")
    private Long prevTotalViolations;

    @Column(name = "trend_percent")
    private Double trendPercent;

    @Column(name = "top_violators", columnDefinition = "TEXT")
    private String topViolators;

    @Column(name = "by_country", columnDefinition = "TEXT")
    private String byCountry;

    @Column(name = "by_action", columnDefinition = "TEXT")
    private String byAction;

    @Column(name = "by_asn_type", columnDefinition = "TEXT")
    private String byAsnType;

    @Column(name = "message_text", columnDefinition = "TEXT")
    private String messageText;

    @Column(name = "generated_at", nullable = false)
    private Instant generatedAt;

    @Column(name = "sent_at")
    private Instant sentAt;
}
