package com.netwarden.backend.report.model;

import com.netwarden.backend.violation.dto.TopViolator;
import lombok.Getter;
import lombok.Setter;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 一份報表的完整內容（產生中可變，產生完就只讀）。
 */
@Getter
@Setter
public class ViolationReportData {

    private Long id;
    private ReportType reportType;
    private Instant periodStart;
    private Instant periodEnd;

    private long totalViolations;
    private long criticalCount;
    private long warningCount;
    private long monitorCount;
    private long uniqueUsers;
    private double avgScore;
    private double maxScore;

    /** 前一個可比較期間的總數（null = 沒比） */
    private Long prevTotalViolations;
    private Double trendPercent;
    private TrendDirection trendDirection = TrendDirection.STABLE;

    private List<TopViolator> topViolators = new ArrayList<>();
    private Map<String, Long> byCountry = new LinkedHashMap<>();
    private Map<String, Long> byAction = new LinkedHashMap<>();
    private Map<String, Long> byAsnType = new LinkedHashMap<>();

    private String messageText = "";
    private Instant generatedAt;
    private Instant sentAt;

    public boolean isEmpty() {
        return totalViolations == 0;
    }
}
