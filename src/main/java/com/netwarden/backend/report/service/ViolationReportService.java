package com.netwarden.backend.report.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.netwarden.backend.report.config.ReportProperties;
import com.netwarden.backend.report.entity.ViolationReportEntity;
import com.netwarden.backend.report.model.ReportPeriod;
import com.netwarden.backend.report.model.ReportType;
import com.netwarden.backend.report.model.TrendDirection;
import com.netwarden.backend.report.model.ViolationReportData;
import com.netwarden.backend.report.repo.ViolationReportRepository;
import com.netwarden.backend.violation.dto.TopViolator;
import com.netwarden.backend.violation.dto.ViolationStats;
import com.netwarden.backend.violation.service.ViolationService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Optional;

/**
 * 違規報表：算期間 → 拉聚合 → 和前一期比 → 排版 → 視需要存檔。
 * storage 出錯時報表照樣產生（聚合值退成 0 / 空），只是不會有 id。
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ViolationReportService {

    private static final TypeReference<List<TopViolator>> TOP_VIOLATORS = new TypeReference<>() {};
    private static final TypeReference<LinkedHashMap<String, Long>> COUNTS = new TypeReference<>() {};

    private final ViolationService violations;
    private final ViolationReportRepository repo;
    private final ReportMessageFormatter formatter;
    private final ReportProperties props;
    private final ObjectMapper om;
    private final Clock clock;

    public ViolationReportData generateReport(ReportType type) {
        return generateReport(type, null, true);
    }

    /**
     * @param referenceDay 以哪一天為「今天」（null = 現在，UTC）
     */
    public ViolationReportData generateReport(ReportType type, LocalDate referenceDay, boolean saveToDb) {
        if (type == null || !type.isScheduled()) {
            throw new IllegalArgumentException("scheduled report type required: " + type);
        }
        LocalDate ref = referenceDay != null ? referenceDay : LocalDate.now(clock.withZone(ZoneOffset.UTC));
        ReportPeriod period = ReportPeriods.current(type, ref);
        ReportPeriod previous = ReportPeriods.previous(type, period);

        log.info("generating {} violation report. period={}..{}", type.code(), period.start(), period.end());

        ViolationReportData report = build(type, period, previous, props.getMinScore());
        if (saveToDb) save(report);

        log.info("generated {} report. total={} users={} id={}",
                type.code(), report.getTotalViolations(), report.getUniqueUsers(), report.getId());
        return report;
    }

    /**
     * 任意期間；趨勢和「前面同長度的期間」比。
     */
    public ViolationReportData getCustomReport(Instant start, Instant end, Double minScore, boolean saveToDb) {
        ReportPeriod period = new ReportPeriod(start, end);
        Duration length = Duration.between(start, end);
        ReportPeriod previous = new ReportPeriod(start.minus(length), start);

        double threshold = minScore == null ? props.getMinScore() : clampScore(minScore);
        ViolationReportData report = build(ReportType.CUSTOM, period, previous, threshold);
        if (saveToDb) save(report);
        return report;
    }

    public Optional<ViolationReportData> getLastReport(ReportType type) {
        if (type == null) return Optional.empty();
        try {
            return repo.findFirstByReportTypeOrderByPeriodEndDescIdDesc(type.code()).map(this::toData);
        } catch (DataAccessException ex) {
            log.error("last report query failed. type={} err={}", type.code(), ex.toString(), ex);
            return Optional.empty();
        }
    }

    /** @param type null = 全部類型 */
    public List<ViolationReportData> getReportsHistory(ReportType type, int limit) {
        PageRequest page = PageRequest.of(0, Math.max(1, Math.min(100, limit)));
        try {
            List<ViolationReportEntity> rows = type == null
                    ? repo.findAllByOrderByGeneratedAtDescIdDesc(page)
                    : repo.findByReportTypeOrderByGeneratedAtDescIdDesc(type.code(), page);
            return rows.stream().map(this::toData).toList();
        } catch (DataAccessException ex) {
            log.error("report history query failed. type={} err={}", type, ex.toString(), ex);
            return List.of();
        }
    }

    /**
     * sent_at 只寫一次；已經標過（或不存在）回 false。
     */
    public boolean markReportSent(Long reportId) {
        if (reportId == null) return false;
        try {
            return repo.markSent(reportId, Instant.now(clock)) > 0;
        } catch (DataAccessException ex) {
            log.error("mark report sent failed. id={} err={}", reportId, ex.toString(), ex);
            return false;
        }
    }

    // ===== internal =====

    private ViolationReportData build(ReportType type, ReportPeriod period, ReportPeriod previous, double minScore) {
        ViolationReportData r = new ViolationReportData();
        r.setReportType(type);
        r.setPeriodStart(period.start());
        r.setPeriodEnd(period.end());

        ViolationStats stats = violations.getViolationsStatsForPeriod(period.start(), period.end(), minScore);
        r.setTotalViolations(stats.total());
        r.setCriticalCount(stats.critical());
        r.setWarningCount(stats.warning());
        r.setMonitorCount(stats.monitor());
        r.setUniqueUsers(stats.uniqueUsers());
        r.setAvgScore(stats.avgScore());
        r.setMaxScore(stats.maxScore());

        long prevTotal = violations.getViolationsStatsForPeriod(previous.start(), previous.end(), minScore).total();
        r.setPrevTotalViolations(prevTotal);
        r.setTrendPercent(trendPercent(stats.total(), prevTotal));
        r.setTrendDirection(TrendDirection.of(r.getTrendPercent()));

        r.setTopViolators(violations.getTopViolatorsForPeriod(
                period.start(), period.end(), minScore, props.getTopViolatorsCount()));
        r.setByCountry(violations.getViolationsByCountry(period.start(), period.end(), minScore));
        r.setByAction(violations.getViolationsByAction(period.start(), period.end(), minScore));
        r.setByAsnType(violations.getViolationsByAsnType(period.start(), period.end(), minScore));

        r.setGeneratedAt(Instant.now(clock));
        r.setMessageText(formatter.format(r));
        return r;
    }

    /** 前期 0 筆時沒有意義，回 null */
    static Double trendPercent(long current, long previous) {
        if (previous <= 0) return null;
        return (current - previous) * 100.0 / previous;
    }

    private void save(ViolationReportData r) {
        ViolationReportEntity e = new ViolationReportEntity();
        e.setReportType(r.getReportType().code());
        e.setPeriodStart(r.getPeriodStart());
        e.setPeriodEnd(r.getPeriodEnd());
        e.setTotalViolations(r.getTotalViolations());
        e.setCriticalCount(r.getCriticalCount());
        e.setWarningCount(r.getWarningCount());
        e.setMonitorCount(r.getMonitorCount());
        e.setUniqueUsers(r.getUniqueUsers());
        e.setPrevTotalViolations(r.getPrevTotalViolations());
        e.setTrendPercent(r.getTrendPercent());
        e.setTopViolators(r.getTopViolators().isEmpty() ? null : toJson(r.getTopViolators()));
        e.setByCountry(r.getByCountry().isEmpty() ? null : toJson(r.getByCountry()));
        e.setByAction(r.getByAction().isEmpty() ? null : toJson(r.getByAction()));
        e.setByAsnType(r.getByAsnType().isEmpty() ? null : toJson(r.getByAsnType()));
        e.setMessageText(r.getMessageText());
        e.setGeneratedAt(r.getGeneratedAt());

        try {
            r.setId(repo.save(e).getId());
        } catch (DataAccessException ex) {
            log.error("save report failed. type={} err={}", r.getReportType().code(), ex.toString(), ex);
        }
    }

    private ViolationReportData toData(ViolationReportEntity e) {
        ViolationReportData r = new ViolationReportData();
        r.setId(e.getId());
        r.setReportType(ReportType.fromCode(e.getReportType()));
        r.setPeriodStart(e.getPeriodStart());
        r.setPeriodEnd(e.getPeriodEnd());
        r.setTotalViolations(e.getTotalViolations());
        r.setCriticalCount(e.getCriticalCount());
        r.setWarningCount(e.getWarningCount());
        r.setMonitorCount(e.getMonitorCount());
        r.setUniqueUsers(e.getUniqueUsers());
        r.setPrevTotalViolations(e.getPrevTotalViolations());
        r.setTrendPercent(e.getTrendPercent());
        r.setTrendDirection(TrendDirection.of(e.getTrendPercent()));
        r.setTopViolators(fromJson(e.getTopViolators(), TOP_VIOLATORS, List.of()));
        r.setByCountry(fromJson(e.getByCountry(), COUNTS, new LinkedHashMap<>()));
        r.setByAction(fromJson(e.getByAction(), COUNTS, new LinkedHashMap<>()));
        r.setByAsnType(fromJson(e.getByAsnType(), COUNTS, new LinkedHashMap<>()));
        r.setMessageText(e.getMessageText() == null ? "" : e.getMessageText());
        r.setGeneratedAt(e.getGeneratedAt());
        r.setSentAt(e.getSentAt());
        return r;
    }

    private String toJson(Object v) {
        try {
            return om.writeValueAsString(v);
        } catch (JsonProcessingException ex) {
            log.warn("report section not serializable, storing null: {}", ex.getOriginalMessage());
            return null;
        }
    }

    private <T> T fromJson(String json, TypeReference<? extends T> type, T fallback) {
        if (json == null || json.isBlank()) return fallback;
        try {
            return om.readValue(json, type);
        } catch (JsonProcessingException ex) {
            log.warn("stored report section unreadable, using empty: {}", ex.getOriginalMessage());
            return fallback;
        }
    }

    private static double clampScore(double v) {
        return Math.max(0.0, Math.min(100.0, v));
    }
}
