package com.netwarden.backend.report.controller;

import com.netwarden.backend.report.model.ReportType;
import com.netwarden.backend.report.model.ScheduleStatus;
import com.netwarden.backend.report.model.ViolationReportData;
import com.netwarden.backend.report.scheduler.ReportScheduler;
import com.netwarden.backend.report.service.ViolationReportService;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import lombok.RequiredArgsConstructor;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import java.util.NoSuchElementException;

@Validated
@RestController
@RequiredArgsConstructor
@RequestMapping("/api/v1/reports")
public class ReportController {

    private final ViolationReportService reports;
    private final ReportScheduler scheduler;

    /**
     * send=true：產生 + 存檔 + 送出（手動補發）
     * send=false：只產生，可指定 referenceDay 預覽某天的報表
     */
    @PostMapping("/{type}")
    public ViolationReportData generate(
            @PathVariable String type,
            @RequestParam(defaultValue = "true") boolean send,
            @RequestParam(required = false) Long topicId,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate referenceDay,
            @RequestParam(defaultValue = "true") boolean save
    ) {
        ReportType t = ReportType.fromCode(type);
        if (send) return scheduler.sendReportManually(t, topicId);
        if (!t.isScheduled()) throw new IllegalArgumentException("use /custom for custom reports");
        return reports.generateReport(t, referenceDay, save);
    }

    @GetMapping("/custom")
    public ViolationReportData custom(
            @RequestParam @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) Instant start,
            @RequestParam @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) Instant end,
            @RequestParam(required = false) @DecimalMin("0") @DecimalMax("100") Double minScore,
            @RequestParam(defaultValue = "false") boolean save
    ) {
        if (!start.isBefore(end)) throw new IllegalArgumentException("start must be before end");
        return reports.getCustomReport(start, end, minScore, save);
    }

    @GetMapping("/history")
    public List<ViolationReportData> history(
            @RequestParam(required = false) String type,
            @RequestParam(defaultValue = "20") @Min(1) @Max(100) int limit
    ) {
        ReportType t = (type == null || type.isBlank()) ? null : ReportType.fromCode(type);
        return reports.getReportsHistory(t, limit);
    }

    @GetMapping("/last/{type}")
    public ViolationReportData last(@PathVariable String type) {
        return reports.getLastReport(ReportType.fromCode(type))
                .orElseThrow(() -> new NoSuchElementException("REPORT_NOT_FOUND"));
    }

    @GetMapping("/schedule")
    public ScheduleStatus schedule() {
        return scheduler.getScheduleStatus();
    }
}
