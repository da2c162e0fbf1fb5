package com.netwarden.backend.violation.controller;

import com.netwarden.backend.violation.dto.SaveViolationCommand;
import com.netwarden.backend.violation.dto.TopViolator;
import com.netwarden.backend.violation.dto.ViolationStats;
import com.netwarden.backend.violation.dto.ViolationView;
import com.netwarden.backend.violation.service.ViolationCsvExporter;
import com.netwarden.backend.violation.service.ViolationService;
import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import lombok.RequiredArgsConstructor;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PatchMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;

@Validated
@RestController
@RequiredArgsConstructor
@RequestMapping("/api/v1/violations")
public class ViolationController {

    private final ViolationService violations;
    private final ViolationCsvExporter csvExporter;

    public record SaveResponse(Long id) {}

    public record ActionRequest(@NotBlank @Size(max = 32) String action, Long adminTelegramId) {}

    @PostMapping
    public ResponseEntity<SaveResponse> save(@Valid @RequestBody SaveViolationCommand cmd) {
        return violations.saveViolation(cmd)
                .map(id -> ResponseEntity.status(HttpStatus.CREATED).body(new SaveResponse(id)))
                .orElseGet(() -> ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE).body(new SaveResponse(null)));
    }

    @GetMapping("/stats")
    public ViolationStats stats(
            @RequestParam @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) Instant start,
            @RequestParam @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) Instant end,
            @RequestParam(defaultValue = "30") @DecimalMin("0") @DecimalMax("100") double minScore
    ) {
        requireOrdered(start, end);
        return violations.getViolationsStatsForPeriod(start, end, minScore);
    }

    @GetMapping("/top")
    public List<TopViolator> top(
            @RequestParam @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) Instant start,
            @RequestParam @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) Instant end,
            @RequestParam(defaultValue = "30") @DecimalMin("0") @DecimalMax("100") double minScore,
            @RequestParam(defaultValue = "10") @Min(1) @Max(100) int limit
    ) {
        requireOrdered(start, end);
        return violations.getTopViolatorsForPeriod(start, end, minScore, limit);
    }

    @GetMapping("/by-country")
    public Map<String, Long> byCountry(
            @RequestParam @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) Instant start,
            @RequestParam @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) Instant end,
            @RequestParam(defaultValue = "30") @DecimalMin("0") @DecimalMax("100") double minScore
    ) {
        requireOrdered(start, end);
        return violations.getViolationsByCountry(start, end, minScore);
    }

    @GetMapping("/by-action")
    public Map<String, Long> byAction(
            @RequestParam @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) Instant start,
            @RequestParam @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) Instant end,
            @RequestParam(defaultValue = "30") @DecimalMin("0") @DecimalMax("100") double minScore
    ) {
        requireOrdered(start, end);
        return violations.getViolationsByAction(start, end, minScore);
    }

    @GetMapping("/by-asn-type")
    public Map<String, Long> byAsnType(
            @RequestParam @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) Instant start,
            @RequestParam @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) Instant end,
            @RequestParam(defaultValue = "30") @DecimalMin("0") @DecimalMax("100") double minScore
    ) {
        requireOrdered(start, end);
        return violations.getViolationsByAsnType(start, end, minScore);
    }

    @GetMapping("/period")
    public List<ViolationView> period(
            @RequestParam @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) Instant start,
            @RequestParam @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) Instant end,
            @RequestParam(defaultValue = "30") @DecimalMin("0") @DecimalMax("100") double minScore,
            @RequestParam(defaultValue = "100") @Min(1) @Max(1000) int limit
    ) {
        requireOrdered(start, end);
        return violations.getViolationsForPeriod(start, end, minScore, limit);
    }

    @GetMapping("/export")
    public ResponseEntity<String> export(
            @RequestParam @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) Instant start,
            @RequestParam @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) Instant end,
            @RequestParam(defaultValue = "30") @DecimalMin("0") @DecimalMax("100") double minScore
    ) {
        requireOrdered(start, end);
        String csv = csvExporter.export(start, end, minScore);
        return ResponseEntity.ok()
                .contentType(new MediaType("text", "csv", StandardCharsets.UTF_8))
                .header(HttpHeaders.CONTENT_DISPOSITION, "attachment; filename=\"violations.csv\"")
                .body(csv);
    }

    @GetMapping("/users/{userUuid}")
    public List<ViolationView> userViolations(
            @PathVariable String userUuid,
            @RequestParam(defaultValue = "30") @Min(1) @Max(365) int days,
            @RequestParam(defaultValue = "100") @Min(1) @Max(1000) int limit
    ) {
        return violations.getUserViolations(userUuid, days, limit);
    }

    @PatchMapping("/{id}/action")
    public ResponseEntity<Void> updateAction(@PathVariable Long id, @Valid @RequestBody ActionRequest req) {
        if (!violations.updateViolationAction(id, req.action(), req.adminTelegramId())) {
            throw new NoSuchElementException("VIOLATION_NOT_FOUND");
        }
        return ResponseEntity.noContent().build();
    }

    @PostMapping("/{id}/notified")
    public ResponseEntity<Void> markNotified(@PathVariable Long id) {
        if (!violations.markViolationNotified(id)) {
            throw new NoSuchElementException("VIOLATION_NOT_FOUND");
        }
        return ResponseEntity.noContent().build();
    }

    private static void requireOrdered(Instant start, Instant end) {
        if (!start.isBefore(end)) throw new IllegalArgumentException("start must be before end");
    }
}
