package com.netwarden.backend.report.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.netwarden.backend.report.config.ReportProperties;
import com.netwarden.backend.report.model.ReportType;
import com.netwarden.backend.report.model.TrendDirection;
import com.netwarden.backend.report.model.ViolationReportData;
import com.netwarden.backend.report.repo.ViolationReportRepository;
import com.netwarden.backend.testsupport.BaseSpringTest;
import com.netwarden.backend.testsupport.MutableClock;
import com.netwarden.backend.violation.dto.SaveViolationCommand;
import com.netwarden.backend.violation.repo.ViolationRepository;
import com.netwarden.backend.violation.service.ViolationService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;

import java.time.Instant;
import java.time.LocalDate;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DataJpaTest
class ViolationReportServiceTest extends BaseSpringTest {

    static final LocalDate TODAY = LocalDate.of(2024, 5, 8);

    @Autowired ViolationRepository violationRepo;
    @Autowired ViolationReportRepository reportRepo;

    MutableClock clock;
    ViolationService violations;
    ReportProperties props;
    ViolationReportService svc;

    @BeforeEach
    void setUp() {
        clock = MutableClock.at("2024-05-08T09:00:00Z");
        ObjectMapper om = new ObjectMapper().registerModule(new JavaTimeModule());
        violations = new ViolationService(violationRepo, om, clock);
        props = new ReportProperties();
        svc = new ViolationReportService(violations, reportRepo, new ReportMessageFormatter(), props, om, clock);
    }

    private void violationAt(String iso, String user, double score, String country) {
        Instant keep = clock.instant();
        clock.set(Instant.parse(iso));
        violations.saveViolation(SaveViolationCommand.builder()
                .userUuid(user)
                .username("name-" + user)
                .score(score)
                .recommendedAction(score >= 80 ? "hard_block" : "warn")
                .countries(List.of(country))
                .asnTypes(List.of("mobile"))
                .build());
        clock.set(keep);
    }

    @Test
    void daily_report_aggregates_yesterday_and_compares_with_day_before() {
        violationAt("2024-05-07T10:00:00Z", "u1", 90, "RU");
        violationAt("2024-05-07T11:00:00Z", "u1", 60, "RU");
        violationAt("2024-05-07T12:00:00Z", "u2", 45, "DE");
        violationAt("2024-05-07T13:00:00Z", "u3", 20, "DE");
        violationAt("2024-05-06T10:00:00Z", "u9", 70, "RU");
        violationAt("2024-05-06T11:00:00Z", "u9", 70, "RU");
        violationAt("2024-05-08T01:00:00Z", "u1", 99, "RU");

        ViolationReportData r = svc.generateReport(ReportType.DAILY, TODAY, true);

        assertThat(r.getPeriodStart()).isEqualTo(Instant.parse("2024-05-07T00:00:00Z"));
        assertThat(r.getTotalViolations()).isEqualTo(3);
        assertThat(r.getCriticalCount()).isEqualTo(1);
        assertThat(r.getUniqueUsers()).isEqualTo(2);
        assertThat(r.getPrevTotalViolations()).isEqualTo(2L);
        assertThat(r.getTrendPercent()).isEqualTo(50.0);
        assertThat(r.getTrendDirection()).isEqualTo(TrendDirection.UP);
        assertThat(r.getTopViolators()).extracting(t -> t.userUuid()).containsExactly("u1", "u2");
        assertThat(r.getByCountry()).containsEntry("RU", 2L).containsEntry("DE", 1L);
        assertThat(r.getMessageText()).contains("Daily violations report");
        assertThat(r.getGeneratedAt()).isEqualTo(clock.instant());
        assertThat(r.getId()).isNotNull();
    }

    @Test
    void no_previous_data_means_no_trend_percent() {
        violationAt("2024-05-07T10:00:00Z", "u1", 90, "RU");

        ViolationReportData r = svc.generateReport(ReportType.DAILY, TODAY, false);

        assertThat(r.getPrevTotalViolations()).isZero();
        assertThat(r.getTrendPercent()).isNull();
        assertThat(r.getTrendDirection()).isEqualTo(TrendDirection.STABLE);
        assertThat(r.getId()).isNull();
        assertThat(reportRepo.count()).isZero();
    }

    @Test
    void small_change_is_stable() {
        assertThat(ViolationReportService.trendPercent(102, 100)).isEqualTo(2.0);
        assertThat(TrendDirection.of(ViolationReportService.trendPercent(102, 100))).isEqualTo(TrendDirection.STABLE);
        assertThat(TrendDirection.of(ViolationReportService.trendPercent(50, 100))).isEqualTo(TrendDirection.DOWN);
    }

    @Test
    void stored_report_reads_back_with_sections() {
        violationAt("2024-05-07T10:00:00Z", "u1", 90, "RU");
        ViolationReportData saved = svc.generateReport(ReportType.DAILY, TODAY, true);

        ViolationReportData last = svc.getLastReport(ReportType.DAILY).orElseThrow();

        assertThat(last.getId()).isEqualTo(saved.getId());
        assertThat(last.getReportType()).isEqualTo(ReportType.DAILY);
        assertThat(last.getTotalViolations()).isEqualTo(1);
        assertThat(last.getTopViolators()).hasSize(1);
        assertThat(last.getTopViolators().get(0).displayName()).isEqualTo("name-u1");
        assertThat(last.getByCountry()).containsEntry("RU", 1L);
        assertThat(last.getMessageText()).isEqualTo(saved.getMessageText());
        assertThat(last.getSentAt()).isNull();
        assertThat(svc.getLastReport(ReportType.WEEKLY)).isEmpty();
    }

    @Test
    void empty_report_is_still_saved_with_null_sections() {
        ViolationReportData r = svc.generateReport(ReportType.WEEKLY, TODAY, true);

        assertThat(r.isEmpty()).isTrue();
        var row = reportRepo.findById(r.getId()).orElseThrow();
        assertThat(row.getByCountry()).isNull();
        assertThat(row.getTopViolators()).isNull();
        assertThat(row.getPeriodStart()).isEqualTo(Instant.parse("2024-04-29T00:00:00Z"));
    }

    @Test
    void mark_sent_only_once() {
        ViolationReportData r = svc.generateReport(ReportType.DAILY, TODAY, true);

        assertThat(svc.markReportSent(r.getId())).isTrue();
        assertThat(svc.markReportSent(r.getId())).isFalse();
        assertThat(svc.markReportSent(null)).isFalse();
        assertThat(svc.getLastReport(ReportType.DAILY).orElseThrow().getSentAt()).isEqualTo(clock.instant());
    }

    @Test
    void history_is_newest_first_and_filterable() {
        svc.generateReport(ReportType.DAILY, TODAY, true);
        clock.set(Instant.parse("2024-05-08T10:00:00Z"));
        svc.generateReport(ReportType.WEEKLY, TODAY, true);
        clock.set(Instant.parse("2024-05-08T11:00:00Z"));
        svc.generateReport(ReportType.DAILY, TODAY, true);

        assertThat(svc.getReportsHistory(null, 20)).extracting(ViolationReportData::getReportType)
                .containsExactly(ReportType.DAILY, ReportType.WEEKLY, ReportType.DAILY);
        assertThat(svc.getReportsHistory(ReportType.WEEKLY, 20)).hasSize(1);
        assertThat(svc.getReportsHistory(null, 2)).hasSize(2);
    }

    @Test
    void custom_report_compares_with_preceding_window() {
        violationAt("2024-05-03T10:00:00Z", "u1", 90, "RU");
        violationAt("2024-05-01T10:00:00Z", "u2", 90, "RU");
        violationAt("2024-05-01T11:00:00Z", "u2", 90, "RU");

        ViolationReportData r = svc.getCustomReport(
                Instant.parse("2024-05-03T00:00:00Z"), Instant.parse("2024-05-05T00:00:00Z"), null, false);

        assertThat(r.getReportType()).isEqualTo(ReportType.CUSTOM);
        assertThat(r.getTotalViolations()).isEqualTo(1);
        assertThat(r.getPrevTotalViolations()).isEqualTo(2L);
        assertThat(r.getTrendPercent()).isEqualTo(-50.0);
        assertThat(r.getMessageText()).startsWith("<b>📊 Violations report</b>");
    }

    @Test
    void custom_min_score_overrides_default() {
        violationAt("2024-05-03T10:00:00Z", "u1", 35, "RU");

        ViolationReportData high = svc.getCustomReport(
                Instant.parse("2024-05-03T00:00:00Z"), Instant.parse("2024-05-04T00:00:00Z"), 50.0, false);

        assertThat(high.getTotalViolations()).isZero();
    }

    @Test
    void custom_type_cannot_be_generated_as_scheduled() {
        assertThatThrownBy(() -> svc.generateReport(ReportType.CUSTOM, TODAY, false))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
