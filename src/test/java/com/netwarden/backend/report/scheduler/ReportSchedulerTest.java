package com.netwarden.backend.report.scheduler;

import com.netwarden.backend.common.status.SyncMetadataEntity;
import com.netwarden.backend.common.status.SyncStatusService;
import com.netwarden.backend.report.config.ReportProperties;
import com.netwarden.backend.report.entity.ReportScheduleStateEntity;
import com.netwarden.backend.report.model.ReportType;
import com.netwarden.backend.report.model.ScheduleStatus;
import com.netwarden.backend.report.model.ViolationReportData;
import com.netwarden.backend.report.notify.LoggingNotificationSink;
import com.netwarden.backend.report.notify.NotificationDispatchException;
import com.netwarden.backend.report.notify.NotificationSink;
import com.netwarden.backend.report.repo.ReportScheduleStateRepository;
import com.netwarden.backend.report.service.ViolationReportService;
import com.netwarden.backend.testsupport.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.time.DayOfWeek;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyBoolean;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class ReportSchedulerTest {

    ViolationReportService reports;
    NotificationSink sink;
    ReportProperties props;
    ReportScheduleStateRepository stateRepo;
    SyncStatusService syncStatus;
    MutableClock clock;
    ReportScheduler scheduler;

    @BeforeEach
    void setUp() {
        reports = mock(ViolationReportService.class);
        sink = mock(NotificationSink.class);
        stateRepo = mock(ReportScheduleStateRepository.class);
        syncStatus = mock(SyncStatusService.class);
        clock = MutableClock.at("2024-05-08T09:00:00Z");

        props = new ReportProperties();
        props.getWeekly().setEnabled(false);
        props.getMonthly().setEnabled(false);
        props.setTopicId(77L);

        when(sink.sinkCode()).thenReturn("TEST");
        when(sink.delivers()).thenReturn(true);
        when(stateRepo.findById(anyString())).thenReturn(Optional.empty());
        when(stateRepo.save(any(ReportScheduleStateEntity.class))).thenAnswer(inv -> inv.getArgument(0));

        scheduler = new ReportScheduler(reports, sink, props, stateRepo, syncStatus, clock);
    }

    private static ViolationReportData report(long id, long total) {
        ViolationReportData r = new ViolationReportData();
        r.setId(id);
        r.setReportType(ReportType.DAILY);
        r.setTotalViolations(total);
        r.setMessageText("<b>report " + id + "</b>");
        return r;
    }

    @Test
    void daily_fires_once_at_trigger_minute() {
        when(reports.generateReport(ReportType.DAILY, null, true)).thenReturn(report(1L, 5));
        when(sink.dispatch(anyString(), any())).thenReturn(true);
        when(reports.markReportSent(1L)).thenReturn(true);

        scheduler.checkAndSend(Instant.parse("2024-05-08T09:00:00Z"));
        scheduler.checkAndSend(Instant.parse("2024-05-08T09:00:40Z"));

        verify(sink, times(1)).dispatch("<b>report 1</b>", 77L);
        verify(reports).markReportSent(1L);
        verify(syncStatus).record(SyncStatusService.KEY_VIOLATION_REPORTS,
                SyncMetadataEntity.SyncStatus.SUCCESS, 1, null);

        ArgumentCaptor<ReportScheduleStateEntity> state = ArgumentCaptor.forClass(ReportScheduleStateEntity.class);
        verify(stateRepo).save(state.capture());
        assertThat(state.getValue().getCadence()).isEqualTo("daily");
        assertThat(state.getValue().getLastSentDate()).isEqualTo(LocalDate.of(2024, 5, 8));
    }

    @Test
    void other_minutes_do_nothing() {
        scheduler.checkAndSend(Instant.parse("2024-05-08T08:59:00Z"));
        scheduler.checkAndSend(Instant.parse("2024-05-08T09:01:00Z"));

        verify(reports, never()).generateReport(any(), any(), anyBoolean());
    }

    @Test
    void persisted_gate_blocks_resend_after_restart() {
        ReportScheduleStateEntity row = new ReportScheduleStateEntity();
        row.setCadence("daily");
        row.setLastSentDate(LocalDate.of(2024, 5, 8));
        when(stateRepo.findById("daily")).thenReturn(Optional.of(row));

        scheduler.checkAndSend(Instant.parse("2024-05-08T09:00:00Z"));

        verify(reports, never()).generateReport(any(), any(), anyBoolean());
    }

    @Test
    void empty_report_is_saved_but_not_sent_and_gate_advances() {
        when(reports.generateReport(ReportType.DAILY, null, true)).thenReturn(report(2L, 0));

        scheduler.checkAndSend(Instant.parse("2024-05-08T09:00:00Z"));

        verify(sink, never()).dispatch(anyString(), any());
        verify(reports, never()).markReportSent(anyLong());
        verify(syncStatus).record(SyncStatusService.KEY_VIOLATION_REPORTS,
                SyncMetadataEntity.SyncStatus.SKIPPED, 0, null);
        verify(stateRepo).save(any(ReportScheduleStateEntity.class));
    }

    @Test
    void empty_report_is_sent_when_configured() {
        props.setSendEmpty(true);
        when(reports.generateReport(ReportType.DAILY, null, true)).thenReturn(report(3L, 0));
        when(sink.dispatch(anyString(), any())).thenReturn(true);

        scheduler.checkAndSend(Instant.parse("2024-05-08T09:00:00Z"));

        verify(sink).dispatch("<b>report 3</b>", 77L);
    }

    @Test
    void dispatch_failure_keeps_gate_open_and_report_unsent() {
        when(reports.generateReport(ReportType.DAILY, null, true)).thenReturn(report(4L, 5));
        when(sink.dispatch(anyString(), any()))
                .thenThrow(new NotificationDispatchException("TELEGRAM_HTTP_502", 502))
                .thenReturn(true);

        scheduler.checkAndSend(Instant.parse("2024-05-08T09:00:00Z"));

        verify(reports, never()).markReportSent(anyLong());
        verify(stateRepo, never()).save(any());
        verify(syncStatus).record(eq(SyncStatusService.KEY_VIOLATION_REPORTS),
                eq(SyncMetadataEntity.SyncStatus.FAILED), eq(0), anyString());

        // 隔天同一分鐘：gate 沒推進，照常觸發
        scheduler.checkAndSend(Instant.parse("2024-05-09T09:00:00Z"));
        verify(sink, times(2)).dispatch(anyString(), any());
        verify(reports).markReportSent(4L);
    }

    @Test
    void unconfirmed_dispatch_counts_as_failure() {
        when(reports.generateReport(ReportType.DAILY, null, true)).thenReturn(report(5L, 5));
        when(sink.dispatch(anyString(), any())).thenReturn(false);

        scheduler.checkAndSend(Instant.parse("2024-05-08T09:00:00Z"));

        verify(reports, never()).markReportSent(anyLong());
        verify(stateRepo, never()).save(any());
    }

    @Test
    void log_sink_never_marks_reports_sent() {
        ReportScheduler logOnly = new ReportScheduler(reports, new LoggingNotificationSink(), props, stateRepo, syncStatus, clock);
        when(reports.generateReport(ReportType.DAILY, null, true)).thenReturn(report(12L, 5));

        logOnly.checkAndSend(Instant.parse("2024-05-08T09:00:00Z"));

        verify(reports, never()).markReportSent(anyLong());
        verify(syncStatus).record(SyncStatusService.KEY_VIOLATION_REPORTS,
                SyncMetadataEntity.SyncStatus.SKIPPED, 0, null);
        // 沒送達也推進，不會每天重產同一份
        verify(stateRepo).save(any(ReportScheduleStateEntity.class));

        ViolationReportData manual = logOnly.sendReportManually(ReportType.DAILY, null);
        assertThat(manual.getSentAt()).isNull();
        verify(reports, never()).markReportSent(anyLong());
    }

    @Test
    void weekly_only_on_configured_day() {
        props.getDaily().setEnabled(false);
        props.getWeekly().setEnabled(true);
        props.getWeekly().setDay(DayOfWeek.MONDAY);
        props.getWeekly().setTime("10:00");
        when(reports.generateReport(ReportType.WEEKLY, null, true)).thenReturn(report(6L, 1));
        when(sink.dispatch(anyString(), any())).thenReturn(true);

        // 2024-05-08 星期三
        scheduler.checkAndSend(Instant.parse("2024-05-08T10:00:00Z"));
        verify(reports, never()).generateReport(any(), any(), anyBoolean());

        // 2024-05-13 星期一
        scheduler.checkAndSend(Instant.parse("2024-05-13T10:00:00Z"));
        verify(reports).generateReport(ReportType.WEEKLY, null, true);
    }

    @Test
    void monthly_only_on_configured_day_of_month() {
        props.getDaily().setEnabled(false);
        props.getMonthly().setEnabled(true);
        props.getMonthly().setDay(1);
        props.getMonthly().setTime("10:00");
        when(reports.generateReport(ReportType.MONTHLY, null, true)).thenReturn(report(7L, 1));
        when(sink.dispatch(anyString(), any())).thenReturn(true);

        scheduler.checkAndSend(Instant.parse("2024-05-02T10:00:00Z"));
        scheduler.checkAndSend(Instant.parse("2024-06-01T10:00:00Z"));

        verify(reports, times(1)).generateReport(ReportType.MONTHLY, null, true);
    }

    @Test
    void trigger_time_is_in_configured_zone() {
        props.setZone(ZoneId.of("Europe/Moscow"));
        when(reports.generateReport(ReportType.DAILY, null, true)).thenReturn(report(8L, 1));
        when(sink.dispatch(anyString(), any())).thenReturn(true);

        // 09:00 MSK = 06:00 UTC
        scheduler.checkAndSend(Instant.parse("2024-05-08T09:00:00Z"));
        verify(reports, never()).generateReport(any(), any(), anyBoolean());

        scheduler.checkAndSend(Instant.parse("2024-05-08T06:00:00Z"));
        verify(reports).generateReport(ReportType.DAILY, null, true);
    }

    @Test
    void global_switch_off_does_nothing() {
        props.setEnabled(false);

        scheduler.checkAndSend(Instant.parse("2024-05-08T09:00:00Z"));

        verify(reports, never()).generateReport(any(), any(), anyBoolean());
    }

    @Test
    void manual_send_ignores_gate_and_sends_empty_reports() {
        when(reports.generateReport(ReportType.DAILY, null, true)).thenReturn(report(9L, 0));
        when(sink.dispatch(anyString(), any())).thenReturn(true);
        when(reports.markReportSent(9L)).thenReturn(true);

        ViolationReportData r = scheduler.sendReportManually(ReportType.DAILY, 5L);

        assertThat(r.getSentAt()).isEqualTo(clock.instant());
        verify(sink).dispatch("<b>report 9</b>", 5L);
        verify(stateRepo, never()).save(any());
    }

    @Test
    void manual_send_uses_default_topic_and_propagates_failure() {
        when(reports.generateReport(ReportType.DAILY, null, true)).thenReturn(report(10L, 3));
        when(sink.dispatch(anyString(), any())).thenThrow(new NotificationDispatchException("TELEGRAM_NOT_OK", 200));

        assertThatThrownBy(() -> scheduler.sendReportManually(ReportType.DAILY, null))
                .isInstanceOf(NotificationDispatchException.class)
                .hasMessage("TELEGRAM_NOT_OK");
        verify(sink).dispatch(anyString(), eq(77L));
        assertThatThrownBy(() -> scheduler.sendReportManually(ReportType.CUSTOM, null))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void tick_survives_unexpected_errors_and_stop_halts() {
        clock.set(Instant.parse("2024-05-08T09:00:00Z"));
        when(reports.generateReport(ReportType.DAILY, null, true)).thenThrow(new IllegalStateException("boom"));

        scheduler.tick();
        assertThat(scheduler.isRunning()).isTrue();

        scheduler.stop();
        scheduler.tick();
        assertThat(scheduler.isRunning()).isFalse();
        verify(reports, times(1)).generateReport(ReportType.DAILY, null, true);
    }

    @Test
    void schedule_status_reports_gates_and_last_run() {
        when(reports.generateReport(ReportType.DAILY, null, true)).thenReturn(report(11L, 0));
        when(syncStatus.get(SyncStatusService.KEY_VIOLATION_REPORTS)).thenReturn(Optional.empty());
        scheduler.checkAndSend(Instant.parse("2024-05-08T09:00:00Z"));

        ScheduleStatus s = scheduler.getScheduleStatus();

        assertThat(s.enabled()).isTrue();
        assertThat(s.sink()).isEqualTo("TEST");
        assertThat(s.daily().time()).isEqualTo("09:00");
        assertThat(s.daily().lastSent()).isEqualTo(LocalDate.of(2024, 5, 8));
        assertThat(s.weekly().enabled()).isFalse();
        assertThat(s.weekly().day()).isEqualTo("MONDAY");
        assertThat(s.lastRunStatus()).isNull();
    }
}
