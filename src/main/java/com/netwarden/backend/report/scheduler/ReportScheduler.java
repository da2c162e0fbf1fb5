package com.netwarden.backend.report.scheduler;

import com.netwarden.backend.common.status.SyncMetadataEntity;
import com.netwarden.backend.common.status.SyncStatusService;
import com.netwarden.backend.report.config.ReportProperties;
import com.netwarden.backend.report.entity.ReportScheduleStateEntity;
import com.netwarden.backend.report.model.ReportType;
import com.netwarden.backend.report.model.ScheduleStatus;
import com.netwarden.backend.report.model.ViolationReportData;
import com.netwarden.backend.report.notify.NotificationDispatchException;
import com.netwarden.backend.report.notify.NotificationSink;
import com.netwarden.backend.report.repo.ReportScheduleStateRepository;
import com.netwarden.backend.report.service.ViolationReportService;
import jakarta.annotation.PreDestroy;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalTime;
import java.time.ZonedDateTime;
import java.time.temporal.ChronoUnit;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * 每分鐘檢查一次 daily → weekly → monthly：
 * 1) 總開關 / cadence 開關 / 今天已送過 → 跳過
 * 2) weekly / monthly 還要對上星期幾 / 幾號
 * 3) HH:mm 要剛好等於設定時間
 * 4) 產生 + 存檔 → 送出 → 標記 sent → 推進 last_sent_date
 * 送出失敗：不標 sent、不推進，同一天下一個對得上的分鐘再試。
 * sink 不會真的送達（log sink）：照樣推進，但不標 sent，狀態記 SKIPPED。
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ReportScheduler {

    private final ViolationReportService reports;
    private final NotificationSink sink;
    private final ReportProperties props;
    private final ReportScheduleStateRepository stateRepo;
    private final SyncStatusService syncStatus;
    private final Clock clock;

    private final AtomicBoolean running = new AtomicBoolean(true);

    /** DB 讀不到時的備援；寫 DB 失敗也至少守住這個 process */
    private final Map<ReportType, LocalDate> lastSent = new ConcurrentHashMap<>();

    @Scheduled(fixedDelayString = "${app.reports.tick-delay:PT60S}", initialDelayString = "${app.reports.initial-delay:PT30S}")
    public void tick() {
        if (!running.get()) return;
        try {
            checkAndSend(Instant.now(clock));
        } catch (RuntimeException e) {
            // loop 不能死：單次 tick 的非預期錯誤只記 log
            log.error("report scheduler tick failed: {}", e.toString(), e);
        }
    }

    void checkAndSend(Instant instant) {
        if (!props.isEnabled()) return;

        ZonedDateTime now = instant.atZone(props.getZone());
        LocalDate today = now.toLocalDate();
        LocalTime minute = now.toLocalTime().truncatedTo(ChronoUnit.MINUTES);

        check(ReportType.DAILY, props.getDaily(), true, today, minute);
        if (!running.get()) return;

        check(ReportType.WEEKLY, props.getWeekly(),
                now.getDayOfWeek() == props.getWeekly().getDay(), today, minute);
        if (!running.get()) return;

        check(ReportType.MONTHLY, props.getMonthly(),
                now.getDayOfMonth() == props.getMonthly().getDay(), today, minute);
    }

    private void check(ReportType type, ReportProperties.Cadence cfg, boolean dayMatches,
                       LocalDate today, LocalTime minute) {
        if (!cfg.isEnabled()) return;
        if (today.equals(lastSentDate(type).orElse(null))) return;
        if (!dayMatches) return;
        if (!minute.equals(cfg.triggerTime())) return;

        log.info("sending scheduled {} violation report", type.code());
        try {
            int sent = generateAndDispatch(type, props.getTopicId(), props.isSendEmpty());
            advanceGate(type, today);
            syncStatus.record(SyncStatusService.KEY_VIOLATION_REPORTS,
                    sent > 0 ? SyncMetadataEntity.SyncStatus.SUCCESS : SyncMetadataEntity.SyncStatus.SKIPPED,
                    sent, null);
        } catch (NotificationDispatchException e) {
            log.error("scheduled {} report dispatch failed, will retry next matching minute. code={} status={}",
                    type.code(), e.getMessage(), e.getHttpStatus(), e);
            syncStatus.record(SyncStatusService.KEY_VIOLATION_REPORTS,
                    SyncMetadataEntity.SyncStatus.FAILED, 0, type.code() + ": " + e.getMessage());
        }
    }

    /**
     * 手動補發：不看開關、不看時間、也不動 last_sent_date；空報表照發。
     *
     * @throws NotificationDispatchException 送出失敗
     */
    public ViolationReportData sendReportManually(ReportType type, Long topicId) {
        if (type == null || !type.isScheduled()) {
            throw new IllegalArgumentException("scheduled report type required: " + type);
        }
        ViolationReportData report = reports.generateReport(type, null, true);
        if (dispatch(report, topicId != null ? topicId : props.getTopicId())) {
            log.info("manual {} report sent. id={} total={}", type.code(), report.getId(), report.getTotalViolations());
        }
        return report;
    }

    public ScheduleStatus getScheduleStatus() {
        Optional<SyncMetadataEntity> last = syncStatus.get(SyncStatusService.KEY_VIOLATION_REPORTS);
        return new ScheduleStatus(
                props.isEnabled(),
                props.getZone().getId(),
                sink.sinkCode(),
                new ScheduleStatus.Cadence(props.getDaily().isEnabled(), props.getDaily().getTime(),
                        null, lastSentDate(ReportType.DAILY).orElse(null)),
                new ScheduleStatus.Cadence(props.getWeekly().isEnabled(), props.getWeekly().getTime(),
                        props.getWeekly().getDay().name(), lastSentDate(ReportType.WEEKLY).orElse(null)),
                new ScheduleStatus.Cadence(props.getMonthly().isEnabled(), props.getMonthly().getTime(),
                        Integer.toString(props.getMonthly().getDay()), lastSentDate(ReportType.MONTHLY).orElse(null)),
                last.map(s -> s.getSyncStatus().name()).orElse(null),
                last.map(SyncMetadataEntity::getLastSyncAt).orElse(null),
                last.map(SyncMetadataEntity::getErrorMessage).orElse(null)
        );
    }

    @PreDestroy
    public void stop() {
        if (running.compareAndSet(true, false)) {
            log.info("report scheduler stopped");
        }
    }

    boolean isRunning() {
        return running.get();
    }

    // ===== internal =====

    /** @return 送達的報表數（0 = 空報表略過，或 sink 不會送達） */
    private int generateAndDispatch(ReportType type, Long topicId, boolean sendEmpty) {
        ViolationReportData report = reports.generateReport(type, null, true);
        if (report.isEmpty() && !sendEmpty) {
            log.info("skipping empty {} report (no violations)", type.code());
            return 0;
        }
        if (!dispatch(report, topicId)) return 0;
        log.info("sent {} report. total={} users={}", type.code(), report.getTotalViolations(), report.getUniqueUsers());
        return 1;
    }

    /** @return true = 真的送達並已標 sent */
    private boolean dispatch(ViolationReportData report, Long topicId) {
        boolean ok = sink.dispatch(report.getMessageText(), topicId);
        if (!ok) throw new NotificationDispatchException("SINK_NOT_CONFIRMED", null);

        if (!sink.delivers()) {
            log.warn("{} report id={} not delivered: no delivering notification sink configured (sink={})",
                    report.getReportType() == null ? "?" : report.getReportType().code(), report.getId(), sink.sinkCode());
            return false;
        }

        // ✅ 只有 sink 確認收下才標 sent
        if (report.getId() != null && reports.markReportSent(report.getId())) {
            report.setSentAt(Instant.now(clock));
        }
        return true;
    }

    private Optional<LocalDate> lastSentDate(ReportType type) {
        LocalDate mem = lastSent.get(type);
        try {
            Optional<LocalDate> stored = stateRepo.findById(type.code())
                    .map(ReportScheduleStateEntity::getLastSentDate);
            if (stored.isPresent() && (mem == null || stored.get().isAfter(mem))) return stored;
        } catch (DataAccessException e) {
            log.warn("report schedule state read failed. cadence={} err={}", type.code(), e.toString());
        }
        return Optional.ofNullable(mem);
    }

    private void advanceGate(ReportType type, LocalDate today) {
        lastSent.put(type, today);
        try {
            ReportScheduleStateEntity row = stateRepo.findById(type.code()).orElseGet(() -> {
                ReportScheduleStateEntity e = new ReportScheduleStateEntity();
                e.setCadence(type.code());
                return e;
            });
            row.setLastSentDate(today);
            row.setUpdatedAt(Instant.now(clock));
            stateRepo.save(row);
        } catch (DataAccessException e) {
            log.warn("report schedule state write failed. cadence={} err={}", type.code(), e.toString());
        }
    }
}
