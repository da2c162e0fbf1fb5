package com.netwarden.backend.common.status;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.Optional;

/**
 * 各子系統最後一次同步/執行狀態（sync_metadata 一列一個 key）。
 * 寫入失敗只記 log，不影響主流程；不開外層交易，避免 rollback-only 汙染呼叫端。
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class SyncStatusService {

    public static final String KEY_VIOLATION_REPORTS = "violation_reports";
    public static final String KEY_GEOIP_BATCH = "geoip_batch";

    private static final int MAX_ERROR_CHARS = 1000;

    private final SyncMetadataRepository repo;
    private final Clock clock;

    public void record(String key, SyncMetadataEntity.SyncStatus status, int records, String error) {
        try {
            SyncMetadataEntity row = repo.findById(key).orElseGet(() -> {
                SyncMetadataEntity e = new SyncMetadataEntity();
                e.setSyncKey(key);
                return e;
            });
            row.setLastSyncAt(Instant.now(clock));
            row.setSyncStatus(status);
            row.setRecordsSynced(Math.max(0, records));
            row.setErrorMessage(truncate(error));
            repo.save(row);
        } catch (DataAccessException ex) {
            log.warn("sync status write failed. key={} status={} err={}", key, status, ex.toString());
        }
    }

    public Optional<SyncMetadataEntity> get(String key) {
        try {
            return repo.findById(key);
        } catch (DataAccessException ex) {
            log.warn("sync status read failed. key={} err={}", key, ex.toString());
            return Optional.empty();
        }
    }

    private static String truncate(String s) {
        if (s == null) return null;
        return s.length() <= MAX_ERROR_CHARS ? s : s.substring(0, MAX_ERROR_CHARS);
    }
}
