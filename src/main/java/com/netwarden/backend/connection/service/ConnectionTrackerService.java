package com.netwarden.backend.connection.service;

import com.netwarden.backend.common.time.ObservedAtParser;
import com.netwarden.backend.connection.config.ConnectionTrackerProperties;
import com.netwarden.backend.connection.dto.BatchResult;
import com.netwarden.backend.connection.dto.ConnectionEvent;
import com.netwarden.backend.connection.dto.ConnectionView;
import com.netwarden.backend.connection.entity.UserConnectionEntity;
import com.netwarden.backend.connection.repo.UserConnectionRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionException;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * 每個 user 的連線帳本（reconciled ledger）：
 * - 同一個 (user, ip) 重複事件只更新那一列 open 連線
 * - 換 IP 時，超過 grace window 的舊 IP open 連線自動關掉
 * 寫入失敗一律 log + 回 empty，不往上丟（上游是高頻事件流）。
 * 同一個 user 的寫入在 process 內以 striped lock 串行化，避免同時插出兩列 open；
 * 既有 open 列另外用 PESSIMISTIC_WRITE 鎖住。多台部署要再加 DB 層唯一約束或分散式鎖。
 */
@Slf4j
@Service
public class ConnectionTrackerService {

    private final UserConnectionRepository repo;
    private final ConnectionTrackerProperties props;
    private final TransactionTemplate tx;
    private final Clock clock;

    private static final int LOCK_STRIPES = 64;
    private final Object[] userLocks = new Object[LOCK_STRIPES];

    public ConnectionTrackerService(
            UserConnectionRepository repo,
            ConnectionTrackerProperties props,
            PlatformTransactionManager txManager,
            Clock clock
    ) {
        this.repo = repo;
        this.props = props;
        this.tx = new TransactionTemplate(txManager);
        this.clock = clock;
        for (int i = 0; i < LOCK_STRIPES; i++) userLocks[i] = new Object();
    }

    // ===== write =====

    public Optional<Long> recordConnection(String userUuid, String ip) {
        return recordConnection(userUuid, ip, null, null, null);
    }

    /**
     * @return 這次事件對應（新建或沿用）的 connection id；storage 出錯回 empty
     */
    public Optional<Long> recordConnection(
            String userUuid,
            String ip,
            String nodeUuid,
            Map<String, Object> deviceInfo,
            Instant observedAt
    ) {
        if (isBlank(userUuid) || isBlank(ip)) {
            log.warn("record connection skipped: blank user or ip. user={} ip={}", userUuid, ip);
            return Optional.empty();
        }

        String user = userUuid.trim();
        String addr = ip.trim();

        try {
            // ✅ 交易包在裡面、例外接在外面：避免 rollback-only 變成 UnexpectedRollbackException 漏出去
            // 鎖要包住整個交易：commit 完才放，下一個事件才看得到這一列
            Long id;
            synchronized (lockFor(user)) {
                id = tx.execute(status -> upsertAndReconcile(user, addr, nodeUuid, deviceInfo, observedAt));
            }
            return Optional.ofNullable(id);
        } catch (DataAccessException | TransactionException ex) {
            log.error("record connection failed. user={} ip={} err={}", user, addr, ex.toString(), ex);
            return Optional.empty();
        }
    }

    private Long upsertAndReconcile(
            String user,
            String ip,
            String nodeUuid,
            Map<String, Object> deviceInfo,
            Instant observedAt
    ) {
        Instant now = Instant.now(clock);

        UserConnectionEntity row = repo
                .findOpenForUpdate(user, ip, PageRequest.of(0, 1))
                .stream()
                .findFirst()
                .orElse(null);

        if (row != null) {
            // connected_at 只往後推，不倒退
            if (observedAt != null && observedAt.isAfter(row.getConnectedAt())) {
                row.setConnectedAt(observedAt);
            }
            if (!isBlank(nodeUuid)) row.setNodeUuid(nodeUuid.trim());
            if (deviceInfo != null && !deviceInfo.isEmpty()) row.setDeviceInfo(deviceInfo);
        } else {
            row = new UserConnectionEntity();
            row.setUserUuid(user);
            row.setIpAddress(ip);
            row.setNodeUuid(isBlank(nodeUuid) ? null : nodeUuid.trim());
            row.setDeviceInfo(deviceInfo);
            row.setConnectedAt(observedAt != null ? observedAt : now);
        }
        Long id = repo.save(row).getId();

        Instant cutoff = now.minus(props.getGraceWindow());
        int closed = repo.closeStaleOtherIps(user, ip, cutoff, now);
        if (closed > 0) {
            log.debug("closed {} stale connection(s) of user={} after switch to ip={}", closed, user, ip);
        }
        return id;
    }

    private Object lockFor(String user) {
        return userLocks[Math.floorMod(user.hashCode(), LOCK_STRIPES)];
    }

    /**
     * 批次寫入：壞事件（user / ip 空白）跳過，不讓整批失敗。
     */
    public BatchResult recordBatch(List<ConnectionEvent> events) {
        if (events == null || events.isEmpty()) return new BatchResult(0, 0, 0, 0);

        int recorded = 0;
        int skipped = 0;
        int failed = 0;

        for (ConnectionEvent ev : events) {
            if (ev == null || isBlank(ev.subscriberId()) || isBlank(ev.ip())) {
                skipped++;
                continue;
            }
            Instant observedAt = parseObservedAt(ev);
            Optional<Long> id = recordConnection(ev.subscriberId(), ev.ip(), ev.relayId(), ev.deviceInfo(), observedAt);
            if (id.isPresent()) recorded++;
            else failed++;
        }

        if (skipped > 0 || failed > 0) {
            log.info("connection batch done. received={} recorded={} skipped={} failed={}",
                    events.size(), recorded, skipped, failed);
        }
        return new BatchResult(events.size(), recorded, skipped, failed);
    }

    public Optional<Long> recordEvent(ConnectionEvent ev) {
        if (ev == null) return Optional.empty();
        return recordConnection(ev.subscriberId(), ev.ip(), ev.relayId(), ev.deviceInfo(), parseObservedAt(ev));
    }

    private static Instant parseObservedAt(ConnectionEvent ev) {
        if (isBlank(ev.observedAt())) return null;
        Instant t = ObservedAtParser.parse(ev.observedAt());
        if (t == null) {
            log.warn("unparseable observed_at, using server time. user={} raw={}", ev.subscriberId(), ev.observedAt());
        }
        return t;
    }

    public boolean closeConnection(Long connectionId) {
        if (connectionId == null) return false;
        try {
            return repo.closeById(connectionId, Instant.now(clock)) > 0;
        } catch (DataAccessException ex) {
            log.error("close connection failed. id={} err={}", connectionId, ex.toString(), ex);
            return false;
        }
    }

    // ===== read =====

    public List<ConnectionView> getActiveConnections(String userUuid) {
        return getActiveConnections(userUuid, props.getActiveLimit(), props.getActiveMaxAge());
    }

    public List<ConnectionView> getActiveConnections(String userUuid, int limit, Duration maxAge) {
        if (isBlank(userUuid)) return List.of();
        Instant since = Instant.now(clock).minus(maxAge);
        try {
            return repo.findActive(userUuid, since, PageRequest.of(0, Math.max(1, limit)))
                    .stream()
                    .map(ConnectionView::from)
                    .toList();
        } catch (DataAccessException ex) {
            log.error("active connections query failed. user={} err={}", userUuid, ex.toString(), ex);
            return List.of();
        }
    }

    public long getUniqueIpsInWindow(String userUuid) {
        return getUniqueIpsInWindow(userUuid, props.getUniqueIpWindow());
    }

    /** 視窗內出現過的 distinct IP（不論是否已斷線） */
    public long getUniqueIpsInWindow(String userUuid, Duration window) {
        if (isBlank(userUuid)) return 0;
        try {
            return repo.countDistinctIpsSince(userUuid, Instant.now(clock).minus(window));
        } catch (DataAccessException ex) {
            log.error("unique ip query failed. user={} err={}", userUuid, ex.toString(), ex);
            return 0;
        }
    }

    public long getUniqueIpsCount(String userUuid, int sinceHours) {
        return getUniqueIpsInWindow(userUuid, Duration.ofHours(Math.max(1, sinceHours)));
    }

    /** 目前所有 open 連線數（不看時間） */
    public long getSimultaneousConnections(String userUuid) {
        if (isBlank(userUuid)) return 0;
        try {
            return repo.countByUserUuidAndDisconnectedAtIsNull(userUuid);
        } catch (DataAccessException ex) {
            log.error("simultaneous query failed. user={} err={}", userUuid, ex.toString(), ex);
            return 0;
        }
    }

    public List<ConnectionView> getConnectionHistory(String userUuid) {
        return getConnectionHistory(userUuid, props.getHistoryDays(), props.getHistoryLimit());
    }

    public List<ConnectionView> getConnectionHistory(String userUuid, int days, int limit) {
        if (isBlank(userUuid)) return List.of();
        Instant since = Instant.now(clock).minus(Duration.ofDays(Math.max(1, days)));
        try {
            return repo.findByUserUuidAndConnectedAtAfterOrderByConnectedAtDesc(
                            userUuid, since, PageRequest.of(0, Math.max(1, limit)))
                    .stream()
                    .map(ConnectionView::from)
                    .toList();
        } catch (DataAccessException ex) {
            log.error("connection history query failed. user={} err={}", userUuid, ex.toString(), ex);
            return List.of();
        }
    }

    private static boolean isBlank(String s) {
        return s == null || s.isBlank();
    }
}
