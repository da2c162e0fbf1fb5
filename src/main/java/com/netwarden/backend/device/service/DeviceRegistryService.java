package com.netwarden.backend.device.service;

import com.netwarden.backend.device.dto.DeviceInfo;
import com.netwarden.backend.device.entity.HwidDeviceEntity;
import com.netwarden.backend.device.repo.HwidDeviceRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionException;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Clock;
import java.time.Instant;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * 使用者 HWID 裝置清單（以上游為準整批同步）。
 * 同步時：不在新清單的刪掉，其餘 upsert；新值為 null 的欄位保留舊值。
 */
@Slf4j
@Service
public class DeviceRegistryService {

    private final HwidDeviceRepository repo;
    private final TransactionTemplate tx;
    private final Clock clock;

    public DeviceRegistryService(HwidDeviceRepository repo, PlatformTransactionManager txManager, Clock clock) {
        this.repo = repo;
        this.tx = new TransactionTemplate(txManager);
        this.clock = clock;
    }

    /**
     * @return 同步後的裝置數；storage 出錯回 0（整批 rollback）
     */
    public int syncUserDevices(String userUuid, List<DeviceInfo> devices) {
        if (userUuid == null || userUuid.isBlank()) return 0;
        String user = userUuid.trim();

        // 同一個 hwid 出現多次：後面的蓋前面的
        Map<String, DeviceInfo> incoming = new LinkedHashMap<>();
        if (devices != null) {
            for (DeviceInfo d : devices) {
                if (d == null || d.hwid() == null || d.hwid().isBlank()) continue;
                incoming.put(d.hwid().trim(), d);
            }
        }

        try {
            Integer synced = tx.execute(status -> replace(user, incoming));
            int n = synced == null ? 0 : synced;
            log.debug("hwid devices synced. user={} count={}", user, n);
            return n;
        } catch (DataAccessException | TransactionException ex) {
            log.error("hwid device sync failed. user={} err={}", user, ex.toString(), ex);
            return 0;
        }
    }

    public List<DeviceInfo> getUserDevices(String userUuid) {
        if (userUuid == null || userUuid.isBlank()) return List.of();
        try {
            return repo.findByUserUuidOrderByCreatedAtDescIdDesc(userUuid.trim()).stream()
                    .map(DeviceInfo::from)
                    .toList();
        } catch (DataAccessException ex) {
            log.error("hwid devices query failed. user={} err={}", userUuid, ex.toString(), ex);
            return List.of();
        }
    }

    public long getUserDevicesCount(String userUuid) {
        if (userUuid == null || userUuid.isBlank()) return 0;
        try {
            return repo.countByUserUuid(userUuid.trim());
        } catch (DataAccessException ex) {
            log.error("hwid devices count failed. user={} err={}", userUuid, ex.toString(), ex);
            return 0;
        }
    }

    public int deleteAllUserDevices(String userUuid) {
        if (userUuid == null || userUuid.isBlank()) return 0;
        try {
            int n = repo.deleteAllByUser(userUuid.trim());
            if (n > 0) log.info("hwid devices deleted. user={} count={}", userUuid, n);
            return n;
        } catch (DataAccessException ex) {
            log.error("hwid devices delete failed. user={} err={}", userUuid, ex.toString(), ex);
            return 0;
        }
    }

    // ===== internal（在交易內） =====

    private int replace(String user, Map<String, DeviceInfo> incoming) {
        Instant now = Instant.now(clock);
        Map<String, HwidDeviceEntity> current = repo.findByUserUuid(user).stream()
                .collect(Collectors.toMap(HwidDeviceEntity::getHwid, Function.identity(), (a, b) -> a));

        Set<String> stale = new HashSet<>(current.keySet());
        stale.removeAll(incoming.keySet());
        if (!stale.isEmpty()) {
            repo.deleteByUserUuidAndHwidIn(user, stale);
            // bulk delete 會 clear persistence context，剩下的重新讀
            current = repo.findByUserUuid(user).stream()
                    .collect(Collectors.toMap(HwidDeviceEntity::getHwid, Function.identity(), (a, b) -> a));
        }

        int synced = 0;
        for (Map.Entry<String, DeviceInfo> e : incoming.entrySet()) {
            DeviceInfo d = e.getValue();
            HwidDeviceEntity row = current.get(e.getKey());
            if (row == null) {
                row = new HwidDeviceEntity();
                row.setUserUuid(user);
                row.setHwid(e.getKey());
                row.setCreatedAt(d.createdAt() != null ? d.createdAt() : now);
            }
            if (d.platform() != null) row.setPlatform(d.platform());
            if (d.osVersion() != null) row.setOsVersion(d.osVersion());
            if (d.deviceModel() != null) row.setDeviceModel(d.deviceModel());
            if (d.appVersion() != null) row.setAppVersion(d.appVersion());
            if (d.userAgent() != null) row.setUserAgent(d.userAgent());
            row.setUpdatedAt(d.updatedAt() != null ? d.updatedAt() : now);
            row.setSyncedAt(now);
            repo.save(row);
            synced++;
        }
        return synced;
    }
}
