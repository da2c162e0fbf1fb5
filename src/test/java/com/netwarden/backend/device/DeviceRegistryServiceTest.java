package com.netwarden.backend.device;

import com.netwarden.backend.device.dto.DeviceInfo;
import com.netwarden.backend.device.repo.HwidDeviceRepository;
import com.netwarden.backend.device.service.DeviceRegistryService;
import com.netwarden.backend.testsupport.BaseSpringTest;
import com.netwarden.backend.testsupport.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.transaction.PlatformTransactionManager;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

@DataJpaTest
class DeviceRegistryServiceTest extends BaseSpringTest {

    @Autowired HwidDeviceRepository repo;
    @Autowired PlatformTransactionManager txManager;

    MutableClock clock;
    DeviceRegistryService svc;

    @BeforeEach
    void setUp() {
        clock = MutableClock.at("2024-05-01T12:00:00Z");
        svc = new DeviceRegistryService(repo, txManager, clock);
    }

    private static DeviceInfo device(String hwid, String platform, String os) {
        return new DeviceInfo(hwid, platform, os, null, null, null, null, null);
    }

    @Test
    void sync_inserts_then_replaces_the_set() {
        assertThat(svc.syncUserDevices("u1", List.of(device("h1", "android", "14"), device("h2", "ios", "17.4"))))
                .isEqualTo(2);

        clock.advance(Duration.ofHours(1));
        int n = svc.syncUserDevices("u1", List.of(device("h2", "ios", "17.5"), device("h3", "windows", "11")));

        assertThat(n).isEqualTo(2);
        assertThat(svc.getUserDevices("u1")).extracting(DeviceInfo::hwid).containsExactlyInAnyOrder("h2", "h3");
        DeviceInfo h2 = svc.getUserDevices("u1").stream().filter(d -> d.hwid().equals("h2")).findFirst().orElseThrow();
        assertThat(h2.osVersion()).isEqualTo("17.5");
        // 既有的一列 created_at 不動
        assertThat(h2.createdAt()).isEqualTo(Instant.parse("2024-05-01T12:00:00Z"));
        assertThat(h2.updatedAt()).isEqualTo(Instant.parse("2024-05-01T13:00:00Z"));
    }

    @Test
    void null_fields_keep_previous_values() {
        svc.syncUserDevices("u1", List.of(new DeviceInfo("h1", "android", "14", "Pixel 8", "3.1.0", "ua/1", null, null)));

        svc.syncUserDevices("u1", List.of(new DeviceInfo("h1", null, "15", null, null, null, null, null)));

        DeviceInfo d = svc.getUserDevices("u1").get(0);
        assertThat(d.platform()).isEqualTo("android");
        assertThat(d.osVersion()).isEqualTo("15");
        assertThat(d.deviceModel()).isEqualTo("Pixel 8");
        assertThat(d.userAgent()).isEqualTo("ua/1");
    }

    @Test
    void duplicate_hwid_keeps_the_last_entry() {
        int n = svc.syncUserDevices("u1", List.of(device("h1", "android", "13"), device("h1", "android", "14")));

        assertThat(n).isEqualTo(1);
        assertThat(svc.getUserDevices("u1").get(0).osVersion()).isEqualTo("14");
    }

    @Test
    void empty_list_clears_user_devices_only() {
        svc.syncUserDevices("u1", List.of(device("h1", "android", "14")));
        svc.syncUserDevices("u2", List.of(device("h1", "android", "14")));

        assertThat(svc.syncUserDevices("u1", List.of())).isZero();

        assertThat(svc.getUserDevicesCount("u1")).isZero();
        assertThat(svc.getUserDevicesCount("u2")).isEqualTo(1);
    }

    @Test
    void upstream_timestamps_are_kept_for_new_rows() {
        Instant created = Instant.parse("2024-01-01T00:00:00Z");
        svc.syncUserDevices("u1", List.of(new DeviceInfo("h1", "ios", null, null, null, null, created, created)));

        DeviceInfo d = svc.getUserDevices("u1").get(0);
        assertThat(d.createdAt()).isEqualTo(created);
        assertThat(d.updatedAt()).isEqualTo(created);
    }

    @Test
    void delete_all_and_blank_user() {
        svc.syncUserDevices("u1", List.of(device("h1", "android", "14"), device("h2", "ios", "17")));

        assertThat(svc.deleteAllUserDevices("u1")).isEqualTo(2);
        assertThat(svc.deleteAllUserDevices("u1")).isZero();
        assertThat(svc.syncUserDevices(" ", List.of(device("h1", "x", "y")))).isZero();
        assertThat(svc.getUserDevices(null)).isEmpty();
    }
}
