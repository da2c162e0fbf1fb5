package com.netwarden.backend.violation;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.netwarden.backend.testsupport.MutableClock;
import com.netwarden.backend.testsupport.MySqlContainerBaseTest;
import com.netwarden.backend.violation.dto.SaveViolationCommand;
import com.netwarden.backend.violation.dto.ViolationStats;
import com.netwarden.backend.violation.dto.ViolationView;
import com.netwarden.backend.violation.repo.ViolationRepository;
import com.netwarden.backend.violation.service.ViolationService;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.jdbc.AutoConfigureTestDatabase;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;

import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * 真 MySQL：JSON 欄位存取 + 聚合查詢（沒有 Docker 就跳過）
 */
@DataJpaTest
@AutoConfigureTestDatabase(replace = AutoConfigureTestDatabase.Replace.NONE)
class ViolationRepositoryMySqlTest extends MySqlContainerBaseTest {

    @Autowired ViolationRepository repo;

    @Test
    void json_lists_and_aggregates_on_mysql() {
        MutableClock clock = MutableClock.at("2024-05-01T10:00:00Z");
        ViolationService svc = new ViolationService(repo, new ObjectMapper(), clock);

        svc.saveViolation(SaveViolationCommand.builder()
                .userUuid("u1").score(91).recommendedAction("hard_block")
                .countries(List.of("RU", "KZ")).asnTypes(List.of("mobile_isp"))
                .ipAddresses(List.of("5.9.1.1", "2a00:1450::1"))
                .rawBreakdown(Map.of("geo", 40))
                .build());
        svc.saveViolation(SaveViolationCommand.builder()
                .userUuid("u2").score(55).recommendedAction("warn")
                .countries(List.of("RU")).asnTypes(List.of("hosting"))
                .build());

        Instant start = Instant.parse("2024-05-01T00:00:00Z");
        Instant end = Instant.parse("2024-05-02T00:00:00Z");

        ViolationStats s = svc.getViolationsStatsForPeriod(start, end, 30);
        assertThat(s.total()).isEqualTo(2);
        assertThat(s.critical()).isEqualTo(1);
        assertThat(s.warning()).isEqualTo(1);

        assertThat(svc.getViolationsByCountry(start, end, 30))
                .containsExactly(Map.entry("RU", 2L), Map.entry("KZ", 1L));

        ViolationView v = svc.getUserViolations("u1").get(0);
        assertThat(v.ipAddresses()).containsExactly("5.9.1.1", "2a00:1450::1");
    }
}
