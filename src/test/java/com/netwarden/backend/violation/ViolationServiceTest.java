package com.netwarden.backend.violation;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.netwarden.backend.testsupport.BaseSpringTest;
import com.netwarden.backend.testsupport.MutableClock;
import com.netwarden.backend.violation.dto.SaveViolationCommand;
import com.netwarden.backend.violation.dto.TopViolator;
import com.netwarden.backend.violation.dto.ViolationStats;
import com.netwarden.backend.violation.dto.ViolationView;
import com.netwarden.backend.violation.repo.ViolationRepository;
import com.netwarden.backend.violation.service.ViolationService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

@DataJpaTest
class ViolationServiceTest extends BaseSpringTest {

    static final Instant START = Instant.parse("2024-05-01T00:00:00Z");
    static final Instant END = Instant.parse("2024-05-02T00:00:00Z");

    @Autowired ViolationRepository repo;

    MutableClock clock;
    ViolationService svc;

    @BeforeEach
    void setUp() {
        clock = MutableClock.at("2024-05-01T08:00:00Z");
        svc = new ViolationService(repo, new ObjectMapper(), clock);
    }

    private Long save(String user, double score, String action, List<String> countries) {
        clock.advance(Duration.ofMinutes(5));
        return svc.saveViolation(SaveViolationCommand.builder()
                .userUuid(user)
                .username(user.startsWith("anon") ? null : "name-" + user)
                .score(score)
                .recommendedAction(action)
                .confidence(0.9)
                .countries(countries)
                .asnTypes(List.of("mobile"))
                .ipAddresses(List.of("5.9.1.1"))
                .reasons(List.of("too many ips"))
                .simultaneousConnections(3)
                .rawBreakdown(Map.of("temporal", 12.5))
                .build()).orElseThrow();
    }

    @Test
    void stats_split_scores_into_bands_and_respect_min_score() {
        save("u1", 95, "hard_block", List.of("RU"));
        save("u2", 60, "warn", List.of("RU"));
        save("u3", 40, "monitor", List.of("DE"));
        save("u4", 10, "no_action", List.of("DE"));

        ViolationStats s = svc.getViolationsStatsForPeriod(START, END, ViolationService.DEFAULT_MIN_SCORE);

        assertThat(s.total()).isEqualTo(3);
        assertThat(s.critical()).isEqualTo(1);
        assertThat(s.warning()).isEqualTo(1);
        assertThat(s.monitor()).isEqualTo(1);
        assertThat(s.uniqueUsers()).isEqualTo(3);
        assertThat(s.avgScore()).isCloseTo(65.0, within(0.001));
        assertThat(s.maxScore()).isEqualTo(95.0);
    }

    @Test
    void below_band_scores_still_count_toward_total() {
        save("u1", 95, "hard_block", List.of("RU"));
        save("u2", 60, "warn", List.of("RU"));
        save("u3", 40, "monitor", List.of("DE"));
        save("u4", 10, "no_action", List.of("DE"));

        ViolationStats s = svc.getViolationsStatsForPeriod(START, END, 0);

        assertThat(s.total()).isEqualTo(4);
        assertThat(s.critical()).isEqualTo(1);
        assertThat(s.warning()).isEqualTo(1);
        assertThat(s.monitor()).isEqualTo(1);
    }

    @Test
    void empty_period_is_all_zero() {
        save("u1", 95, "hard_block", List.of("RU"));

        ViolationStats s = svc.getViolationsStatsForPeriod(END, END.plus(Duration.ofDays(1)), 30);

        assertThat(s).isEqualTo(ViolationStats.empty());
    }

    @Test
    void period_end_is_exclusive() {
        clock.set(END.minus(Duration.ofMinutes(5)));
        save("u1", 70, "warn", List.of("RU"));

        assertThat(svc.getViolationsStatsForPeriod(START, END, 30).total()).isZero();
        assertThat(svc.getViolationsStatsForPeriod(END, END.plus(Duration.ofDays(1)), 30).total()).isEqualTo(1);
    }

    @Test
    void top_violators_order_by_count_then_max_score() {
        save("a", 55, "warn", List.of("RU"));
        save("a", 60, "temp_block", List.of("RU"));
        save("b", 95, "hard_block", List.of("RU"));
        save("b", 40, "monitor", List.of("RU"));
        save("anon-c", 99, "hard_block", List.of("RU"));

        List<TopViolator> top = svc.getTopViolatorsForPeriod(START, END, 30, 10);

        assertThat(top).extracting(TopViolator::userUuid).containsExactly("b", "a", "anon-c");
        TopViolator b = top.get(0);
        assertThat(b.violationsCount()).isEqualTo(2);
        assertThat(b.maxScore()).isEqualTo(95.0);
        assertThat(b.avgScore()).isCloseTo(67.5, within(0.001));
        assertThat(b.actions()).containsExactly("hard_block", "monitor");
        assertThat(b.displayName()).isEqualTo("name-b");
        assertThat(top.get(2).displayName()).isEqualTo("anon-c");

        assertThat(svc.getTopViolatorsForPeriod(START, END, 30, 1)).hasSize(1);
    }

    @Test
    void countries_and_asn_types_count_each_member() {
        save("u1", 80, "hard_block", List.of("RU", "DE"));
        save("u2", 80, "hard_block", List.of("RU"));
        save("u3", 80, "hard_block", List.of());

        Map<String, Long> byCountry = svc.getViolationsByCountry(START, END, 30);

        assertThat(byCountry).containsExactly(Map.entry("RU", 2L), Map.entry("DE", 1L));
        assertThat(svc.getViolationsByAsnType(START, END, 30)).containsEntry("mobile", 3L);
    }

    @Test
    void by_action_groups_recommended_action() {
        save("u1", 90, "hard_block", List.of("RU"));
        save("u2", 85, "hard_block", List.of("RU"));
        save("u3", 45, "monitor", List.of("RU"));

        Map<String, Long> byAction = svc.getViolationsByAction(START, END, 30);

        assertThat(byAction).containsExactly(Map.entry("hard_block", 2L), Map.entry("monitor", 1L));
    }

    @Test
    void admin_action_and_notified_are_recorded() {
        Long id = save("u1", 90, "hard_block", List.of("RU"));

        assertThat(svc.updateViolationAction(id, "temp_block", 42L)).isTrue();
        assertThat(svc.markViolationNotified(id)).isTrue();
        assertThat(svc.updateViolationAction(999_999L, "temp_block", 42L)).isFalse();

        ViolationView v = svc.getUserViolations("u1").get(0);
        assertThat(v.actionTaken()).isEqualTo("temp_block");
        assertThat(v.actionTakenBy()).isEqualTo(42L);
        assertThat(v.notifiedAt()).isNotNull();
        // 原本的建議不變
        assertThat(v.recommendedAction()).isEqualTo("hard_block");
    }

    @Test
    void user_history_is_newest_first_and_bounded_by_days() {
        save("u1", 50, "warn", List.of("RU"));
        clock.advance(Duration.ofDays(40));
        save("u1", 70, "warn", List.of("RU"));
        save("u1", 80, "hard_block", List.of("RU"));

        List<ViolationView> recent = svc.getUserViolations("u1", 30, 100);

        assertThat(recent).extracting(ViolationView::score).containsExactly(80.0, 70.0);
        assertThat(svc.getUserViolations("u1", 30, 1)).hasSize(1);
        assertThat(svc.getUserViolations(" ", 30, 10)).isEmpty();
    }

    @Test
    void missing_confidence_stays_null() {
        clock.advance(Duration.ofMinutes(5));
        svc.saveViolation(SaveViolationCommand.builder()
                .userUuid("u9")
                .score(65)
                .recommendedAction("warn")
                .build()).orElseThrow();
        save("u9", 70, "warn", List.of("RU"));

        List<ViolationView> views = svc.getUserViolations("u9");

        assertThat(views).extracting(ViolationView::confidence).containsExactly(0.9, null);
    }

    @Test
    void blank_user_is_not_saved() {
        assertThat(svc.saveViolation(SaveViolationCommand.builder().userUuid(" ").score(90).build())).isEmpty();
        assertThat(repo.count()).isZero();
    }
}
