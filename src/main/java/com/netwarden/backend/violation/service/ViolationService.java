package com.netwarden.backend.violation.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.netwarden.backend.violation.dto.SaveViolationCommand;
import com.netwarden.backend.violation.dto.TopViolator;
import com.netwarden.backend.violation.dto.ViolationStats;
import com.netwarden.backend.violation.dto.ViolationView;
import com.netwarden.backend.violation.entity.ViolationEntity;
import com.netwarden.backend.violation.repo.ViolationRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * 違規紀錄（append-only）+ 報表用聚合查詢。
 * storage 出錯：讀回空值 / 0，寫回 empty / false，只記 log。
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ViolationService {

    public static final double DEFAULT_MIN_SCORE = 30.0;

    private final ViolationRepository repo;
    private final ObjectMapper om;
    private final Clock clock;

    // ===== write =====

    public Optional<Long> saveViolation(SaveViolationCommand cmd) {
        if (cmd == null || cmd.userUuid() == null || cmd.userUuid().isBlank()) {
            log.warn("save violation skipped: missing user uuid");
            return Optional.empty();
        }

        ViolationEntity e = ViolationEntity.builder()
                .userUuid(cmd.userUuid().trim())
                .username(cmd.username())
                .email(cmd.email())
                .telegramId(cmd.telegramId())
                .score(cmd.score())
                .recommendedAction(cmd.recommendedAction())
                .confidence(cmd.confidence())
                .temporalScore(cmd.temporalScore())
                .geoScore(cmd.geoScore())
                .asnScore(cmd.asnScore())
                .profileScore(cmd.profileScore())
                .deviceScore(cmd.deviceScore())
                .ipAddresses(copy(cmd.ipAddresses()))
                .countries(copy(cmd.countries()))
                .cities(copy(cmd.cities()))
                .asnTypes(copy(cmd.asnTypes()))
                .osList(copy(cmd.osList()))
                .clientList(copy(cmd.clientList()))
                .reasons(copy(cmd.reasons()))
                .simultaneousConnections(cmd.simultaneousConnections())
                .uniqueIpsCount(cmd.uniqueIpsCount())
                .deviceLimit(cmd.deviceLimit())
                .impossibleTravel(cmd.impossibleTravel())
                .mobile(cmd.mobile())
                .datacenter(cmd.datacenter())
                .vpn(cmd.vpn())
                .rawBreakdown(toJson(cmd.rawBreakdown()))
                .detectedAt(Instant.now(clock))
                .build();

        try {
            Long id = repo.save(e).getId();
            log.info("violation saved. id={} user={} score={} action={}",
                    id, e.getUserUuid(), e.getScore(), e.getRecommendedAction());
            return Optional.ofNullable(id);
        } catch (DataAccessException ex) {
            log.error("save violation failed. user={} err={}", cmd.userUuid(), ex.toString(), ex);
            return Optional.empty();
        }
    }

    /** 管理員處置：只動 action_taken*，可重複呼叫 */
    public boolean updateViolationAction(Long violationId, String action, Long adminTelegramId) {
        if (violationId == null || action == null || action.isBlank()) return false;
        try {
            return repo.updateAction(violationId, action.trim(), adminTelegramId, Instant.now(clock)) > 0;
        } catch (DataAccessException ex) {
            log.error("update violation action failed. id={} err={}", violationId, ex.toString(), ex);
            return false;
        }
    }

    public boolean markViolationNotified(Long violationId) {
        if (violationId == null) return false;
        try {
            return repo.markNotified(violationId, Instant.now(clock)) > 0;
        } catch (DataAccessException ex) {
            log.error("mark violation notified failed. id={} err={}", violationId, ex.toString(), ex);
            return false;
        }
    }

    // ===== aggregates =====

    public ViolationStats getViolationsStatsForPeriod(Instant start, Instant end, double minScore) {
        try {
            List<Object[]> rows = repo.aggregateStats(start, end, minScore);
            if (rows.isEmpty() || rows.get(0) == null) return ViolationStats.empty();
            Object[] r = rows.get(0);
            long total = toLong(r[0]);
            if (total == 0) return ViolationStats.empty();
            return new ViolationStats(
                    total,
                    toLong(r[1]),
                    toLong(r[2]),
                    toLong(r[3]),
                    toLong(r[4]),
                    toDouble(r[5]),
                    toDouble(r[6])
            );
        } catch (DataAccessException ex) {
            log.error("violation stats query failed. start={} end={} err={}", start, end, ex.toString(), ex);
            return ViolationStats.empty();
        }
    }

    /**
     * 依 user 分組，違規次數多的在前；同次數比最高分。
     */
    public List<TopViolator> getTopViolatorsForPeriod(Instant start, Instant end, double minScore, int limit) {
        try {
            List<Object[]> rows = repo.topViolators(start, end, minScore, PageRequest.of(0, Math.max(1, limit)));
            if (rows.isEmpty()) return List.of();

            List<String> users = rows.stream().map(r -> (String) r[0]).toList();
            Map<String, Set<String>> actions = new HashMap<>();
            for (Object[] a : repo.distinctActionsForUsers(users, start, end, minScore)) {
                if (a[1] == null) continue;
                actions.computeIfAbsent((String) a[0], k -> new LinkedHashSet<>()).add((String) a[1]);
            }

            List<TopViolator> out = new ArrayList<>(rows.size());
            for (Object[] r : rows) {
                String user = (String) r[0];
                List<String> userActions = new ArrayList<>(actions.getOrDefault(user, Set.of()));
                userActions.sort(Comparator.naturalOrder());
                out.add(new TopViolator(
                        user,
                        (String) r[1],
                        (String) r[2],
                        r[3] == null ? null : ((Number) r[3]).longValue(),
                        toLong(r[4]),
                        toDouble(r[5]),
                        toDouble(r[6]),
                        (Instant) r[7],
                        userActions
                ));
            }
            return out;
        } catch (DataAccessException ex) {
            log.error("top violators query failed. start={} end={} err={}", start, end, ex.toString(), ex);
            return List.of();
        }
    }

    /** 一筆違規有多個國家時，每個國家各算一次 */
    public Map<String, Long> getViolationsByCountry(Instant start, Instant end, double minScore) {
        try {
            return explode(repo.findCountryLists(start, end, minScore));
        } catch (DataAccessException ex) {
            log.error("violations by country query failed. err={}", ex.toString(), ex);
            return Map.of();
        }
    }

    public Map<String, Long> getViolationsByAsnType(Instant start, Instant end, double minScore) {
        try {
            return explode(repo.findAsnTypeLists(start, end, minScore));
        } catch (DataAccessException ex) {
            log.error("violations by asn type query failed. err={}", ex.toString(), ex);
            return Map.of();
        }
    }

    public Map<String, Long> getViolationsByAction(Instant start, Instant end, double minScore) {
        try {
            Map<String, Long> out = new LinkedHashMap<>();
            for (Object[] r : repo.countByAction(start, end, minScore)) {
                if (r[0] == null) continue;
                out.put((String) r[0], toLong(r[1]));
            }
            return out;
        } catch (DataAccessException ex) {
            log.error("violations by action query failed. err={}", ex.toString(), ex);
            return Map.of();
        }
    }

    // ===== lists =====

    public List<ViolationView> getUserViolations(String userUuid) {
        return getUserViolations(userUuid, 30, 100);
    }

    public List<ViolationView> getUserViolations(String userUuid, int days, int limit) {
        if (userUuid == null || userUuid.isBlank()) return List.of();
        Instant since = Instant.now(clock).minus(Duration.ofDays(Math.max(1, days)));
        try {
            return repo.findByUserUuidAndDetectedAtGreaterThanEqualOrderByDetectedAtDesc(
                            userUuid, since, PageRequest.of(0, Math.max(1, limit)))
                    .stream()
                    .map(ViolationView::from)
                    .toList();
        } catch (DataAccessException ex) {
            log.error("user violations query failed. user={} err={}", userUuid, ex.toString(), ex);
            return List.of();
        }
    }

    public List<ViolationView> getViolationsForPeriod(Instant start, Instant end, double minScore, int limit) {
        try {
            return repo.findForPeriod(start, end, minScore, PageRequest.of(0, Math.max(1, limit)))
                    .stream()
                    .map(ViolationView::from)
                    .toList();
        } catch (DataAccessException ex) {
            log.error("violations for period query failed. err={}", ex.toString(), ex);
            return List.of();
        }
    }

    // ===== helpers =====

    static Map<String, Long> explode(List<List<String>> lists) {
        Map<String, Long> counts = new HashMap<>();
        for (List<String> values : lists) {
            if (values == null) continue;
            for (String v : values) {
                if (v == null || v.isBlank()) continue;
                counts.merge(v, 1L, Long::sum);
            }
        }
        return sortByCountDesc(counts);
    }

    /** count desc，同數量照 key 字母序（輸出穩定） */
    static Map<String, Long> sortByCountDesc(Map<String, Long> counts) {
        Map<String, Long> out = new LinkedHashMap<>();
        counts.entrySet().stream()
                .sorted(Map.Entry.<String, Long>comparingByValue().reversed()
                        .thenComparing(Map.Entry.comparingByKey()))
                .forEach(e -> out.put(e.getKey(), e.getValue()));
        return out;
    }

    private String toJson(Map<String, Object> breakdown) {
        if (breakdown == null || breakdown.isEmpty()) return null;
        try {
            return om.writeValueAsString(breakdown);
        } catch (JsonProcessingException e) {
            log.warn("raw breakdown not serializable, dropping it: {}", e.getOriginalMessage());
            return null;
        }
    }

    private static List<String> copy(List<String> v) {
        if (v == null) return new ArrayList<>();
        return v.stream().filter(Objects::nonNull).toList();
    }

    private static long toLong(Object o) {
        return (o instanceof Number n) ? n.longValue() : 0L;
    }

    private static double toDouble(Object o) {
        return (o instanceof Number n) ? n.doubleValue() : 0.0;
    }
}
