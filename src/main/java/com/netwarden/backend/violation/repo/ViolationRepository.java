package com.netwarden.backend.violation.repo;

import com.netwarden.backend.violation.entity.ViolationEntity;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.Collection;
import java.util.List;

/**
 * 所有期間查詢都是 [start, end) 且 score >= minScore。
 * list 欄位（countries / asn_types）是 JSON，展開計數在 service 做，不綁特定 DB 的 JSON 函式。
 */
public interface ViolationRepository extends JpaRepository<ViolationEntity, Long> {

    /**
     * 單列：total, critical(>=80), warning[50,80), monitor[30,50), unique users, avg, max
     */
    @Query("""
            select count(v),
                   sum(case when v.score >= 80 then 1 else 0 end),
                   sum(case when v.score >= 50 and v.score < 80 then 1 else 0 end),
                   sum(case when v.score >= 30 and v.score < 50 then 1 else 0 end),
                   count(distinct v.userUuid),
                   avg(v.score),
                   max(v.score)
              from ViolationEntity v
             where v.detectedAt >= :start
               and v.detectedAt < :end
               and v.score >= :minScore
            """)
    List<Object[]> aggregateStats(@Param("start") Instant start,
                                  @Param("end") Instant end,
                                  @Param("minScore") double minScore);

    /**
     * 每個 user 一列：uuid, username, email, telegramId, count, max, avg, last detected
     */
    @Query("""
            select v.userUuid,
                   max(v.username),
                   max(v.email),
                   max(v.telegramId),
                   count(v),
                   max(v.score),
                   avg(v.score),
                   max(v.detectedAt)
              from ViolationEntity v
             where v.detectedAt >= :start
               and v.detectedAt < :end
               and v.score >= :minScore
             group by v.userUuid
             order by count(v) desc, max(v.score) desc
            """)
    List<Object[]> topViolators(@Param("start") Instant start,
                                @Param("end") Instant end,
                                @Param("minScore") double minScore,
                                Pageable page);

    @Query("""
            select distinct v.userUuid, v.recommendedAction
              from ViolationEntity v
             where v.userUuid in :users
               and v.detectedAt >= :start
               and v.detectedAt < :end
               and v.score >= :minScore
            """)
    List<Object[]> distinctActionsForUsers(@Param("users") Collection<String> users,
                                           @Param("start") Instant start,
                                           @Param("end") Instant end,
                                           @Param("minScore") double minScore);

    @Query("""
            select v.recommendedAction, count(v)
              from ViolationEntity v
             where v.detectedAt >= :start
               and v.detectedAt < :end
               and v.score >= :minScore
             group by v.recommendedAction
             order by count(v) desc
            """)
    List<Object[]> countByAction(@Param("start") Instant start,
                                 @Param("end") Instant end,
                                 @Param("minScore") double minScore);

    @Query("""
            select v.countries
              from ViolationEntity v
             where v.detectedAt >= :start
               and v.detectedAt < :end
               and v.score >= :minScore
            """)
    List<List<String>> findCountryLists(@Param("start") Instant start,
                                        @Param("end") Instant end,
                                        @Param("minScore") double minScore);

    @Query("""
            select v.asnTypes
              from ViolationEntity v
             where v.detectedAt >= :start
               and v.detectedAt < :end
               and v.score >= :minScore
            """)
    List<List<String>> findAsnTypeLists(@Param("start") Instant start,
                                        @Param("end") Instant end,
                                        @Param("minScore") double minScore);

    @Query("""
            select v from ViolationEntity v
             where v.detectedAt >= :start
               and v.detectedAt < :end
               and v.score >= :minScore
             order by v.detectedAt desc
            """)
    List<ViolationEntity> findForPeriod(@Param("start") Instant start,
                                        @Param("end") Instant end,
                                        @Param("minScore") double minScore,
                                        Pageable page);

    List<ViolationEntity> findByUserUuidAndDetectedAtGreaterThanEqualOrderByDetectedAtDesc(
            String userUuid, Instant since, Pageable page);

    @Transactional
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("""
            update ViolationEntity v
               set v.actionTaken = :action,
                   v.actionTakenBy = :adminId,
                   v.actionTakenAt = :now
             where v.id = :id
            """)
    int updateAction(@Param("id") Long id,
                     @Param("action") String action,
                     @Param("adminId") Long adminId,
                     @Param("now") Instant now);

    @Transactional
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("update ViolationEntity v set v.notifiedAt = :now where v.id = :id")
    int markNotified(@Param("id") Long id, @Param("now") Instant now);
}
