package com.netwarden.backend.report.repo;

import com.netwarden.backend.report.entity.ViolationReportEntity;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

public interface ViolationReportRepository extends JpaRepository<ViolationReportEntity, Long> {

    Optional<ViolationReportEntity> findFirstByReportTypeOrderByPeriodEndDescIdDesc(String reportType);

    List<ViolationReportEntity> findAllByOrderByGeneratedAtDescIdDesc(Pageable page);

    List<ViolationReportEntity> findByReportTypeOrderByGeneratedAtDescIdDesc(String reportType, Pageable page);

    /** 只在 sent_at 還是 null 時寫入：同一份報表只會標記一次 */
    @Transactional
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("update ViolationReportEntity r set r.sentAt = :now where r.id = :id and r.sentAt is null")
    int markSent(@Param("id") Long id, @Param("now") Instant now);
}
