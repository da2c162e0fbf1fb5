package com.netwarden.backend.report.repo;

import com.netwarden.backend.report.entity.ReportScheduleStateEntity;
import org.springframework.data.jpa.repository.JpaRepository;

public interface ReportScheduleStateRepository extends JpaRepository<ReportScheduleStateEntity, String> {
}
