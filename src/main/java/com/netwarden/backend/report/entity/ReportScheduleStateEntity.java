package com.netwarden.backend.report.entity;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import lombok.Getter;
import lombok.Setter;

import java.time.Instant;
import java.time.LocalDate;

/** 每個 cadence 最後一次發送成功的日期（重啟後同一天不會重發） */
@Getter
@Setter
@Entity
@Table(name = "report_schedule_state")
public class ReportScheduleStateEntity {

    @Id
    @Column(length = 16, nullable = false)
    private String cadence;

    @Column(name = "last_sent_date")
    private LocalDate lastSentDate;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;
}
