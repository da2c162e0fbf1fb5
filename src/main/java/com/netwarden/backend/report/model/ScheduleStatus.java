package com.netwarden.backend.report.model;

import java.time.Instant;
import java.time.LocalDate;

public record ScheduleStatus(
        boolean enabled,
        String zone,
        String sink,
        Cadence daily,
        Cadence weekly,
        Cadence monthly,
        String lastRunStatus,
        Instant lastRunAt,
        String lastRunError
) {
    /** day：weekly 是 MONDAY..SUNDAY，monthly 是 1..28，daily 為 null */
    public record Cadence(boolean enabled, String time, String day, LocalDate lastSent) {}
}
