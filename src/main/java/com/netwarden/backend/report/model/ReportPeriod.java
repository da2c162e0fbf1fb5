package com.netwarden.backend.report.model;

import java.time.Instant;

/** [start, end) */
public record ReportPeriod(Instant start, Instant end) {

    public ReportPeriod {
        if (start == null || end == null || !start.isBefore(end)) {
            throw new IllegalArgumentException("invalid report period: " + start + " .. " + end);
        }
    }
}
