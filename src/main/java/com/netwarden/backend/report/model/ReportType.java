package com.netwarden.backend.report.model;

import java.util.Locale;

public enum ReportType {
    DAILY, WEEKLY, MONTHLY, CUSTOM;

    /** DB / API 用小寫 */
    public String code() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static ReportType fromCode(String raw) {
        if (raw == null || raw.isBlank()) throw new IllegalArgumentException("report type is required");
        try {
            return ReportType.valueOf(raw.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("unknown report type: " + raw);
        }
    }

    public boolean isScheduled() {
        return this != CUSTOM;
    }
}
