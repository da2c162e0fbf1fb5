package com.netwarden.backend.report.service;

import com.netwarden.backend.report.model.ReportPeriod;
import com.netwarden.backend.report.model.ReportType;

import java.time.DayOfWeek;
import java.time.Duration;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.time.temporal.TemporalAdjusters;

/**
 * 報表期間（全部 UTC，[start, end)）：
 * - daily：昨天
 * - weekly：上週一 00:00 ~ 本週一 00:00
 * - monthly：上個月 1 號 ~ 本月 1 號
 */
public final class ReportPeriods {

    private ReportPeriods() {}

    public static ReportPeriod current(ReportType type, LocalDate referenceDay) {
        return switch (type) {
            case DAILY -> days(referenceDay.minusDays(1), referenceDay);
            case WEEKLY -> {
                LocalDate thisMonday = referenceDay.with(TemporalAdjusters.previousOrSame(DayOfWeek.MONDAY));
                yield days(thisMonday.minusWeeks(1), thisMonday);
            }
            case MONTHLY -> {
                LocalDate firstOfMonth = referenceDay.withDayOfMonth(1);
                yield days(firstOfMonth.minusMonths(1), firstOfMonth);
            }
            case CUSTOM -> throw new IllegalArgumentException("custom reports need explicit bounds");
        };
    }

    /**
     * 前一個可比較期間：monthly 取再前一個日曆月，其他直接往前平移同樣長度。
     */
    public static ReportPeriod previous(ReportType type, ReportPeriod current) {
        if (type == ReportType.MONTHLY) {
            LocalDate start = current.start().atZone(ZoneOffset.UTC).toLocalDate();
            return days(start.minusMonths(1), start);
        }
        Duration length = Duration.between(current.start(), current.end());
        return new ReportPeriod(current.start().minus(length), current.start());
    }

    private static ReportPeriod days(LocalDate startInclusive, LocalDate endExclusive) {
        return new ReportPeriod(
                startInclusive.atStartOfDay(ZoneOffset.UTC).toInstant(),
                endExclusive.atStartOfDay(ZoneOffset.UTC).toInstant()
        );
    }
}
