package com.netwarden.backend.violation.service;

import com.netwarden.backend.violation.dto.ViolationView;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * 期間違規匯出成 ';' 分隔 CSV（營運拿去 Excel 開）。
 * 值裡面的 ';' 一律換成 ','，所以不需要 quoting。
 */
@Service
@RequiredArgsConstructor
public class ViolationCsvExporter {

    public static final String NO_DATA = "No data for the selected period";
    public static final int MAX_ROWS = 10_000;

    static final List<String> HEADERS = List.of(
            "ID", "Date", "User", "Email", "Telegram ID",
            "Score", "Action", "IP addresses", "Countries", "Providers",
            "Simultaneous connections", "Reasons"
    );

    private static final DateTimeFormatter DATE_FMT =
            DateTimeFormatter.ofPattern("dd.MM.yyyy HH:mm").withZone(ZoneOffset.UTC);

    private final ViolationService violations;

    public String export(Instant start, Instant end, double minScore) {
        List<ViolationView> rows = violations.getViolationsForPeriod(start, end, minScore, MAX_ROWS);
        if (rows.isEmpty()) return NO_DATA;

        List<String> lines = new ArrayList<>(rows.size() + 1);
        lines.add(String.join(";", HEADERS));
        for (ViolationView v : rows) {
            lines.add(toLine(v));
        }
        return String.join("\n", lines);
    }

    static String toLine(ViolationView v) {
        List<String> cells = List.of(
                v.id() == null ? "" : v.id().toString(),
                v.detectedAt() == null ? "" : DATE_FMT.format(v.detectedAt()),
                nz(v.username()),
                nz(v.email()),
                v.telegramId() == null ? "" : v.telegramId().toString(),
                String.format(Locale.ROOT, "%.1f", v.score()),
                nz(v.recommendedAction()),
                String.join(", ", v.ipAddresses()),
                String.join(", ", v.countries()),
                String.join(", ", v.asnTypes()),
                v.simultaneousConnections() == 0 ? "" : Integer.toString(v.simultaneousConnections()),
                String.join("; ", v.reasons())
        );
        return String.join(";", cells.stream().map(c -> c.replace(';', ',')).toList());
    }

    private static String nz(String s) {
        return s == null ? "" : s;
    }
}
