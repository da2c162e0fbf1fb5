package com.netwarden.backend.report.service;

import com.netwarden.backend.report.model.ReportType;
import com.netwarden.backend.report.model.TrendDirection;
import com.netwarden.backend.report.model.ViolationReportData;
import com.netwarden.backend.violation.dto.TopViolator;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * 報表 → Telegram HTML 訊息（parse_mode = HTML，只用 b / i）。
 * 使用者提供的文字（username / email）一律 escape。
 */
@Component
public class ReportMessageFormatter {

    static final int TOP_N = 5;
    static final String UNKNOWN_FLAG = "🏳️";

    static final Map<String, String> ACTION_NAMES = Map.of(
            "no_action", "No action",
            "monitor", "Monitoring",
            "warn", "Warning",
            "soft_block", "Soft block",
            "temp_block", "Temporary block",
            "hard_block", "Permanent block"
    );

    static final Map<String, String> ASN_TYPE_NAMES = Map.of(
            "mobile", "Mobile",
            "mobile_isp", "Mobile ISP",
            "fixed", "Fixed line",
            "isp", "ISP",
            "regional_isp", "Regional ISP",
            "hosting", "Hosting",
            "datacenter", "Datacenter",
            "vpn", "VPN",
            "business", "Business",
            "infrastructure", "Infrastructure"
    );

    private static final DateTimeFormatter DAY_FMT =
            DateTimeFormatter.ofPattern("dd.MM.yyyy").withZone(ZoneOffset.UTC);
    private static final DateTimeFormatter FOOTER_FMT =
            DateTimeFormatter.ofPattern("dd.MM.yyyy HH:mm").withZone(ZoneOffset.UTC);

    public String format(ViolationReportData r) {
        List<String> lines = new ArrayList<>();

        lines.add("<b>" + title(r.getReportType()) + "</b>");
        lines.add("");

        // 期間：end 是 exclusive，顯示時往前退 1 秒
        String from = DAY_FMT.format(r.getPeriodStart());
        String to = DAY_FMT.format(r.getPeriodEnd().minusSeconds(1));
        lines.add(from.equals(to)
                ? "📅 <b>Period:</b> " + from
                : "📅 <b>Period:</b> " + from + " — " + to);
        lines.add("");

        lines.add("<b>📈 Summary:</b>");
        lines.add("  • Total violations: <b>" + r.getTotalViolations() + "</b>");
        lines.add("  • Unique users: <b>" + r.getUniqueUsers() + "</b>");
        if (r.getTotalViolations() > 0) {
            lines.add("  • Average score: <b>" + fmt("%.1f", r.getAvgScore()) + "</b>");
            lines.add("  • Max score: <b>" + fmt("%.1f", r.getMaxScore()) + "</b>");
        }
        lines.add("");

        if (r.getTotalViolations() > 0) {
            lines.add("<b>🎯 By severity:</b>");
            severity(lines, "🔴", "Critical (≥80)", r.getCriticalCount(), r.getTotalViolations());
            severity(lines, "🟠", "Warning (50-79)", r.getWarningCount(), r.getTotalViolations());
            severity(lines, "🟡", "Monitor (30-49)", r.getMonitorCount(), r.getTotalViolations());
            lines.add("");
        }

        if (r.getPrevTotalViolations() != null) {
            String trend = r.getTrendPercent() == null
                    ? "—"
                    : (r.getTrendPercent() > 0 ? "+" : "") + fmt("%.1f", r.getTrendPercent()) + "%";
            lines.add("<b>" + trendEmoji(r.getTrendDirection()) + " Trend:</b> " + trend
                    + " (was: " + r.getPrevTotalViolations() + ")");
            lines.add("");
        }

        if (!r.getTopViolators().isEmpty()) {
            lines.add("<b>👥 Top violators:</b>");
            int i = 1;
            for (TopViolator v : r.getTopViolators().stream().limit(TOP_N).toList()) {
                lines.add("  " + i++ + ". " + escapeHtml(v.displayName())
                        + ": <b>" + v.violationsCount() + "</b> (max: " + fmt("%.0f", v.maxScore()) + ")");
            }
            lines.add("");
        }

        if (!r.getByCountry().isEmpty()) {
            lines.add("<b>🌍 By country:</b>");
            top(r.getByCountry()).forEach(e ->
                    lines.add("  " + countryFlag(e.getKey()) + " " + escapeHtml(e.getKey()) + ": <b>" + e.getValue() + "</b>"));
            lines.add("");
        }

        if (!r.getByAsnType().isEmpty()) {
            lines.add("<b>🔌 By provider type:</b>");
            top(r.getByAsnType()).forEach(e ->
                    lines.add("  • " + escapeHtml(ASN_TYPE_NAMES.getOrDefault(e.getKey(), e.getKey()))
                            + ": <b>" + e.getValue() + "</b>"));
            lines.add("");
        }

        if (!r.getByAction().isEmpty()) {
            lines.add("<b>⚡ By recommended action:</b>");
            sorted(r.getByAction()).forEach(e ->
                    lines.add("  • " + escapeHtml(ACTION_NAMES.getOrDefault(e.getKey(), e.getKey()))
                            + ": <b>" + e.getValue() + "</b>"));
        }

        lines.add("");
        Instant generated = r.getGeneratedAt() == null ? Instant.now() : r.getGeneratedAt();
        lines.add("<i>Generated: " + FOOTER_FMT.format(generated) + " UTC</i>");

        return String.join("\n", lines);
    }

    static String title(ReportType type) {
        return switch (type) {
            case DAILY -> "📊 Daily violations report";
            case WEEKLY -> "📊 Weekly violations report";
            case MONTHLY -> "📊 Monthly violations report";
            case CUSTOM -> "📊 Violations report";
        };
    }

    static String trendEmoji(TrendDirection d) {
        return switch (d == null ? TrendDirection.STABLE : d) {
            case UP -> "📈";
            case DOWN -> "📉";
            case STABLE -> "➡️";
        };
    }

    static String escapeHtml(String s) {
        if (s == null || s.isEmpty()) return "";
        return s.replace("&", "&amp;").replace("<", "&lt;").replace(">", "&gt;");
    }

    /** ISO 3166 alpha-2 → regional indicator 國旗；不合法就白旗 */
    static String countryFlag(String code) {
        if (code == null || code.length() != 2) return UNKNOWN_FLAG;
        String upper = code.toUpperCase(Locale.ROOT);
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < 2; i++) {
            char c = upper.charAt(i);
            if (c < 'A' || c > 'Z') return UNKNOWN_FLAG;
            sb.appendCodePoint(0x1F1E6 + (c - 'A'));
        }
        return sb.toString();
    }

    private static void severity(List<String> lines, String emoji, String label, long count, long total) {
        if (count <= 0) return;
        double pct = count * 100.0 / total;
        lines.add("  " + emoji + " " + label + ": <b>" + count + "</b> (" + fmt("%.0f", pct) + "%)");
    }

    private static List<Map.Entry<String, Long>> top(Map<String, Long> counts) {
        return sorted(counts).stream().limit(TOP_N).toList();
    }

    private static List<Map.Entry<String, Long>> sorted(Map<String, Long> counts) {
        return counts.entrySet().stream()
                .sorted(Map.Entry.<String, Long>comparingByValue().reversed()
                        .thenComparing(Map.Entry.comparingByKey()))
                .toList();
    }

    private static String fmt(String pattern, double v) {
        return String.format(Locale.ROOT, pattern, v);
    }
}
